/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.booking.persistence.impl;

import org.fireflyframework.booking.config.BookingEngineProperties;
import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.fireflyframework.booking.persistence.serialization.BookingSnapshotSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Redis-backed snapshot store.
 * <p>
 * Redis key structure:
 * <ul>
 *   <li>{prefix}state:{requestId} - serialized snapshot</li>
 *   <li>{prefix}user:{userId} - set of request ids of the user</li>
 *   <li>{prefix}terminal:{requestId} - time the request reached a terminal state</li>
 * </ul>
 * The sequence guard is a read followed by a write; it assumes one engine instance owns a
 * given request at a time.
 */
public class RedisBookingPersistenceProvider implements BookingPersistenceProvider {

    private static final Logger log = LoggerFactory.getLogger(RedisBookingPersistenceProvider.class);

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final BookingSnapshotSerializer serializer;
    private final BookingEngineProperties.RedisProperties redisProperties;

    private final String stateKeyPrefix;
    private final String userKeyPrefix;
    private final String terminalKeyPrefix;

    public RedisBookingPersistenceProvider(ReactiveRedisTemplate<String, byte[]> redisTemplate,
                                           BookingSnapshotSerializer serializer,
                                           BookingEngineProperties.RedisProperties redisProperties) {
        this.redisTemplate = redisTemplate;
        this.serializer = serializer;
        this.redisProperties = redisProperties;

        String basePrefix = redisProperties.getKeyPrefix();
        this.stateKeyPrefix = basePrefix + "state:";
        this.userKeyPrefix = basePrefix + "user:";
        this.terminalKeyPrefix = basePrefix + "terminal:";

        log.info("Initialized Redis booking persistence provider with key prefix: {}", basePrefix);
    }

    @Override
    public Mono<Void> persist(BookingSnapshot snapshot) {
        String requestId = snapshot.requestId();
        String stateKey = stateKeyPrefix + requestId;

        return find(requestId)
                .flatMap(existing -> {
                    if (existing.isPresent() && existing.get().sequence() > snapshot.sequence()) {
                        log.debug("Skipping stale snapshot {} at sequence {} (stored {})",
                                requestId, snapshot.sequence(), existing.get().sequence());
                        return Mono.<Void>empty();
                    }
                    return Mono.fromCallable(() -> serializer.serialize(snapshot))
                            .flatMap(bytes -> {
                                Mono<Boolean> stateOp = redisTemplate.opsForValue().set(stateKey, bytes);
                                Mono<Long> userOp = redisTemplate.opsForSet()
                                        .add(userKeyPrefix + snapshot.userId(), requestId.getBytes(StandardCharsets.UTF_8));
                                Mono<Boolean> terminalOp = snapshot.isTerminal()
                                        ? redisTemplate.opsForValue().set(terminalKeyPrefix + requestId,
                                                snapshot.updatedAt().toString().getBytes(StandardCharsets.UTF_8))
                                        : Mono.just(true);
                                Mono<Void> ttlOp = Mono.empty();
                                if (redisProperties.getKeyTtl() != null) {
                                    ttlOp = redisTemplate.expire(stateKey, redisProperties.getKeyTtl()).then();
                                }
                                return Mono.when(stateOp, userOp, terminalOp).then(ttlOp);
                            });
                })
                .doOnSuccess(v -> log.debug("Persisted snapshot {} at sequence {}", requestId, snapshot.sequence()))
                .onErrorMap(e -> new IllegalStateException("Redis persistence failed for " + requestId, e));
    }

    @Override
    public Mono<Optional<BookingSnapshot>> find(String requestId) {
        return redisTemplate.opsForValue().get(stateKeyPrefix + requestId)
                .map(bytes -> {
                    try {
                        return Optional.of(serializer.deserialize(bytes));
                    } catch (BookingSnapshotSerializer.SerializationException e) {
                        log.error("Failed to deserialize snapshot {}", requestId, e);
                        return Optional.<BookingSnapshot>empty();
                    }
                })
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    public Flux<BookingSnapshot> findByUser(String userId) {
        return redisTemplate.opsForSet().members(userKeyPrefix + userId)
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .flatMap(this::find)
                .flatMap(opt -> opt.map(Mono::just).orElseGet(Mono::empty))
                .sort(Comparator.comparing(BookingSnapshot::createdAt).reversed());
    }

    @Override
    public Flux<BookingSnapshot> findInFlight() {
        return redisTemplate.scan(ScanOptions.scanOptions().match(stateKeyPrefix + "*").build())
                .map(key -> key.substring(stateKeyPrefix.length()))
                .flatMap(this::find)
                .flatMap(opt -> opt.map(Mono::just).orElseGet(Mono::empty))
                .filter(s -> !s.isTerminal());
    }

    @Override
    public Mono<Long> cleanupTerminal(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        return redisTemplate.scan(ScanOptions.scanOptions().match(terminalKeyPrefix + "*").build())
                .flatMap(terminalKey -> redisTemplate.opsForValue().get(terminalKey)
                        .filter(bytes -> Instant.parse(new String(bytes, StandardCharsets.UTF_8)).isBefore(cutoff))
                        .flatMap(bytes -> {
                            String requestId = terminalKey.substring(terminalKeyPrefix.length());
                            return find(requestId).flatMap(snapshot -> {
                                Mono<Long> userOp = snapshot
                                        .map(s -> redisTemplate.opsForSet().remove(userKeyPrefix + s.userId(),
                                                (Object) requestId.getBytes(StandardCharsets.UTF_8)))
                                        .orElse(Mono.just(0L));
                                return userOp.then(redisTemplate.delete(stateKeyPrefix + requestId, terminalKey));
                            });
                        }))
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.info("Removed {} terminal booking snapshot(s) older than {}", count, olderThan);
                    }
                });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return redisTemplate.hasKey(stateKeyPrefix + "health-check")
                .map(exists -> true)
                .onErrorResume(e -> {
                    log.warn("Redis health check failed: {}", e.toString());
                    return Mono.just(false);
                });
    }

    @Override
    public String getProviderType() {
        return "redis";
    }
}
