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

import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Snapshot store backed by a {@link ConcurrentHashMap}. Contents are lost on restart.
 */
public class InMemoryBookingPersistenceProvider implements BookingPersistenceProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBookingPersistenceProvider.class);

    private final ConcurrentMap<String, BookingSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> persist(BookingSnapshot snapshot) {
        return Mono.fromRunnable(() -> {
            snapshots.merge(snapshot.requestId(), snapshot,
                    (stored, incoming) -> incoming.sequence() >= stored.sequence() ? incoming : stored);
            log.debug("Persisted snapshot {} at sequence {}", snapshot.requestId(), snapshot.sequence());
        });
    }

    @Override
    public Mono<Optional<BookingSnapshot>> find(String requestId) {
        return Mono.fromSupplier(() -> Optional.ofNullable(snapshots.get(requestId)));
    }

    @Override
    public Flux<BookingSnapshot> findByUser(String userId) {
        return Flux.defer(() -> Flux.fromStream(snapshots.values().stream()
                .filter(s -> userId.equals(s.userId()))
                .sorted(Comparator.comparing(BookingSnapshot::createdAt).reversed())));
    }

    @Override
    public Flux<BookingSnapshot> findInFlight() {
        return Flux.defer(() -> Flux.fromStream(snapshots.values().stream().filter(s -> !s.isTerminal())));
    }

    @Override
    public Mono<Long> cleanupTerminal(Duration olderThan) {
        return Mono.fromSupplier(() -> {
            Instant cutoff = Instant.now().minus(olderThan);
            long removed = 0;
            for (BookingSnapshot s : snapshots.values()) {
                if (s.isTerminal() && s.updatedAt().isBefore(cutoff) && snapshots.remove(s.requestId(), s)) {
                    removed++;
                }
            }
            if (removed > 0) {
                log.info("Removed {} terminal booking snapshot(s) older than {}", removed, olderThan);
            }
            return removed;
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    @Override
    public String getProviderType() {
        return "in-memory";
    }

    public int size() {
        return snapshots.size();
    }
}
