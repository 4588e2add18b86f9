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


package org.fireflyframework.booking.config;

import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.fireflyframework.booking.persistence.impl.RedisBookingPersistenceProvider;
import org.fireflyframework.booking.persistence.serialization.BookingSnapshotSerializer;
import org.fireflyframework.booking.persistence.serialization.JsonBookingSnapshotSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Auto-configuration for Redis-based booking persistence.
 * <p>
 * Only loaded when Redis classes are on the classpath and
 * {@code firefly.booking.persistence.provider=redis}. The provider it registers is
 * {@link Primary}, so it wins over the in-memory default.
 */
@AutoConfiguration(before = RedisAutoConfiguration.class)
@EnableConfigurationProperties(BookingEngineProperties.class)
@ConditionalOnClass({RedisConnectionFactory.class, ReactiveRedisTemplate.class})
@ConditionalOnProperty(name = "firefly.booking.persistence.provider", havingValue = "redis")
public class BookingRedisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BookingRedisAutoConfiguration.class);

    /**
     * Connection factory built from {@code firefly.booking.persistence.redis.*}, unless the
     * application provides its own.
     */
    @Bean
    @ConditionalOnMissingBean(RedisConnectionFactory.class)
    public LettuceConnectionFactory bookingRedisConnectionFactory(BookingEngineProperties properties) {
        BookingEngineProperties.RedisProperties redis = properties.getPersistence().getRedis();

        log.info("Configuring Redis connection factory for booking persistence: {}:{}",
                redis.getHost(), redis.getPort());

        LettuceConnectionFactory factory = new LettuceConnectionFactory(redis.getHost(), redis.getPort());
        factory.setDatabase(redis.getDatabase());
        if (redis.getPassword() != null) {
            factory.setPassword(redis.getPassword());
        }
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean(name = "bookingReactiveRedisTemplate")
    public ReactiveRedisTemplate<String, byte[]> bookingReactiveRedisTemplate(ReactiveRedisConnectionFactory connectionFactory) {
        RedisSerializationContext<String, byte[]> context = RedisSerializationContext
                .<String, byte[]>newSerializationContext()
                .key(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .value(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .hashKey(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .hashValue(RedisSerializationContext.SerializationPair.fromSerializer(RedisSerializer.byteArray()))
                .build();

        return new ReactiveRedisTemplate<>(connectionFactory, context);
    }

    @Bean
    @ConditionalOnMissingBean
    public BookingSnapshotSerializer bookingSnapshotSerializer() {
        return new JsonBookingSnapshotSerializer();
    }

    @Bean
    @Primary
    public BookingPersistenceProvider redisBookingPersistenceProvider(ReactiveRedisTemplate<String, byte[]> bookingReactiveRedisTemplate,
                                                                      BookingSnapshotSerializer serializer,
                                                                      BookingEngineProperties properties) {
        BookingEngineProperties.RedisProperties redis = properties.getPersistence().getRedis();
        log.info("Configuring Redis booking persistence provider with key prefix: {}", redis.getKeyPrefix());
        return new RedisBookingPersistenceProvider(bookingReactiveRedisTemplate, serializer, redis);
    }
}
