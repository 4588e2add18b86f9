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
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;

import static org.assertj.core.api.Assertions.assertThat;

class BookingRedisAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BookingRedisAutoConfiguration.class));

    @Test
    void inactiveUnlessRedisProviderIsSelected() {
        runner.run(ctx -> assertThat(ctx).doesNotHaveBean(BookingPersistenceProvider.class)
                .doesNotHaveBean(LettuceConnectionFactory.class));
    }

    @Test
    void registersRedisPersistenceWhenSelected() {
        runner.withPropertyValues(
                        "firefly.booking.persistence.provider=redis",
                        "firefly.booking.persistence.redis.host=redis.internal",
                        "firefly.booking.persistence.redis.port=6380",
                        "firefly.booking.persistence.redis.key-prefix=test:booking:")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(BookingSnapshotSerializer.class);
                    assertThat(ctx.getBean(BookingPersistenceProvider.class))
                            .isInstanceOf(RedisBookingPersistenceProvider.class);
                    assertThat(ctx.getBean(BookingPersistenceProvider.class).getProviderType()).isEqualTo("redis");
                    LettuceConnectionFactory factory = ctx.getBean(LettuceConnectionFactory.class);
                    assertThat(factory.getHostName()).isEqualTo("redis.internal");
                    assertThat(factory.getPort()).isEqualTo(6380);
                });
    }
}
