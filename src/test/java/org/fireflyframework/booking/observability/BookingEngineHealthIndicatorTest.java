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


package org.fireflyframework.booking.observability;

import org.fireflyframework.booking.audit.AuditEventKind;
import org.fireflyframework.booking.audit.AuditLogger;
import org.fireflyframework.booking.audit.AuditSink;
import org.fireflyframework.booking.audit.InMemoryAuditSink;
import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.fireflyframework.booking.persistence.impl.InMemoryBookingPersistenceProvider;
import org.fireflyframework.booking.security.SensitiveDataMasker;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BookingEngineHealthIndicatorTest {

    private static AuditLogger audit(AuditSink... sinks) {
        return new AuditLogger(new InMemoryAuditSink(), List.of(sinks), new SensitiveDataMasker());
    }

    @Test
    void upWhenPersistenceAndAuditAreHealthy() {
        BookingEngineHealthIndicator indicator =
                new BookingEngineHealthIndicator(new InMemoryBookingPersistenceProvider(), audit());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("persistence.provider", "in-memory")
                .containsEntry("audit.degraded.writes", 0L);
    }

    @Test
    void degradedWhenAuditSinkFails() {
        AuditLogger audit = audit(entry -> {
            throw new IllegalStateException("disk full");
        });
        audit.record("req-1", AuditEventKind.REQUEST_CREATED, Map.of());

        Health health = new BookingEngineHealthIndicator(new InMemoryBookingPersistenceProvider(), audit).health();

        assertThat(health.getStatus()).isEqualTo(BookingEngineHealthIndicator.DEGRADED);
        assertThat(health.getDetails()).containsEntry("audit.degraded.writes", 1L);
    }

    @Test
    void downWhenPersistenceIsUnhealthyOrFails() {
        BookingPersistenceProvider unhealthy = mock(BookingPersistenceProvider.class);
        when(unhealthy.isHealthy()).thenReturn(Mono.just(false));
        when(unhealthy.getProviderType()).thenReturn("redis");
        assertThat(new BookingEngineHealthIndicator(unhealthy, audit()).health().getStatus()).isEqualTo(Status.DOWN);

        BookingPersistenceProvider failing = mock(BookingPersistenceProvider.class);
        when(failing.isHealthy()).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        Health health = new BookingEngineHealthIndicator(failing, audit()).health();
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error.type", "IllegalStateException");
    }
}
