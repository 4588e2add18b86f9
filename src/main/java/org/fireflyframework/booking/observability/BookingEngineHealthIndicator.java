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

import org.fireflyframework.booking.audit.AuditLogger;
import org.fireflyframework.booking.audit.AuditSummary;
import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

/**
 * Spring Boot Actuator health indicator for the booking engine.
 * <p>
 * DOWN when the persistence provider is unreachable, DEGRADED when audit entries could only
 * be kept in the in-memory journal, UP otherwise.
 */
public class BookingEngineHealthIndicator extends AbstractHealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED");
    private static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final BookingPersistenceProvider persistence;
    private final AuditLogger audit;

    public BookingEngineHealthIndicator(BookingPersistenceProvider persistence, AuditLogger audit) {
        super("Booking engine health check failed");
        this.persistence = persistence;
        this.audit = audit;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        try {
            Boolean healthy = persistence.isHealthy().block(CHECK_TIMEOUT);
            AuditSummary summary = audit.summary();

            builder.withDetail("persistence.provider", persistence.getProviderType())
                    .withDetail("persistence.healthy", Boolean.TRUE.equals(healthy))
                    .withDetail("audit.entries", summary.totalEntries())
                    .withDetail("audit.high.severity", summary.highSeverityEntries())
                    .withDetail("audit.degraded.writes", summary.degradedWrites());

            if (!Boolean.TRUE.equals(healthy)) {
                builder.down();
            } else if (audit.isDegraded()) {
                builder.status(DEGRADED);
            } else {
                builder.up();
            }
        } catch (Exception e) {
            builder.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("error.type", e.getClass().getSimpleName());
        }
    }
}
