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


package org.fireflyframework.booking.annotations;

import org.fireflyframework.booking.config.BookingEngineConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables the booking engine components in a Spring application.
 * <p>
 * This annotation imports {@link BookingEngineConfiguration} directly so it works in both
 * Spring Boot and plain Spring contexts. Redis persistence is registered separately through
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}
 * and activated with {@code firefly.booking.persistence.provider=redis}.
 * <p>
 * Components wired by this annotation:
 * - {@code BookingEngine}: the request orchestrator
 * - {@code TransportEventRouter} and {@code BookingToolFacade}: the two front-end entry points
 * - {@code BookingEvents}: logging and, when a {@code MeterRegistry} exists, Micrometer observers
 * - {@code AuditLogger}: in-memory journal plus the optional JSON-lines file sink
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Import(BookingEngineConfiguration.class)
public @interface EnableBookingEngine {
}
