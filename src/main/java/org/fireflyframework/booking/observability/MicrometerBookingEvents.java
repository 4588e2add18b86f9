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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.fireflyframework.booking.core.BookingState;

import java.time.Duration;

/**
 * Publishes booking counters and collaborator call timers to Micrometer.
 */
public class MicrometerBookingEvents implements BookingEvents {

    private final MeterRegistry registry;

    public MicrometerBookingEvents(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onRequestCreated(String requestId, String userId) {
        registry.counter("booking.requests.created").increment();
    }

    @Override
    public void onTransition(String requestId, BookingState from, BookingState to, String trigger, long sequence) {
        Tags tags = Tags.of(
                Tag.of("from", from.name().toLowerCase()),
                Tag.of("to", to.name().toLowerCase()),
                Tag.of("trigger", trigger.toLowerCase()));
        registry.counter("booking.transitions", tags).increment();
    }

    @Override
    public void onTerminal(String requestId, BookingState state, String reason) {
        registry.counter("booking.requests.closed", Tags.of(Tag.of("state", state.name().toLowerCase()))).increment();
    }

    @Override
    public void onValidationFailed(String requestId, String field, String message) {
        registry.counter("booking.input.rejected", Tags.of(Tag.of("field", field), Tag.of("reason", "validation"))).increment();
    }

    @Override
    public void onSecurityViolation(String requestId, String field, String reason) {
        registry.counter("booking.input.rejected", Tags.of(Tag.of("field", field), Tag.of("reason", "security"))).increment();
    }

    @Override
    public void onInvalidTransition(String requestId, BookingState state, String event) {
        registry.counter("booking.events.invalid", Tags.of(Tag.of("state", state.name().toLowerCase()))).increment();
    }

    @Override
    public void onIdempotentReplay(String requestId, String trigger) {
        registry.counter("booking.events.replayed").increment();
    }

    @Override
    public void onStaleEvent(String requestId, String description) {
        registry.counter("booking.events.stale").increment();
    }

    @Override
    public void onRetry(String requestId, String operation, int failedAttempt, Throwable error) {
        registry.counter("booking.calls.retries", Tags.of(
                Tag.of("operation", operation),
                Tag.of("error.type", error.getClass().getSimpleName()))).increment();
    }

    @Override
    public void onCallCompleted(String requestId, String operation, boolean success, long latencyMs) {
        Tags tags = Tags.of(Tag.of("operation", operation), Tag.of("outcome", success ? "success" : "failure"));
        registry.timer("booking.calls.duration", tags).record(Duration.ofMillis(Math.max(0, latencyMs)));
    }

    @Override
    public void onExternalServiceDegraded(String requestId, String operation, Throwable error) {
        registry.counter("booking.calls.degraded", Tags.of(Tag.of("operation", operation))).increment();
    }

    @Override
    public void onPersistenceFailed(String requestId, Throwable error) {
        registry.counter("booking.persistence.failures").increment();
    }
}
