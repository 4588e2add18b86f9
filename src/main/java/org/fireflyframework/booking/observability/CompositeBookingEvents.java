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

import org.fireflyframework.booking.core.BookingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans out every event to a list of delegates. A failing delegate is logged and does not stop
 * the others.
 */
public class CompositeBookingEvents implements BookingEvents {

    private static final Logger log = LoggerFactory.getLogger(CompositeBookingEvents.class);

    private final List<BookingEvents> delegates;

    public CompositeBookingEvents(List<BookingEvents> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates"));
    }

    private void each(Consumer<BookingEvents> call) {
        for (BookingEvents delegate : delegates) {
            try {
                call.accept(delegate);
            } catch (RuntimeException e) {
                log.warn("BookingEvents delegate {} failed", delegate.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public void onRequestCreated(String requestId, String userId) {
        each(d -> d.onRequestCreated(requestId, userId));
    }

    @Override
    public void onTransition(String requestId, BookingState from, BookingState to, String trigger, long sequence) {
        each(d -> d.onTransition(requestId, from, to, trigger, sequence));
    }

    @Override
    public void onTerminal(String requestId, BookingState state, String reason) {
        each(d -> d.onTerminal(requestId, state, reason));
    }

    @Override
    public void onValidationFailed(String requestId, String field, String message) {
        each(d -> d.onValidationFailed(requestId, field, message));
    }

    @Override
    public void onSecurityViolation(String requestId, String field, String reason) {
        each(d -> d.onSecurityViolation(requestId, field, reason));
    }

    @Override
    public void onInvalidTransition(String requestId, BookingState state, String event) {
        each(d -> d.onInvalidTransition(requestId, state, event));
    }

    @Override
    public void onIdempotentReplay(String requestId, String trigger) {
        each(d -> d.onIdempotentReplay(requestId, trigger));
    }

    @Override
    public void onStaleEvent(String requestId, String description) {
        each(d -> d.onStaleEvent(requestId, description));
    }

    @Override
    public void onRetry(String requestId, String operation, int failedAttempt, Throwable error) {
        each(d -> d.onRetry(requestId, operation, failedAttempt, error));
    }

    @Override
    public void onCallCompleted(String requestId, String operation, boolean success, long latencyMs) {
        each(d -> d.onCallCompleted(requestId, operation, success, latencyMs));
    }

    @Override
    public void onExternalServiceDegraded(String requestId, String operation, Throwable error) {
        each(d -> d.onExternalServiceDegraded(requestId, operation, error));
    }

    @Override
    public void onPersistenceFailed(String requestId, Throwable error) {
        each(d -> d.onPersistenceFailed(requestId, error));
    }
}
