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

/**
 * Observability hooks for booking lifecycle events. All methods default to no-ops.
 * Implement this interface and expose it as a Spring bean to receive callbacks.
 */
public interface BookingEvents {

    default void onRequestCreated(String requestId, String userId) {}

    default void onTransition(String requestId, BookingState from, BookingState to, String trigger, long sequence) {}

    default void onTerminal(String requestId, BookingState state, String reason) {}

    default void onValidationFailed(String requestId, String field, String message) {}

    default void onSecurityViolation(String requestId, String field, String reason) {}

    default void onInvalidTransition(String requestId, BookingState state, String event) {}

    default void onIdempotentReplay(String requestId, String trigger) {}

    default void onStaleEvent(String requestId, String description) {}

    /** Invoked before a collaborator call is retried. */
    default void onRetry(String requestId, String operation, int failedAttempt, Throwable error) {}

    default void onCallCompleted(String requestId, String operation, boolean success, long latencyMs) {}

    default void onExternalServiceDegraded(String requestId, String operation, Throwable error) {}

    default void onPersistenceFailed(String requestId, Throwable error) {}
}
