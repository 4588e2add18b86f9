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

/**
 * Writes every lifecycle event as a single-line JSON log record.
 * <p>
 * Log levels used:
 * <ul>
 *   <li>INFO - creation, transitions, terminal states</li>
 *   <li>WARN - rejected input, retries, stale or invalid events</li>
 *   <li>ERROR - degraded collaborators and persistence failures</li>
 * </ul>
 */
public class BookingLoggerEvents implements BookingEvents {

    private static final Logger log = LoggerFactory.getLogger(BookingLoggerEvents.class);

    @Override
    public void onRequestCreated(String requestId, String userId) {
        log.info("{{\"booking_event\":\"created\",\"request_id\":\"{}\",\"user_id\":\"{}\"}}", requestId, userId);
    }

    @Override
    public void onTransition(String requestId, BookingState from, BookingState to, String trigger, long sequence) {
        log.info("{{\"booking_event\":\"transition\",\"request_id\":\"{}\",\"from\":\"{}\",\"to\":\"{}\",\"trigger\":\"{}\",\"sequence\":\"{}\"}}",
                requestId, from, to, trigger, sequence);
    }

    @Override
    public void onTerminal(String requestId, BookingState state, String reason) {
        log.info("{{\"booking_event\":\"terminal\",\"request_id\":\"{}\",\"state\":\"{}\",\"reason\":\"{}\"}}",
                requestId, state, reason == null ? "" : reason);
    }

    @Override
    public void onValidationFailed(String requestId, String field, String message) {
        log.warn("{{\"booking_event\":\"validation_failed\",\"request_id\":\"{}\",\"field\":\"{}\",\"message\":\"{}\"}}",
                requestId, field, message);
    }

    @Override
    public void onSecurityViolation(String requestId, String field, String reason) {
        log.warn("{{\"booking_event\":\"security_violation\",\"request_id\":\"{}\",\"field\":\"{}\",\"reason\":\"{}\"}}",
                requestId, field, reason);
    }

    @Override
    public void onInvalidTransition(String requestId, BookingState state, String event) {
        log.warn("{{\"booking_event\":\"invalid_transition\",\"request_id\":\"{}\",\"state\":\"{}\",\"event\":\"{}\"}}",
                requestId, state, event);
    }

    @Override
    public void onIdempotentReplay(String requestId, String trigger) {
        log.info("{{\"booking_event\":\"replay\",\"request_id\":\"{}\",\"trigger\":\"{}\"}}", requestId, trigger);
    }

    @Override
    public void onStaleEvent(String requestId, String description) {
        log.warn("{{\"booking_event\":\"stale_event\",\"request_id\":\"{}\",\"description\":\"{}\"}}", requestId, description);
    }

    @Override
    public void onRetry(String requestId, String operation, int failedAttempt, Throwable error) {
        log.warn("{{\"booking_event\":\"retry\",\"request_id\":\"{}\",\"operation\":\"{}\",\"failed_attempt\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                requestId, operation, failedAttempt, error.getClass().getSimpleName(), error.getMessage());
    }

    @Override
    public void onCallCompleted(String requestId, String operation, boolean success, long latencyMs) {
        log.debug("{{\"booking_event\":\"call_completed\",\"request_id\":\"{}\",\"operation\":\"{}\",\"success\":\"{}\",\"latency_ms\":\"{}\"}}",
                requestId, operation, success, latencyMs);
    }

    @Override
    public void onExternalServiceDegraded(String requestId, String operation, Throwable error) {
        log.error("{{\"booking_event\":\"external_degraded\",\"request_id\":\"{}\",\"operation\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                requestId, operation, error.getClass().getSimpleName(), error.getMessage());
    }

    @Override
    public void onPersistenceFailed(String requestId, Throwable error) {
        log.error("{{\"booking_event\":\"persistence_failed\",\"request_id\":\"{}\",\"error_class\":\"{}\",\"error_message\":\"{}\"}}",
                requestId, error.getClass().getSimpleName(), error.getMessage());
    }
}
