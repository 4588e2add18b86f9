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


package org.fireflyframework.booking.engine;

import org.fireflyframework.booking.audit.AuditEventKind;
import org.fireflyframework.booking.audit.AuditLogger;
import org.fireflyframework.booking.audit.AuditSeverity;
import org.fireflyframework.booking.core.BookingRequest;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.exception.InvalidTransitionException;
import org.fireflyframework.booking.observability.BookingEvents;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies transitions to a {@link BookingRequest} whose lock is held by the caller. Every
 * applied transition bumps the sequence and writes exactly one TRANSITION audit entry.
 */
public class BookingStateMachine {

    private final AuditLogger audit;
    private final BookingEvents events;

    public BookingStateMachine(AuditLogger audit, BookingEvents events) {
        this.audit = audit;
        this.events = events;
    }

    public AppliedTransition apply(BookingRequest request, TriggerKind trigger, String eventKey, Map<String, ?> detail) {
        requireLock(request);
        BookingState from = request.getState();
        BookingState to = BookingTransitions.target(from, trigger)
                .orElseThrow(() -> reject(request, trigger.name()));
        long sequence = request.advance(to, signature(trigger, eventKey), Instant.now());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("from", from.name());
        payload.put("to", to.name());
        payload.put("trigger", trigger.name());
        payload.put("sequence", sequence);
        if (detail != null) {
            payload.putAll(detail);
        }
        audit.record(request.getRequestId(), AuditEventKind.TRANSITION, AuditSeverity.INFO, payload);
        events.onTransition(request.getRequestId(), from, to, trigger.name(), sequence);
        if (to.isTerminal()) {
            events.onTerminal(request.getRequestId(), to, request.getClosureReason());
        }
        return new AppliedTransition(from, to, trigger, sequence);
    }

    /**
     * Decides whether an inbound event repeats a transition that was already applied.
     * With an observed sequence, the event is a replay when the transition applied right after
     * that sequence carries the same signature. Without one, it is a replay when it matches the
     * latest transition and could not be applied again from the current state.
     *
     * @throws InvalidTransitionException if the observed sequence is stale for a different
     *                                    event, or lies in the future
     */
    public boolean isReplay(BookingRequest request, TriggerKind trigger, String eventKey, Long observedSequence) {
        requireLock(request);
        String signature = signature(trigger, eventKey);
        if (observedSequence != null) {
            long current = request.getSequence();
            if (observedSequence > current) {
                throw reject(request, trigger + " (observed sequence " + observedSequence + " is ahead of " + current + ")");
            }
            if (observedSequence < current) {
                boolean same = request.triggerAppliedAt(observedSequence + 1).map(signature::equals).orElse(false);
                if (same) {
                    recordReplay(request, trigger);
                    return true;
                }
                throw reject(request, trigger + " (stale: observed sequence " + observedSequence + ", current " + current + ")");
            }
            return false;
        }
        boolean matchesLatest = request.triggerAppliedAt(request.getSequence()).map(signature::equals).orElse(false);
        if (matchesLatest && !BookingTransitions.isAllowed(request.getState(), trigger)) {
            recordReplay(request, trigger);
            return true;
        }
        return false;
    }

    /**
     * Replay check for events that take priority over whatever happened since the caller last
     * looked, such as a cancel. An older observed sequence only matters when the transition right
     * after it was this very event; otherwise the event is new and not stale.
     *
     * @throws InvalidTransitionException if the observed sequence lies in the future
     */
    public boolean isPriorityReplay(BookingRequest request, TriggerKind trigger, String eventKey, Long observedSequence) {
        requireLock(request);
        if (observedSequence != null && observedSequence < request.getSequence()) {
            String signature = signature(trigger, eventKey);
            boolean same = request.triggerAppliedAt(observedSequence + 1).map(signature::equals).orElse(false);
            if (same) {
                recordReplay(request, trigger);
            }
            return same;
        }
        return isReplay(request, trigger, eventKey, observedSequence);
    }

    /**
     * Audits a rejected event and returns the exception for the caller to throw.
     */
    public InvalidTransitionException reject(BookingRequest request, String event) {
        audit.record(request.getRequestId(), AuditEventKind.INVALID_TRANSITION, AuditSeverity.MEDIUM,
                Map.of("state", request.getState().name(), "event", event));
        events.onInvalidTransition(request.getRequestId(), request.getState(), event);
        return new InvalidTransitionException(request.getRequestId(), request.getState(), event);
    }

    public void recordStale(BookingRequest request, String description, Map<String, ?> detail) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("description", description);
        payload.put("state", request.getState().name());
        payload.put("sequence", request.getSequence());
        if (detail != null) {
            payload.putAll(detail);
        }
        audit.record(request.getRequestId(), AuditEventKind.STALE_EVENT, AuditSeverity.MEDIUM, payload);
        events.onStaleEvent(request.getRequestId(), description);
    }

    private void recordReplay(BookingRequest request, TriggerKind trigger) {
        audit.record(request.getRequestId(), AuditEventKind.IDEMPOTENT_REPLAY, AuditSeverity.INFO,
                Map.of("trigger", trigger.name(), "sequence", request.getSequence()));
        events.onIdempotentReplay(request.getRequestId(), trigger.name());
    }

    static String signature(TriggerKind trigger, String eventKey) {
        return eventKey == null ? trigger.name() : trigger.name() + ":" + eventKey;
    }

    private static void requireLock(BookingRequest request) {
        if (!request.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock of request " + request.getRequestId() + " is not held");
        }
    }
}
