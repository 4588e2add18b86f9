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

import org.fireflyframework.booking.audit.AuditEntry;
import org.fireflyframework.booking.audit.AuditEventKind;
import org.fireflyframework.booking.audit.AuditLogger;
import org.fireflyframework.booking.audit.InMemoryAuditSink;
import org.fireflyframework.booking.core.BookingRequest;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.IntentKind;
import org.fireflyframework.booking.core.RouteCriteria;
import org.fireflyframework.booking.core.exception.InvalidTransitionException;
import org.fireflyframework.booking.security.SensitiveDataMasker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BookingStateMachineTest {

    private AuditLogger audit;
    private BookingEngineHarness.RecordingEvents events;
    private BookingStateMachine machine;
    private BookingRequest request;

    @BeforeEach
    void setUp() {
        audit = new AuditLogger(new InMemoryAuditSink(), List.of(), new SensitiveDataMasker());
        events = new BookingEngineHarness.RecordingEvents();
        machine = new BookingStateMachine(audit, events);
        LocalDate day = LocalDate.of(2026, 11, 20);
        request = new BookingRequest("user-1", IntentKind.BOOK_TRUCK,
                new RouteCriteria("Mumbai", "Pune", day, day, 1), null, Map.of(), Instant.now());
    }

    @Test
    void appliedTransitionBumpsSequenceAndAuditsOnce() {
        AppliedTransition applied = request.withLock(() ->
                machine.apply(request, TriggerKind.SEARCH_RESULTS, null, Map.of("candidates", "TRK-A")));

        assertEquals(BookingState.SEARCHING, applied.from());
        assertEquals(BookingState.AWAITING_SELECTION, applied.to());
        assertEquals(1L, applied.sequence());
        assertEquals(1L, request.getSequence());

        List<AuditEntry> entries = audit.entriesFor(request.getRequestId());
        assertEquals(1, entries.size());
        AuditEntry entry = entries.get(0);
        assertEquals(AuditEventKind.TRANSITION, entry.kind());
        assertEquals("SEARCHING", entry.get("from"));
        assertEquals("AWAITING_SELECTION", entry.get("to"));
        assertEquals("1", entry.get("sequence"));
        assertEquals("TRK-A", entry.get("candidates"));
        assertEquals(List.of("transition:SEARCHING->AWAITING_SELECTION"), events.calls);
    }

    @Test
    void disallowedTriggerIsAuditedAndRaised() {
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class, () ->
                request.withLock(() -> machine.apply(request, TriggerKind.AVAILABILITY_CONFIRMED, "BK-1", Map.of())));

        assertEquals(BookingState.SEARCHING, e.getState());
        assertEquals(BookingState.SEARCHING, request.getState());
        assertEquals(0L, request.getSequence());
        assertEquals(AuditEventKind.INVALID_TRANSITION, audit.entriesFor(request.getRequestId()).get(0).kind());
    }

    @Test
    void applyingWithoutTheLockFails() {
        assertThrows(IllegalStateException.class, () ->
                machine.apply(request, TriggerKind.SEARCH_RESULTS, null, Map.of()));
    }

    @Test
    void terminalTransitionIsReported() {
        request.withLock(() -> {
            request.close("changed plans");
            return machine.apply(request, TriggerKind.USER_CANCELLED, null, Map.of());
        });

        assertTrue(events.calls.contains("terminal:CANCELLED"));
    }

    @Test
    void replayDetectionWithObservedSequence() {
        request.withLock(() -> machine.apply(request, TriggerKind.SEARCH_RESULTS, null, Map.of()));
        request.withLock(() -> machine.apply(request, TriggerKind.CANDIDATE_SELECTED, "TRK-A", Map.of()));

        assertTrue(request.withLock(() -> machine.isReplay(request, TriggerKind.CANDIDATE_SELECTED, "TRK-A", 1L)));
        assertFalse(request.withLock(() -> machine.isReplay(request, TriggerKind.DETAILS_COMPLETED, null, 2L)));
        assertThrows(InvalidTransitionException.class, () ->
                request.withLock(() -> machine.isReplay(request, TriggerKind.CANDIDATE_SELECTED, "TRK-B", 1L)));
        assertThrows(InvalidTransitionException.class, () ->
                request.withLock(() -> machine.isReplay(request, TriggerKind.CANDIDATE_SELECTED, "TRK-A", 9L)));
    }

    @Test
    void replayDetectionWithoutObservedSequence() {
        request.withLock(() -> machine.apply(request, TriggerKind.SEARCH_RESULTS, null, Map.of()));
        request.withLock(() -> machine.apply(request, TriggerKind.CANDIDATE_SELECTED, "TRK-A", Map.of()));

        assertTrue(request.withLock(() -> machine.isReplay(request, TriggerKind.CANDIDATE_SELECTED, "TRK-A", null)));
        // a different offer is a new event, which the transition table then refuses
        assertFalse(request.withLock(() -> machine.isReplay(request, TriggerKind.CANDIDATE_SELECTED, "TRK-B", null)));
        assertFalse(request.withLock(() -> machine.isReplay(request, TriggerKind.USER_CANCELLED, null, null)));
    }

    @Test
    void priorityEventsWithAnOlderObservedSequenceAreNotStale() {
        request.withLock(() -> machine.apply(request, TriggerKind.SEARCH_RESULTS, null, Map.of()));
        request.withLock(() -> machine.apply(request, TriggerKind.CANDIDATE_SELECTED, "TRK-A", Map.of()));

        assertFalse(request.withLock(() -> machine.isPriorityReplay(request, TriggerKind.USER_CANCELLED, null, 0L)));
        assertFalse(request.withLock(() -> machine.isPriorityReplay(request, TriggerKind.USER_CANCELLED, null, 2L)));
        assertThrows(InvalidTransitionException.class, () ->
                request.withLock(() -> machine.isPriorityReplay(request, TriggerKind.USER_CANCELLED, null, 5L)));

        request.withLock(() -> {
            request.close("changed plans");
            return machine.apply(request, TriggerKind.USER_CANCELLED, null, Map.of());
        });
        assertTrue(request.withLock(() -> machine.isPriorityReplay(request, TriggerKind.USER_CANCELLED, null, 2L)));
        assertEquals(AuditEventKind.IDEMPOTENT_REPLAY,
                audit.entriesFor(request.getRequestId()).get(audit.entriesFor(request.getRequestId()).size() - 1).kind());
    }

    @Test
    void staleEventsAreAuditedWithoutChangingState() {
        request.withLock(() -> {
            machine.recordStale(request, "catalog results", Map.of("observed_sequence", 0L));
            return null;
        });

        AuditEntry entry = audit.entriesFor(request.getRequestId()).get(0);
        assertEquals(AuditEventKind.STALE_EVENT, entry.kind());
        assertEquals("catalog results", entry.get("description"));
        assertEquals("0", entry.get("observed_sequence"));
        assertEquals(BookingState.SEARCHING, request.getState());
        assertEquals(List.of("stale"), events.calls);
    }
}
