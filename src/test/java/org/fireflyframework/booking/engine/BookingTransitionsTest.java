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
import org.fireflyframework.booking.audit.AuditSeverity;
import org.fireflyframework.booking.core.BookingState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BookingTransitionsTest {

    @ParameterizedTest
    @EnumSource(value = BookingState.class, names = {"DELIVERED", "CANCELLED", "FAILED"})
    void terminalStatesAcceptNothing(BookingState state) {
        assertTrue(BookingTransitions.allowedTriggers(state).isEmpty());
    }

    @ParameterizedTest
    @EnumSource(value = BookingState.class, names = {"DELIVERED", "CANCELLED", "FAILED"}, mode = EnumSource.Mode.EXCLUDE)
    void everyOpenStateCanBeCancelledOrFailed(BookingState state) {
        assertEquals(BookingState.CANCELLED, BookingTransitions.target(state, TriggerKind.USER_CANCELLED).orElseThrow());
        assertEquals(BookingState.FAILED, BookingTransitions.target(state, TriggerKind.UNRECOVERABLE_ERROR).orElseThrow());
    }

    @Test
    void confirmationOnlyFollowsVerification() {
        for (BookingState state : BookingState.values()) {
            boolean allowed = BookingTransitions.isAllowed(state, TriggerKind.AVAILABILITY_CONFIRMED);
            assertEquals(state == BookingState.VERIFYING_AVAILABILITY, allowed, state.name());
        }
        assertFalse(BookingTransitions.isAllowed(BookingState.COLLECTING_DETAILS, TriggerKind.AVAILABILITY_REJECTED));
        assertFalse(BookingTransitions.isAllowed(BookingState.CONFIRMED, TriggerKind.TRANSIT_STARTED));
    }

    @Test
    void replayFollowsTheHappyPath() {
        List<AuditEntry> trail = List.of(
                noise(1),
                transition(2, BookingState.SEARCHING, BookingState.AWAITING_SELECTION, TriggerKind.SEARCH_RESULTS, 1),
                transition(3, BookingState.AWAITING_SELECTION, BookingState.COLLECTING_DETAILS, TriggerKind.CANDIDATE_SELECTED, 2),
                noise(4),
                transition(5, BookingState.COLLECTING_DETAILS, BookingState.VERIFYING_AVAILABILITY, TriggerKind.DETAILS_COMPLETED, 3),
                transition(6, BookingState.VERIFYING_AVAILABILITY, BookingState.CONFIRMED, TriggerKind.AVAILABILITY_CONFIRMED, 4));

        assertEquals(BookingState.CONFIRMED, BookingTransitions.replay(trail));
    }

    @Test
    void replayOfAnEmptyTrailIsSearching() {
        assertEquals(BookingState.SEARCHING, BookingTransitions.replay(List.of(noise(1))));
    }

    @Test
    void replayRejectsGapsAndIllegalJumps() {
        List<AuditEntry> gap = List.of(
                transition(1, BookingState.SEARCHING, BookingState.AWAITING_SELECTION, TriggerKind.SEARCH_RESULTS, 1),
                transition(2, BookingState.AWAITING_SELECTION, BookingState.COLLECTING_DETAILS, TriggerKind.CANDIDATE_SELECTED, 3));
        assertThrows(IllegalStateException.class, () -> BookingTransitions.replay(gap));

        List<AuditEntry> jump = List.of(
                transition(1, BookingState.SEARCHING, BookingState.CONFIRMED, TriggerKind.AVAILABILITY_CONFIRMED, 1));
        assertThrows(IllegalStateException.class, () -> BookingTransitions.replay(jump));

        List<AuditEntry> broken = List.of(
                transition(1, BookingState.SEARCHING, BookingState.AWAITING_SELECTION, TriggerKind.SEARCH_RESULTS, 1),
                transition(2, BookingState.COLLECTING_DETAILS, BookingState.VERIFYING_AVAILABILITY, TriggerKind.DETAILS_COMPLETED, 2));
        assertThrows(IllegalStateException.class, () -> BookingTransitions.replay(broken));
    }

    private static AuditEntry transition(long auditSequence, BookingState from, BookingState to, TriggerKind trigger, long sequence) {
        return new AuditEntry(auditSequence, Instant.now(), "req-1", AuditEventKind.TRANSITION, AuditSeverity.INFO, Map.of(
                "from", from.name(),
                "to", to.name(),
                "trigger", trigger.name(),
                "sequence", String.valueOf(sequence)));
    }

    private static AuditEntry noise(long auditSequence) {
        return new AuditEntry(auditSequence, Instant.now(), "req-1", AuditEventKind.DETAILS_UPDATED, AuditSeverity.INFO,
                Map.of("consigner_name", "Asha"));
    }
}
