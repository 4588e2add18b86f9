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
import org.fireflyframework.booking.core.BookingState;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.fireflyframework.booking.core.BookingState.*;

/**
 * The transition table of a booking request. Cancellation and unrecoverable errors are
 * accepted from every non-terminal state; terminal states accept nothing.
 */
public final class BookingTransitions {

    private static final Map<BookingState, Map<TriggerKind, BookingState>> TABLE = new EnumMap<>(BookingState.class);

    static {
        for (BookingState state : BookingState.values()) {
            TABLE.put(state, new EnumMap<>(TriggerKind.class));
        }
        allow(SEARCHING, TriggerKind.SEARCH_RESULTS, AWAITING_SELECTION);
        allow(RETRY_SELECTION, TriggerKind.SEARCH_RESULTS, AWAITING_SELECTION);
        allow(RETRY_SELECTION, TriggerKind.SEARCH_EXHAUSTED, FAILED);
        allow(RETRY_SELECTION, TriggerKind.RETRY_LIMIT_REACHED, FAILED);
        allow(AWAITING_SELECTION, TriggerKind.CANDIDATE_SELECTED, COLLECTING_DETAILS);
        allow(COLLECTING_DETAILS, TriggerKind.DETAILS_COMPLETED, VERIFYING_AVAILABILITY);
        allow(VERIFYING_AVAILABILITY, TriggerKind.AVAILABILITY_CONFIRMED, CONFIRMED);
        allow(VERIFYING_AVAILABILITY, TriggerKind.AVAILABILITY_REJECTED, RETRY_SELECTION);
        allow(VERIFYING_AVAILABILITY, TriggerKind.VERIFICATION_UNAVAILABLE, RETRY_SELECTION);
        allow(CONFIRMED, TriggerKind.DOCUMENTS_REQUESTED, DOCUMENTS_PENDING);
        allow(DOCUMENTS_PENDING, TriggerKind.DOCUMENTS_VERIFIED, DOCUMENTS_VERIFIED);
        allow(DOCUMENTS_VERIFIED, TriggerKind.TRANSIT_STARTED, IN_TRANSIT);
        allow(IN_TRANSIT, TriggerKind.DELIVERY_CONFIRMED, DELIVERED);
        for (BookingState state : BookingState.values()) {
            if (!state.isTerminal()) {
                allow(state, TriggerKind.USER_CANCELLED, CANCELLED);
                allow(state, TriggerKind.UNRECOVERABLE_ERROR, FAILED);
            }
        }
    }

    private BookingTransitions() {
    }

    private static void allow(BookingState from, TriggerKind trigger, BookingState to) {
        TABLE.get(from).put(trigger, to);
    }

    public static Optional<BookingState> target(BookingState from, TriggerKind trigger) {
        return Optional.ofNullable(TABLE.get(from).get(trigger));
    }

    public static boolean isAllowed(BookingState from, TriggerKind trigger) {
        return TABLE.get(from).containsKey(trigger);
    }

    public static Set<TriggerKind> allowedTriggers(BookingState from) {
        return Collections.unmodifiableSet(TABLE.get(from).keySet());
    }

    /**
     * Replays the TRANSITION entries of an audit trail from SEARCHING and returns the state
     * they lead to.
     *
     * @throws IllegalStateException if an entry does not continue from the previous state,
     *                               uses a transition the table does not allow, or skips a
     *                               sequence number
     */
    public static BookingState replay(List<AuditEntry> entries) {
        BookingState state = SEARCHING;
        long expectedSequence = 1;
        List<AuditEntry> transitions = entries.stream()
                .filter(e -> e.kind() == AuditEventKind.TRANSITION)
                .sorted(Comparator.comparingLong(AuditEntry::auditSequence))
                .toList();
        for (AuditEntry entry : transitions) {
            BookingState from = BookingState.valueOf(entry.get("from"));
            BookingState to = BookingState.valueOf(entry.get("to"));
            TriggerKind trigger = TriggerKind.valueOf(entry.get("trigger"));
            long sequence = Long.parseLong(entry.get("sequence"));
            if (from != state) {
                throw new IllegalStateException("Transition #" + sequence + " starts at " + from + " but request was " + state);
            }
            if (sequence != expectedSequence) {
                throw new IllegalStateException("Expected sequence " + expectedSequence + " but found " + sequence);
            }
            BookingState allowed = target(from, trigger).orElseThrow(() ->
                    new IllegalStateException(trigger + " is not allowed from " + from));
            if (allowed != to) {
                throw new IllegalStateException(trigger + " from " + from + " leads to " + allowed + ", not " + to);
            }
            state = to;
            expectedSequence++;
        }
        return state;
    }
}
