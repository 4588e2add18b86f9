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


package org.fireflyframework.booking.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of a booking request. Returned by every engine operation and stored by the
 * persistence providers.
 */
public record BookingSnapshot(String requestId,
                              String userId,
                              IntentKind intentKind,
                              RouteCriteria criteria,
                              BigDecimal budget,
                              Map<String, String> constraints,
                              BookingState state,
                              long sequence,
                              List<Candidate> offeredCandidates,
                              String selectedCandidateId,
                              List<String> excludedCandidateIds,
                              int retrySelections,
                              TripDetails tripDetails,
                              Set<TripField> outstandingFields,
                              Booking booking,
                              List<DocumentRecord> documents,
                              String closureReason,
                              Map<Long, String> appliedTriggers,
                              Instant createdAt,
                              Instant updatedAt) {

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
