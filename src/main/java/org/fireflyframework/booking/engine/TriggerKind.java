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

/**
 * Events that move a booking request between states.
 */
public enum TriggerKind {
    SEARCH_RESULTS,
    SEARCH_EXHAUSTED,
    RETRY_LIMIT_REACHED,
    CANDIDATE_SELECTED,
    DETAILS_COMPLETED,
    AVAILABILITY_CONFIRMED,
    AVAILABILITY_REJECTED,
    VERIFICATION_UNAVAILABLE,
    DOCUMENTS_REQUESTED,
    DOCUMENTS_VERIFIED,
    TRANSIT_STARTED,
    DELIVERY_CONFIRMED,
    USER_CANCELLED,
    UNRECOVERABLE_ERROR
}
