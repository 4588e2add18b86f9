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
 * What an engine operation did to the request.
 */
public enum EventOutcome {
    /** A state transition was applied. */
    APPLIED,
    /** Data changed without a transition, e.g. partial trip details or one verified document. */
    UPDATED,
    /** Nothing changed. */
    NO_CHANGE,
    /** The event repeated a transition that was already applied. */
    REPLAYED,
    /** A collaborator result arrived after the request moved on and was discarded. */
    STALE_DISCARDED,
    /** A collaborator stayed unreachable; the request kept its state. */
    DEGRADED
}
