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

import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.FieldIssue;

import java.util.List;

/**
 * Result of an engine operation: the request as it stands afterwards, what happened, and any
 * rejected inputs the user must fix.
 */
public record EngineResult(BookingSnapshot snapshot, EventOutcome outcome, List<FieldIssue> issues) {

    public EngineResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
