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


package org.fireflyframework.booking.details;

import org.fireflyframework.booking.core.FieldIssue;
import org.fireflyframework.booking.core.TripDetails;
import org.fireflyframework.booking.core.TripField;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of merging one batch of user-supplied fields.
 *
 * @param details          merged details, previously accepted values included
 * @param accepted         fields accepted from this batch
 * @param issues           rejected fields with the reason
 * @param outstanding      required fields still missing after the merge
 * @param rejectedInputs   raw values of fields rejected by the security gate, for auditing only
 */
public record DetailSubmission(TripDetails details,
                               List<TripField> accepted,
                               List<FieldIssue> issues,
                               Set<TripField> outstanding,
                               Map<String, String> rejectedInputs) {

    public boolean isComplete() {
        return outstanding.isEmpty();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
