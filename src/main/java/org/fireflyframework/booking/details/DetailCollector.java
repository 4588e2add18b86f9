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
import org.fireflyframework.booking.core.exception.ErrorKind;
import org.fireflyframework.booking.core.exception.SecurityViolationException;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.security.SecurityGate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges user-supplied trip fields across turns. Each field is screened by the
 * {@link SecurityGate} and then format-checked; a rejected field is reported and left out of
 * the merge, so accepted values are never lost.
 */
public class DetailCollector {

    private final SecurityGate securityGate;
    private final TripFieldValidator validator;

    public DetailCollector(SecurityGate securityGate, TripFieldValidator validator) {
        this.securityGate = securityGate;
        this.validator = validator;
    }

    public DetailSubmission submit(TripDetails current, Map<String, String> fields) {
        TripDetails merged = current == null ? TripDetails.empty() : current;
        List<TripField> accepted = new ArrayList<>();
        List<FieldIssue> issues = new ArrayList<>();
        Map<String, String> rejectedInputs = new LinkedHashMap<>();

        if (fields != null) {
            for (Map.Entry<String, String> entry : fields.entrySet()) {
                Optional<TripField> field = TripField.fromKey(entry.getKey());
                if (field.isEmpty()) {
                    issues.add(new FieldIssue(String.valueOf(entry.getKey()), ErrorKind.VALIDATION_ERROR, "unknown field"));
                    continue;
                }
                String key = field.get().key();
                try {
                    String screened = securityGate.screenField(key, entry.getValue());
                    String normalized = validator.validate(field.get(), screened);
                    merged = merged.with(field.get(), normalized);
                    accepted.add(field.get());
                } catch (SecurityViolationException e) {
                    issues.add(new FieldIssue(key, ErrorKind.SECURITY_VIOLATION, e.getReason()));
                    rejectedInputs.put(key, entry.getValue());
                } catch (ValidationException e) {
                    issues.add(new FieldIssue(key, ErrorKind.VALIDATION_ERROR, e.getMessage()));
                }
            }
        }
        return new DetailSubmission(merged, List.copyOf(accepted), List.copyOf(issues),
                merged.missingRequired(), rejectedInputs);
    }
}
