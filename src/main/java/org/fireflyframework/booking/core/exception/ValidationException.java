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


package org.fireflyframework.booking.core.exception;

import org.fireflyframework.booking.core.FieldIssue;

import java.util.List;

/**
 * Malformed or missing input. Resolved by re-prompting the user, never escalated.
 */
public class ValidationException extends BookingException {

    private final String field;

    public ValidationException(String message) {
        this(null, message);
    }

    public ValidationException(String field, String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public List<FieldIssue> toIssues() {
        return List.of(new FieldIssue(field == null ? "request" : field, getKind(), getMessage()));
    }
}
