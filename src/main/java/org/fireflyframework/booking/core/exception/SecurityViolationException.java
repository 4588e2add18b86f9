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

/**
 * Input matched a dangerous pattern, referenced a non-whitelisted URL, or came from a user
 * who is not allowed to book.
 */
public class SecurityViolationException extends BookingException {

    private final String field;
    private final String reason;

    public SecurityViolationException(String field, String reason) {
        super(ErrorKind.SECURITY_VIOLATION, "Input rejected for security reasons: " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
