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
 * A collaborator call failed after its retry budget was spent, or failed in a way that
 * retrying cannot fix.
 */
public class ExternalServiceException extends BookingException {

    private final String operation;
    private final int attempts;

    public ExternalServiceException(String operation, int attempts, Throwable cause) {
        super(ErrorKind.EXTERNAL_SERVICE_ERROR,
                operation + " failed after " + attempts + " attempt(s): " + describe(cause), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public ExternalServiceException(String operation, String message) {
        super(ErrorKind.EXTERNAL_SERVICE_ERROR, operation + ": " + message);
        this.operation = operation;
        this.attempts = 1;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
