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


package org.fireflyframework.booking.verification;

import org.fireflyframework.booking.core.exception.ExternalServiceException;

import java.util.Locale;

/**
 * Business outcome of an availability check. A rejection is an outcome, not an error.
 */
public interface VerificationOutcome {

    record Confirmed(String bookingReference) implements VerificationOutcome {
    }

    record Rejected(String reason) implements VerificationOutcome {
    }

    /**
     * Validates a wire response.
     *
     * @throws ExternalServiceException if the response is malformed
     */
    static VerificationOutcome from(VerificationResponse response) {
        if (response == null || response.status() == null) {
            throw new ExternalServiceException(AvailabilityVerifier.OPERATION, "response without status");
        }
        switch (response.status().trim().toUpperCase(Locale.ROOT)) {
            case "CONFIRMED":
                if (response.bookingReference() == null || response.bookingReference().isBlank()) {
                    throw new ExternalServiceException(AvailabilityVerifier.OPERATION, "confirmation without booking reference");
                }
                return new Confirmed(response.bookingReference().trim());
            case "REJECTED":
                return new Rejected(response.reason() == null || response.reason().isBlank()
                        ? "provider declined" : response.reason().trim());
            default:
                throw new ExternalServiceException(AvailabilityVerifier.OPERATION, "unknown status " + response.status());
        }
    }
}
