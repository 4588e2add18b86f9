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

/**
 * Provider answer as received on the wire.
 *
 * @param status            {@code CONFIRMED} or {@code REJECTED}
 * @param bookingReference  provider reference, required when confirmed
 * @param reason            rejection reason
 */
public record VerificationResponse(String status, String bookingReference, String reason) {

    public static VerificationResponse confirmed(String bookingReference) {
        return new VerificationResponse("CONFIRMED", bookingReference, null);
    }

    public static VerificationResponse rejected(String reason) {
        return new VerificationResponse("REJECTED", null, reason);
    }
}
