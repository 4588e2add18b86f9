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


package org.fireflyframework.booking.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A booking confirmed by the provider. Only {@code status} and the consignment note number,
 * issued once when documentation starts, change after confirmation.
 *
 * @param bookingReference  reference returned by the availability provider
 * @param candidateId       offer that was confirmed
 * @param tripDetails       details the booking was confirmed with
 * @param quotedPrice       price of the confirmed offer
 * @param consignmentNote   consignment note (bilty) number, null until documentation starts
 * @param status            current booking status
 * @param confirmedAt       confirmation time
 */
public record Booking(String bookingReference,
                      String candidateId,
                      TripDetails tripDetails,
                      BigDecimal quotedPrice,
                      String consignmentNote,
                      BookingStatus status,
                      Instant confirmedAt) {

    public Booking withStatus(BookingStatus newStatus) {
        return new Booking(bookingReference, candidateId, tripDetails, quotedPrice, consignmentNote, newStatus, confirmedAt);
    }

    public Booking withConsignmentNote(String note) {
        if (consignmentNote != null) {
            throw new IllegalStateException("Consignment note already issued for booking " + bookingReference);
        }
        return new Booking(bookingReference, candidateId, tripDetails, quotedPrice, note, status, confirmedAt);
    }
}
