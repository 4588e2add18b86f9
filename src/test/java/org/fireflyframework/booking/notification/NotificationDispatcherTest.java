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


package org.fireflyframework.booking.notification;

import org.fireflyframework.booking.core.Booking;
import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.BookingStatus;
import org.fireflyframework.booking.core.Candidate;
import org.fireflyframework.booking.core.DocumentRecord;
import org.fireflyframework.booking.core.DocumentType;
import org.fireflyframework.booking.core.FieldIssue;
import org.fireflyframework.booking.core.IntentKind;
import org.fireflyframework.booking.core.RouteCriteria;
import org.fireflyframework.booking.core.TripDetails;
import org.fireflyframework.booking.core.TripField;
import org.fireflyframework.booking.core.exception.ErrorKind;
import org.fireflyframework.booking.core.exception.RequestNotFoundException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationDispatcherTest {

    private static final LocalDate DAY = LocalDate.of(2026, 11, 20);

    private final List<StatusMessage> delivered = new ArrayList<>();

    @Test
    void deliveryFailuresDoNotStopTheBatch() {
        OutboundTransport flaky = message -> message.getText().contains("first")
                ? Mono.error(new IllegalStateException("channel down"))
                : Mono.fromRunnable(() -> delivered.add(message));
        NotificationDispatcher dispatcher = new NotificationDispatcher(flaky);

        StatusMessage first = new StatusMessage("u1", "req-1", StatusMessage.Kind.STATUS, BookingState.SEARCHING, 0, "first");
        StatusMessage second = new StatusMessage("u1", "req-1", StatusMessage.Kind.STATUS, BookingState.SEARCHING, 1, "second");

        StepVerifier.create(dispatcher.dispatch(List.of(first, second))).verifyComplete();
        assertThat(delivered).extracting(StatusMessage::getText).containsExactly("second");
    }

    @Test
    void transportThatThrowsIsContainedToo() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(message -> {
            throw new IllegalStateException("not connected");
        });
        StatusMessage msg = new StatusMessage("u1", "req-1", StatusMessage.Kind.STATUS, BookingState.SEARCHING, 0, "hi");

        StepVerifier.create(dispatcher.dispatch(List.of(msg))).verifyComplete();
    }

    @Test
    void awaitingSelectionListsNumberedOptions() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(message -> Mono.empty());
        BookingSnapshot s = snapshot(BookingState.AWAITING_SELECTION, 1, null, EnumSet.noneOf(TripField.class), List.of());

        StatusMessage msg = dispatcher.transitioned(s);

        assertThat(msg.getKind()).isEqualTo(StatusMessage.Kind.STATUS);
        assertThat(msg.getSequence()).isEqualTo(1L);
        assertThat(msg.getText()).startsWith("Found 2 option(s) from Mumbai to Pune:")
                .contains("1. Medium Truck (TRK-A) by alpha, capacity 5000, price 100")
                .contains("2. Large Truck (TRK-B)");
    }

    @Test
    void rendersBookingAndDocumentStates() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(message -> Mono.empty());
        Booking booking = new Booking("BK-7", "TRK-A", TripDetails.empty(), new BigDecimal("100.00"),
                "CN-20261120-ABCDEF12", BookingStatus.DOCUMENTS_PENDING, Instant.now());
        List<DocumentRecord> docs = List.of(
                DocumentRecord.required(DocumentType.ID_PROOF, Instant.now()).verified(Instant.now()),
                DocumentRecord.required(DocumentType.PARCEL_PHOTO, Instant.now()));

        assertThat(dispatcher.transitioned(snapshot(BookingState.CONFIRMED, 4, booking, Set.of(), docs)).getText())
                .isEqualTo("Booking confirmed. Reference: BK-7, price 100.00.");
        assertThat(dispatcher.transitioned(snapshot(BookingState.DOCUMENTS_PENDING, 5, booking, Set.of(), docs)).getText())
                .contains("CN-20261120-ABCDEF12").endsWith("Documents needed: PARCEL_PHOTO");
        assertThat(dispatcher.documentAccepted(snapshot(BookingState.DOCUMENTS_PENDING, 5, booking, Set.of(), docs),
                DocumentType.ID_PROOF).getText()).isEqualTo("ID_PROOF verified. Still needed: PARCEL_PHOTO");
    }

    @Test
    void rejectedInputListsProblemsAndWhatIsStillNeeded() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(message -> Mono.empty());
        BookingSnapshot s = snapshot(BookingState.COLLECTING_DETAILS, 2, null,
                EnumSet.of(TripField.PARCEL_WEIGHT, TripField.CONSIGNEE_PHONE), List.of());

        StatusMessage msg = dispatcher.inputRejected(s,
                List.of(new FieldIssue("parcel_weight", ErrorKind.VALIDATION_ERROR, "weight must be greater than zero")));

        assertThat(msg.getKind()).isEqualTo(StatusMessage.Kind.INPUT_REJECTED);
        assertThat(msg.getText()).isEqualTo("Some details could not be accepted:\n"
                + "- parcel_weight: weight must be greater than zero\n"
                + "Still needed: consignee_phone, parcel_weight");
    }

    @Test
    void degradedAndErrorMessages() {
        NotificationDispatcher dispatcher = new NotificationDispatcher(message -> Mono.empty());
        BookingSnapshot s = snapshot(BookingState.SEARCHING, 0, null, Set.of(), List.of());

        assertThat(dispatcher.degraded(s, "catalog.search").getText()).contains("vehicle catalog");
        assertThat(dispatcher.degraded(s, "availability.verify").getText()).contains("the provider");
        assertThat(dispatcher.noResults(s).getText()).startsWith("No available vehicles found from Mumbai to Pune");

        StatusMessage error = dispatcher.error("u1", "req-x", new RequestNotFoundException("req-x"));
        assertThat(error.getKind()).isEqualTo(StatusMessage.Kind.ERROR);
        assertThat(error.getState()).isNull();
        assertThat(error.getText()).isEqualTo("No booking request with id req-x");
    }

    private static BookingSnapshot snapshot(BookingState state, long sequence, Booking booking,
                                            Set<TripField> outstanding, List<DocumentRecord> documents) {
        List<Candidate> offers = List.of(
                new Candidate("TRK-A", "alpha", null, "Medium Truck", 5000, new BigDecimal("100"), 4.5, true),
                new Candidate("TRK-B", "beta", null, "Large Truck", 9000, new BigDecimal("140"), 4.0, true));
        return new BookingSnapshot("req-1", "u1", IntentKind.BOOK_TRUCK,
                new RouteCriteria("Mumbai", "Pune", DAY, DAY, 1), null, Map.of(), state, sequence,
                offers, null, List.of(), 0, TripDetails.empty(), outstanding, booking, documents,
                null, Map.of(), Instant.now(), Instant.now());
    }
}
