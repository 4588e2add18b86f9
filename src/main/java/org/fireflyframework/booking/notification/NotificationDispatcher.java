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

import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.Candidate;
import org.fireflyframework.booking.core.DocumentRecord;
import org.fireflyframework.booking.core.DocumentType;
import org.fireflyframework.booking.core.FieldIssue;
import org.fireflyframework.booking.core.TripField;
import org.fireflyframework.booking.core.exception.BookingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders user-facing messages and sends them through the {@link OutboundTransport}.
 * Delivery failures are logged and never reach the caller.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final OutboundTransport transport;

    public NotificationDispatcher(OutboundTransport transport) {
        this.transport = transport;
    }

    public Mono<Void> dispatch(List<StatusMessage> messages) {
        return Flux.fromIterable(messages)
                .concatMap(message -> Mono.defer(() -> transport.send(message))
                        .onErrorResume(e -> {
                            log.warn("Failed to deliver {} message for request {} to user {}: {}",
                                    message.getKind(), message.getRequestId(), message.getUserId(), e.toString());
                            return Mono.empty();
                        }))
                .then();
    }

    public StatusMessage transitioned(BookingSnapshot s) {
        return message(s, StatusMessage.Kind.STATUS, render(s));
    }

    public StatusMessage noResults(BookingSnapshot s) {
        return message(s, StatusMessage.Kind.STATUS, String.format(
                "No available vehicles found from %s to %s between %s and %s. Try other dates or a larger budget, or cancel.",
                s.criteria().origin(), s.criteria().destination(), s.criteria().earliest(), s.criteria().latest()));
    }

    public StatusMessage detailsNeeded(BookingSnapshot s) {
        return message(s, StatusMessage.Kind.STATUS, "Thanks. Still needed: " + fieldList(s));
    }

    public StatusMessage documentAccepted(BookingSnapshot s, DocumentType type) {
        String outstanding = s.documents().stream().filter(d -> !d.isVerified())
                .map(DocumentRecord::type).map(Enum::name).collect(Collectors.joining(", "));
        return message(s, StatusMessage.Kind.STATUS, type + " verified. Still needed: " + outstanding);
    }

    public StatusMessage inputRejected(BookingSnapshot s, List<FieldIssue> issues) {
        String problems = issues.stream()
                .map(i -> "- " + i.field() + ": " + i.message())
                .collect(Collectors.joining("\n"));
        String text = "Some details could not be accepted:\n" + problems;
        if (s.state() == BookingState.COLLECTING_DETAILS && !s.outstandingFields().isEmpty()) {
            text += "\nStill needed: " + fieldList(s);
        }
        return message(s, StatusMessage.Kind.INPUT_REJECTED, text);
    }

    public StatusMessage degraded(BookingSnapshot s, String operation) {
        return message(s, StatusMessage.Kind.DEGRADED,
                "We could not reach the " + describe(operation) + " right now. Your request is saved, please try again shortly.");
    }

    public StatusMessage error(String userId, String requestId, BookingException e) {
        return new StatusMessage(userId, requestId, StatusMessage.Kind.ERROR, null, -1, e.getMessage());
    }

    private StatusMessage message(BookingSnapshot s, StatusMessage.Kind kind, String text) {
        return new StatusMessage(s.userId(), s.requestId(), kind, s.state(), s.sequence(), text);
    }

    private String render(BookingSnapshot s) {
        switch (s.state()) {
            case AWAITING_SELECTION: {
                StringBuilder sb = new StringBuilder("Found ").append(s.offeredCandidates().size())
                        .append(" option(s) from ").append(s.criteria().origin())
                        .append(" to ").append(s.criteria().destination()).append(":");
                int i = 1;
                for (Candidate c : s.offeredCandidates()) {
                    sb.append("\n").append(i++).append(". ").append(c.vehicleType())
                            .append(" (").append(c.offerId()).append(") by ").append(c.providerId())
                            .append(", capacity ").append(c.capacity())
                            .append(", price ").append(c.price().toPlainString())
                            .append(", rating ").append(c.rating());
                }
                return sb.append("\nReply with the option number to continue.").toString();
            }
            case COLLECTING_DETAILS:
                return "Option " + s.selectedCandidateId() + " selected. Please provide: " + fieldList(s);
            case VERIFYING_AVAILABILITY:
                return "All details received. Checking availability with the provider.";
            case RETRY_SELECTION:
                return "The provider could not confirm this option. Looking for alternatives.";
            case CONFIRMED:
                return "Booking confirmed. Reference: " + s.booking().bookingReference()
                        + ", price " + s.booking().quotedPrice().toPlainString() + ".";
            case DOCUMENTS_PENDING:
                return "Consignment note " + s.booking().consignmentNote() + " issued. Documents needed: "
                        + s.documents().stream().filter(d -> !d.isVerified())
                        .map(DocumentRecord::type).map(Enum::name).collect(Collectors.joining(", "));
            case DOCUMENTS_VERIFIED:
                return "All documents verified. Your shipment is ready for pickup.";
            case IN_TRANSIT:
                return "Your shipment is on its way.";
            case DELIVERED:
                return "Delivered. Thank you for booking with us.";
            case CANCELLED:
                return "Request cancelled" + (s.closureReason() == null ? "." : ": " + s.closureReason());
            case FAILED:
                return "We could not complete your booking: " + s.closureReason();
            default:
                return "Request is now " + s.state();
        }
    }

    private static String fieldList(BookingSnapshot s) {
        return s.outstandingFields().stream().map(TripField::key).collect(Collectors.joining(", "));
    }

    private static String describe(String operation) {
        if (operation == null) return "service";
        if (operation.startsWith("catalog")) return "vehicle catalog";
        if (operation.startsWith("availability")) return "provider";
        if (operation.startsWith("documents")) return "document service";
        return "service";
    }
}
