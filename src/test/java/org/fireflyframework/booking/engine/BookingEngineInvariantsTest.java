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


package org.fireflyframework.booking.engine;

import org.fireflyframework.booking.audit.AuditEntry;
import org.fireflyframework.booking.audit.AuditEventKind;
import org.fireflyframework.booking.audit.AuditSeverity;
import org.fireflyframework.booking.catalog.CatalogResponse;
import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.exception.InvalidTransitionException;
import org.fireflyframework.booking.core.exception.RequestNotFoundException;
import org.fireflyframework.booking.core.exception.SecurityViolationException;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.intent.BookingIntent;
import org.fireflyframework.booking.verification.VerificationResponse;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingEngineInvariantsTest {

    @Test
    void repeatedSelectionWithSameObservedSequenceIsReplayed() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = h.createAwaitingSelection();

        EngineResult first = h.engine.selectCandidate(id, "TRK-A", 1L).block();
        EngineResult second = h.engine.selectCandidate(id, "TRK-A", 1L).block();

        assertThat(first.outcome()).isEqualTo(EventOutcome.APPLIED);
        assertThat(second.outcome()).isEqualTo(EventOutcome.REPLAYED);
        assertThat(second.snapshot().sequence()).isEqualTo(2L);
        assertThat(h.triggers(id)).containsExactly("SEARCH_RESULTS", "CANDIDATE_SELECTED");
        assertThat(h.trail(id, AuditEventKind.IDEMPOTENT_REPLAY)).hasSize(1);
        assertThat(h.events.calls).contains("replay:CANDIDATE_SELECTED");
    }

    @Test
    void differentSelectionAgainstStaleSequenceIsRejected() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = h.createAwaitingSelection();
        h.engine.selectCandidate(id, "TRK-A", 1L).block();

        StepVerifier.create(h.engine.selectCandidate(id, "TRK-B", 1L))
                .expectError(InvalidTransitionException.class)
                .verify();
        StepVerifier.create(h.engine.selectCandidate(id, "TRK-B", 42L))
                .expectError(InvalidTransitionException.class)
                .verify();

        assertThat(h.engine.status(id).block().selectedCandidateId()).isEqualTo("TRK-A");
        assertThat(h.trail(id, AuditEventKind.INVALID_TRANSITION)).hasSize(2);
    }

    @Test
    void secondCancelIsReplayedNotRejected() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = h.createAwaitingSelection();

        EngineResult first = h.engine.cancel(id, "   ", null).block();
        EngineResult second = h.engine.cancel(id, "again", null).block();

        assertThat(first.snapshot().state()).isEqualTo(BookingState.CANCELLED);
        assertThat(first.snapshot().closureReason()).isEqualTo("cancelled by user");
        assertThat(second.outcome()).isEqualTo(EventOutcome.REPLAYED);
        assertThat(second.snapshot().closureReason()).isEqualTo("cancelled by user");
        assertThat(h.triggers(id)).containsExactly("SEARCH_RESULTS", "USER_CANCELLED");
    }

    @Test
    void detailsCannotBeSubmittedBeforeSelection() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = h.createAwaitingSelection();

        StepVerifier.create(h.engine.submitDetails(id, BookingEngineHarness.completeDetails(), null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(InvalidTransitionException.class);
                    assertThat(((InvalidTransitionException) e).getState()).isEqualTo(BookingState.AWAITING_SELECTION);
                })
                .verify();
        assertThat(h.providerCalls.get()).isZero();
    }

    @Test
    void providerIsNotAskedUntilEveryRequiredFieldIsAccepted() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = h.createAwaitingSelection();
        h.engine.selectCandidate(id, "TRK-A", null).block();

        EngineResult partial = h.engine.submitDetails(id, Map.of("consigner_name", "Asha Verma"), null).block();
        assertThat(partial.outcome()).isEqualTo(EventOutcome.UPDATED);
        assertThat(partial.snapshot().outstandingFields()).hasSize(7);
        assertThat(h.providerCalls.get()).isZero();

        EngineResult nothing = h.engine.submitDetails(id, Map.of("colour", "blue"), null).block();
        assertThat(nothing.outcome()).isEqualTo(EventOutcome.NO_CHANGE);
        assertThat(nothing.issues()).extracting(i -> i.field()).containsExactly("colour");
        assertThat(h.providerCalls.get()).isZero();
    }

    @Test
    void unofferedSelectionIsRejectedAsValidationError() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = h.createAwaitingSelection();

        StepVerifier.create(h.engine.selectCandidate(id, "TRK-Z", null))
                .expectError(ValidationException.class)
                .verify();
        assertThat(h.engine.status(id).block().state()).isEqualTo(BookingState.AWAITING_SELECTION);
        assertThat(h.trail(id, AuditEventKind.VALIDATION_FAILED)).singleElement()
                .satisfies(e -> assertThat(e.get("field")).isEqualTo("selection"));
    }

    @Test
    void excludedCandidatesOnlyAccumulate() {
        BookingEngineHarness h = new BookingEngineHarness();
        h.provider = request -> Mono.just(VerificationResponse.rejected("fully booked"));
        h.build();
        String id = h.createAwaitingSelection();
        h.engine.selectCandidate(id, "TRK-A", null).block();

        List<List<String>> observed = new ArrayList<>();
        observed.add(h.engine.submitDetails(id, BookingEngineHarness.completeDetails(), null).block()
                .snapshot().excludedCandidateIds());
        observed.add(h.engine.selectCandidate(id, "TRK-B", null).block().snapshot().excludedCandidateIds());
        BookingSnapshot last = h.engine.selectCandidate(id, "TRK-C", null).block().snapshot();
        observed.add(last.excludedCandidateIds());

        for (int i = 1; i < observed.size(); i++) {
            assertThat(observed.get(i)).startsWith(observed.get(i - 1).toArray(new String[0]));
        }
        assertThat(last.excludedCandidateIds()).containsExactly("TRK-A", "TRK-B", "TRK-C");
        assertThat(last.state()).isEqualTo(BookingState.FAILED);
        assertThat(last.closureReason()).isEqualTo("no alternatives available");
        assertThat(h.replayedState(id)).isEqualTo(last.state());
    }

    @Test
    void lateCatalogResultsAfterCancelAreDiscarded() {
        BookingEngineHarness h = new BookingEngineHarness();
        Sinks.One<CatalogResponse> results = Sinks.one();
        h.catalog = query -> results.asMono();
        h.build();

        StepVerifier.create(h.engine.create("user-1", BookingEngineHarness.intent()))
                .then(() -> {
                    String id = h.engine.history("user-1", 1).blockFirst().requestId();
                    h.engine.cancel(id, null, null).block();
                    results.tryEmitValue(new CatalogResponse(BookingEngineHarness.defaultCandidates()));
                })
                .assertNext(result -> {
                    assertThat(result.outcome()).isEqualTo(EventOutcome.STALE_DISCARDED);
                    assertThat(result.snapshot().state()).isEqualTo(BookingState.CANCELLED);
                    assertThat(result.snapshot().offeredCandidates()).isEmpty();
                })
                .thenCancel().verify(Duration.ofSeconds(5));
        assertThat(h.events.calls).contains("stale");
    }

    @Test
    void unauthorizedUserCannotOpenRequests() {
        BookingEngineHarness h = new BookingEngineHarness();
        h.properties.getSecurity().setAuthorizedUsers(List.of("user-1"));
        h.build();

        StepVerifier.create(h.engine.create("intruder", BookingEngineHarness.intent()))
                .expectError(SecurityViolationException.class)
                .verify();

        List<AuditEntry> entries = h.audit.entriesFor("-");
        assertThat(entries).singleElement().satisfies(e -> {
            assertThat(e.kind()).isEqualTo(AuditEventKind.UNAUTHORIZED_ACCESS);
            assertThat(e.severity()).isEqualTo(AuditSeverity.HIGH);
            assertThat(e.get("user_id")).isEqualTo("intruder");
        });
        assertThat(h.catalogCalls.get()).isZero();
        assertThat(h.createAwaitingSelection()).isNotBlank();
    }

    @Test
    void malformedIntentsAreRejectedBeforeSearching() {
        BookingEngineHarness h = new BookingEngineHarness().build();

        BookingIntent unsupported = new BookingIntent("book_flight", new BookingIntent.Route("Mumbai", "Pune"),
                BookingIntent.DateWindow.on(BookingEngineHarness.TRAVEL_DATE), 1, null, Map.of());
        StepVerifier.create(h.engine.create("user-1", unsupported))
                .expectErrorSatisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("intent_kind"))
                .verify();

        BookingIntent backwards = new BookingIntent("book_trip", new BookingIntent.Route("Mumbai", "Pune"),
                new BookingIntent.DateWindow(BookingEngineHarness.TRAVEL_DATE, BookingEngineHarness.TRAVEL_DATE.minusDays(2)),
                2, null, Map.of());
        StepVerifier.create(h.engine.create("user-1", backwards))
                .expectErrorSatisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("dates"))
                .verify();

        BookingIntent hostile = new BookingIntent("book_truck", new BookingIntent.Route("Mumbai", "Pune"),
                BookingIntent.DateWindow.on(BookingEngineHarness.TRAVEL_DATE), 1, null,
                Map.of("notes", "fragile; sudo rm -rf /"));
        StepVerifier.create(h.engine.create("user-1", hostile))
                .expectError(SecurityViolationException.class)
                .verify();

        assertThat(h.catalogCalls.get()).isZero();
        assertThat(h.audit.entriesFor("-")).extracting(AuditEntry::kind).containsExactly(
                AuditEventKind.VALIDATION_FAILED, AuditEventKind.VALIDATION_FAILED, AuditEventKind.SECURITY_VIOLATION);
    }

    @Test
    void unknownRequestIsNotFound() {
        BookingEngineHarness h = new BookingEngineHarness().build();

        StepVerifier.create(h.engine.status("missing"))
                .expectError(RequestNotFoundException.class)
                .verify();
        StepVerifier.create(h.engine.cancel("missing", null, null))
                .expectError(RequestNotFoundException.class)
                .verify();
    }

    @Test
    void requestsSurviveAnEngineRestart() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String open = h.createAwaitingSelection();
        String closed = h.createAwaitingSelection();
        h.engine.cancel(closed, null, null).block();

        // a fresh engine over the same persistence
        h.build();
        assertThat(h.engine.recoverInFlight().block()).isEqualTo(1L);

        StepVerifier.create(h.engine.selectCandidate(open, "TRK-B", 1L))
                .assertNext(result -> {
                    assertThat(result.snapshot().state()).isEqualTo(BookingState.COLLECTING_DETAILS);
                    assertThat(result.snapshot().sequence()).isEqualTo(2L);
                })
                .verifyComplete();
        assertThat(h.engine.status(closed).block().state()).isEqualTo(BookingState.CANCELLED);
        assertThat(h.engine.history("user-1", 10).collectList().block())
                .extracting(BookingSnapshot::requestId).containsExactlyInAnyOrder(open, closed);
    }

    @Test
    void terminalRequestsAreCleanedUpAfterRetention() throws InterruptedException {
        BookingEngineHarness h = new BookingEngineHarness();
        h.properties.getPersistence().setTerminalRetention(Duration.ZERO);
        h.build();
        String open = h.createAwaitingSelection();
        String closed = h.createAwaitingSelection();
        h.engine.cancel(closed, null, null).block();
        Thread.sleep(10);

        assertThat(h.engine.cleanupTerminal().block()).isEqualTo(1L);

        StepVerifier.create(h.engine.status(closed))
                .expectError(RequestNotFoundException.class)
                .verify();
        assertThat(h.engine.status(open).block().state()).isEqualTo(BookingState.AWAITING_SELECTION);
    }

    @Test
    void auditTrailReplaysToTheCurrentState() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = BookingEngineScenariosTest.confirmedBooking(h);
        h.engine.requestDocuments(id, null).block();

        List<AuditEntry> trail = h.engine.auditTrail(id).block();
        assertThat(BookingTransitions.replay(trail)).isEqualTo(h.engine.status(id).block().state());
        assertThat(trail).extracting(AuditEntry::auditSequence).isSorted();
        assertThat(trail.get(0).kind()).isEqualTo(AuditEventKind.REQUEST_CREATED);
    }

    @Test
    void transitPastConfirmationNeedsDocumentsFirst() {
        BookingEngineHarness h = new BookingEngineHarness().build();
        String id = BookingEngineScenariosTest.confirmedBooking(h);

        assertThatThrownBy(() -> h.engine.startTransit(id, null).block())
                .isInstanceOf(InvalidTransitionException.class);
        assertThatThrownBy(() -> h.engine.confirmDelivery(id, null).block())
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(h.engine.status(id).block().state()).isEqualTo(BookingState.CONFIRMED);
    }
}
