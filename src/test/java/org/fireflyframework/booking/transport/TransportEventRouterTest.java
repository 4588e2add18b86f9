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


package org.fireflyframework.booking.transport;

import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.exception.SecurityViolationException;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.engine.BookingEngineHarness;
import org.fireflyframework.booking.engine.EngineResult;
import org.fireflyframework.booking.notification.NotificationDispatcher;
import org.fireflyframework.booking.notification.StatusMessage;
import org.fireflyframework.booking.security.SecurityGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TransportEventRouterTest {

    private BookingEngineHarness h;
    private TransportEventRouter router;

    @BeforeEach
    void setUp() {
        h = new BookingEngineHarness();
    }

    private void start() {
        h.build();
        router = new TransportEventRouter(h.engine, new NotificationDispatcher(h.transport),
                new SecurityGate(h.properties.getSecurity()));
    }

    @Test
    void intentOpensTheActiveRequestAndOptionNumbersSelect() {
        start();
        EngineResult created = router.route(InboundEvent.intent("user-1", BookingEngineHarness.intent())).block();
        String requestId = created.snapshot().requestId();

        assertThat(router.activeRequest("user-1")).contains(requestId);
        assertThat(created.snapshot().state()).isEqualTo(BookingState.AWAITING_SELECTION);

        EngineResult selected = router.route(InboundEvent.selection("user-1", " 2 ", null)).block();

        assertThat(selected.snapshot().state()).isEqualTo(BookingState.COLLECTING_DETAILS);
        assertThat(selected.snapshot().selectedCandidateId())
                .isEqualTo(created.snapshot().offeredCandidates().get(1).offerId());
    }

    @Test
    void offerIdsAreAcceptedAndDetailsFlowToConfirmation() {
        start();
        router.route(InboundEvent.intent("user-1", BookingEngineHarness.intent())).block();
        router.route(InboundEvent.selection("user-1", "TRK-A", null)).block();

        EngineResult confirmed = router.route(InboundEvent.fieldUpdate("user-1", BookingEngineHarness.completeDetails(), null)).block();

        assertThat(confirmed.snapshot().state()).isEqualTo(BookingState.CONFIRMED);
        assertThat(confirmed.snapshot().booking().bookingReference()).isEqualTo("BK-1001");
    }

    @Test
    void unknownOptionNumberIsRejectedAndReported() {
        start();
        String requestId = router.route(InboundEvent.intent("user-1", BookingEngineHarness.intent())).block()
                .snapshot().requestId();

        StepVerifier.create(router.route(InboundEvent.selection("user-1", "7", null)))
                .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(ValidationException.class)
                        .hasMessageContaining("choose between 1 and 3"))
                .verify();

        List<StatusMessage> sent = h.transport.forRequest(requestId);
        assertThat(sent.get(sent.size() - 1).getKind()).isEqualTo(StatusMessage.Kind.ERROR);
    }

    @Test
    void secondIntentWaitsUntilTheFirstIsClosed() {
        start();
        router.route(InboundEvent.intent("user-1", BookingEngineHarness.intent())).block();

        StepVerifier.create(router.route(InboundEvent.intent("user-1", BookingEngineHarness.intent())))
                .expectErrorSatisfies(e -> assertThat(e).hasMessageContaining("still in progress"))
                .verify();

        EngineResult cancelled = router.route(InboundEvent.cancel("user-1", "found another truck", null)).block();
        assertThat(cancelled.snapshot().state()).isEqualTo(BookingState.CANCELLED);

        EngineResult next = router.route(InboundEvent.intent("user-1", BookingEngineHarness.intent())).block();
        assertThat(next.snapshot().requestId()).isNotEqualTo(cancelled.snapshot().requestId());
        assertThat(router.activeRequest("user-1")).contains(next.snapshot().requestId());
    }

    @Test
    void eventsWithoutAnActiveRequestAreRejected() {
        start();

        StepVerifier.create(router.route(InboundEvent.fieldUpdate("user-9", Map.of("parcel_weight", "5 kg"), null)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(router.route(null)).expectError(ValidationException.class).verify();
    }

    @Test
    void unauthorizedUsersAreTurnedAway() {
        h.properties.getSecurity().setAuthorizedUsers(List.of("user-1"));
        start();

        StepVerifier.create(router.route(InboundEvent.intent("intruder", BookingEngineHarness.intent())))
                .expectError(SecurityViolationException.class)
                .verify();
        assertThat(router.activeRequest("intruder")).isEmpty();
    }
}
