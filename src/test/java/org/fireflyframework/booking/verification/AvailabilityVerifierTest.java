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

import org.fireflyframework.booking.core.Candidate;
import org.fireflyframework.booking.core.RouteCriteria;
import org.fireflyframework.booking.core.TripDetails;
import org.fireflyframework.booking.core.TripField;
import org.fireflyframework.booking.core.exception.ExternalServiceException;
import org.fireflyframework.booking.invoke.CallPolicy;
import org.fireflyframework.booking.invoke.ExternalCallInvoker;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityVerifierTest {

    private static final LocalDate DAY = LocalDate.of(2026, 11, 20);
    private static final Candidate TRUCK = new Candidate("TRK-A", "alpha", null, "Medium Truck", 5000,
            new BigDecimal("100"), 4.5, true);
    private static final RouteCriteria ROUTE = new RouteCriteria("Mumbai", "Pune", DAY, DAY, 1);
    private static final CallPolicy POLICY = new CallPolicy(Duration.ofMillis(500), 3, Duration.ofMillis(1),
            Duration.ofMillis(2), 2.0, 0.0);

    private static TripDetails details(String weight) {
        return TripDetails.empty().with(TripField.CONSIGNER_NAME, "Asha").with(TripField.PARCEL_WEIGHT, weight);
    }

    @Test
    void sendsOfferAndWireDetails() {
        AtomicReference<VerificationRequest> seen = new AtomicReference<>();
        AvailabilityVerifier verifier = new AvailabilityVerifier(request -> {
            seen.set(request);
            return Mono.just(VerificationResponse.confirmed("BK-7"));
        }, new ExternalCallInvoker(), POLICY);

        StepVerifier.create(verifier.verify("req-1", TRUCK, details("250 kg"), ROUTE, null))
                .expectNext(new VerificationOutcome.Confirmed("BK-7"))
                .verifyComplete();
        assertThat(seen.get().offerId()).isEqualTo("TRK-A");
        assertThat(seen.get().capacity()).isEqualTo(5000);
        assertThat(seen.get().tripDetails()).containsEntry("parcel_weight", "250 kg").containsEntry("consigner_name", "Asha");
    }

    @Test
    void transientProviderErrorsAreRetried() {
        AtomicInteger calls = new AtomicInteger();
        AvailabilityVerifier verifier = new AvailabilityVerifier(request -> calls.incrementAndGet() == 1
                ? Mono.error(new TransientProviderException("HTTP 502", 502))
                : Mono.just(VerificationResponse.rejected("no driver")), new ExternalCallInvoker(), POLICY);

        StepVerifier.create(verifier.verify("req-1", TRUCK, details("1 t"), ROUTE, null))
                .expectNext(new VerificationOutcome.Rejected("no driver"))
                .verifyComplete();
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void silentProviderIsAnExternalServiceError() {
        AvailabilityVerifier verifier = new AvailabilityVerifier(request -> Mono.empty(), new ExternalCallInvoker(), POLICY);

        StepVerifier.create(verifier.verify("req-1", TRUCK, details("1 t"), ROUTE, null))
                .expectError(ExternalServiceException.class)
                .verify();
    }

    @Test
    void simulatedProviderDeclinesOverweightParcels() {
        AvailabilityVerifier verifier = new AvailabilityVerifier(new SimulatedAvailabilityProvider(),
                new ExternalCallInvoker(), POLICY);

        StepVerifier.create(verifier.verify("req-1", TRUCK, details("6 t"), ROUTE, null))
                .assertNext(outcome -> assertThat(outcome).isInstanceOf(VerificationOutcome.Rejected.class))
                .verifyComplete();
        StepVerifier.create(verifier.verify("req-1", TRUCK, details("4500 kg"), ROUTE, null))
                .assertNext(outcome -> assertThat(((VerificationOutcome.Confirmed) outcome).bookingReference()).startsWith("BK"))
                .verifyComplete();
    }
}
