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
import org.fireflyframework.booking.core.exception.ExternalServiceException;
import org.fireflyframework.booking.invoke.CallPolicy;
import org.fireflyframework.booking.invoke.ExternalCallInvoker;
import org.fireflyframework.booking.invoke.RetryListener;
import reactor.core.publisher.Mono;

/**
 * Asks the provider whether the selected offer can be booked with the collected details.
 * Transient failures are retried per the call policy; exhaustion surfaces as
 * {@link ExternalServiceException}.
 */
public class AvailabilityVerifier {

    public static final String OPERATION = "availability.verify";

    private final AvailabilityProvider provider;
    private final ExternalCallInvoker invoker;
    private final CallPolicy policy;

    public AvailabilityVerifier(AvailabilityProvider provider, ExternalCallInvoker invoker, CallPolicy policy) {
        this.provider = provider;
        this.invoker = invoker;
        this.policy = policy;
    }

    public Mono<VerificationOutcome> verify(String requestId, Candidate candidate, TripDetails details,
                                            RouteCriteria criteria, RetryListener listener) {
        VerificationRequest request = new VerificationRequest(requestId, candidate.offerId(), candidate.providerId(),
                candidate.capacity(), criteria.earliest(), criteria.latest(), details.toWire());
        return invoker.invoke(OPERATION, policy, () -> provider.requestAvailability(request), listener)
                .switchIfEmpty(Mono.error(() -> new ExternalServiceException(OPERATION, "no response from provider")))
                .map(VerificationOutcome::from);
    }
}
