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

import org.fireflyframework.booking.core.TripField;
import org.fireflyframework.booking.details.TripFieldValidator;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stand-in provider used when no verifier URL is configured. Declines parcels heavier than
 * the vehicle capacity and confirms everything else.
 */
public class SimulatedAvailabilityProvider implements AvailabilityProvider {

    @Override
    public Mono<VerificationResponse> requestAvailability(VerificationRequest request) {
        return Mono.fromSupplier(() -> {
            String weight = request.tripDetails().get(TripField.PARCEL_WEIGHT.key());
            if (weight != null && request.capacity() > 0) {
                BigDecimal kg = TripFieldValidator.parseWeightKg(weight);
                if (kg.compareTo(BigDecimal.valueOf(request.capacity())) > 0) {
                    return VerificationResponse.rejected("parcel exceeds vehicle capacity of " + request.capacity() + " kg");
                }
            }
            return VerificationResponse.confirmed("BK" + ThreadLocalRandom.current().nextInt(10000, 100000));
        });
    }
}
