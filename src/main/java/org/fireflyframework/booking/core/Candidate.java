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

/**
 * An offer returned by the catalog. Read-only once received.
 *
 * @param offerId         catalog identifier of the offer
 * @param providerId      provider (transporter or operator) identifier
 * @param providerContact provider contact handle, shown to the user after confirmation
 * @param vehicleType     vehicle or service class
 * @param capacity        payload capacity in kilograms for trucks, seats for trips
 * @param price           quoted price
 * @param rating          provider rating between 0 and 5
 * @param available       availability flag as reported at query time
 */
public record Candidate(String offerId,
                        String providerId,
                        String providerContact,
                        String vehicleType,
                        int capacity,
                        BigDecimal price,
                        double rating,
                        boolean available) {
}
