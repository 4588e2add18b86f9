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

import java.time.LocalDate;

/**
 * Search criteria of a booking request: route, travel window and party size.
 *
 * @param origin      pickup city or location
 * @param destination drop city or location
 * @param earliest    first acceptable travel date (inclusive)
 * @param latest      last acceptable travel date (inclusive)
 * @param partyCount  passengers or consignments to carry, at least 1
 */
public record RouteCriteria(String origin,
                            String destination,
                            LocalDate earliest,
                            LocalDate latest,
                            int partyCount) {

    public boolean hasValidWindow() {
        return earliest != null && latest != null && !earliest.isAfter(latest);
    }
}
