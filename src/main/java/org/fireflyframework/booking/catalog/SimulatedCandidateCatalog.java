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


package org.fireflyframework.booking.catalog;

import org.fireflyframework.booking.core.Candidate;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Stand-in catalog used when no catalog URL is configured. Prices are derived from the route
 * so repeated searches return the same offers.
 */
public class SimulatedCandidateCatalog implements CandidateCatalog {

    private static final List<Candidate> FLEET = List.of(
            new Candidate("TRK001", "abc-transport", "+91-9876543210", "Medium Truck", 5000, new BigDecimal("25"), 4.5, true),
            new Candidate("TRK002", "xyz-logistics", "+91-9876543211", "Large Truck", 10000, new BigDecimal("35"), 4.2, true),
            new Candidate("TRK003", "swift-movers", "+91-9876543212", "Mini Truck", 1500, new BigDecimal("18"), 3.9, true),
            new Candidate("TRK004", "highway-kings", "+91-9876543213", "Trailer", 20000, new BigDecimal("48"), 4.7, false));

    @Override
    public Mono<CatalogResponse> search(CatalogQuery query) {
        return Mono.fromSupplier(() -> {
            int distance = estimateDistanceKm(query.origin(), query.destination());
            List<Candidate> offers = new ArrayList<>();
            for (Candidate truck : FLEET) {
                if (query.excluded().contains(truck.offerId())) {
                    continue;
                }
                BigDecimal total = truck.price().multiply(BigDecimal.valueOf(distance)).setScale(2, RoundingMode.HALF_UP);
                offers.add(new Candidate(truck.offerId(), truck.providerId(), truck.providerContact(),
                        truck.vehicleType(), truck.capacity(), total, truck.rating(), truck.available()));
            }
            return new CatalogResponse(offers);
        });
    }

    static int estimateDistanceKm(String origin, String destination) {
        String route = (origin + "|" + destination).toLowerCase(Locale.ROOT);
        return 100 + Math.floorMod(route.hashCode(), 1400);
    }
}
