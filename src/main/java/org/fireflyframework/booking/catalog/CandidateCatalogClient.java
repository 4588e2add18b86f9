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
import org.fireflyframework.booking.core.RouteCriteria;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.invoke.CallPolicy;
import org.fireflyframework.booking.invoke.ExternalCallInvoker;
import org.fireflyframework.booking.invoke.RetryListener;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Queries the catalog and turns its raw offers into a ranked, filtered candidate list.
 * <p>
 * Dropped: excluded offers, offers flagged unavailable, offers whose capacity is below the
 * party count and offers above the budget. Ranking is by
 * {@code price * (1 + (5 - rating) * ratingWeight)}, lowest first, then provider id, then
 * offer id.
 */
public class CandidateCatalogClient {

    public static final String OPERATION = "catalog.search";

    private final CandidateCatalog catalog;
    private final ExternalCallInvoker invoker;
    private final CallPolicy policy;
    private final double ratingWeight;

    public CandidateCatalogClient(CandidateCatalog catalog, ExternalCallInvoker invoker,
                                  CallPolicy policy, double ratingWeight) {
        this.catalog = catalog;
        this.invoker = invoker;
        this.policy = policy;
        this.ratingWeight = ratingWeight;
    }

    public Mono<List<Candidate>> search(String requestId, RouteCriteria criteria, BigDecimal budget,
                                        Collection<String> excluded, RetryListener listener) {
        return Mono.defer(() -> {
            validateCriteria(criteria);
            Set<String> excludedIds = excluded == null ? Set.of() : new HashSet<>(excluded);
            CatalogQuery query = new CatalogQuery(requestId, criteria.origin(), criteria.destination(),
                    criteria.earliest(), criteria.latest(), criteria.partyCount(), List.copyOf(excludedIds));
            return invoker.invoke(OPERATION, policy, () -> catalog.search(query), listener)
                    .map(response -> rank(response.candidates(), criteria, budget, excludedIds));
        });
    }

    public static void validateCriteria(RouteCriteria criteria) {
        if (criteria == null) {
            throw new ValidationException("criteria", "route criteria are required");
        }
        if (criteria.origin() == null || criteria.origin().isBlank()) {
            throw new ValidationException("origin", "origin is required");
        }
        if (criteria.destination() == null || criteria.destination().isBlank()) {
            throw new ValidationException("destination", "destination is required");
        }
        if (criteria.earliest() == null || criteria.latest() == null) {
            throw new ValidationException("dates", "a travel date window is required");
        }
        if (!criteria.hasValidWindow()) {
            throw new ValidationException("dates", "earliest date must not be after latest date");
        }
        if (criteria.partyCount() < 1) {
            throw new ValidationException("party_count", "party count must be at least 1");
        }
    }

    List<Candidate> rank(List<Candidate> raw, RouteCriteria criteria, BigDecimal budget, Set<String> excluded) {
        return raw.stream()
                .filter(c -> c.offerId() != null && !excluded.contains(c.offerId()))
                .filter(Candidate::available)
                .filter(c -> c.capacity() >= criteria.partyCount())
                .filter(c -> c.price() != null && (budget == null || c.price().compareTo(budget) <= 0))
                .sorted(Comparator.comparingDouble(this::score)
                        .thenComparing(Candidate::providerId, Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(Candidate::offerId))
                .toList();
    }

    double score(Candidate c) {
        double rating = Math.max(0.0, Math.min(5.0, c.rating()));
        return c.price().doubleValue() * (1.0 + (5.0 - rating) * ratingWeight);
    }
}
