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


package org.fireflyframework.booking.intent;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.fireflyframework.booking.core.IntentKind;
import org.fireflyframework.booking.core.RouteCriteria;
import org.fireflyframework.booking.core.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured intent produced by the language front end from the user's first message.
 */
public record BookingIntent(@JsonProperty("intent_kind") String intentKind,
                            @JsonProperty("route") Route route,
                            @JsonProperty("dates") DateWindow dates,
                            @JsonProperty("party_count") Integer partyCount,
                            @JsonProperty("budget") BigDecimal budget,
                            @JsonProperty("free_text_fields") Map<String, String> freeTextFields) {

    public record Route(String origin, String destination) {
    }

    public record DateWindow(LocalDate earliest, LocalDate latest) {

        public static DateWindow on(LocalDate date) {
            return new DateWindow(date, date);
        }
    }

    public BookingIntent {
        Map<String, String> fields = new LinkedHashMap<>();
        if (freeTextFields != null) {
            freeTextFields.forEach((k, v) -> {
                if (k != null && v != null) fields.put(k, v);
            });
        }
        freeTextFields = Collections.unmodifiableMap(fields);
    }

    public IntentKind kind() {
        return IntentKind.parse(intentKind)
                .orElseThrow(() -> new ValidationException("intent_kind", "unsupported intent kind: " + intentKind));
    }

    /**
     * Extracts and checks the search criteria.
     *
     * @throws ValidationException if origin, destination or dates are missing, or the party count
     *                             or budget is not positive
     */
    public RouteCriteria toCriteria() {
        if (route == null || isBlank(route.origin())) {
            throw new ValidationException("origin", "origin is required");
        }
        if (isBlank(route.destination())) {
            throw new ValidationException("destination", "destination is required");
        }
        if (dates == null || dates.earliest() == null) {
            throw new ValidationException("dates", "a travel date is required");
        }
        if (partyCount != null && partyCount < 1) {
            throw new ValidationException("party_count", "party count must be at least 1");
        }
        if (budget != null && budget.signum() <= 0) {
            throw new ValidationException("budget", "budget must be positive");
        }
        LocalDate latest = dates.latest() == null ? dates.earliest() : dates.latest();
        RouteCriteria criteria = new RouteCriteria(route.origin().trim(), route.destination().trim(),
                dates.earliest(), latest, partyCount == null ? 1 : partyCount);
        if (!criteria.hasValidWindow()) {
            throw new ValidationException("dates", "earliest date must not be after latest date");
        }
        return criteria;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
