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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Accepted trip details of one request. Immutable: every merge yields a new instance and
 * keeps all previously accepted values.
 */
public final class TripDetails {

    private static final TripDetails EMPTY = new TripDetails(new EnumMap<>(TripField.class));

    private final Map<TripField, String> values;

    private TripDetails(EnumMap<TripField, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static TripDetails empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TripDetails of(Map<TripField, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        EnumMap<TripField, String> copy = new EnumMap<>(TripField.class);
        values.forEach((field, value) -> {
            if (field != null && value != null) {
                copy.put(field, value);
            }
        });
        return new TripDetails(copy);
    }

    public TripDetails with(TripField field, String value) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        EnumMap<TripField, String> copy = values.isEmpty()
                ? new EnumMap<>(TripField.class)
                : new EnumMap<>(values);
        copy.put(field, value);
        return new TripDetails(copy);
    }

    public Optional<String> get(TripField field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean contains(TripField field) {
        return values.containsKey(field);
    }

    public Set<TripField> missingRequired() {
        EnumSet<TripField> missing = EnumSet.noneOf(TripField.class);
        for (TripField field : TripField.values()) {
            if (field.isRequired() && !values.containsKey(field)) {
                missing.add(field);
            }
        }
        return missing;
    }

    public boolean isComplete() {
        return missingRequired().isEmpty();
    }

    @JsonValue
    public Map<TripField, String> asMap() {
        return values;
    }

    /**
     * Values keyed by their wire keys, as sent to collaborators.
     */
    public Map<String, String> toWire() {
        Map<String, String> wire = new LinkedHashMap<>();
        values.forEach((field, value) -> wire.put(field.key(), value));
        return wire;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TripDetails other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "TripDetails" + values.keySet();
    }
}
