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

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fields collected from the user before availability can be verified.
 */
public enum TripField {
    CONSIGNER_NAME("consigner_name", true),
    CONSIGNER_PHONE("consigner_phone", true),
    CONSIGNEE_NAME("consignee_name", true),
    CONSIGNEE_PHONE("consignee_phone", true),
    PICKUP_ADDRESS("pickup_address", true),
    DELIVERY_ADDRESS("delivery_address", true),
    PARCEL_DIMENSIONS("parcel_dimensions", true),
    PARCEL_WEIGHT("parcel_weight", true),
    DECLARED_VALUE("declared_value", false),
    SPECIAL_INSTRUCTIONS("special_instructions", false);

    private static final Map<String, TripField> ALIASES = Map.of(
            "weight", PARCEL_WEIGHT,
            "dimensions", PARCEL_DIMENSIONS,
            "parcel_size", PARCEL_DIMENSIONS,
            "pickup", PICKUP_ADDRESS,
            "delivery", DELIVERY_ADDRESS,
            "value", DECLARED_VALUE,
            "instructions", SPECIAL_INSTRUCTIONS
    );

    private final String key;
    private final boolean required;

    TripField(String key, boolean required) {
        this.key = key;
        this.required = required;
    }

    public String key() {
        return key;
    }

    public boolean isRequired() {
        return required;
    }

    /**
     * Resolves a field from its wire key, enum name or a short alias ("weight", "dimensions").
     */
    public static Optional<TripField> fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TripField field : values()) {
            if (field.key.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }
}
