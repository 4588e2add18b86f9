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


package org.fireflyframework.booking.details;

import org.fireflyframework.booking.core.TripField;
import org.fireflyframework.booking.core.exception.ValidationException;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Format rules for trip fields. Values are expected to have passed the security gate.
 */
public class TripFieldValidator {

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern WEIGHT = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*(kg|kgs|g|t|ton|tons|tonne|tonnes|lb|lbs)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIMENSIONS = Pattern.compile(
            "^(\\d+(?:\\.\\d+)?)\\s*[x*×]\\s*(\\d+(?:\\.\\d+)?)\\s*[x*×]\\s*(\\d+(?:\\.\\d+)?)\\s*(cm|mm|m|in)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE_SEPARATORS = Pattern.compile("[\\s().-]");
    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^(?i)(rs\\.?|inr|₹|\\$|usd)\\s*");

    private static final Map<String, BigDecimal> KG_PER_UNIT = Map.of(
            "kg", BigDecimal.ONE,
            "kgs", BigDecimal.ONE,
            "g", new BigDecimal("0.001"),
            "t", new BigDecimal("1000"),
            "ton", new BigDecimal("1000"),
            "tons", new BigDecimal("1000"),
            "tonne", new BigDecimal("1000"),
            "tonnes", new BigDecimal("1000"),
            "lb", new BigDecimal("0.45359237"),
            "lbs", new BigDecimal("0.45359237"));

    /**
     * Validates one value and returns its normalized form.
     *
     * @throws ValidationException naming the field when the value is rejected
     */
    public String validate(TripField field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field.key(), field.key() + " must not be empty");
        }
        String v = value.trim();
        switch (field) {
            case CONSIGNER_NAME, CONSIGNEE_NAME -> {
                if (v.length() > 100 || v.chars().noneMatch(Character::isLetter)) {
                    throw new ValidationException(field.key(), "name must contain letters and be at most 100 characters");
                }
                return v;
            }
            case CONSIGNER_PHONE, CONSIGNEE_PHONE -> {
                return normalizePhone(field, v);
            }
            case PICKUP_ADDRESS, DELIVERY_ADDRESS -> {
                if (v.length() < 5) {
                    throw new ValidationException(field.key(), "address must be at least 5 characters");
                }
                return v;
            }
            case PARCEL_WEIGHT -> {
                parseWeightKg(v);
                return v;
            }
            case PARCEL_DIMENSIONS -> {
                Matcher m = DIMENSIONS.matcher(v);
                if (!m.matches()) {
                    throw new ValidationException(field.key(), "dimensions must look like LxWxH with an optional cm, m, mm or in unit");
                }
                for (int i = 1; i <= 3; i++) {
                    if (new BigDecimal(m.group(i)).signum() <= 0) {
                        throw new ValidationException(field.key(), "every dimension must be greater than zero");
                    }
                }
                return v;
            }
            case DECLARED_VALUE -> {
                String amount = CURRENCY_PREFIX.matcher(v).replaceFirst("").replace(",", "");
                if (!NUMBER.matcher(amount).matches() || new BigDecimal(amount).signum() <= 0) {
                    throw new ValidationException(field.key(), "declared value must be a positive amount");
                }
                return amount;
            }
            default -> {
                return v;
            }
        }
    }

    /**
     * Parses a weight such as {@code "12.5 kg"} or {@code "2t"} into kilograms. A bare number
     * is taken as kilograms.
     */
    public static BigDecimal parseWeightKg(String value) {
        Matcher m = WEIGHT.matcher(value == null ? "" : value.trim());
        if (!m.matches()) {
            throw new ValidationException(TripField.PARCEL_WEIGHT.key(),
                    "weight must be a positive number with an optional kg, g, t, tonnes or lb unit");
        }
        BigDecimal magnitude = new BigDecimal(m.group(1));
        if (magnitude.signum() <= 0) {
            throw new ValidationException(TripField.PARCEL_WEIGHT.key(), "weight must be greater than zero");
        }
        String unit = m.group(2) == null ? "kg" : m.group(2).toLowerCase(Locale.ROOT);
        return magnitude.multiply(KG_PER_UNIT.get(unit));
    }

    private static String normalizePhone(TripField field, String v) {
        String compact = PHONE_SEPARATORS.matcher(v).replaceAll("");
        boolean international = compact.startsWith("+");
        String digits = international ? compact.substring(1) : compact;
        if (!digits.chars().allMatch(Character::isDigit) || digits.length() < 10 || digits.length() > 13) {
            throw new ValidationException(field.key(), "phone number must have 10 to 13 digits");
        }
        return international ? "+" + digits : digits;
    }
}
