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


package org.fireflyframework.booking.security;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks e-mail addresses, phone numbers and long tokens before values reach the audit log.
 */
public class SensitiveDataMasker {

    private static final Pattern EMAIL = Pattern.compile("\\b([A-Za-z0-9._%+-]+)@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b");
    private static final Pattern TOKEN = Pattern.compile("\\b[A-Za-z0-9]{20,}\\b");
    private static final Pattern PHONE_LIKE = Pattern.compile("(?<![\\w-])\\+?\\d[\\d\\s-]{8,16}\\d(?![\\w-])");

    public String mask(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        String masked = replace(EMAIL, value, m -> {
            String local = m.group(1);
            return local.substring(0, Math.min(3, local.length())) + "***@***.***";
        });
        masked = replace(TOKEN, masked, m -> {
            String token = m.group();
            return token.substring(0, 4) + "*".repeat(token.length() - 8) + token.substring(token.length() - 4);
        });
        masked = replace(PHONE_LIKE, masked, m -> {
            String candidate = m.group();
            String digits = candidate.replaceAll("\\D", "");
            if (digits.length() < 10) {
                return candidate;
            }
            return "*".repeat(digits.length() - 2) + digits.substring(digits.length() - 2);
        });
        return masked;
    }

    public Map<String, String> mask(Map<String, ?> payload) {
        Map<String, String> masked = new LinkedHashMap<>();
        if (payload == null) {
            return masked;
        }
        payload.forEach((k, v) -> masked.put(k, v == null ? null : mask(String.valueOf(v))));
        return masked;
    }

    private static String replace(Pattern pattern, String input, Function<Matcher, String> replacer) {
        Matcher m = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(replacer.apply(m)));
        }
        m.appendTail(out);
        return out.toString();
    }
}
