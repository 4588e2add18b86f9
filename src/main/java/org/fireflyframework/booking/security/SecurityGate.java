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

import org.fireflyframework.booking.config.BookingEngineProperties;
import org.fireflyframework.booking.core.exception.SecurityViolationException;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Screens every user-supplied value before it is validated or stored: strips control
 * characters, enforces length limits, rejects injection patterns and links to domains
 * outside the whitelist, and checks the user allow-list.
 */
public class SecurityGate {

    private static final Logger log = LoggerFactory.getLogger(SecurityGate.class);

    private static final List<String> BUILT_IN_PATTERNS = List.of(
            "rm\\s+-rf",
            "sudo\\s+",
            "curl.*\\|.*sh",
            "wget.*\\|.*sh",
            "eval\\s*\\(",
            "exec\\s*\\(",
            "__import__",
            "subprocess",
            "os\\.system",
            "shell\\s*=\\s*true",
            "<\\s*script",
            "javascript\\s*:",
            "\\bunion\\s+select\\b",
            ";\\s*drop\\s+table",
            "'\\s*or\\s+'?1'?\\s*=\\s*'?1",
            "\\$\\{jndi:",
            "\\.\\./"
    );

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\t]]");
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)([^/\\s:?#]+)");

    private final List<Pattern> dangerousPatterns;
    private final Set<String> safeDomains;
    private final Set<String> authorizedUsers;
    private final int maxFieldLength;
    private final int maxMessageLength;

    public SecurityGate(BookingEngineProperties.SecurityProperties properties) {
        List<Pattern> patterns = new ArrayList<>();
        for (String p : BUILT_IN_PATTERNS) {
            patterns.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
        }
        for (String p : properties.getDangerousPatterns()) {
            patterns.add(Pattern.compile(p, Pattern.CASE_INSENSITIVE));
        }
        this.dangerousPatterns = List.copyOf(patterns);
        this.safeDomains = properties.getSafeDomains().stream()
                .map(d -> d.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.authorizedUsers = Set.copyOf(properties.getAuthorizedUsers());
        this.maxFieldLength = properties.getMaxFieldLength();
        this.maxMessageLength = properties.getMaxMessageLength();
    }

    /**
     * Screens a single structured field.
     *
     * @return the sanitized value, or null for null input
     * @throws ValidationException         if the value exceeds the field length limit
     * @throws SecurityViolationException  if the value is dangerous
     */
    public String screenField(String field, String raw) {
        return screen(field, raw, maxFieldLength);
    }

    /**
     * Screens free text such as constraints carried by an intent.
     */
    public String screenMessage(String field, String raw) {
        return screen(field, raw, maxMessageLength);
    }

    public boolean isAuthorized(String userId) {
        return authorizedUsers.isEmpty() || (userId != null && authorizedUsers.contains(userId));
    }

    public String sanitize(String raw) {
        if (raw == null) {
            return null;
        }
        return CONTROL_CHARS.matcher(raw).replaceAll("").trim();
    }

    private String screen(String field, String raw, int limit) {
        if (raw == null) {
            return null;
        }
        if (raw.length() > limit) {
            throw new ValidationException(field, "value is longer than " + limit + " characters");
        }
        for (Pattern pattern : dangerousPatterns) {
            if (pattern.matcher(raw).find()) {
                log.warn("Dangerous pattern '{}' detected in field {}", pattern.pattern(), field);
                throw new SecurityViolationException(field, "dangerous pattern detected");
            }
        }
        Matcher urls = URL.matcher(raw);
        while (urls.find()) {
            String host = urls.group(1).toLowerCase(Locale.ROOT);
            if (!isSafeDomain(host)) {
                log.warn("Suspicious URL host {} in field {}", host, field);
                throw new SecurityViolationException(field, "suspicious url");
            }
        }
        return sanitize(raw);
    }

    private boolean isSafeDomain(String host) {
        for (String domain : safeDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }
}
