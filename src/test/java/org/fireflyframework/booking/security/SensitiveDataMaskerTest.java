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

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SensitiveDataMaskerTest {

    private final SensitiveDataMasker masker = new SensitiveDataMasker();

    @Test
    void masksEmailAddresses() {
        assertThat(masker.mask("write to rahul.sharma@example.com today"))
                .isEqualTo("write to rah***@***.*** today");
    }

    @Test
    void masksPhoneNumbersKeepingTheLastTwoDigits() {
        assertThat(masker.mask("call +91 98765 43210")).isEqualTo("call **********10");
        assertThat(masker.mask("9123456780")).isEqualTo("********80");
    }

    @Test
    void masksLongTokens() {
        assertThat(masker.mask("token abcdefghijklmnopqrstuvwxyz"))
                .isEqualTo("token abcd" + "*".repeat(18) + "wxyz");
    }

    @Test
    void leavesStateAndTriggerNamesAlone() {
        assertThat(masker.mask("AVAILABILITY_CONFIRMED")).isEqualTo("AVAILABILITY_CONFIRMED");
        assertThat(masker.mask("VERIFYING_AVAILABILITY")).isEqualTo("VERIFYING_AVAILABILITY");
        assertThat(masker.mask("VERIFICATION_UNAVAILABLE")).isEqualTo("VERIFICATION_UNAVAILABLE");

        Map<String, String> masked = masker.mask(Map.of("trigger", "AVAILABILITY_REJECTED"));
        assertThat(masked).containsEntry("trigger", "AVAILABILITY_REJECTED");
    }

    @Test
    void leavesOrdinaryTextAlone() {
        assertThat(masker.mask("100x80x60 cm, 250 kg")).isEqualTo("100x80x60 cm, 250 kg");
        assertThat(masker.mask("")).isEmpty();
        assertThat(masker.mask((String) null)).isNull();
    }

    @Test
    void masksEveryPayloadValue() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phone", "9123456780");
        payload.put("attempts", 3);
        payload.put("missing", null);

        Map<String, String> masked = masker.mask(payload);

        assertThat(masked).containsEntry("phone", "********80")
                .containsEntry("attempts", "3")
                .containsEntry("missing", null);
    }
}
