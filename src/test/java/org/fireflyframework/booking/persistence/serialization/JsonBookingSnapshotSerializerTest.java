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


package org.fireflyframework.booking.persistence.serialization;

import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.TripField;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.fireflyframework.booking.persistence.PersistenceFixtures.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonBookingSnapshotSerializerTest {

    private final JsonBookingSnapshotSerializer serializer = new JsonBookingSnapshotSerializer();

    @Test
    void snapshotSurvivesStorage() throws Exception {
        Instant now = Instant.parse("2026-11-20T10:15:30Z");
        BookingSnapshot original = snapshot("req-1", "u1", BookingState.DOCUMENTS_PENDING, 6, now, now);

        byte[] bytes = serializer.serialize(original);
        BookingSnapshot restored = serializer.deserialize(bytes);

        assertThat(restored).isEqualTo(original);
        assertThat(restored.tripDetails().get(TripField.PARCEL_WEIGHT)).contains("250 kg");
        assertThat(restored.booking().consignmentNote()).isEqualTo("CN-20261120-ABCDEF12");
        assertThat(restored.appliedTriggers()).containsEntry(2L, "CANDIDATE_SELECTED:TRK-A");
        assertThat(new String(bytes, StandardCharsets.UTF_8)).contains("\"createdAt\":\"2026-11-20T10:15:30Z\"");
        assertThat(serializer.getFormat()).isEqualTo("json");
    }

    @Test
    void unknownPropertiesAreIgnoredAndGarbageRejected() throws Exception {
        Instant now = Instant.now();
        String json = new String(serializer.serialize(snapshot("req-2", "u1", BookingState.SEARCHING, 0, now, now)),
                StandardCharsets.UTF_8);
        String extended = json.substring(0, json.length() - 1) + ",\"schemaVersion\":2}";

        assertThat(serializer.deserialize(extended.getBytes(StandardCharsets.UTF_8)).requestId()).isEqualTo("req-2");
        assertThatThrownBy(() -> serializer.deserialize("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(BookingSnapshotSerializer.SerializationException.class);
    }
}
