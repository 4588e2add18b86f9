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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.util.JsonUtils;

import java.io.IOException;

/**
 * Jackson-based snapshot serializer. Unknown properties are ignored so older readers can load
 * snapshots written by newer versions.
 */
public class JsonBookingSnapshotSerializer implements BookingSnapshotSerializer {

    private final ObjectMapper objectMapper;

    public JsonBookingSnapshotSerializer() {
        this.objectMapper = JsonUtils.newMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] serialize(BookingSnapshot snapshot) throws SerializationException {
        try {
            return objectMapper.writeValueAsBytes(snapshot);
        } catch (IOException e) {
            throw new SerializationException("Failed to serialize snapshot of " + snapshot.requestId(), e);
        }
    }

    @Override
    public BookingSnapshot deserialize(byte[] data) throws SerializationException {
        try {
            return objectMapper.readValue(data, BookingSnapshot.class);
        } catch (IOException e) {
            throw new SerializationException("Failed to deserialize booking snapshot", e);
        }
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
