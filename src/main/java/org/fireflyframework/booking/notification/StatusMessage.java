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


package org.fireflyframework.booking.notification;

import lombok.Data;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.util.JsonUtils;

import java.time.Instant;

/**
 * User-facing message handed to the outbound transport.
 */
@Data
public class StatusMessage {

    public enum Kind { STATUS, INPUT_REJECTED, DEGRADED, ERROR }

    private String userId;
    private String requestId;
    private Kind kind;
    private BookingState state;
    private long sequence;
    private String text;
    private Instant timestamp;

    public StatusMessage(String userId, String requestId, Kind kind, BookingState state, long sequence, String text) {
        this.userId = userId;
        this.requestId = requestId;
        this.kind = kind;
        this.state = state;
        this.sequence = sequence;
        this.text = text;
        this.timestamp = Instant.now();
    }

    @Override
    public String toString() {
        return JsonUtils.toJson(this);
    }
}
