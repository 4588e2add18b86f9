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


package org.fireflyframework.booking.transport;

import org.fireflyframework.booking.intent.BookingIntent;

import java.util.Map;

/**
 * Event received from the messaging channel. Only the payload matching {@code kind} is set.
 *
 * @param userId            sender
 * @param kind              what the user did
 * @param intent            structured intent, for {@link InboundEventKind#INTENT}
 * @param selection         option number (1-based) or offer ID, for {@link InboundEventKind#SELECTION}
 * @param fields            trip fields, for {@link InboundEventKind#FIELD_UPDATE}
 * @param reason            cancellation reason, for {@link InboundEventKind#CANCEL}
 * @param observedSequence  sequence of the last status the user saw, if known
 */
public record InboundEvent(String userId,
                           InboundEventKind kind,
                           BookingIntent intent,
                           String selection,
                           Map<String, String> fields,
                           String reason,
                           Long observedSequence) {

    public static InboundEvent intent(String userId, BookingIntent intent) {
        return new InboundEvent(userId, InboundEventKind.INTENT, intent, null, null, null, null);
    }

    public static InboundEvent selection(String userId, String selection, Long observedSequence) {
        return new InboundEvent(userId, InboundEventKind.SELECTION, null, selection, null, null, observedSequence);
    }

    public static InboundEvent fieldUpdate(String userId, Map<String, String> fields, Long observedSequence) {
        return new InboundEvent(userId, InboundEventKind.FIELD_UPDATE, null, null, fields, null, observedSequence);
    }

    public static InboundEvent cancel(String userId, String reason, Long observedSequence) {
        return new InboundEvent(userId, InboundEventKind.CANCEL, null, null, null, reason, observedSequence);
    }
}
