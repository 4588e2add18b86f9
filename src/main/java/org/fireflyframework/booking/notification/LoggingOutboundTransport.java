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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Default transport when none is provided: writes each message to the log.
 */
public class LoggingOutboundTransport implements OutboundTransport {

    private static final Logger log = LoggerFactory.getLogger(LoggingOutboundTransport.class);

    @Override
    public Mono<Void> send(StatusMessage message) {
        return Mono.fromRunnable(() -> log.info("Outbound to {}: {}", message.getUserId(), message));
    }
}
