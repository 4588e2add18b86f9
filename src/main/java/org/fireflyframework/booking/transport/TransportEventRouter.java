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

import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.Candidate;
import org.fireflyframework.booking.core.exception.BookingException;
import org.fireflyframework.booking.core.exception.SecurityViolationException;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.engine.BookingEngine;
import org.fireflyframework.booking.engine.EngineResult;
import org.fireflyframework.booking.notification.NotificationDispatcher;
import org.fireflyframework.booking.security.SecurityGate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes messaging-channel events to the sender's active booking request. A user has at most
 * one active request; a new intent is refused while it is not terminal. Errors are sent back
 * to the user as an ERROR message and then propagated to the caller.
 */
public class TransportEventRouter {

    private static final Logger log = LoggerFactory.getLogger(TransportEventRouter.class);

    private final BookingEngine engine;
    private final NotificationDispatcher notifications;
    private final SecurityGate securityGate;
    private final Map<String, String> activeByUser = new ConcurrentHashMap<>();

    public TransportEventRouter(BookingEngine engine, NotificationDispatcher notifications, SecurityGate securityGate) {
        this.engine = engine;
        this.notifications = notifications;
        this.securityGate = securityGate;
    }

    public Mono<EngineResult> route(InboundEvent event) {
        if (event == null || event.userId() == null || event.kind() == null) {
            return Mono.error(new ValidationException("event", "event must carry a user and a kind"));
        }
        String userId = event.userId();
        String requestId = activeByUser.get(userId);
        Mono<EngineResult> handled = Mono.defer(() -> {
            if (!securityGate.isAuthorized(userId)) {
                return Mono.error(new SecurityViolationException("user", "unauthorized access"));
            }
            log.debug("Routing {} from user {} to request {}", event.kind(), userId, requestId);
            switch (event.kind()) {
                case INTENT:
                    return startRequest(userId, requestId, event);
                case SELECTION:
                    return requireActive(requestId).flatMap(id -> resolveSelection(id, event.selection())
                            .flatMap(offerId -> engine.selectCandidate(id, offerId, event.observedSequence())));
                case FIELD_UPDATE:
                    return requireActive(requestId).flatMap(id ->
                            engine.submitDetails(id, event.fields() == null ? Map.of() : event.fields(), event.observedSequence()));
                case CANCEL:
                    return requireActive(requestId).flatMap(id -> engine.cancel(id, event.reason(), event.observedSequence()));
                default:
                    return Mono.error(new ValidationException("event", "unsupported event kind " + event.kind()));
            }
        });
        return handled.onErrorResume(BookingException.class, e ->
                notifications.dispatch(List.of(notifications.error(userId, activeByUser.get(userId), e)))
                        .then(Mono.error(e)));
    }

    public Optional<String> activeRequest(String userId) {
        return Optional.ofNullable(activeByUser.get(userId));
    }

    private Mono<EngineResult> startRequest(String userId, String currentRequestId, InboundEvent event) {
        Mono<Boolean> busy = currentRequestId == null
                ? Mono.just(false)
                : engine.status(currentRequestId).map(s -> !s.isTerminal()).onErrorReturn(false);
        return busy.flatMap(active -> {
            if (active) {
                return Mono.error(new ValidationException("intent",
                        "request " + currentRequestId + " is still in progress, cancel it before starting a new one"));
            }
            return engine.create(userId, event.intent())
                    .doOnNext(result -> activeByUser.put(userId, result.snapshot().requestId()));
        });
    }

    private static Mono<String> requireActive(String requestId) {
        return requestId == null
                ? Mono.error(new ValidationException("request", "no active booking request, send a booking intent first"))
                : Mono.just(requestId);
    }

    /**
     * Accepts the option number shown to the user or the offer ID itself.
     */
    private Mono<String> resolveSelection(String requestId, String selection) {
        if (selection == null || selection.isBlank()) {
            return Mono.error(new ValidationException("selection", "selection is required"));
        }
        String trimmed = selection.trim();
        if (!trimmed.chars().allMatch(Character::isDigit)) {
            return Mono.just(trimmed);
        }
        return engine.status(requestId).flatMap(snapshot -> optionAt(snapshot, trimmed));
    }

    private static Mono<String> optionAt(BookingSnapshot snapshot, String number) {
        List<Candidate> offered = snapshot.offeredCandidates();
        int index;
        try {
            index = Integer.parseInt(number);
        } catch (NumberFormatException e) {
            return Mono.error(new ValidationException("selection", "option " + number + " does not exist"));
        }
        if (index < 1 || index > offered.size()) {
            return Mono.error(new ValidationException("selection",
                    "option " + number + " does not exist, choose between 1 and " + offered.size()));
        }
        return Mono.just(offered.get(index - 1).offerId());
    }
}
