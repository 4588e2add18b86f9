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


package org.fireflyframework.booking.persistence;

import org.fireflyframework.booking.core.BookingSnapshot;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;

/**
 * Stores the latest snapshot of each booking request.
 * <p>
 * Implementations never replace a stored snapshot with one carrying a lower sequence number,
 * so out-of-order writes cannot roll a request back.
 */
public interface BookingPersistenceProvider {

    Mono<Void> persist(BookingSnapshot snapshot);

    Mono<Optional<BookingSnapshot>> find(String requestId);

    /**
     * All requests of one user, newest first.
     */
    Flux<BookingSnapshot> findByUser(String userId);

    /**
     * Requests not yet in a terminal state.
     */
    Flux<BookingSnapshot> findInFlight();

    /**
     * Removes terminal requests last updated before {@code now - olderThan}.
     *
     * @return number of removed requests
     */
    Mono<Long> cleanupTerminal(Duration olderThan);

    Mono<Boolean> isHealthy();

    String getProviderType();
}
