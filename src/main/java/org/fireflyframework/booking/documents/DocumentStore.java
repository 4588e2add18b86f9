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


package org.fireflyframework.booking.documents;

import org.fireflyframework.booking.core.DocumentType;
import reactor.core.publisher.Mono;

/**
 * Storage and authenticity checks for uploaded documents.
 */
public interface DocumentStore {

    /**
     * Stores the payload and returns the record id assigned by the store.
     */
    Mono<String> upload(String requestId, DocumentType type, byte[] payload);

    Mono<DocumentCheck> verify(String recordId);
}
