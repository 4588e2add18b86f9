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

import org.fireflyframework.booking.config.BookingEngineProperties;
import org.fireflyframework.booking.core.DocumentType;
import org.fireflyframework.booking.core.exception.ExternalServiceException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process document store. Verification checks size bounds and the file signature: image
 * documents must be JPEG or PNG, the others may also be PDF.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G'};
    private static final byte[] PDF = "%PDF".getBytes(StandardCharsets.US_ASCII);

    private final Map<String, StoredDocument> documents = new ConcurrentHashMap<>();
    private final int minPayloadBytes;
    private final int maxPayloadBytes;

    public InMemoryDocumentStore(BookingEngineProperties.DocumentProperties properties) {
        this.minPayloadBytes = properties.getMinPayloadBytes();
        this.maxPayloadBytes = properties.getMaxPayloadBytes();
    }

    @Override
    public Mono<String> upload(String requestId, DocumentType type, byte[] payload) {
        return Mono.fromSupplier(() -> {
            String recordId = "DOC-" + UUID.randomUUID();
            documents.put(recordId, new StoredDocument(requestId, type, payload == null ? new byte[0] : payload.clone()));
            return recordId;
        });
    }

    @Override
    public Mono<DocumentCheck> verify(String recordId) {
        return Mono.fromSupplier(() -> {
            StoredDocument doc = documents.get(recordId);
            if (doc == null) {
                throw new ExternalServiceException("documents.verify", "unknown record " + recordId);
            }
            return check(doc);
        });
    }

    private DocumentCheck check(StoredDocument doc) {
        if (doc.payload().length < minPayloadBytes) {
            return DocumentCheck.rejected("file is empty or too small to be readable");
        }
        if (doc.payload().length > maxPayloadBytes) {
            return DocumentCheck.rejected("file exceeds the size limit of " + maxPayloadBytes + " bytes");
        }
        boolean image = startsWith(doc.payload(), JPEG) || startsWith(doc.payload(), PNG);
        if (doc.type().imageOnly()) {
            return image ? DocumentCheck.accepted() : DocumentCheck.rejected(doc.type() + " must be a JPEG or PNG image");
        }
        return image || startsWith(doc.payload(), PDF)
                ? DocumentCheck.accepted()
                : DocumentCheck.rejected(doc.type() + " must be an image or a PDF");
    }

    private static boolean startsWith(byte[] payload, byte[] prefix) {
        if (payload.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (payload[i] != prefix[i]) return false;
        }
        return true;
    }

    private record StoredDocument(String requestId, DocumentType type, byte[] payload) {
    }
}
