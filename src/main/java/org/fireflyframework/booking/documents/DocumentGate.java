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
import org.fireflyframework.booking.core.DocumentRecord;
import org.fireflyframework.booking.core.DocumentType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which documents a booking needs and whether they are all verified.
 */
public class DocumentGate {

    private final Set<DocumentType> required;

    public DocumentGate(BookingEngineProperties.DocumentProperties properties) {
        Set<DocumentType> types = new LinkedHashSet<>(properties.getUserRequired());
        types.addAll(properties.getProviderRequired());
        this.required = Set.copyOf(types);
        if (required.isEmpty()) {
            throw new IllegalArgumentException("At least one required document type must be configured");
        }
    }

    public Set<DocumentType> requiredTypes() {
        return required;
    }

    public boolean isRequired(DocumentType type) {
        return required.contains(type);
    }

    /**
     * Fresh records for every required type, user side first.
     */
    public List<DocumentRecord> openRecords(Instant now) {
        List<DocumentRecord> records = new ArrayList<>();
        for (DocumentType type : DocumentType.values()) {
            if (required.contains(type)) {
                records.add(DocumentRecord.required(type, now));
            }
        }
        return records;
    }

    public DocumentRecord apply(DocumentRecord record, DocumentCheck check, Instant now) {
        return check.verified() ? record.verified(now) : record.rejected(check.reason(), now);
    }

    public List<DocumentType> outstanding(Collection<DocumentRecord> records) {
        List<DocumentType> outstanding = new ArrayList<>();
        for (DocumentType type : DocumentType.values()) {
            if (!required.contains(type)) continue;
            boolean verified = records.stream().anyMatch(r -> r.type() == type && r.isVerified());
            if (!verified) outstanding.add(type);
        }
        return outstanding;
    }

    public boolean allVerified(Collection<DocumentRecord> records) {
        return outstanding(records).isEmpty();
    }
}
