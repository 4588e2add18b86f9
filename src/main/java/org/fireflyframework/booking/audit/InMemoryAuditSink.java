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


package org.fireflyframework.booking.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Queryable in-process journal, always present behind the {@link AuditLogger}.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(AuditEntry entry) {
        entries.add(entry);
    }

    public synchronized List<AuditEntry> entriesFor(String requestId) {
        List<AuditEntry> result = new ArrayList<>();
        for (AuditEntry e : entries) {
            if (requestId.equals(e.requestId())) {
                result.add(e);
            }
        }
        return result;
    }

    public synchronized List<AuditEntry> all() {
        return List.copyOf(entries);
    }
}
