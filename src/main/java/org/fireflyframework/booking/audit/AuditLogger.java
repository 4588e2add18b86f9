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

import org.fireflyframework.booking.security.SensitiveDataMasker;
import org.fireflyframework.booking.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only audit log. Recording never fails the caller: a sink that throws is reported on
 * the {@code booking.audit.fallback} logger and the logger is flagged degraded, while the
 * other sinks still receive the entry.
 */
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger fallback = LoggerFactory.getLogger("booking.audit.fallback");

    private final InMemoryAuditSink journal;
    private final List<AuditSink> sinks;
    private final SensitiveDataMasker masker;
    private final Object appendLock = new Object();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong degradedWrites = new AtomicLong();

    public AuditLogger(InMemoryAuditSink journal, List<AuditSink> extraSinks, SensitiveDataMasker masker) {
        this.journal = journal;
        this.sinks = List.copyOf(extraSinks);
        this.masker = masker;
    }

    public AuditEntry record(String requestId, AuditEventKind kind, AuditSeverity severity, Map<String, ?> payload) {
        Map<String, String> masked = masker.mask(payload);
        synchronized (appendLock) {
            AuditEntry entry = new AuditEntry(sequence.incrementAndGet(), Instant.now(), requestId, kind, severity, masked);
            journal.append(entry);
            for (AuditSink sink : sinks) {
                try {
                    sink.append(entry);
                } catch (RuntimeException e) {
                    long failures = degradedWrites.incrementAndGet();
                    fallback.error(JsonUtils.json(
                            "event", "audit_sink_failed",
                            "sink", sink.name(),
                            "failed_writes", String.valueOf(failures),
                            "audit_sequence", String.valueOf(entry.auditSequence()),
                            "request_id", requestId,
                            "kind", kind.name(),
                            "payload", JsonUtils.toJson(masked),
                            "error_class", e.getClass().getName(),
                            "error_message", e.getMessage()), e);
                }
            }
            log.debug("Audit #{} {} {} {}", entry.auditSequence(), requestId, kind, severity);
            return entry;
        }
    }

    public AuditEntry record(String requestId, AuditEventKind kind, Map<String, ?> payload) {
        return record(requestId, kind, AuditSeverity.INFO, payload);
    }

    public List<AuditEntry> entriesFor(String requestId) {
        return journal.entriesFor(requestId);
    }

    public boolean isDegraded() {
        return degradedWrites.get() > 0;
    }

    public long getDegradedWrites() {
        return degradedWrites.get();
    }

    public AuditSummary summary() {
        List<AuditEntry> all = journal.all();
        Map<AuditEventKind, Long> byKind = new EnumMap<>(AuditEventKind.class);
        long high = 0;
        for (AuditEntry e : all) {
            byKind.merge(e.kind(), 1L, Long::sum);
            if (e.severity() == AuditSeverity.HIGH) {
                high++;
            }
        }
        return new AuditSummary(all.size(), byKind, high, degradedWrites.get());
    }
}
