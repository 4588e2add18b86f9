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

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.booking.security.SensitiveDataMasker;
import org.fireflyframework.booking.util.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuditLoggerTest {

    @Test
    void sequenceIsGloballyIncreasingAndEntriesAreMasked() {
        AuditLogger audit = new AuditLogger(new InMemoryAuditSink(), List.of(), new SensitiveDataMasker());

        audit.record("req-1", AuditEventKind.REQUEST_CREATED, Map.of("user", "u1"));
        audit.record("req-2", AuditEventKind.REQUEST_CREATED, Map.of("user", "u2"));
        AuditEntry third = audit.record("req-1", AuditEventKind.DETAILS_UPDATED,
                Map.of("consigner_phone", "9876543210", "attempt", 2));

        assertThat(third.auditSequence()).isEqualTo(3L);
        assertThat(third.severity()).isEqualTo(AuditSeverity.INFO);
        assertThat(third.get("consigner_phone")).doesNotContain("98765");
        assertThat(third.get("attempt")).isEqualTo("2");
        assertThat(audit.entriesFor("req-1")).extracting(AuditEntry::auditSequence).containsExactly(1L, 3L);
    }

    @Test
    void failingSinkDegradesButKeepsTheJournal() {
        AuditSink broken = entry -> {
            throw new IllegalStateException("disk full");
        };
        AuditLogger audit = new AuditLogger(new InMemoryAuditSink(), List.of(broken), new SensitiveDataMasker());

        audit.record("req-1", AuditEventKind.SECURITY_VIOLATION, AuditSeverity.HIGH, Map.of("field", "origin"));
        audit.record("req-1", AuditEventKind.TRANSITION, Map.of("from", "SEARCHING"));

        assertThat(audit.isDegraded()).isTrue();
        assertThat(audit.getDegradedWrites()).isEqualTo(2L);
        assertThat(audit.entriesFor("req-1")).hasSize(2);

        AuditSummary summary = audit.summary();
        assertThat(summary.totalEntries()).isEqualTo(2L);
        assertThat(summary.highSeverityEntries()).isEqualTo(1L);
        assertThat(summary.degradedWrites()).isEqualTo(2L);
        assertThat(summary.entriesByKind()).containsEntry(AuditEventKind.SECURITY_VIOLATION, 1L)
                .containsEntry(AuditEventKind.TRANSITION, 1L);
    }

    @Test
    void jsonLinesSinkAppendsOneObjectPerEntry(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("audit/booking-audit.jsonl");
        AuditLogger audit = new AuditLogger(new InMemoryAuditSink(), List.of(new JsonLinesAuditSink(file)),
                new SensitiveDataMasker());

        audit.record("req-1", AuditEventKind.REQUEST_CREATED, Map.of("intent_kind", "BOOK_TRUCK"));
        audit.record("req-1", AuditEventKind.TRANSITION, Map.of("from", "SEARCHING", "to", "AWAITING_SELECTION"));

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonNode second = JsonUtils.mapper().readTree(lines.get(1));
        assertThat(second.get("auditSequence").asLong()).isEqualTo(2L);
        assertThat(second.get("kind").asText()).isEqualTo("TRANSITION");
        assertThat(second.get("payload").get("to").asText()).isEqualTo("AWAITING_SELECTION");
        assertThat(second.get("timestamp").isTextual()).isTrue();
        assertThat(audit.isDegraded()).isFalse();
    }

    @Test
    void transitionEntriesKeepStateAndTriggerNames() {
        AuditLogger audit = new AuditLogger(new InMemoryAuditSink(), List.of(), new SensitiveDataMasker());

        AuditEntry entry = audit.record("req-1", AuditEventKind.TRANSITION, Map.of(
                "from", "VERIFYING_AVAILABILITY",
                "to", "CONFIRMED",
                "trigger", "AVAILABILITY_CONFIRMED"));

        assertThat(entry.get("from")).isEqualTo("VERIFYING_AVAILABILITY");
        assertThat(entry.get("trigger")).isEqualTo("AVAILABILITY_CONFIRMED");
    }

    @Test
    void unserializableEntryCountsAsDegradedWrite(@TempDir Path dir) throws Exception {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonMappingException(null, "cannot write entry"));
        Path file = dir.resolve("booking-audit.jsonl");
        AuditLogger audit = new AuditLogger(new InMemoryAuditSink(), List.of(new JsonLinesAuditSink(file, failing)),
                new SensitiveDataMasker());

        audit.record("req-1", AuditEventKind.REQUEST_CREATED, Map.of("intent_kind", "BOOK_TRUCK"));

        assertThat(audit.getDegradedWrites()).isEqualTo(1L);
        assertThat(audit.entriesFor("req-1")).hasSize(1);
        assertThat(file).doesNotExist();
    }

    @Test
    void sinkFailureIsReportedAsStructuredJson() throws Exception {
        Logger fallback = (Logger) LoggerFactory.getLogger("booking.audit.fallback");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        fallback.addAppender(appender);
        try {
            AuditSink broken = entry -> {
                throw new IllegalStateException("disk full");
            };
            AuditLogger audit = new AuditLogger(new InMemoryAuditSink(), List.of(broken), new SensitiveDataMasker());

            audit.record("req-7", AuditEventKind.TRANSITION, Map.of("from", "SEARCHING"));

            assertThat(appender.list).hasSize(1);
            JsonNode line = JsonUtils.mapper().readTree(appender.list.get(0).getFormattedMessage());
            assertThat(line.get("event").asText()).isEqualTo("audit_sink_failed");
            assertThat(line.get("request_id").asText()).isEqualTo("req-7");
            assertThat(line.get("kind").asText()).isEqualTo("TRANSITION");
            assertThat(line.get("failed_writes").asText()).isEqualTo("1");
            assertThat(line.get("error_message").asText()).isEqualTo("disk full");
        } finally {
            fallback.detachAppender(appender);
        }
    }
}
