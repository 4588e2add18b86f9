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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.booking.util.JsonUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends one JSON document per line to a file. An entry that cannot be written, including
 * one Jackson fails to serialize, surfaces as {@link UncheckedIOException}.
 */
public class JsonLinesAuditSink implements AuditSink {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonLinesAuditSink(Path file) {
        this(file, JsonUtils.mapper());
    }

    public JsonLinesAuditSink(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        try {
            String line = mapper.writeValueAsString(entry) + System.lineSeparator();
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append audit entry to " + file, e);
        }
    }

    @Override
    public String name() {
        return "json-lines:" + file;
    }

    public Path getFile() {
        return file;
    }
}
