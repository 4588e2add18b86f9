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


package org.fireflyframework.booking.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.fireflyframework.booking.core.FieldIssue;
import org.fireflyframework.booking.core.exception.ErrorKind;

import java.util.List;
import java.util.Map;

/**
 * Result-or-error envelope returned to the tool-invocation front end.
 *
 * @param success   whether the call did what was asked
 * @param data      result payload; on a partial failure it still carries the request snapshot
 * @param errorKind error classification, null on success
 * @param error     human readable error, null on success
 * @param issues    per-field problems, empty when none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(@JsonProperty("success") boolean success,
                         @JsonProperty("data") Map<String, Object> data,
                         @JsonProperty("error_kind") ErrorKind errorKind,
                         @JsonProperty("error") String error,
                         @JsonProperty("issues") List<FieldIssue> issues) {

    public ToolResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public static ToolResult ok(Map<String, Object> data) {
        return new ToolResult(true, data, null, null, List.of());
    }

    public static ToolResult error(ErrorKind kind, String message, List<FieldIssue> issues, Map<String, Object> data) {
        return new ToolResult(false, data, kind, message, issues);
    }

    public static ToolResult error(ErrorKind kind, String message) {
        return error(kind, message, List.of(), null);
    }
}
