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

import com.fasterxml.jackson.core.type.TypeReference;
import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.DocumentType;
import org.fireflyframework.booking.core.FieldIssue;
import org.fireflyframework.booking.core.exception.BookingException;
import org.fireflyframework.booking.core.exception.ErrorKind;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.engine.BookingEngine;
import org.fireflyframework.booking.engine.EngineResult;
import org.fireflyframework.booking.engine.EventOutcome;
import org.fireflyframework.booking.intent.BookingIntent;
import org.fireflyframework.booking.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Exposes the engine as named tools with fixed schemas. Every call completes with a
 * {@link ToolResult}; engine exceptions become error envelopes carrying their {@link ErrorKind}.
 */
public class BookingToolFacade {

    private static final Logger log = LoggerFactory.getLogger(BookingToolFacade.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    public static final String CREATE_REQUEST = "create_request";
    public static final String SUBMIT_SELECTION = "submit_selection";
    public static final String SUBMIT_DETAILS = "submit_details";
    public static final String QUERY_STATUS = "query_status";
    public static final String CANCEL_REQUEST = "cancel_request";
    public static final String UPLOAD_DOCUMENT = "upload_document";

    private final BookingEngine engine;
    private final Map<String, ToolSchema> schemas;
    private final Map<String, Function<Map<String, Object>, Mono<ToolResult>>> handlers;

    public BookingToolFacade(BookingEngine engine) {
        this.engine = engine;
        this.schemas = buildSchemas().stream()
                .collect(Collectors.toMap(ToolSchema::name, s -> s, (a, b) -> a, LinkedHashMap::new));
        this.handlers = Map.of(
                CREATE_REQUEST, this::createRequest,
                SUBMIT_SELECTION, this::submitSelection,
                SUBMIT_DETAILS, this::submitDetails,
                QUERY_STATUS, this::queryStatus,
                CANCEL_REQUEST, this::cancelRequest,
                UPLOAD_DOCUMENT, this::uploadDocument);
    }

    public List<ToolSchema> tools() {
        return List.copyOf(schemas.values());
    }

    public Mono<ToolResult> invoke(String name, Map<String, Object> arguments) {
        ToolSchema schema = schemas.get(name);
        if (schema == null) {
            return Mono.just(ToolResult.error(ErrorKind.VALIDATION_ERROR, "unknown tool: " + name));
        }
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        return Mono.defer(() -> {
                    for (String required : schema.requiredParameters()) {
                        Object value = args.get(required);
                        if (value == null || (value instanceof String s && s.isBlank())) {
                            return Mono.error(new ValidationException(required, required + " is required"));
                        }
                    }
                    return handlers.get(name).apply(args);
                })
                .onErrorResume(BookingException.class, e -> Mono.just(ToolResult.error(e.getKind(), e.getMessage(),
                        e instanceof ValidationException v ? v.toIssues() : List.of(), null)))
                .onErrorResume(e -> {
                    log.error("Tool {} failed unexpectedly", name, e);
                    return Mono.just(ToolResult.error(ErrorKind.FATAL, "internal error"));
                });
    }

    private Mono<ToolResult> createRequest(Map<String, Object> args) {
        BookingIntent intent = new BookingIntent(
                string(args, "intent_kind"),
                new BookingIntent.Route(string(args, "origin"), string(args, "destination")),
                new BookingIntent.DateWindow(date(args, "earliest_date"), date(args, "latest_date")),
                integer(args, "party_count"),
                decimal(args, "budget"),
                stringMap(args, "constraints"));
        return engine.create(string(args, "user_id"), intent).map(this::toResult);
    }

    private Mono<ToolResult> submitSelection(Map<String, Object> args) {
        return engine.selectCandidate(string(args, "request_id"), string(args, "offer_id"), longValue(args, "observed_sequence"))
                .map(this::toResult);
    }

    private Mono<ToolResult> submitDetails(Map<String, Object> args) {
        return engine.submitDetails(string(args, "request_id"), stringMap(args, "fields"), longValue(args, "observed_sequence"))
                .map(this::toResult);
    }

    private Mono<ToolResult> queryStatus(Map<String, Object> args) {
        return engine.status(string(args, "request_id")).map(s -> ToolResult.ok(snapshotData(s, null)));
    }

    private Mono<ToolResult> cancelRequest(Map<String, Object> args) {
        return engine.cancel(string(args, "request_id"), string(args, "reason"), longValue(args, "observed_sequence"))
                .map(this::toResult);
    }

    private Mono<ToolResult> uploadDocument(Map<String, Object> args) {
        DocumentType type;
        try {
            type = DocumentType.valueOf(string(args, "document_type").trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("document_type", "unknown document type " + args.get("document_type"));
        }
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(string(args, "payload_base64"));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("payload_base64", "payload is not valid base64");
        }
        return engine.uploadDocument(string(args, "request_id"), type, payload).map(this::toResult);
    }

    private ToolResult toResult(EngineResult result) {
        Map<String, Object> data = snapshotData(result.snapshot(), result.outcome());
        if (result.outcome() == EventOutcome.DEGRADED) {
            return ToolResult.error(ErrorKind.EXTERNAL_SERVICE_ERROR,
                    "an external service is unavailable, the request kept its state", List.of(), data);
        }
        if (result.hasIssues()) {
            boolean security = result.issues().stream().anyMatch(i -> i.kind() == ErrorKind.SECURITY_VIOLATION);
            return ToolResult.error(security ? ErrorKind.SECURITY_VIOLATION : ErrorKind.VALIDATION_ERROR,
                    describe(result.issues()), result.issues(), data);
        }
        return ToolResult.ok(data);
    }

    private static Map<String, Object> snapshotData(BookingSnapshot snapshot, EventOutcome outcome) {
        Map<String, Object> data = new LinkedHashMap<>(JsonUtils.mapper().convertValue(snapshot, MAP_TYPE));
        if (outcome != null) {
            data.put("outcome", outcome.name());
        }
        return data;
    }

    private static String describe(List<FieldIssue> issues) {
        return issues.size() + " field(s) rejected: "
                + issues.stream().map(FieldIssue::field).collect(Collectors.joining(", "));
    }

    // ------------------------------------------------------------------ argument parsing

    private static String string(Map<String, Object> args, String name) {
        Object value = args.get(name);
        return value == null ? null : value.toString();
    }

    private static Long longValue(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name, name + " must be an integer");
        }
    }

    private static Integer integer(Map<String, Object> args, String name) {
        Long value = longValue(args, name);
        return value == null ? null : Math.toIntExact(value);
    }

    private static BigDecimal decimal(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name, name + " must be a number");
        }
    }

    private static LocalDate date(Map<String, Object> args, String name) {
        String value = string(args, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(name, name + " must be an ISO date (yyyy-MM-dd)");
        }
    }

    private static Map<String, String> stringMap(Map<String, Object> args, String name) {
        Object value = args.get(name);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new ValidationException(name, name + " must be an object");
        }
        Map<String, String> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                result.put(k.toString(), v.toString());
            }
        });
        return result;
    }

    private static List<ToolSchema> buildSchemas() {
        return List.of(
                new ToolSchema(CREATE_REQUEST, "Start a booking request from a structured intent and search for vehicles", List.of(
                        ToolParameter.required("user_id", "string", "user the request belongs to"),
                        ToolParameter.required("intent_kind", "string", "BOOK_TRUCK or BOOK_TRIP"),
                        ToolParameter.required("origin", "string", "pickup city"),
                        ToolParameter.required("destination", "string", "delivery city"),
                        ToolParameter.required("earliest_date", "string", "earliest travel date, yyyy-MM-dd"),
                        ToolParameter.optional("latest_date", "string", "latest travel date, yyyy-MM-dd"),
                        ToolParameter.optional("party_count", "integer", "capacity needed"),
                        ToolParameter.optional("budget", "number", "maximum price"),
                        ToolParameter.optional("constraints", "object", "free-text constraints by name"))),
                new ToolSchema(SUBMIT_SELECTION, "Select one of the offered vehicles", List.of(
                        ToolParameter.required("request_id", "string", "booking request"),
                        ToolParameter.required("offer_id", "string", "offer to select"),
                        ToolParameter.optional("observed_sequence", "integer", "sequence of the last status seen"))),
                new ToolSchema(SUBMIT_DETAILS, "Provide trip details such as names, phones, addresses, weight and dimensions", List.of(
                        ToolParameter.required("request_id", "string", "booking request"),
                        ToolParameter.required("fields", "object", "trip fields by name"),
                        ToolParameter.optional("observed_sequence", "integer", "sequence of the last status seen"))),
                new ToolSchema(QUERY_STATUS, "Get the current state of a booking request", List.of(
                        ToolParameter.required("request_id", "string", "booking request"))),
                new ToolSchema(CANCEL_REQUEST, "Cancel a booking request", List.of(
                        ToolParameter.required("request_id", "string", "booking request"),
                        ToolParameter.optional("reason", "string", "why the user cancelled"),
                        ToolParameter.optional("observed_sequence", "integer", "sequence of the last status seen"))),
                new ToolSchema(UPLOAD_DOCUMENT, "Upload a required document for a confirmed booking", List.of(
                        ToolParameter.required("request_id", "string", "booking request"),
                        ToolParameter.required("document_type", "string", "document type, e.g. ID_PROOF"),
                        ToolParameter.required("payload_base64", "string", "document content, base64 encoded"))));
    }
}
