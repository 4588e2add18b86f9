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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed input schema of a tool exposed to the tool-invocation front end.
 */
public record ToolSchema(String name, String description, List<ToolParameter> parameters) {

    public ToolSchema {
        parameters = List.copyOf(parameters);
    }

    public List<String> requiredParameters() {
        return parameters.stream().filter(ToolParameter::required).map(ToolParameter::name).toList();
    }

    /**
     * JSON-schema style description, as tool-calling front ends expect it.
     */
    public Map<String, Object> toJsonSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter p : parameters) {
            properties.put(p.name(), Map.of("type", p.type(), "description", p.description()));
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", requiredParameters());
        return schema;
    }
}
