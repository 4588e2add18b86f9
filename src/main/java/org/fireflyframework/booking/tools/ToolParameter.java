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

/**
 * One input parameter of a tool.
 *
 * @param type JSON schema type name: {@code string}, {@code integer}, {@code number} or {@code object}
 */
public record ToolParameter(String name, String type, String description, boolean required) {

    public static ToolParameter required(String name, String type, String description) {
        return new ToolParameter(name, type, description, true);
    }

    public static ToolParameter optional(String name, String type, String description) {
        return new ToolParameter(name, type, description, false);
    }
}
