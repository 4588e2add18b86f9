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

/**
 * Verdict of the document store on one uploaded record.
 */
public record DocumentCheck(boolean verified, String reason) {

    public static DocumentCheck accepted() {
        return new DocumentCheck(true, null);
    }

    public static DocumentCheck rejected(String reason) {
        return new DocumentCheck(false, reason);
    }
}
