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


package org.fireflyframework.booking.invoke;

import java.time.Duration;

/**
 * Timeout and retry budget of a collaborator call.
 *
 * @param timeout        per-attempt timeout, null or zero disables it
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff delay before the first retry
 * @param maxBackoff     upper bound of any single delay
 * @param multiplier     growth factor applied per retry
 * @param jitterFactor   0..1, spreads each delay by up to this fraction
 */
public record CallPolicy(Duration timeout,
                         int maxAttempts,
                         Duration initialBackoff,
                         Duration maxBackoff,
                         double multiplier,
                         double jitterFactor) {

    public CallPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null ? initialBackoff : maxBackoff;
        multiplier = multiplier < 1.0 ? 1.0 : multiplier;
    }

    public static CallPolicy noRetry(Duration timeout) {
        return new CallPolicy(timeout, 1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }
}
