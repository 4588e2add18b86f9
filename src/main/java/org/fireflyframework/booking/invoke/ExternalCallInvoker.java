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

import org.fireflyframework.booking.core.exception.BookingException;
import org.fireflyframework.booking.core.exception.ExternalServiceException;
import org.fireflyframework.booking.util.JsonUtils;
import org.fireflyframework.booking.verification.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls with a per-attempt timeout and bounded exponential backoff.
 * Only transient failures are retried; once the budget is spent the last error is wrapped in
 * an {@link ExternalServiceException}. Booking exceptions raised by the call itself pass
 * through untouched.
 */
public class ExternalCallInvoker {

    private static final Logger log = LoggerFactory.getLogger(ExternalCallInvoker.class);

    public <T> Mono<T> invoke(String operation, CallPolicy policy, Supplier<Mono<T>> call, RetryListener listener) {
        return attemptCall(operation, policy, call, listener == null ? RetryListener.NONE : listener, 1);
    }

    private <T> Mono<T> attemptCall(String operation, CallPolicy policy, Supplier<Mono<T>> call,
                                    RetryListener listener, int attempt) {
        Mono<T> base = Mono.defer(call);
        if (policy.timeout() != null && !policy.timeout().isZero() && !policy.timeout().isNegative()) {
            base = base.timeout(policy.timeout());
        }
        return base.onErrorResume(err -> {
            if (err instanceof BookingException) {
                return Mono.error(err);
            }
            if (!isTransient(err)) {
                return Mono.error(new ExternalServiceException(operation, attempt, err));
            }
            if (attempt >= policy.maxAttempts()) {
                log.warn(JsonUtils.json(
                        "event", "external_call_exhausted",
                        "operation", operation,
                        "attempts", String.valueOf(attempt),
                        "error_class", err.getClass().getName(),
                        "error_message", err.getMessage()));
                return Mono.error(new ExternalServiceException(operation, attempt, err));
            }
            long delay = computeDelay(policy, attempt);
            if (log.isDebugEnabled()) {
                log.debug(JsonUtils.json(
                        "event", "external_call_retrying",
                        "operation", operation,
                        "attempt", String.valueOf(attempt),
                        "delay_ms", String.valueOf(delay),
                        "error_class", err.getClass().getName(),
                        "error_message", err.getMessage()));
            }
            listener.onRetry(attempt, err);
            return Mono.delay(Duration.ofMillis(delay))
                    .then(attemptCall(operation, policy, call, listener, attempt + 1));
        });
    }

    /**
     * Timeouts, I/O errors, connection failures, 5xx and 429 responses.
     */
    public static boolean isTransient(Throwable err) {
        if (err instanceof TimeoutException
                || err instanceof IOException
                || err instanceof WebClientRequestException
                || err instanceof TransientProviderException) {
            return true;
        }
        if (err instanceof WebClientResponseException response) {
            return response.getStatusCode().is5xxServerError() || response.getStatusCode().value() == 429;
        }
        return err.getCause() instanceof IOException;
    }

    /**
     * Delay before retrying after {@code failedAttempt}: {@code initial * multiplier^(n-1)}, capped,
     * then spread by the jitter factor.
     */
    public static long computeDelay(CallPolicy policy, int failedAttempt) {
        long initial = policy.initialBackoff().toMillis();
        if (initial <= 0) return 0L;
        double raw = initial * Math.pow(policy.multiplier(), Math.max(0, failedAttempt - 1));
        long capped = (long) Math.min(raw, (double) Math.max(initial, policy.maxBackoff().toMillis()));
        if (policy.jitterFactor() <= 0.0) return capped;
        double f = Math.min(policy.jitterFactor(), 1.0d);
        double min = capped * (1.0d - f);
        double max = capped * (1.0d + f);
        return Math.max(0L, Math.round(ThreadLocalRandom.current().nextDouble(min, max)));
    }
}
