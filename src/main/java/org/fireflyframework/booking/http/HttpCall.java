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


package org.fireflyframework.booking.http;

import org.fireflyframework.booking.core.exception.ExternalServiceException;
import org.fireflyframework.booking.verification.TransientProviderException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Objects;

/**
 * Helper for collaborator calls over WebClient: propagates the booking request id and maps
 * error statuses to the exceptions the retry policy understands.
 * Usage:
 *   HttpCall.exchange(client.post().uri("/availability").bodyValue(body), requestId,
 *       "availability.verify", VerificationResponse.class)
 */
public final class HttpCall {
    public static final String REQUEST_ID_HEADER = "X-Booking-Request-Id";

    private HttpCall() {}

    public static WebClient.RequestHeadersSpec<?> propagate(WebClient.RequestHeadersSpec<?> spec, String requestId) {
        if (requestId == null) return spec;
        return spec.header(REQUEST_ID_HEADER, requestId);
    }

    public static WebClient.RequestHeadersSpec<?> propagate(WebClient.RequestHeadersSpec<?> spec,
                                                            String requestId,
                                                            Map<String, String> extraHeaders) {
        WebClient.RequestHeadersSpec<?> s = propagate(spec, requestId);
        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    s = s.header(e.getKey(), e.getValue());
                }
            }
        }
        return s;
    }

    public static HttpHeaders buildHeaders(String requestId) {
        HttpHeaders h = new HttpHeaders();
        if (requestId != null) h.add(REQUEST_ID_HEADER, requestId);
        return h;
    }

    /**
     * Executes the request and returns the body on 2xx. 5xx and 429 become
     * {@link TransientProviderException} so they are retried; other statuses become a
     * non-retryable {@link ExternalServiceException} carrying the response body.
     */
    public static <T> Mono<T> exchange(WebClient.RequestHeadersSpec<?> spec,
                                       String requestId,
                                       String operation,
                                       Class<T> successType) {
        Objects.requireNonNull(successType, "successType");
        return propagate(spec, requestId)
                .exchangeToMono(resp -> handleResponse(resp, operation, successType));
    }

    private static <T> Mono<T> handleResponse(ClientResponse resp, String operation, Class<T> successType) {
        if (resp.statusCode().is2xxSuccessful()) {
            return resp.bodyToMono(successType)
                    .switchIfEmpty(Mono.error(() -> new ExternalServiceException(operation, "empty response body")));
        }
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    String message = "HTTP " + status + (body.isBlank() ? "" : ": " + truncate(body));
                    if (status >= 500 || status == 429) {
                        return Mono.error(new TransientProviderException(message, status));
                    }
                    return Mono.error(new ExternalServiceException(operation, message));
                });
    }

    private static String truncate(String body) {
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
