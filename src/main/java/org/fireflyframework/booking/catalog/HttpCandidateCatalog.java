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


package org.fireflyframework.booking.catalog;

import org.fireflyframework.booking.http.HttpCall;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Catalog reached over HTTP: {@code POST {baseUrl}{path}} with the query as JSON body.
 */
public class HttpCandidateCatalog implements CandidateCatalog {

    private final WebClient webClient;
    private final String path;

    public HttpCandidateCatalog(WebClient webClient, String path) {
        this.webClient = webClient;
        this.path = path;
    }

    @Override
    public Mono<CatalogResponse> search(CatalogQuery query) {
        return HttpCall.exchange(webClient.post().uri(path).bodyValue(query),
                query.requestId(), "catalog.search", CatalogResponse.class);
    }
}
