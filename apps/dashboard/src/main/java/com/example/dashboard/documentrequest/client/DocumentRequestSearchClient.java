package com.example.dashboard.documentrequest.client;

import com.example.dashboard.documentrequest.model.request.DocumentRequestSearchRequest;
import com.example.dashboard.documentrequest.model.response.DocumentRequestSearchResponse;
import reactor.core.publisher.Mono;

/**
 * Document request search API. Failures are signalled as
 * {@link com.example.dashboard.documentrequest.exception.DocumentRequestSearchException}.
 */
public interface DocumentRequestSearchClient {

    /**
     * @param page 1-based page number
     * @param size page size
     */
    Mono<DocumentRequestSearchResponse> search(DocumentRequestSearchRequest request, int page, int size);
}
