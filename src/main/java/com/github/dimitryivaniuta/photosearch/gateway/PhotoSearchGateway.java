package com.github.dimitryivaniuta.photosearch.gateway;

import com.github.dimitryivaniuta.photosearch.domain.PhotoPage;
import reactor.core.publisher.Mono;

/**
 * Source of keyword search results.
 */
public interface PhotoSearchGateway {

    /**
     * Fetch one page of photos matching a keyword.
     *
     * @param keyword free-text keyword as typed by the user
     * @param page    1-based page number
     * @return the page, or an error signal; a
     *         {@link com.github.dimitryivaniuta.photosearch.domain.PhotoSearchException}
     *         marks a failure reported by the search service itself
     */
    Mono<PhotoPage> fetchPhotos(String keyword, int page);
}
