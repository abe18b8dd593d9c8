package com.github.dimitryivaniuta.photosearch.domain;

import lombok.Getter;

/**
 * Remote photo search failed for a service-specific reason (error status, unreadable payload).
 */
@Getter
public class PhotoSearchException extends RuntimeException {

    private final String keyword;
    private final int page;

    public PhotoSearchException(String keyword, int page, String message) {
        this(keyword, page, message, null);
    }

    public PhotoSearchException(String keyword, int page, String message, Throwable cause) {
        super(message, cause);
        this.keyword = keyword;
        this.page = page;
    }
}
