package com.github.dimitryivaniuta.photosearch.session;

import lombok.Getter;

/**
 * A command addressed a session that was never opened or is already closed.
 */
@Getter
public class SearchSessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SearchSessionNotFoundException(String sessionId) {
        super("No open search session '%s'".formatted(sessionId));
        this.sessionId = sessionId;
    }
}
