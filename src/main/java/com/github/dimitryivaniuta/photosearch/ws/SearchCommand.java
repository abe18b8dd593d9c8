package com.github.dimitryivaniuta.photosearch.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound WebSocket frame: {@code {"type":"search","keyword":"cat"}}, {@code {"type":"next-page"}}
 * or {@code {"type":"reset"}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchCommand(
        @JsonProperty("type")    String type,
        @JsonProperty("keyword") String keyword
) {

    public static final String SEARCH = "search";
    public static final String NEXT_PAGE = "next-page";
    public static final String RESET = "reset";
}
