package com.github.dimitryivaniuta.photosearch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Suggested search keyword. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Keyword(@JsonProperty("keyword") String value) {

    public Keyword {
        value = value == null ? "" : value.trim();
    }
}
