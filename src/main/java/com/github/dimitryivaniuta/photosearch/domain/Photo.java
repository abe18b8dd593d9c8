package com.github.dimitryivaniuta.photosearch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A single photo returned by the remote search API.
 * <p>
 * Equality is by value over all fields; merged result pages rely on it to drop duplicates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Photo(
        @JsonProperty("id")    String id,
        @JsonProperty("title") String title,
        @JsonProperty("url")   String url
) implements Serializable {

    public Photo {
        if (title != null) title = title.trim();
    }

    public static Photo of(String id, String title, String url) {
        return new Photo(id, title, url);
    }
}
