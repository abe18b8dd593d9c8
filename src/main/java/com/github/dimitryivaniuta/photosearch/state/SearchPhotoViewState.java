package com.github.dimitryivaniuta.photosearch.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.github.dimitryivaniuta.photosearch.domain.Photo;

import java.util.List;
import java.util.Objects;

/**
 * UI-facing state of the photo search screen. Exactly one value is current at a time;
 * every transition publishes a new instance.
 * <p>
 * Serialized with a {@code type} discriminator equal to the variant name, e.g.
 * {@code {"type":"Searching","keyword":"cat"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SearchPhotoViewState.Idling.class, name = "Idling"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.Searching.class, name = "Searching"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.PhotosFetched.class, name = "PhotosFetched"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.NotFound.class, name = "NotFound"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.SearchFailed.class, name = "SearchFailed"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.LoadingNextPage.class, name = "LoadingNextPage"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.LoadPageFailed.class, name = "LoadPageFailed"),
        @JsonSubTypes.Type(value = SearchPhotoViewState.KeywordsLoaded.class, name = "KeywordsLoaded")
})
public sealed interface SearchPhotoViewState {

    /** Nothing searched yet, or the search was reset. */
    record Idling() implements SearchPhotoViewState {
        public static final Idling INSTANCE = new Idling();
    }

    /** First page for {@code keyword} is being fetched. */
    record Searching(String keyword) implements SearchPhotoViewState {
        public Searching {
            Objects.requireNonNull(keyword, "keyword");
        }
    }

    /**
     * Pages {@code 1..page} have been fetched and merged into {@code photos}.
     */
    record PhotosFetched(String keyword, List<Photo> photos, int page, int totalPages)
            implements SearchPhotoViewState {
        public PhotosFetched {
            Objects.requireNonNull(keyword, "keyword");
            photos = List.copyOf(photos);
            if (page < 1) {
                throw new IllegalArgumentException("page must be >= 1, was " + page);
            }
        }
    }

    /** The API reported zero pages for {@code keyword}. */
    record NotFound(String keyword) implements SearchPhotoViewState {
        public NotFound {
            Objects.requireNonNull(keyword, "keyword");
        }
    }

    /** Fetching the first page for {@code keyword} failed. */
    record SearchFailed(String keyword) implements SearchPhotoViewState {
        public SearchFailed {
            Objects.requireNonNull(keyword, "keyword");
        }
    }

    /** The next page is being fetched; {@code photos} keeps what is already on screen. */
    record LoadingNextPage(List<Photo> photos) implements SearchPhotoViewState {
        public LoadingNextPage {
            photos = List.copyOf(photos);
        }
    }

    /**
     * Fetching {@code pageFailedToLoad} failed. The previous photos stay visible and
     * loading the next page again retries the same page.
     */
    @JsonIgnoreProperties({"cause"})
    record LoadPageFailed(String keyword, List<Photo> photos, int pageFailedToLoad, int totalPages, Throwable cause)
            implements SearchPhotoViewState {
        public LoadPageFailed {
            Objects.requireNonNull(keyword, "keyword");
            photos = List.copyOf(photos);
        }

        @JsonProperty("error")
        public String errorMessage() {
            if (cause == null) return null;
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        }
    }

    /** Keyword suggestions, published once when the screen starts. */
    record KeywordsLoaded(List<KeywordWithState> keywords) implements SearchPhotoViewState {
        public KeywordsLoaded {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }
}
