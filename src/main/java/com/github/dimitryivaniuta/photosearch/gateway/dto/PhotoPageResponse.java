package com.github.dimitryivaniuta.photosearch.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.photosearch.domain.Photo;
import com.github.dimitryivaniuta.photosearch.domain.PhotoPage;

import java.util.List;

/**
 * Payload of {@code GET /photos} on the upstream photo API.
 * <p>
 * Fields:
 *  - photos:     photos on the requested page, in ranking order
 *  - totalPages: number of pages for the keyword (0 when nothing matched)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PhotoPageResponse(
        @JsonProperty("photos")     List<Photo> photos,
        @JsonProperty("totalPages") int totalPages
) {

    /** Drops entries without an id; the upstream occasionally sends placeholders. */
    public PhotoPage toPhotoPage() {
        List<Photo> valid = photos == null ? List.of() : photos.stream()
                .filter(p -> p != null && p.id() != null)
                .toList();
        return new PhotoPage(valid, totalPages);
    }
}
