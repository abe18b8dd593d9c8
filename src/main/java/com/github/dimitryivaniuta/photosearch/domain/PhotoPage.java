package com.github.dimitryivaniuta.photosearch.domain;

import java.util.List;

/**
 * One page of photos for a keyword plus the total number of pages the API reports.
 */
public record PhotoPage(List<Photo> photos, int totalPages) {

    public PhotoPage {
        photos = photos == null ? List.of() : List.copyOf(photos);
        if (totalPages < 0) totalPages = 0;
    }

    public static PhotoPage empty() {
        return new PhotoPage(List.of(), 0);
    }
}
