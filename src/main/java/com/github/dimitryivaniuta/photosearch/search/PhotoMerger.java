package com.github.dimitryivaniuta.photosearch.search;

import com.github.dimitryivaniuta.photosearch.domain.Photo;

import java.util.LinkedHashSet;
import java.util.List;

final class PhotoMerger {

    private PhotoMerger() {
    }

    /**
     * {@code fetched ++ next} with duplicate photos removed, keeping the first occurrence.
     */
    static List<Photo> mergeDistinct(List<Photo> fetched, List<Photo> next) {
        LinkedHashSet<Photo> merged = new LinkedHashSet<>(fetched.size() + next.size());
        merged.addAll(fetched);
        merged.addAll(next);
        return List.copyOf(merged);
    }
}
