package com.github.dimitryivaniuta.photosearch.state;

import com.github.dimitryivaniuta.photosearch.domain.Keyword;

/**
 * Keyword suggestion as rendered by the screen: the keyword text plus whether its chip is selected.
 */
public record KeywordWithState(String keyword, boolean selected) {

    public static KeywordWithState from(Keyword keyword) {
        return new KeywordWithState(keyword.value(), false);
    }
}
