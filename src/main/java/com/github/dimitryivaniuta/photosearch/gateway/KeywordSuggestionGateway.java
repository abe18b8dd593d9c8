package com.github.dimitryivaniuta.photosearch.gateway;

import com.github.dimitryivaniuta.photosearch.domain.Keyword;
import reactor.core.publisher.Mono;

import java.util.List;

public interface KeywordSuggestionGateway {
    Mono<List<Keyword>> fetchKeywords();
}
