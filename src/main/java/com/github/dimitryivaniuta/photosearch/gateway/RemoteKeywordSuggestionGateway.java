package com.github.dimitryivaniuta.photosearch.gateway;

import com.github.dimitryivaniuta.photosearch.domain.Keyword;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@Slf4j
public class RemoteKeywordSuggestionGateway implements KeywordSuggestionGateway {

    private final WebClient webClient;

    public RemoteKeywordSuggestionGateway(WebClient photoApiWebClient) {
        this.webClient = photoApiWebClient;
    }

    @Override
    public Mono<List<Keyword>> fetchKeywords() {
        return webClient.get()
                .uri("/keywords")
                .retrieve()
                .bodyToFlux(Keyword.class)
                .filter(k -> !k.value().isEmpty())
                .collectList()
                .doOnNext(list -> log.debug("fetchKeywords -> {} keywords", list.size()))
                .doOnError(e -> log.warn("fetchKeywords failed: {}", e.toString()));
    }
}
