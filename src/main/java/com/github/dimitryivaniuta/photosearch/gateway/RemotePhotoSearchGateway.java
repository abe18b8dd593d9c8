package com.github.dimitryivaniuta.photosearch.gateway;

import com.github.dimitryivaniuta.photosearch.config.PhotoApiProps;
import com.github.dimitryivaniuta.photosearch.domain.PhotoPage;
import com.github.dimitryivaniuta.photosearch.domain.PhotoSearchException;
import com.github.dimitryivaniuta.photosearch.gateway.dto.PhotoPageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Photo search over HTTP.
 * <p>
 * - Error statuses and transport/decoding failures become {@link PhotoSearchException}.
 * - An empty body is read as "nothing found" (0 pages).
 */
@Component
@Slf4j
public class RemotePhotoSearchGateway implements PhotoSearchGateway {

    private final WebClient webClient;
    private final PhotoApiProps props;

    public RemotePhotoSearchGateway(WebClient photoApiWebClient, PhotoApiProps props) {
        this.webClient = photoApiWebClient;
        this.props = props;
    }

    @Override
    public Mono<PhotoPage> fetchPhotos(String keyword, int page) {
        if (page < 1) {
            return Mono.error(new IllegalArgumentException("page must be >= 1, was " + page));
        }
        final String q = keyword == null ? "" : keyword.trim();
        return webClient.get()
                .uri(uri -> uri.path("/photos")
                        .queryParam("keyword", q)
                        .queryParam("page", page)
                        .queryParam("perPage", props.perPage())
                        .build())
                .retrieve()
                .bodyToMono(PhotoPageResponse.class)
                .map(PhotoPageResponse::toPhotoPage)
                .defaultIfEmpty(PhotoPage.empty())
                .onErrorMap(WebClientResponseException.class, e -> new PhotoSearchException(q, page,
                        "Photo API answered %d for keyword='%s' page=%d".formatted(e.getStatusCode().value(), q, page), e))
                .onErrorMap(WebClientException.class, e -> new PhotoSearchException(q, page,
                        "Photo API unreachable for keyword='%s' page=%d".formatted(q, page), e))
                .onErrorMap(CodecException.class, e -> new PhotoSearchException(q, page,
                        "Unreadable photo page for keyword='%s' page=%d".formatted(q, page), e))
                .doOnSubscribe(s -> log.debug("fetchPhotos keyword='{}' page={} perPage={}", q, page, props.perPage()))
                .doOnNext(p -> log.debug("fetchPhotos keyword='{}' page={} -> {} photos, totalPages={}",
                        q, page, p.photos().size(), p.totalPages()))
                .doOnError(e -> log.warn("fetchPhotos failed keyword='{}' page={}: {}", q, page, e.toString()));
    }
}
