package com.github.dimitryivaniuta.photosearch.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.photosearch.search.SearchPhotoStateMachine;
import com.github.dimitryivaniuta.photosearch.session.SearchSessionRegistry;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * One search screen per socket: JSON commands in, JSON states out.
 * Closing the socket closes the search session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchPhotoWsHandler implements WebSocketHandler {

    public static final String PATH = "/ws/photos";

    private final SearchSessionRegistry sessions;
    private final ObjectMapper mapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        final String sessionId = extractSessionId(session.getHandshakeInfo().getUri());
        final SearchPhotoStateMachine machine = sessions.open(sessionId);
        log.debug("WS connected sessionId={}", sessionId);

        Mono<Void> inbound =
                session.receive()
                        .map(WebSocketMessage::getPayloadAsText)
                        .doOnNext(payload -> dispatch(machine, sessionId, payload))
                        .onErrorResume(ex -> {
                            log.warn("WS inbound error sessionId={}: {}", sessionId, ex.toString());
                            return Mono.empty();
                        })
                        .then();

        Flux<WebSocketMessage> outbound =
                machine.states()
                        .map(this::toJson)
                        .map(session::textMessage)
                        .doOnError(ex -> log.warn("WS outbound error sessionId={}: {}", sessionId, ex.toString()));

        // first side to finish (client close or session disposed) ends the exchange
        return Mono.firstWithSignal(session.send(outbound), inbound)
                .doFinally(sig -> {
                    sessions.close(sessionId, machine);
                    log.debug("WS disconnected sessionId={} signal={}", sessionId, sig);
                });
    }

    void dispatch(SearchPhotoStateMachine machine, String sessionId, String payload) {
        final SearchCommand command;
        try {
            command = mapper.readValue(payload, SearchCommand.class);
        } catch (Exception e) {
            log.warn("Ignoring malformed command sessionId={}: {}", sessionId, e.toString());
            return;
        }
        String type = command.type() == null ? "" : command.type().trim();
        switch (type) {
            case SearchCommand.SEARCH -> {
                if (command.keyword() == null) {
                    log.warn("Ignoring search command without keyword sessionId={}", sessionId);
                    return;
                }
                machine.searchPhotos(command.keyword());
            }
            case SearchCommand.NEXT_PAGE -> machine.loadNextPage();
            case SearchCommand.RESET -> machine.resetSearch();
            default -> log.warn("Ignoring unknown command type='{}' sessionId={}", type, sessionId);
        }
    }

    /* ---------------- helpers ---------------- */

    private String toJson(SearchPhotoViewState state) {
        try {
            return mapper.writeValueAsString(state);
        } catch (Exception e) {
            log.warn("JSON serialization failed for {}: {}", state.getClass().getSimpleName(), e.toString());
            return "{\"type\":\"" + state.getClass().getSimpleName() + "\"}";
        }
    }

    private static String extractSessionId(URI uri) {
        MultiValueMap<String, String> q = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String id = q.getFirst("sessionId");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("sessionId is required in query, e.g. " + PATH + "?sessionId=s1");
        }
        return id;
    }
}
