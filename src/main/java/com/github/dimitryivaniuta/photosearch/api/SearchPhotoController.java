package com.github.dimitryivaniuta.photosearch.api;

import com.github.dimitryivaniuta.photosearch.search.SearchPhotoStateMachine;
import com.github.dimitryivaniuta.photosearch.session.SearchSessionRegistry;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/photos")
@Validated
@Slf4j
public class SearchPhotoController {

    private final SearchSessionRegistry sessions;

    public SearchPhotoController(SearchSessionRegistry sessions) {
        this.sessions = sessions;
    }

    /**
     * Server-Sent Events: the current state of the session, then every transition.
     * Opens the session if needed and closes it when the stream ends.
     *
     * Example:
     *   curl -N "http://localhost:8080/api/photos/states?sessionId=s1"
     *   # then POST keywords to /api/photos/keyword
     */
    @GetMapping(value = "/states", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<SearchPhotoViewState> states(@RequestParam String sessionId) {
        final SearchPhotoStateMachine machine = sessions.open(sessionId);
        return machine.states()
                .doOnSubscribe(s -> log.debug("SSE subscribed sessionId={}", sessionId))
                .doFinally(sig -> {
                    sessions.close(sessionId, machine);
                    log.debug("SSE finished sessionId={} signal={}", sessionId, sig);
                });
    }

    /** Current state of an open session. Example: GET /api/photos/state?sessionId=s1 */
    @GetMapping(value = "/state", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<SearchPhotoViewState> state(@RequestParam String sessionId) {
        return Mono.fromSupplier(() -> sessions.require(sessionId).currentState());
    }

    /**
     * Example:
     *   curl -X POST "http://localhost:8080/api/photos/keyword?sessionId=s1" \
     *        -H "Content-Type: text/plain" -d "cat"
     */
    @PostMapping(path = "/keyword", consumes = MediaType.TEXT_PLAIN_VALUE)
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void keyword(@RequestParam String sessionId, @RequestBody String keyword) {
        sessions.open(sessionId).searchPhotos(keyword);
    }

    @PostMapping("/next-page")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void nextPage(@RequestParam String sessionId) {
        sessions.require(sessionId).loadNextPage();
    }

    @PostMapping("/reset")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void reset(@RequestParam String sessionId) {
        sessions.require(sessionId).resetSearch();
    }

    @DeleteMapping("/session")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void close(@RequestParam String sessionId) {
        sessions.close(sessionId);
    }
}
