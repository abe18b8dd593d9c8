package com.github.dimitryivaniuta.photosearch.session;

import com.github.dimitryivaniuta.photosearch.config.SearchProps;
import com.github.dimitryivaniuta.photosearch.gateway.KeywordSuggestionGateway;
import com.github.dimitryivaniuta.photosearch.gateway.PhotoSearchGateway;
import com.github.dimitryivaniuta.photosearch.search.SearchPhotoStateMachine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One {@link SearchPhotoStateMachine} per open search screen, keyed by a client-chosen session id.
 */
@Component
@Slf4j
public class SearchSessionRegistry {

    private final PhotoSearchGateway photoSearchGateway;
    private final KeywordSuggestionGateway keywordSuggestionGateway;
    private final SearchProps props;
    private final Scheduler searchScheduler;

    private final Map<String, SearchPhotoStateMachine> sessions = new ConcurrentHashMap<>();
    private final Object openLock = new Object();

    public SearchSessionRegistry(PhotoSearchGateway photoSearchGateway,
                                 KeywordSuggestionGateway keywordSuggestionGateway,
                                 SearchProps props,
                                 Scheduler searchScheduler) {
        this.photoSearchGateway = photoSearchGateway;
        this.keywordSuggestionGateway = keywordSuggestionGateway;
        this.props = props;
        this.searchScheduler = searchScheduler;
    }

    /**
     * Session for {@code sessionId}, opened (and started) on first use.
     *
     * @throws IllegalArgumentException if the id is blank
     * @throws IllegalStateException    if opening would exceed {@code app.search.max-sessions}
     */
    public SearchPhotoStateMachine open(String sessionId) {
        final String id = requireSession(sessionId);
        SearchPhotoStateMachine existing = sessions.get(id);
        if (existing != null) {
            return existing;
        }
        synchronized (openLock) {
            existing = sessions.get(id);
            if (existing != null) {
                return existing;
            }
            if (sessions.size() >= props.maxSessions()) {
                throw new IllegalStateException("Too many open search sessions (max %d)".formatted(props.maxSessions()));
            }
            SearchPhotoStateMachine machine = new SearchPhotoStateMachine(
                    photoSearchGateway, keywordSuggestionGateway, props.debounceWindow(), searchScheduler);
            machine.start();
            sessions.put(id, machine);
            log.debug("Search session opened sessionId={}", id);
            return machine;
        }
    }

    public Optional<SearchPhotoStateMachine> find(String sessionId) {
        return Optional.ofNullable(sessions.get(requireSession(sessionId)));
    }

    /**
     * Session for {@code sessionId}; never opens one.
     *
     * @throws SearchSessionNotFoundException if no such session is open
     */
    public SearchPhotoStateMachine require(String sessionId) {
        final String id = requireSession(sessionId);
        return find(id).orElseThrow(() -> new SearchSessionNotFoundException(id));
    }

    /** Dispose and forget the session; unknown ids are ignored. */
    public void close(String sessionId) {
        final String id = requireSession(sessionId);
        SearchPhotoStateMachine machine = sessions.remove(id);
        if (machine != null) {
            machine.dispose();
            log.debug("Search session closed sessionId={}", id);
        }
    }

    /**
     * Close the session only while {@code sessionId} still maps to {@code machine}; a session
     * reopened under the same id after {@code machine} was closed stays open.
     */
    public void close(String sessionId, SearchPhotoStateMachine machine) {
        final String id = requireSession(sessionId);
        if (sessions.remove(id, machine)) {
            log.debug("Search session closed sessionId={}", id);
        }
        machine.dispose();
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        log.debug("Closing {} search sessions", sessions.size());
        sessions.keySet().forEach(this::close);
    }

    private static String requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank())
            throw new IllegalArgumentException("sessionId must be provided");
        return sessionId.trim();
    }
}
