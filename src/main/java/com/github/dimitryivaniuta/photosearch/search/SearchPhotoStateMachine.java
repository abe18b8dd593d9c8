package com.github.dimitryivaniuta.photosearch.search;

import com.github.dimitryivaniuta.photosearch.domain.Photo;
import com.github.dimitryivaniuta.photosearch.domain.PhotoPage;
import com.github.dimitryivaniuta.photosearch.domain.PhotoSearchException;
import com.github.dimitryivaniuta.photosearch.gateway.KeywordSuggestionGateway;
import com.github.dimitryivaniuta.photosearch.gateway.PhotoSearchGateway;
import com.github.dimitryivaniuta.photosearch.state.KeywordWithState;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.Idling;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.KeywordsLoaded;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.LoadPageFailed;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.LoadingNextPage;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.NotFound;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.PhotosFetched;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.SearchFailed;
import com.github.dimitryivaniuta.photosearch.state.SearchPhotoViewState.Searching;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * State holder of one photo search screen.
 * <p>
 * Commands ({@link #searchPhotos}, {@link #loadNextPage}, {@link #resetSearch}) never block;
 * fetches run on the background scheduler and their outcome is published as a new
 * {@link SearchPhotoViewState}. Observers read {@link #currentState()} or subscribe to
 * {@link #states()}, which replays the latest state.
 * <p>
 * Keyword search and next-page loading share one job slot. Each search pipeline, next-page
 * job and reset takes a new generation under {@link #lock}; a job publishes only while its
 * generation is still current, so a result racing its own cancellation is dropped.
 */
@Slf4j
public class SearchPhotoStateMachine implements Disposable {

    static final int FIRST_PAGE = 1;

    private final PhotoSearchGateway photoSearchGateway;
    private final KeywordSuggestionGateway keywordSuggestionGateway;
    private final Scheduler backgroundScheduler;
    private final KeywordDebouncer keywordDebouncer;
    private final Sinks.Many<SearchPhotoViewState> viewStates = Sinks.many().replay().latest();

    private final Object lock = new Object();

    private volatile SearchPhotoViewState currentState = Idling.INSTANCE;

    // guarded by lock
    private long generation;
    private Disposable loadNextPageJob;
    private Disposable keywordsJob;
    private boolean started;
    private boolean disposed;

    public SearchPhotoStateMachine(PhotoSearchGateway photoSearchGateway,
                                   KeywordSuggestionGateway keywordSuggestionGateway,
                                   Duration debounceWindow,
                                   Scheduler backgroundScheduler) {
        this.photoSearchGateway = Objects.requireNonNull(photoSearchGateway, "photoSearchGateway");
        this.keywordSuggestionGateway = Objects.requireNonNull(keywordSuggestionGateway, "keywordSuggestionGateway");
        this.backgroundScheduler = Objects.requireNonNull(backgroundScheduler, "backgroundScheduler");
        this.keywordDebouncer = new KeywordDebouncer(this::searchPipeline, debounceWindow, backgroundScheduler);
        viewStates.tryEmitNext(Idling.INSTANCE);
    }

    /**
     * Start consuming keywords and load keyword suggestions once. Calling it again is a no-op.
     */
    public void start() {
        synchronized (lock) {
            if (started || disposed) {
                return;
            }
            started = true;
        }
        keywordDebouncer.start();

        Disposable job = Mono.defer(keywordSuggestionGateway::fetchKeywords)
                .subscribeOn(backgroundScheduler)
                .map(keywords -> keywords.stream().map(KeywordWithState::from).toList())
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("Keyword suggestions unavailable, showing none: {}", e.toString());
                    return Mono.just(List.<KeywordWithState>of());
                })
                .subscribe(keywords -> publish(new KeywordsLoaded(keywords)));

        synchronized (lock) {
            if (disposed) {
                job.dispose();
            } else {
                keywordsJob = job;
            }
        }
    }

    public SearchPhotoViewState currentState() {
        return currentState;
    }

    /**
     * Latest state followed by every later one; completes when this machine is disposed.
     */
    public Flux<SearchPhotoViewState> states() {
        return viewStates.asFlux();
    }

    /** Queue a keyword search; superseded keywords may never run. */
    public void searchPhotos(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        keywordDebouncer.submitKeyword(keyword);
    }

    /**
     * Fetch the page after the last fetched one, or retry the page that failed to load.
     * Ignored unless the current state is {@link PhotosFetched} or {@link LoadPageFailed},
     * and when the last page has already been fetched.
     */
    public void loadNextPage() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            final SearchPhotoViewState state = currentState;
            final String keyword;
            final List<Photo> fetchedPhotos;
            final int nextPage;
            final int totalPages;
            if (state instanceof PhotosFetched fetched) {
                keyword = fetched.keyword();
                fetchedPhotos = fetched.photos();
                nextPage = fetched.page() + 1;
                totalPages = fetched.totalPages();
            } else if (state instanceof LoadPageFailed failed) {
                keyword = failed.keyword();
                fetchedPhotos = failed.photos();
                nextPage = failed.pageFailedToLoad();
                totalPages = failed.totalPages();
            } else {
                log.debug("loadNextPage ignored in state {}", state.getClass().getSimpleName());
                return;
            }
            if (nextPage > totalPages) {
                log.debug("loadNextPage ignored: keyword='{}' already at last page {}", keyword, totalPages);
                return;
            }

            cancelLoadNextPageJob();
            final long jobGeneration = ++generation;
            publish(new LoadingNextPage(fetchedPhotos));

            loadNextPageJob = fetchPage(keyword, nextPage)
                    .switchIfEmpty(Mono.error(() -> new PhotoSearchException(keyword, nextPage, "Empty photo page")))
                    .<SearchPhotoViewState>map(page -> new PhotosFetched(
                            keyword,
                            PhotoMerger.mergeDistinct(fetchedPhotos, page.photos()),
                            nextPage,
                            page.totalPages()))
                    .onErrorResume(e -> {
                        log.warn("Loading page {} failed for keyword='{}': {}", nextPage, keyword, e.toString());
                        return Mono.just(new LoadPageFailed(keyword, fetchedPhotos, nextPage, totalPages, e));
                    })
                    .doOnCancel(() -> log.debug("Loading page {} for keyword='{}' cancelled", nextPage, keyword))
                    .subscribe(next -> publishIfCurrent(jobGeneration, next));
        }
    }

    /** Cancel the next-page load and any pending search result, then publish {@link Idling}. */
    public void resetSearch() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            cancelLoadNextPageJob();
            generation++;
            publish(Idling.INSTANCE);
        }
    }

    @Override
    public void dispose() {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
            generation++;
            cancelLoadNextPageJob();
            if (keywordsJob != null) {
                keywordsJob.dispose();
                keywordsJob = null;
            }
        }
        keywordDebouncer.dispose();
        viewStates.tryEmitComplete();
        log.debug("Search state machine disposed");
    }

    @Override
    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    private Mono<Void> searchPipeline(String keyword) {
        return Mono.defer(() -> {
            final long searchGeneration = beginSearch(keyword);
            return fetchPage(keyword, FIRST_PAGE)
                    .defaultIfEmpty(PhotoPage.empty())
                    .<SearchPhotoViewState>map(page -> page.totalPages() != 0
                            ? new PhotosFetched(keyword, page.photos(), FIRST_PAGE, page.totalPages())
                            : new NotFound(keyword))
                    .onErrorResume(e -> {
                        if (e instanceof PhotoSearchException) {
                            log.info("Search failed for keyword='{}': {}", keyword, e.getMessage());
                        } else {
                            log.warn("Search failed unexpectedly for keyword='{}': {}", keyword, e.toString());
                        }
                        return Mono.just(new SearchFailed(keyword));
                    })
                    .doOnNext(state -> publishIfCurrent(searchGeneration, state))
                    .then();
        });
    }

    /**
     * Takes the new generation and publishes {@link Searching} in one step, so a concurrent
     * {@link #loadNextPage} sees either the previous state with the previous generation or
     * {@code Searching}, never the previous state with the new generation.
     */
    private long beginSearch(String keyword) {
        synchronized (lock) {
            cancelLoadNextPageJob();
            final long searchGeneration = ++generation;
            publish(new Searching(keyword));
            return searchGeneration;
        }
    }

    private Mono<PhotoPage> fetchPage(String keyword, int page) {
        return Mono.defer(() -> photoSearchGateway.fetchPhotos(keyword, page))
                .subscribeOn(backgroundScheduler);
    }

    private void cancelLoadNextPageJob() {
        if (loadNextPageJob != null) {
            loadNextPageJob.dispose();
            loadNextPageJob = null;
        }
    }

    private void publishIfCurrent(long jobGeneration, SearchPhotoViewState state) {
        synchronized (lock) {
            if (jobGeneration != generation) {
                log.debug("Dropping stale {} (generation {} != {})",
                        state.getClass().getSimpleName(), jobGeneration, generation);
                return;
            }
            publish(state);
        }
    }

    private void publish(SearchPhotoViewState state) {
        synchronized (lock) {
            if (disposed) {
                return;
            }
            currentState = state;
            Sinks.EmitResult result = viewStates.tryEmitNext(state);
            if (result.isFailure()) {
                log.warn("State {} not emitted: {}", state.getClass().getSimpleName(), result);
            }
            log.debug("State -> {}", state.getClass().getSimpleName());
        }
    }
}
