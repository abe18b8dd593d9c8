package com.github.dimitryivaniuta.photosearch.search;

import com.github.dimitryivaniuta.photosearch.domain.Keyword;
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.publisher.PublisherProbe;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SearchPhotoStateMachineTest {

    @Mock
    private PhotoSearchGateway photoSearchGateway;

    @Mock
    private KeywordSuggestionGateway keywordSuggestionGateway;

    private SearchPhotoStateMachine machine;

    private final List<SearchPhotoViewState> published = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        machine = new SearchPhotoStateMachine(
                photoSearchGateway,
                keywordSuggestionGateway,
                Duration.ZERO,
                Schedulers.immediate());
        machine.states().subscribe(published::add);
    }

    @AfterEach
    void tearDown() {
        machine.dispose();
    }

    @Test
    @DisplayName("starts in Idling")
    void initialStateIsIdling() {
        assertThat(machine.currentState()).isEqualTo(Idling.INSTANCE);
        assertThat(published).containsExactly(Idling.INSTANCE);
    }

    @Nested
    @DisplayName("keyword search")
    class KeywordSearch {

        @BeforeEach
        void start() {
            startWithoutSuggestions();
        }

        @Test
        @DisplayName("publishes Searching before PhotosFetched for the first page")
        void searchingThenPhotosFetched() {
            Sinks.One<PhotoPage> firstPage = Sinks.one();
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(firstPage.asMono());

            machine.searchPhotos("cat");

            assertThat(machine.currentState()).isEqualTo(new Searching("cat"));

            firstPage.tryEmitValue(new PhotoPage(photos(1, 20), 3));

            assertThat(machine.currentState()).isEqualTo(new PhotosFetched("cat", photos(1, 20), 1, 3));
            assertThat(published).containsExactly(
                    Idling.INSTANCE,
                    new Searching("cat"),
                    new PhotosFetched("cat", photos(1, 20), 1, 3));
        }

        @Test
        @DisplayName("zero total pages resolves to NotFound")
        void zeroPagesIsNotFound() {
            when(photoSearchGateway.fetchPhotos("qwzx", 1)).thenReturn(Mono.just(new PhotoPage(List.of(), 0)));

            machine.searchPhotos("qwzx");

            assertThat(machine.currentState()).isEqualTo(new NotFound("qwzx"));
        }

        @Test
        @DisplayName("an empty response resolves to NotFound")
        void emptyResponseIsNotFound() {
            when(photoSearchGateway.fetchPhotos("qwzx", 1)).thenReturn(Mono.empty());

            machine.searchPhotos("qwzx");

            assertThat(machine.currentState()).isEqualTo(new NotFound("qwzx"));
        }

        @Test
        @DisplayName("a domain error resolves to SearchFailed")
        void domainErrorIsSearchFailed() {
            when(photoSearchGateway.fetchPhotos("cat", 1))
                    .thenReturn(Mono.error(new PhotoSearchException("cat", 1, "Photo API answered 503")));

            machine.searchPhotos("cat");

            assertThat(machine.currentState()).isEqualTo(new SearchFailed("cat"));
        }

        @Test
        @DisplayName("an unexpected error also resolves to SearchFailed")
        void genericErrorIsSearchFailed() {
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(Mono.error(new IllegalStateException("boom")));

            machine.searchPhotos("cat");

            assertThat(machine.currentState()).isEqualTo(new SearchFailed("cat"));
            assertThat(published).containsExactly(Idling.INSTANCE, new Searching("cat"), new SearchFailed("cat"));
        }

        @Test
        @DisplayName("a newer keyword cancels the running search and its late result is dropped")
        void newerKeywordSupersedesRunningSearch() {
            Sinks.One<PhotoPage> staleResult = Sinks.one();
            PublisherProbe<PhotoPage> stale = PublisherProbe.of(staleResult.asMono());
            when(photoSearchGateway.fetchPhotos("ca", 1)).thenReturn(stale.mono());
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(Mono.just(new PhotoPage(photos(1, 5), 1)));

            machine.searchPhotos("ca");
            machine.searchPhotos("cat");
            staleResult.tryEmitValue(new PhotoPage(List.of(), 0));

            stale.assertWasCancelled();
            assertThat(machine.currentState()).isEqualTo(new PhotosFetched("cat", photos(1, 5), 1, 1));
            assertThat(published).doesNotContain(new NotFound("ca"));
            assertThat(published).containsSubsequence(new Searching("ca"), new Searching("cat"));
        }

        @Test
        @DisplayName("null keyword is rejected")
        void nullKeywordRejected() {
            assertThatThrownBy(() -> machine.searchPhotos(null)).isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("next page")
    class NextPage {

        @BeforeEach
        void start() {
            startWithoutSuggestions();
        }

        @Test
        @DisplayName("merges the next page, dropping photos already shown")
        void mergesNextPageWithoutDuplicates() {
            fetchFirstPage("cat", photos(1, 20), 3);
            Sinks.One<PhotoPage> secondPage = Sinks.one();
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(secondPage.asMono());

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new LoadingNextPage(photos(1, 20)));

            secondPage.tryEmitValue(new PhotoPage(photos(18, 35), 3));

            PhotosFetched fetched = (PhotosFetched) machine.currentState();
            assertThat(fetched.keyword()).isEqualTo("cat");
            assertThat(fetched.photos()).containsExactlyElementsOf(photos(1, 35));
            assertThat(fetched.page()).isEqualTo(2);
            assertThat(fetched.totalPages()).isEqualTo(3);
        }

        @Test
        @DisplayName("takes the total page count reported by the latest page")
        void updatesTotalPages() {
            fetchFirstPage("cat", photos(1, 2), 2);
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(Mono.just(new PhotoPage(photos(3, 4), 5)));

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new PhotosFetched("cat", photos(1, 4), 2, 5));
        }

        @Test
        @DisplayName("is a no-op once the last page has been fetched")
        void noOpAtLastPage() {
            fetchFirstPage("cat", photos(1, 2), 3);
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(Mono.just(new PhotoPage(photos(3, 4), 3)));
            when(photoSearchGateway.fetchPhotos("cat", 3)).thenReturn(Mono.just(new PhotoPage(photos(5, 6), 3)));
            machine.loadNextPage();
            machine.loadNextPage();
            PhotosFetched lastPage = new PhotosFetched("cat", photos(1, 6), 3, 3);
            assertThat(machine.currentState()).isEqualTo(lastPage);
            int publishedBefore = published.size();

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(lastPage);
            assertThat(published).hasSize(publishedBefore);
            verify(photoSearchGateway, never()).fetchPhotos("cat", 4);
        }

        @Test
        @DisplayName("a failed page keeps photos and can be retried for the same page")
        void failedPageCanBeRetried() {
            fetchFirstPage("cat", photos(1, 20), 3);
            PhotoSearchException failure = new PhotoSearchException("cat", 2, "Photo API answered 500");
            when(photoSearchGateway.fetchPhotos("cat", 2))
                    .thenReturn(Mono.error(failure), Mono.just(new PhotoPage(photos(21, 40), 3)));

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new LoadPageFailed("cat", photos(1, 20), 2, 3, failure));

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new PhotosFetched("cat", photos(1, 40), 2, 3));
            verify(photoSearchGateway, times(2)).fetchPhotos("cat", 2);
        }

        @Test
        @DisplayName("an empty next-page response is a page failure")
        void emptyNextPageFails() {
            fetchFirstPage("cat", photos(1, 2), 2);
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(Mono.empty());

            machine.loadNextPage();

            assertThat(machine.currentState()).isInstanceOf(LoadPageFailed.class);
            LoadPageFailed failed = (LoadPageFailed) machine.currentState();
            assertThat(failed.pageFailedToLoad()).isEqualTo(2);
            assertThat(failed.cause()).isInstanceOf(PhotoSearchException.class);
        }

        @Test
        @DisplayName("a new keyword cancels the in-flight page load")
        void newSearchCancelsPageLoad() {
            fetchFirstPage("cat", photos(1, 20), 3);
            PublisherProbe<PhotoPage> pageLoad = PublisherProbe.of(Mono.never());
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(pageLoad.mono());
            when(photoSearchGateway.fetchPhotos("dog", 1)).thenReturn(Mono.never());

            machine.loadNextPage();
            machine.searchPhotos("dog");

            pageLoad.assertWasCancelled();
            assertThat(machine.currentState()).isEqualTo(new Searching("dog"));
        }

        @Test
        @DisplayName("is ignored while searching")
        void ignoredWhileSearching() {
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(Mono.never());
            machine.searchPhotos("cat");

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new Searching("cat"));
            verify(photoSearchGateway, never()).fetchPhotos(eq("cat"), eq(2));
        }

        @Test
        @DisplayName("is ignored after NotFound")
        void ignoredAfterNotFound() {
            when(photoSearchGateway.fetchPhotos("qwzx", 1)).thenReturn(Mono.just(PhotoPage.empty()));
            machine.searchPhotos("qwzx");

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new NotFound("qwzx"));
            verify(photoSearchGateway, times(1)).fetchPhotos(anyString(), anyInt());
        }

        @Test
        @DisplayName("is ignored after SearchFailed")
        void ignoredAfterSearchFailed() {
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(Mono.error(new RuntimeException("down")));
            machine.searchPhotos("cat");

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new SearchFailed("cat"));
            verify(photoSearchGateway, times(1)).fetchPhotos(anyString(), anyInt());
        }

        @Test
        @DisplayName("is ignored while a page is already loading")
        void ignoredWhileLoadingNextPage() {
            fetchFirstPage("cat", photos(1, 20), 3);
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(Mono.never());
            machine.loadNextPage();

            machine.loadNextPage();

            assertThat(machine.currentState()).isEqualTo(new LoadingNextPage(photos(1, 20)));
            verify(photoSearchGateway, times(1)).fetchPhotos("cat", 2);
        }
    }

    @Nested
    @DisplayName("reset")
    class Reset {

        @BeforeEach
        void start() {
            startWithoutSuggestions();
        }

        @Test
        @DisplayName("cancels the page load and a late page never overwrites Idling")
        void resetCancelsPageLoad() {
            fetchFirstPage("cat", photos(1, 20), 3);
            Sinks.One<PhotoPage> secondPage = Sinks.one();
            PublisherProbe<PhotoPage> pageLoad = PublisherProbe.of(secondPage.asMono());
            when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(pageLoad.mono());
            machine.loadNextPage();

            machine.resetSearch();
            secondPage.tryEmitValue(new PhotoPage(photos(21, 40), 3));

            pageLoad.assertWasCancelled();
            assertThat(machine.currentState()).isEqualTo(Idling.INSTANCE);
        }

        @Test
        @DisplayName("drops the result of a search still in flight")
        void resetDropsPendingSearchResult() {
            Sinks.One<PhotoPage> firstPage = Sinks.one();
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(firstPage.asMono());
            machine.searchPhotos("cat");

            machine.resetSearch();
            firstPage.tryEmitValue(new PhotoPage(photos(1, 3), 1));

            assertThat(machine.currentState()).isEqualTo(Idling.INSTANCE);
            assertThat(published).last().isEqualTo(Idling.INSTANCE);
        }

        @Test
        @DisplayName("from a fetched state publishes Idling, after which a new search runs normally")
        void searchAfterReset() {
            fetchFirstPage("cat", photos(1, 3), 1);

            machine.resetSearch();
            assertThat(machine.currentState()).isEqualTo(Idling.INSTANCE);

            when(photoSearchGateway.fetchPhotos("dog", 1)).thenReturn(Mono.just(new PhotoPage(photos(7, 8), 1)));
            machine.searchPhotos("dog");

            assertThat(machine.currentState()).isEqualTo(new PhotosFetched("dog", photos(7, 8), 1, 1));
        }
    }

    @Nested
    @DisplayName("keyword suggestions")
    class Suggestions {

        @Test
        @DisplayName("are published once on start")
        void publishedOnStart() {
            when(keywordSuggestionGateway.fetchKeywords())
                    .thenReturn(Mono.just(List.of(new Keyword("cat"), new Keyword("dog"))));

            machine.start();
            machine.start();

            assertThat(machine.currentState()).isEqualTo(new KeywordsLoaded(List.of(
                    new KeywordWithState("cat", false),
                    new KeywordWithState("dog", false))));
            verify(keywordSuggestionGateway, times(1)).fetchKeywords();
        }

        @Test
        @DisplayName("degrade to an empty list when the source fails")
        void emptyOnFailure() {
            when(keywordSuggestionGateway.fetchKeywords()).thenReturn(Mono.error(new RuntimeException("offline")));

            machine.start();

            assertThat(machine.currentState()).isEqualTo(new KeywordsLoaded(List.of()));
        }

        @Test
        @DisplayName("make next-page requests a no-op")
        void loadNextPageIgnored() {
            when(keywordSuggestionGateway.fetchKeywords()).thenReturn(Mono.just(List.of(new Keyword("cat"))));
            machine.start();

            machine.loadNextPage();

            assertThat(machine.currentState()).isInstanceOf(KeywordsLoaded.class);
            verifyNoInteractions(photoSearchGateway);
        }
    }

    @Nested
    @DisplayName("concurrent commands")
    class ConcurrentCommands {

        private Scheduler scheduler;

        @BeforeEach
        void createScheduler() {
            scheduler = Schedulers.newBoundedElastic(4, 1000, "state-machine-test");
        }

        @AfterEach
        void disposeScheduler() {
            scheduler.dispose();
        }

        @RepeatedTest(50)
        @DisplayName("next-page requests racing a new search never swallow the search result")
        void nextPageRacingNewSearch() throws InterruptedException {
            when(keywordSuggestionGateway.fetchKeywords()).thenReturn(Mono.never());
            when(photoSearchGateway.fetchPhotos("dog", 1)).thenReturn(Mono.just(new PhotoPage(photos(1, 20), 5)));
            lenient().when(photoSearchGateway.fetchPhotos("dog", 2)).thenReturn(Mono.never());
            when(photoSearchGateway.fetchPhotos("cat", 1)).thenReturn(Mono.just(new PhotoPage(photos(30, 32), 1)));

            SearchPhotoStateMachine racing = new SearchPhotoStateMachine(
                    photoSearchGateway, keywordSuggestionGateway, Duration.ZERO, scheduler);
            try {
                racing.start();
                racing.searchPhotos("dog");
                StepVerifier.create(racing.states().filter(PhotosFetched.class::isInstance).next())
                        .expectNextCount(1)
                        .expectComplete()
                        .verify(Duration.ofSeconds(5));

                AtomicBoolean searchDone = new AtomicBoolean();
                CountDownLatch go = new CountDownLatch(1);
                Thread pager = new Thread(() -> {
                    awaitQuietly(go);
                    while (!searchDone.get()) {
                        racing.loadNextPage();
                    }
                }, "pager");
                pager.start();

                PhotosFetched expected = new PhotosFetched("cat", photos(30, 32), 1, 1);
                try {
                    go.countDown();
                    racing.searchPhotos("cat");
                    StepVerifier.create(racing.states().filter(expected::equals).next())
                            .expectNext(expected)
                            .expectComplete()
                            .verify(Duration.ofSeconds(5));
                } finally {
                    searchDone.set(true);
                    pager.join(5_000);
                }
                assertThat(racing.currentState()).isEqualTo(expected);
            } finally {
                racing.dispose();
            }
        }
    }

    @Test
    @DisplayName("loadNextPage in Idling is a no-op")
    void loadNextPageInIdling() {
        machine.loadNextPage();

        assertThat(machine.currentState()).isEqualTo(Idling.INSTANCE);
        assertThat(published).containsExactly(Idling.INSTANCE);
        verifyNoInteractions(photoSearchGateway);
    }

    @Test
    @DisplayName("dispose completes the state stream and cancels the page load")
    void disposeCompletesStates() {
        startWithoutSuggestions();
        fetchFirstPage("cat", photos(1, 20), 3);
        PublisherProbe<PhotoPage> pageLoad = PublisherProbe.of(Mono.never());
        when(photoSearchGateway.fetchPhotos("cat", 2)).thenReturn(pageLoad.mono());
        machine.loadNextPage();

        StepVerifier.create(machine.states())
                .expectNext(new LoadingNextPage(photos(1, 20)))
                .then(machine::dispose)
                .verifyComplete();

        pageLoad.assertWasCancelled();
        assertThat(machine.isDisposed()).isTrue();

        machine.resetSearch();
        machine.searchPhotos("dog");
        assertThat(machine.currentState()).isEqualTo(new LoadingNextPage(photos(1, 20)));
    }

    private void startWithoutSuggestions() {
        when(keywordSuggestionGateway.fetchKeywords()).thenReturn(Mono.never());
        machine.start();
    }

    private void fetchFirstPage(String keyword, List<Photo> photos, int totalPages) {
        when(photoSearchGateway.fetchPhotos(keyword, 1)).thenReturn(Mono.just(new PhotoPage(photos, totalPages)));
        machine.searchPhotos(keyword);
        assertThat(machine.currentState()).isEqualTo(new PhotosFetched(keyword, photos, 1, totalPages));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static List<Photo> photos(int from, int to) {
        return IntStream.rangeClosed(from, to)
                .mapToObj(i -> Photo.of("p" + i, "Photo " + i, "https://img.example/p" + i + ".jpg"))
                .toList();
    }
}
