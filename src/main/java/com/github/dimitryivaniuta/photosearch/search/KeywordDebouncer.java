package com.github.dimitryivaniuta.photosearch.search;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Turns a stream of typed keywords into at most one running search pipeline.
 * <p>
 * - Keywords the consumer has not picked up yet are conflated: only the newest is kept.
 * - A keyword picked up while a pipeline runs cancels that pipeline (latest wins).
 * - With a positive quiet period a keyword is only picked up once no newer keyword
 *   arrived within the period.
 * <p>
 * Pipelines are subscribed on the given scheduler, one at a time.
 */
@Slf4j
public class KeywordDebouncer implements Disposable {

    private final Sinks.Many<String> keywords = Sinks.many().unicast().onBackpressureBuffer();
    private final Function<String, Mono<Void>> pipeline;
    private final Duration quietPeriod;
    private final Scheduler scheduler;

    private volatile Disposable subscription;
    private volatile boolean disposed;

    public KeywordDebouncer(Function<String, Mono<Void>> pipeline,
                            Duration quietPeriod,
                            Scheduler scheduler) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.quietPeriod = quietPeriod == null ? Duration.ZERO : quietPeriod;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Start consuming keywords. Keywords submitted before this call are conflated like any other.
     */
    public synchronized void start() {
        if (subscription != null || disposed) {
            return;
        }
        Flux<String> accepted = keywords.asFlux();
        if (!quietPeriod.isZero() && !quietPeriod.isNegative()) {
            // sampleTimeout drops a keyword when a newer one arrives before its timer fires
            accepted = accepted.sampleTimeout(k -> Mono.delay(quietPeriod, scheduler));
        }
        subscription = accepted
                .onBackpressureLatest()
                .publishOn(scheduler, 1)
                .switchMap(this::runPipeline)
                .subscribe(
                        ignored -> { },
                        e -> log.warn("Keyword stream terminated with error: {}", e.toString()),
                        () -> log.debug("Keyword stream completed"));
    }

    /**
     * Hand a keyword to the consumer without blocking. Ignored once disposed.
     */
    public void submitKeyword(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        Sinks.EmitResult result;
        synchronized (keywords) {
            result = keywords.tryEmitNext(keyword);
        }
        if (result.isFailure()) {
            log.debug("Keyword '{}' not accepted: {}", keyword, result);
        }
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        synchronized (keywords) {
            keywords.tryEmitComplete();
        }
        Disposable current = subscription;
        if (current != null) {
            current.dispose();
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }

    private Mono<Void> runPipeline(String keyword) {
        log.debug("Running search pipeline for keyword='{}'", keyword);
        return Mono.defer(() -> pipeline.apply(keyword))
                .doOnCancel(() -> log.debug("Search pipeline for keyword='{}' superseded", keyword))
                .onErrorResume(e -> {
                    log.warn("Search pipeline failed for keyword='{}': {}", keyword, e.toString());
                    return Mono.empty();
                });
    }
}
