package dev.aparikh.videosearch.search;

import dev.aparikh.videosearch.api.BadRequestException;
import dev.aparikh.videosearch.config.SearchSettings;
import dev.aparikh.videosearch.config.SearchSettingsStore;
import dev.aparikh.videosearch.config.TransportProvider;
import dev.aparikh.videosearch.extract.UrlNormalizer;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.query.BangParser;
import dev.aparikh.videosearch.query.ParsedQuery;
import dev.aparikh.videosearch.source.SourceAdapter;
import dev.aparikh.videosearch.source.SourceFetchException;
import dev.aparikh.videosearch.source.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Fans a search out to the effective sources concurrently and merges what comes back.
 * <p>
 * Every source runs under its own timeout and the whole fan-out under the request deadline.
 * A failing source is recorded and never affects its siblings. Results are emitted per source
 * in completion order, each batch in the order the source returned it.
 */
@Service
public class SearchCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(SearchCoordinator.class);

    static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final SourceRegistry registry;
    private final SearchSettingsStore settingsStore;
    private final TransportProvider transport;
    private final BangParser bangParser;
    private final ThumbnailUrlMapper thumbnailUrlMapper;
    private final RelatedSearches relatedSearches;

    public SearchCoordinator(SourceRegistry registry, SearchSettingsStore settingsStore, TransportProvider transport,
                             BangParser bangParser, ThumbnailUrlMapper thumbnailUrlMapper,
                             RelatedSearches relatedSearches) {
        this.registry = registry;
        this.settingsStore = settingsStore;
        this.transport = transport;
        this.bangParser = bangParser;
        this.thumbnailUrlMapper = thumbnailUrlMapper;
        this.relatedSearches = relatedSearches;
    }

    /**
     * Parses {@code rawQuery} and resolves the sources to search.
     * Bang targets take precedence; {@code engines} is only used when no bang resolved.
     *
     * @throws BadRequestException         when nothing is left to search for
     * @throws NoSourcesAvailableException when no requested source is enabled
     */
    public SearchCommand plan(String rawQuery, int page, List<String> engines, boolean dedupe) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        ParsedQuery parsed = bangParser.parse(rawQuery);
        String term = parsed.searchTerm();
        if (term.isEmpty()) {
            throw new BadRequestException(BadRequestException.EMPTY_QUERY, "Query has no search terms");
        }
        List<String> targets = parsed.hasBang() ? parsed.sources() : engines;
        return new SearchCommand(parsed, term, page, resolveSources(targets), dedupe);
    }

    /**
     * Effective source set: the enabled subset of {@code targets} in target order, or every enabled
     * source when {@code targets} is empty.
     */
    public List<String> resolveSources(List<String> targets) {
        if (targets == null || targets.isEmpty()) {
            List<String> enabled = settingsStore.enabledSources();
            if (enabled.isEmpty()) {
                throw new NoSourcesAvailableException("No sources are enabled");
            }
            return enabled;
        }
        Set<String> effective = new LinkedHashSet<>();
        for (String target : targets) {
            if (target != null && settingsStore.isEnabled(target.trim())) {
                effective.add(target.trim());
            }
        }
        if (effective.isEmpty()) {
            throw new NoSourcesAvailableException("None of the requested sources is available: " + targets);
        }
        return List.copyOf(effective);
    }

    /**
     * Streams one {@link SourceBatchEvent} per finished source, then a {@link SearchSummaryEvent}.
     */
    public Flux<SearchStreamEvent> stream(SearchCommand command) {
        return Flux.defer(() -> {
            long started = System.nanoTime();
            SearchSettings settings = settingsStore.current();
            WebClient client = transport.client();
            Predicate<Result> filter = ResultFilter.of(command.parsed(), settings.minDurationSeconds());
            Set<String> seenUrls = command.dedupe() ? ConcurrentHashMap.newKeySet() : null;
            List<SourceOutcome> finished = Collections.synchronizedList(new ArrayList<>());

            List<Mono<SourceOutcome>> tasks = new ArrayList<>();
            for (String name : command.sources()) {
                registry.find(name).ifPresent(adapter ->
                        tasks.add(runSource(adapter, command, client, settings.sourceTimeout())));
            }

            Flux<SearchStreamEvent> batches = Flux.merge(tasks)
                    .take(settings.requestDeadline())
                    .map(outcome -> {
                        SourceOutcome shaped = shape(outcome, filter, seenUrls);
                        finished.add(shaped);
                        return toEvent(shaped);
                    });
            Mono<SearchStreamEvent> summary = Mono.fromSupplier(() -> summarize(command, finished, started));
            return Flux.concat(batches, summary);
        });
    }

    /**
     * Buffers the stream into a single envelope.
     */
    public Mono<SearchEnvelope> search(SearchCommand command) {
        return stream(command).collectList().map(events -> {
            List<Result> results = new ArrayList<>();
            SearchSummaryEvent summary = null;
            for (SearchStreamEvent event : events) {
                if (event instanceof SourceBatchEvent batch) {
                    results.addAll(batch.results());
                } else if (event instanceof SearchSummaryEvent done) {
                    summary = done;
                }
            }
            if (summary == null) {
                throw new IllegalStateException("search stream completed without a summary");
            }
            ParsedQuery parsed = command.parsed();
            return new SearchEnvelope(summary.query(), summary.searchQuery(), summary.page(),
                    summary.sourcesUsed(), summary.failedSources(), results, results.size(), summary.elapsedMs(),
                    summary.hasBang(), summary.bangSources(), summary.invalidBang(),
                    parsed.exactPhrases(), parsed.exclusions(), parsed.performers(), summary.relatedSearches(),
                    summary.anonymized());
        });
    }

    private Mono<SourceOutcome> runSource(SourceAdapter adapter, SearchCommand command, WebClient client,
                                          Duration timeout) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return adapter.search(client, command.term(), command.page())
                    .defaultIfEmpty(List.of())
                    .timeout(timeout)
                    .map(results -> SourceOutcome.success(adapter, results, elapsedMs(started)))
                    .onErrorResume(error -> {
                        String reason = describe(error, timeout);
                        LOG.warn("Source {} failed: {}", adapter.name(), reason);
                        return Mono.just(SourceOutcome.failure(adapter, reason, elapsedMs(started)));
                    });
        });
    }

    private SourceOutcome shape(SourceOutcome outcome, Predicate<Result> filter, Set<String> seenUrls) {
        if (!outcome.ok()) return outcome;
        List<Result> kept = new ArrayList<>();
        for (Result result : outcome.results()) {
            if (!filter.test(result)) continue;
            if (seenUrls != null && !seenUrls.add(UrlNormalizer.dedupeKey(result.url()))) continue;
            kept.add(result.withMedia(thumbnailUrlMapper.map(result.thumbnail()),
                    thumbnailUrlMapper.map(result.previewUrl())));
        }
        return new SourceOutcome(outcome.source(), outcome.sourceDisplay(), true, null, kept, outcome.elapsedMs());
    }

    private static SourceBatchEvent toEvent(SourceOutcome outcome) {
        return new SourceBatchEvent(outcome.source(), outcome.sourceDisplay(), outcome.ok(), outcome.error(),
                outcome.results(), outcome.results().size(), outcome.elapsedMs());
    }

    private SearchSummaryEvent summarize(SearchCommand command, List<SourceOutcome> finished, long started) {
        List<String> used = new ArrayList<>();
        List<FailedSource> failed = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int total = 0;
        synchronized (finished) {
            for (SourceOutcome outcome : finished) {
                seen.add(outcome.source());
                if (outcome.ok()) {
                    used.add(outcome.source());
                    total += outcome.results().size();
                } else {
                    failed.add(new FailedSource(outcome.source(), outcome.error()));
                }
            }
        }
        for (String name : command.sources()) {
            if (!seen.contains(name)) {
                failed.add(new FailedSource(name, DEADLINE_EXCEEDED));
            }
        }

        ParsedQuery parsed = command.parsed();
        long elapsed = elapsedMs(started);
        LOG.debug("Search '{}' page {}: {} results from {} sources, {} failed in {}ms",
                command.term(), command.page(), total, used.size(), failed.size(), elapsed);
        return new SearchSummaryEvent(parsed.original(), command.term(), command.page(), used, failed, total,
                elapsed, parsed.hasBang(), parsed.sources(), parsed.invalidBang(),
                relatedSearches.related(command.term()), transport.isAnonymized());
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + "ms";
        }
        if (error instanceof SourceFetchException) {
            return error.getMessage();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    private static long elapsedMs(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
    }
}
