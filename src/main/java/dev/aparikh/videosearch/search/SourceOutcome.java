package dev.aparikh.videosearch.search;

import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.source.SourceAdapter;

import java.util.List;

/**
 * What one source produced for one request: its results, or the reason it failed.
 */
record SourceOutcome(
        String source,
        String sourceDisplay,
        boolean ok,
        String error,
        List<Result> results,
        long elapsedMs
) {
    SourceOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }

    static SourceOutcome success(SourceAdapter adapter, List<Result> results, long elapsedMs) {
        return new SourceOutcome(adapter.name(), adapter.displayName(), true, null, results, elapsedMs);
    }

    static SourceOutcome failure(SourceAdapter adapter, String error, long elapsedMs) {
        return new SourceOutcome(adapter.name(), adapter.displayName(), false, error, List.of(), elapsedMs);
    }
}
