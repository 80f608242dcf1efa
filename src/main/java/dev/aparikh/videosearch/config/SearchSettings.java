package dev.aparikh.videosearch.config;

import java.time.Duration;
import java.util.List;

/**
 * Immutable snapshot of the settings a search request runs with.
 *
 * @param enabledSources     sources searched when the request names none; empty means every registered source
 * @param sourceTimeout      budget for a single source
 * @param requestDeadline    budget for the whole fan-out
 * @param minDurationSeconds results with a known duration below this are dropped; 0 disables the filter
 */
public record SearchSettings(
        List<String> enabledSources,
        Duration sourceTimeout,
        Duration requestDeadline,
        int minDurationSeconds
) {
    public SearchSettings {
        enabledSources = enabledSources == null ? List.of() : List.copyOf(enabledSources);
    }
}
