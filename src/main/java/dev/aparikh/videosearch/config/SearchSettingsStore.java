package dev.aparikh.videosearch.config;

import dev.aparikh.videosearch.source.SourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link SearchSettings}. Readers always see one complete snapshot;
 * {@link #reload} validates the replacement before swapping it in.
 */
public class SearchSettingsStore {

    private static final Logger LOG = LoggerFactory.getLogger(SearchSettingsStore.class);

    private final SourceRegistry registry;
    private final AtomicReference<SearchSettings> current = new AtomicReference<>();

    public SearchSettingsStore(SearchSettings initial, SourceRegistry registry) {
        this.registry = registry;
        current.set(validate(initial));
    }

    public SearchSettings current() {
        return current.get();
    }

    /**
     * Replaces the snapshot.
     *
     * @throws ConfigurationException when {@code next} is invalid; the previous snapshot stays active
     */
    public SearchSettings reload(SearchSettings next) {
        SearchSettings validated = validate(next);
        SearchSettings previous = current.getAndSet(validated);
        LOG.info("Search settings reloaded: {} -> {}", previous, validated);
        return validated;
    }

    /**
     * Enabled sources of the current snapshot, in registry order.
     */
    public List<String> enabledSources() {
        SearchSettings settings = current();
        if (settings.enabledSources().isEmpty()) {
            return registry.names();
        }
        List<String> enabled = new ArrayList<>();
        for (String name : registry.names()) {
            if (settings.enabledSources().contains(name)) enabled.add(name);
        }
        return enabled;
    }

    public boolean isEnabled(String source) {
        SearchSettings settings = current();
        return registry.contains(source)
                && (settings.enabledSources().isEmpty() || settings.enabledSources().contains(source));
    }

    private SearchSettings validate(SearchSettings settings) {
        if (settings == null) {
            throw new ConfigurationException("search settings must not be null");
        }
        if (settings.sourceTimeout() == null || settings.sourceTimeout().isZero() || settings.sourceTimeout().isNegative()) {
            throw new ConfigurationException("source timeout must be positive");
        }
        if (settings.requestDeadline() == null || settings.requestDeadline().isZero() || settings.requestDeadline().isNegative()) {
            throw new ConfigurationException("request deadline must be positive");
        }
        if (settings.minDurationSeconds() < 0) {
            throw new ConfigurationException("minimum duration must not be negative");
        }
        for (String name : settings.enabledSources()) {
            if (!registry.contains(name)) {
                throw new ConfigurationException("Unknown source in enabled sources: " + name);
            }
        }
        return settings;
    }
}
