package dev.aparikh.videosearch.config;

import dev.aparikh.videosearch.suggest.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Rebinds search and suggestion properties from the environment and swaps them into the
 * running {@link SearchSettingsStore} and {@link SuggestionService}.
 */
@Component
class SettingsReloader {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsReloader.class);

    private final Environment environment;
    private final SearchSettingsStore settingsStore;
    private final SuggestionService suggestionService;

    SettingsReloader(Environment environment, SearchSettingsStore settingsStore,
                     SuggestionService suggestionService) {
        this.environment = environment;
        this.settingsStore = settingsStore;
        this.suggestionService = suggestionService;
    }

    /**
     * Search settings are validated first; when they are rejected the suggestion tables are left alone.
     *
     * @throws ConfigurationException when the rebound search settings are invalid
     */
    @EventListener
    public void onReload(SettingsReloadEvent event) {
        Binder binder = Binder.get(environment);
        SearchProperties search = binder.bindOrCreate(SearchProperties.PREFIX, SearchProperties.class);
        SuggestionProperties suggestions = binder.bindOrCreate(SuggestionProperties.PREFIX, SuggestionProperties.class);

        try {
            settingsStore.reload(search.toSettings());
        } catch (ConfigurationException e) {
            LOG.error("Rejected settings reload from {}: {}", event.getSource(), e.getMessage());
            throw e;
        }
        suggestionService.reload(suggestions.getCustomTerms(), suggestions.getPerformers());
    }
}
