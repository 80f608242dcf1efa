package dev.aparikh.videosearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.videosearch.query.BangParser;
import dev.aparikh.videosearch.query.BangTable;
import dev.aparikh.videosearch.search.PrefixThumbnailUrlMapper;
import dev.aparikh.videosearch.search.RelatedSearches;
import dev.aparikh.videosearch.search.ThumbnailUrlMapper;
import dev.aparikh.videosearch.source.FetchPolicy;
import dev.aparikh.videosearch.source.SourceCatalog;
import dev.aparikh.videosearch.source.SourceFetcher;
import dev.aparikh.videosearch.source.SourceRegistry;
import dev.aparikh.videosearch.suggest.SuggestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        SearchProperties.class,
        TransportProperties.class,
        BangProperties.class,
        SuggestionProperties.class,
        ThumbnailProperties.class,
        ReloadProperties.class
})
class VideoSearchConfig {

    private static final Logger LOG = LoggerFactory.getLogger(VideoSearchConfig.class);

    @Bean
    FetchPolicy fetchPolicy(TransportProperties transport) {
        return new FetchPolicy(
                transport.getMaxAttempts(),
                transport.getInitialBackoff(),
                transport.getMaxBackoff(),
                transport.getFailureThreshold(),
                transport.getOpenStateWait(),
                transport.getUserAgent());
    }

    @Bean
    SourceFetcher sourceFetcher(FetchPolicy fetchPolicy) {
        return new SourceFetcher(fetchPolicy);
    }

    @Bean
    SourceRegistry sourceRegistry(SourceFetcher sourceFetcher, ObjectMapper objectMapper) {
        SourceRegistry registry = new SourceRegistry(SourceCatalog.create(sourceFetcher, objectMapper));
        LOG.info("Registered {} video sources", registry.names().size());
        return registry;
    }

    @Bean
    TransportProvider transportProvider(TransportProperties transport) {
        return new DefaultTransportProvider(transport);
    }

    @Bean
    SearchSettingsStore searchSettingsStore(SearchProperties search, SourceRegistry registry) {
        return new SearchSettingsStore(search.toSettings(), registry);
    }

    @Bean
    BangTable bangTable(BangProperties bangs, SourceRegistry registry) {
        return BangTable.create(bangs.getCustom(), registry);
    }

    @Bean
    BangParser bangParser(BangTable bangTable) {
        return new BangParser(bangTable);
    }

    @Bean
    ThumbnailUrlMapper thumbnailUrlMapper(ThumbnailProperties thumbnails) {
        String prefix = thumbnails.getProxyPrefix();
        if (prefix == null || prefix.isBlank()) {
            return ThumbnailUrlMapper.IDENTITY;
        }
        LOG.info("Rewriting thumbnail URLs through {}", prefix);
        return new PrefixThumbnailUrlMapper(prefix);
    }

    @Bean
    SuggestionService suggestionService(BangTable bangTable, SuggestionProperties suggestions) {
        return new SuggestionService(
                bangTable,
                suggestions.getCustomTerms(),
                suggestions.getPerformers(),
                suggestions.getMaxResults());
    }

    @Bean
    RelatedSearches relatedSearches(SuggestionService suggestionService) {
        return term -> suggestionService.related(term, SuggestionService.RELATED_COUNT);
    }
}
