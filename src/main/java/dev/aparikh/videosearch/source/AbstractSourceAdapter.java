package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.model.Feature;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Fetch-then-parse skeleton shared by the adapters: build the search URL, fetch it through the
 * {@link SourceFetcher}, and map the body into results.
 */
abstract class AbstractSourceAdapter implements SourceAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSourceAdapter.class);

    private final SourceDescriptor descriptor;
    private final Set<Feature> features;
    private final SourceFetcher fetcher;

    protected AbstractSourceAdapter(SourceDescriptor descriptor, Set<Feature> features, SourceFetcher fetcher) {
        this.descriptor = descriptor;
        this.features = features.isEmpty() ? EnumSet.noneOf(Feature.class) : EnumSet.copyOf(features);
        this.fetcher = fetcher;
    }

    @Override
    public SourceDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public boolean supportsFeature(Feature feature) {
        return features.contains(feature);
    }

    @Override
    public Mono<List<Result>> search(WebClient client, String query, int page) {
        String url = searchUrl(query, Math.max(1, page));
        return fetcher.fetch(client, name(), url)
                .map(body -> {
                    try {
                        List<Result> results = parse(body);
                        LOG.debug("{} parsed {} results from {}", name(), results.size(), url);
                        return results;
                    } catch (SourceFetchException e) {
                        throw e;
                    } catch (RuntimeException e) {
                        throw new SourceFetchException(name(), "undecodable payload: " + e.getMessage(), e);
                    }
                });
    }

    /**
     * Absolute URL of the search page for {@code query} and the 1-based {@code page}.
     */
    protected abstract String searchUrl(String query, int page);

    /**
     * Maps a fetched body into results, skipping items that cannot be mapped.
     */
    protected abstract List<Result> parse(String body);

    /**
     * Result cards of a page: elements matching {@code itemSelector} that are not nested inside another match.
     */
    protected List<Element> cards(String html, String itemSelector) {
        List<Element> cards = new ArrayList<>();
        for (Element card : Jsoup.parse(html, baseUrl()).select(itemSelector)) {
            if (!card.parents().is(itemSelector)) {
                cards.add(card);
            }
        }
        return cards;
    }

    protected static String encode(String query) {
        return URLEncoder.encode(query, StandardCharsets.UTF_8);
    }
}
