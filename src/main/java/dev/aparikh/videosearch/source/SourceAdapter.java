package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.Feature;
import dev.aparikh.videosearch.model.Result;
import dev.aparikh.videosearch.model.SourceDescriptor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Contract every external video source implements.
 * <p>
 * {@link #search} is lazy: nothing is sent until the returned {@link Mono} is subscribed, and
 * cancelling the subscription aborts the outbound exchange. Items that cannot be mapped are
 * skipped; the {@code Mono} only errors with {@link SourceFetchException} when the page itself
 * could not be fetched or decoded.
 */
public interface SourceAdapter {

    SourceDescriptor descriptor();

    /**
     * Issues exactly one logical GET for the given page through {@code client}.
     *
     * @param client the transport chosen by the caller
     * @param query  the cleaned search term
     * @param page   1-based page number
     * @return results in the order the source listed them
     */
    Mono<List<Result>> search(WebClient client, String query, int page);

    boolean supportsFeature(Feature feature);

    default String name() {
        return descriptor().name();
    }

    default String displayName() {
        return descriptor().displayName();
    }

    default String baseUrl() {
        return descriptor().baseUrl();
    }

    default int tier() {
        return descriptor().tier();
    }

    default Set<Capability> capabilities() {
        return descriptor().capabilities();
    }
}
