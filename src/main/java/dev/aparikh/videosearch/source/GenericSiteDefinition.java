package dev.aparikh.videosearch.source;

import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.Feature;

import java.util.EnumSet;
import java.util.Set;

/**
 * Declarative description of a site scraped by {@link GenericHtmlSource}.
 *
 * @param searchPath path appended to the base URL, with {@code {query}} and {@code {page}} placeholders
 * @param itemSelector CSS selector matching one result card
 */
public record GenericSiteDefinition(
        String name,
        String displayName,
        String baseUrl,
        int tier,
        String searchPath,
        String itemSelector,
        Set<Feature> features,
        Set<Capability> capabilities
) {
    static final Set<Capability> DEFAULT_CAPABILITIES = EnumSet.of(Capability.DURATION, Capability.VIEWS);

    public GenericSiteDefinition {
        if (searchPath == null || !searchPath.contains("{query}")) {
            throw new IllegalArgumentException("search path of " + name + " must contain {query}");
        }
        if (itemSelector == null || itemSelector.isBlank()) {
            throw new IllegalArgumentException("item selector of " + name + " must not be blank");
        }
        features = features == null || features.isEmpty() ? Set.of() : Set.copyOf(features);
        capabilities = capabilities == null ? DEFAULT_CAPABILITIES : Set.copyOf(capabilities);
    }

    /**
     * Paginated site with the default duration and views capabilities.
     */
    static GenericSiteDefinition of(String name, String displayName, String baseUrl, int tier,
                                    String searchPath, String itemSelector) {
        Set<Feature> features = searchPath.contains("{page}") ? EnumSet.of(Feature.PAGINATION) : Set.of();
        return new GenericSiteDefinition(name, displayName, baseUrl, tier, searchPath, itemSelector,
                features, DEFAULT_CAPABILITIES);
    }
}
