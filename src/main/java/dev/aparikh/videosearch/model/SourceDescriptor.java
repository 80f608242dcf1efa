package dev.aparikh.videosearch.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Identity and capability declaration of one external source.
 */
public record SourceDescriptor(
        String name,
        String displayName,
        String baseUrl,
        int tier,
        Set<Capability> capabilities,
        ExtractionMethod extractionMethod,
        String previewSource
) {
    public SourceDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("source name must not be blank");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("base url must not be blank for source " + name);
        }
        if (tier < 1) {
            throw new IllegalArgumentException("tier must be >= 1 for source " + name);
        }
        displayName = displayName == null || displayName.isBlank() ? name : displayName;
        capabilities = capabilities == null || capabilities.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        extractionMethod = extractionMethod == null ? ExtractionMethod.HTML : extractionMethod;
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }
}
