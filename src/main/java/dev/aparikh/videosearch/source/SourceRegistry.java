package dev.aparikh.videosearch.source;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable name-to-adapter lookup, preserving catalog order.
 */
public class SourceRegistry {

    private final Map<String, SourceAdapter> adapters;

    public SourceRegistry(List<SourceAdapter> adapters) {
        Map<String, SourceAdapter> byName = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters) {
            if (byName.putIfAbsent(adapter.name(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate source name: " + adapter.name());
            }
        }
        this.adapters = Collections.unmodifiableMap(byName);
    }

    public Optional<SourceAdapter> find(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public boolean contains(String name) {
        return adapters.containsKey(name);
    }

    public Collection<SourceAdapter> all() {
        return adapters.values();
    }

    public List<String> names() {
        return List.copyOf(adapters.keySet());
    }
}
