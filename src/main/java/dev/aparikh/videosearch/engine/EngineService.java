package dev.aparikh.videosearch.engine;

import dev.aparikh.videosearch.config.SearchSettingsStore;
import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.Feature;
import dev.aparikh.videosearch.model.SourceDescriptor;
import dev.aparikh.videosearch.query.BangTable;
import dev.aparikh.videosearch.source.SourceAdapter;
import dev.aparikh.videosearch.source.SourceRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Describes registered sources together with their enabled state and bangs.
 */
@Service
public class EngineService {

    private final SourceRegistry registry;
    private final SearchSettingsStore settingsStore;
    private final BangTable bangTable;

    public EngineService(SourceRegistry registry, SearchSettingsStore settingsStore, BangTable bangTable) {
        this.registry = registry;
        this.settingsStore = settingsStore;
        this.bangTable = bangTable;
    }

    /**
     * Every registered source in catalog order.
     */
    public List<EngineInfo> list() {
        List<EngineInfo> engines = new ArrayList<>();
        for (SourceAdapter adapter : registry.all()) {
            engines.add(describe(adapter));
        }
        return engines;
    }

    /**
     * @throws UnknownEngineException when {@code name} is not registered
     */
    public EngineInfo get(String name) {
        return registry.find(name)
                .map(this::describe)
                .orElseThrow(() -> new UnknownEngineException(name));
    }

    private EngineInfo describe(SourceAdapter adapter) {
        SourceDescriptor descriptor = adapter.descriptor();
        List<Capability> capabilities = Arrays.stream(Capability.values()).filter(descriptor::has).toList();
        List<Feature> features = Arrays.stream(Feature.values()).filter(adapter::supportsFeature).toList();
        List<String> bangs = bangTable.aliasesFor(adapter.name()).stream().map(alias -> "!" + alias).toList();
        return new EngineInfo(
                descriptor.name(),
                descriptor.displayName(),
                descriptor.baseUrl(),
                descriptor.tier(),
                settingsStore.isEnabled(descriptor.name()),
                capabilities,
                features,
                descriptor.extractionMethod(),
                descriptor.previewSource(),
                bangs,
                bangTable.shortCode(adapter.name()).map(code -> "!" + code).orElse(null));
    }
}
