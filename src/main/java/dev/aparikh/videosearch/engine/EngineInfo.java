package dev.aparikh.videosearch.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.aparikh.videosearch.model.Capability;
import dev.aparikh.videosearch.model.ExtractionMethod;
import dev.aparikh.videosearch.model.Feature;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Public view of a registered source.
 */
@Schema(description = "Registered video source")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineInfo(
        @Schema(description = "Source name used in engines= and bangs", example = "pornhub")
        String name,

        @Schema(description = "Human readable name", example = "PornHub")
        String displayName,

        @Schema(description = "Site root", example = "https://www.pornhub.com")
        String baseUrl,

        @Schema(description = "Reliability tier, 1 is best", example = "1")
        int tier,

        @Schema(description = "Whether the source takes part in searches without an explicit target")
        boolean enabled,

        List<Capability> capabilities,
        List<Feature> features,
        ExtractionMethod extractionMethod,

        @Schema(description = "Attribute the preview clip URL is read from", example = "data-mediabook")
        String previewSource,

        @Schema(description = "Every bang routing to this source")
        List<String> bangs,

        @Schema(description = "Shortest bang", example = "!ph")
        String shortCode
) {
    public EngineInfo {
        capabilities = List.copyOf(capabilities);
        features = List.copyOf(features);
        bangs = List.copyOf(bangs);
    }
}
