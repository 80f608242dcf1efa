package dev.aparikh.videosearch.query;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * One row of the bang listing: a source with every alias that routes to it.
 */
@Schema(description = "Bang shortcut for a source")
public record BangInfo(
        @Schema(description = "Primary bang", example = "!pornhub")
        String bang,

        @Schema(description = "Source name", example = "pornhub")
        String engineName,

        @Schema(description = "Source display name", example = "PornHub")
        String displayName,

        @Schema(description = "Shortest alias", example = "!ph")
        String shortCode,

        @Schema(description = "All aliases, each prefixed with !")
        List<String> aliases
) {
    public BangInfo {
        aliases = List.copyOf(aliases);
    }
}
