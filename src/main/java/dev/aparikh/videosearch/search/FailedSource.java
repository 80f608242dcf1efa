package dev.aparikh.videosearch.search;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A source that did not contribute results")
public record FailedSource(
        @Schema(description = "Source name", example = "xvideos")
        String name,

        @Schema(description = "Failure reason", example = "timed out after 15000ms")
        String reason
) {
}
