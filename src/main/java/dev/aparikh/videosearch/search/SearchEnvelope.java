package dev.aparikh.videosearch.search;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.aparikh.videosearch.model.Result;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Buffered search response.
 */
@Schema(description = "Aggregated search response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchEnvelope(
        @Schema(description = "Query as typed", example = "!ph amateur -solo")
        String query,

        @Schema(description = "Text sent to the sources", example = "amateur")
        String searchQuery,

        @Schema(description = "1-based page", example = "1")
        int page,

        @Schema(description = "Sources that answered")
        List<String> sourcesUsed,

        @Schema(description = "Sources that failed, timed out or were cut off by the deadline")
        List<FailedSource> failedSources,

        @Schema(description = "Results in source completion order")
        List<Result> results,

        @Schema(description = "Number of results", example = "42")
        int total,

        @Schema(description = "Wall-clock time of the fan-out in milliseconds", example = "1834")
        long elapsedMs,

        boolean hasBang,
        List<String> bangSources,
        String invalidBang,
        List<String> exactPhrases,
        List<String> exclusions,
        List<String> performers,

        @Schema(description = "Follow-up searches sharing words with the search text")
        List<String> relatedSearches,

        @Schema(description = "Whether source requests went through the anonymizing proxy")
        boolean anonymized
) {
}
