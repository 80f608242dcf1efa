package dev.aparikh.videosearch.suggest;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Bang completion for one source.
 */
public record BangSuggestion(
        String bang,
        String engineName,
        String displayName,
        String shortCode,
        @JsonIgnore int score
) {
}
