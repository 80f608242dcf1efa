package dev.aparikh.videosearch.suggest;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record PerformerSuggestion(
        String name,
        @JsonIgnore int score
) {
}
