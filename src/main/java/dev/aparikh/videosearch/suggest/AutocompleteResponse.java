package dev.aparikh.videosearch.suggest;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Typed suggestions for the current input.
 *
 * @param type        {@code popular}, {@code bang}, {@code bang_start}, {@code performer} or {@code search}
 * @param suggestions {@link BangSuggestion}, {@link PerformerSuggestion} or {@link TermSuggestion} items,
 *                    plain strings for {@code popular}
 * @param replace     the trailing word the chosen suggestion replaces, when not the whole input
 */
@Schema(description = "Autocomplete suggestions")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AutocompleteResponse(
        @Schema(description = "Suggestion kind", example = "bang")
        String type,

        List<?> suggestions,

        @Schema(description = "Word to replace with the chosen suggestion", example = "!po")
        String replace
) {
    public static final String POPULAR = "popular";
    public static final String BANG = "bang";
    public static final String BANG_START = "bang_start";
    public static final String PERFORMER = "performer";
    public static final String SEARCH = "search";

    public AutocompleteResponse {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
