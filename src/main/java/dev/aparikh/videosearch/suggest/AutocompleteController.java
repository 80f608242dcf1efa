package dev.aparikh.videosearch.suggest;

import dev.aparikh.videosearch.query.BangInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for bang listing and autocomplete.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Autocomplete", description = "Bang table and typed search suggestions")
public class AutocompleteController {

    private final SuggestionService suggestionService;

    public AutocompleteController(SuggestionService suggestionService) {
        this.suggestionService = suggestionService;
    }

    @GetMapping("/bangs")
    @Operation(summary = "List bangs", description = "Every source reachable through a !bang, with all its aliases.")
    @ApiResponse(
            responseCode = "200",
            description = "Bang table",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = BangInfo.class)))
    )
    public ResponseEntity<List<BangInfo>> listBangs() {
        return ResponseEntity.ok(suggestionService.allBangs());
    }

    @GetMapping(value = "/bangs", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "List bangs, plain text")
    public String listBangsText() {
        List<BangInfo> bangs = suggestionService.allBangs();
        StringBuilder out = new StringBuilder();
        out.append("bangs: ").append(bangs.size()).append('\n');
        out.append("---\n");
        for (BangInfo bang : bangs) {
            out.append(bang.bang()).append(" - ").append(bang.engineName()).append('\n');
        }
        return out.toString();
    }

    @GetMapping("/autocomplete")
    @Operation(
            summary = "Autocomplete",
            description = "Empty input returns popular searches. A leading or trailing !word completes bangs, " +
                    "a trailing @word completes performers, anything else completes search terms. " +
                    "When only the last word is completed, 'replace' names the word to substitute."
    )
    @ApiResponse(
            responseCode = "200",
            description = "Suggestions",
            content = @Content(schema = @Schema(implementation = AutocompleteResponse.class))
    )
    public ResponseEntity<AutocompleteResponse> autocomplete(
            @Parameter(description = "Current search box input", example = "amateur !po")
            @RequestParam(required = false) String q) {
        return ResponseEntity.ok(suggestionService.autocomplete(q));
    }

    @GetMapping(value = "/autocomplete", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Autocomplete, plain text")
    public String autocompleteText(@RequestParam(required = false) String q) {
        AutocompleteResponse response = suggestionService.autocomplete(q);
        StringBuilder out = new StringBuilder();
        out.append("type: ").append(response.type()).append('\n');
        if (response.replace() != null) {
            out.append("replace: ").append(response.replace()).append('\n');
        }
        out.append("suggestions: ").append(response.suggestions().size()).append('\n');
        out.append("---\n");
        for (Object suggestion : response.suggestions()) {
            out.append(line(suggestion)).append('\n');
        }
        return out.toString();
    }

    private static String line(Object suggestion) {
        if (suggestion instanceof BangSuggestion bang) {
            return bang.bang() + " - " + bang.engineName();
        }
        if (suggestion instanceof PerformerSuggestion performer) {
            return performer.name();
        }
        if (suggestion instanceof TermSuggestion term) {
            return term.term();
        }
        return String.valueOf(suggestion);
    }
}
