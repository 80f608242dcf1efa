package dev.aparikh.videosearch.search;

import dev.aparikh.videosearch.api.BadRequestException;
import dev.aparikh.videosearch.api.ErrorResponse;
import dev.aparikh.videosearch.model.Result;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST Controller for aggregated video search.
 * The same endpoint answers JSON, server-sent events or plain text depending on {@code Accept}.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Video Search", description = "Concurrent search across every enabled video source")
public class SearchController {

    private final SearchCoordinator coordinator;

    public SearchController(SearchCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/search")
    @Operation(
            summary = "Search all sources",
            description = "Fans the query out to the enabled sources and returns every result once all sources " +
                    "have answered, failed or run past the request deadline. " +
                    "Supports !bang routing, \"exact phrases\", -exclusions and @performer filters."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Search completed, possibly with failed sources",
                    content = @Content(schema = @Schema(implementation = SearchEnvelope.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Missing, empty or invalid query parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "503",
                    description = "None of the requested sources is available",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public Mono<SearchEnvelope> search(
            @Parameter(description = "Search query", example = "amateur !ph -solo")
            @RequestParam(required = false) String q,
            @Parameter(description = "1-based page")
            @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "Comma separated source names, ignored when the query carries a bang")
            @RequestParam(required = false) List<String> engines,
            @Parameter(description = "Drop results whose normalized URL was already returned")
            @RequestParam(defaultValue = "false") boolean dedupe) {

        return coordinator.search(toCommand(q, page, engines, dedupe));
    }

    @GetMapping(value = "/search", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(
            summary = "Stream search results",
            description = "Emits one 'result' event per source as soon as it finishes, in completion order, " +
                    "followed by a single 'done' event with the summary."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Stream started successfully",
                    content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Missing, empty or invalid query parameters",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public Flux<ServerSentEvent<SearchStreamEvent>> streamSearch(
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) List<String> engines,
            @RequestParam(defaultValue = "false") boolean dedupe) {

        SearchCommand command = toCommand(q, page, engines, dedupe);
        return coordinator.stream(command)
                .map(event -> ServerSentEvent.<SearchStreamEvent>builder()
                        .event(event.eventName())
                        .data(event)
                        .build());
    }

    @GetMapping(value = "/search", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Search all sources, plain text listing")
    public Mono<String> searchText(
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) List<String> engines,
            @RequestParam(defaultValue = "false") boolean dedupe) {

        return coordinator.search(toCommand(q, page, engines, dedupe)).map(SearchController::toText);
    }

    private SearchCommand toCommand(String q, int page, List<String> engines, boolean dedupe) {
        if (q == null || q.isBlank()) {
            throw new BadRequestException(BadRequestException.MISSING_QUERY, "Query parameter 'q' is required");
        }
        List<String> targets = engines == null ? List.of() : engines.stream()
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
        return coordinator.plan(q, page, targets, dedupe);
    }

    static String toText(SearchEnvelope envelope) {
        StringBuilder out = new StringBuilder();
        out.append("query: ").append(envelope.query()).append('\n');
        out.append("results: ").append(envelope.total()).append('\n');
        out.append("---\n");
        int index = 1;
        for (Result result : envelope.results()) {
            out.append(index++).append(". ").append(result.title()).append('\n');
            out.append("   url: ").append(result.url()).append('\n');
            out.append("   source: ").append(result.sourceDisplay()).append('\n');
            if (result.duration() != null && !result.duration().isEmpty()) {
                out.append("   duration: ").append(result.duration()).append('\n');
            }
            if (result.views() != null && !result.views().isEmpty()) {
                out.append("   views: ").append(result.views()).append('\n');
            }
            out.append('\n');
        }
        return out.toString();
    }
}
