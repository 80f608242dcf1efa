package dev.aparikh.videosearch.engine;

import dev.aparikh.videosearch.api.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller listing the registered sources.
 */
@RestController
@RequestMapping("/api/v1/engines")
@Tag(name = "Engines", description = "Registered video sources and their capabilities")
public class EngineController {

    private final EngineService engineService;

    public EngineController(EngineService engineService) {
        this.engineService = engineService;
    }

    @GetMapping
    @Operation(summary = "List engines", description = "Every registered source with its enabled flag, features and bangs.")
    @ApiResponse(
            responseCode = "200",
            description = "Engines listed",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = EngineInfo.class)))
    )
    public ResponseEntity<List<EngineInfo>> listEngines() {
        return ResponseEntity.ok(engineService.list());
    }

    @GetMapping(produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "List engines, plain text")
    public String listEnginesText() {
        List<EngineInfo> engines = engineService.list();
        StringBuilder out = new StringBuilder();
        out.append("engines: ").append(engines.size()).append('\n');
        out.append("---\n");
        for (EngineInfo engine : engines) {
            out.append(engine.name())
                    .append(" (").append(engine.displayName()).append(')')
                    .append(" - tier ").append(engine.tier())
                    .append(engine.enabled() ? " [enabled]" : " [disabled]")
                    .append('\n');
        }
        return out.toString();
    }

    @GetMapping("/{name}")
    @Operation(summary = "Describe one engine")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Engine found",
                    content = @Content(schema = @Schema(implementation = EngineInfo.class))
            ),
            @ApiResponse(
                    responseCode = "404",
                    description = "No engine with that name",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    public ResponseEntity<EngineInfo> getEngine(
            @Parameter(description = "Source name", example = "xvideos")
            @PathVariable String name) {
        return ResponseEntity.ok(engineService.get(name));
    }
}
