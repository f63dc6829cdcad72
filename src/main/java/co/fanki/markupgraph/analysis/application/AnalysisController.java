package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.analysis.domain.MarkupGraph;
import co.fanki.markupgraph.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for document analysis.
 *
 * <p>Every endpoint takes the document in the request body and analyzes
 * it from scratch; nothing is kept between requests.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/analysis")
@Tag(name = "Markup Analysis",
        description = "Build the element, script and style graph of a"
                + " markup document")
public class AnalysisController {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisController.class);

    private final AnalysisService analysisService;

    /**
     * Creates a new AnalysisController.
     *
     * @param theAnalysisService the analysis service
     */
    public AnalysisController(final AnalysisService theAnalysisService) {
        this.analysisService = theAnalysisService;
    }

    /**
     * Analyzes a document and returns the full graph.
     *
     * @param request the analysis request
     * @return the graph in its presentation format
     */
    @PostMapping
    @Operation(summary = "Analyze a markup document",
            description = "Returns every node, edge and inline script of"
                    + " the document graph.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Graph built"),
            @ApiResponse(responseCode = "400",
                    description = "Document cannot be parsed")
    })
    public ResponseEntity<?> analyze(
            @RequestBody final AnalysisRequest request) {

        LOG.info("Analysis request, document length {}",
                length(request.document()));

        return respond("Analysis", () -> analysisService.analyze(
                request.document(), request.externalStylesheets())
                .toJsonTree());
    }

    /**
     * Analyzes a document and runs a graph query over it.
     *
     * @param request the query request
     * @return the query results
     */
    @PostMapping("/query")
    @Operation(summary = "Query the graph of a markup document",
            description = "Executes a colon-separated query against the"
                    + " document graph. Examples: functions,"
                    + " elements:+content, 3:styles, 5:targets:+edges,"
                    + " 7:?function")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Query run"),
            @ApiResponse(responseCode = "400",
                    description = "Document or query is invalid")
    })
    public ResponseEntity<?> query(@RequestBody final QueryRequest request) {

        LOG.info("Graph query: {}", request.query());

        return respond("Graph query", () -> analysisService.query(
                request.document(), request.query(),
                request.externalStylesheets()));
    }

    /**
     * Analyzes a document and returns node and edge counts per kind.
     *
     * @param request the analysis request
     * @return the counts
     */
    @PostMapping("/summary")
    @Operation(summary = "Summarize the graph of a markup document",
            description = "Returns the number of nodes and edges of each"
                    + " kind.")
    public ResponseEntity<?> summary(
            @RequestBody final AnalysisRequest request) {

        LOG.info("Summary request, document length {}",
                length(request.document()));

        return respond("Summary", () -> {
            final MarkupGraph graph = analysisService.analyze(
                    request.document(), request.externalStylesheets());
            return graph.summary();
        });
    }

    private ResponseEntity<?> respond(final String operation,
            final Supplier<Object> action) {
        try {
            return ResponseEntity.ok(action.get());
        } catch (final DomainException e) {
            LOG.warn("{} failed: {}", operation, e.getMessage());
            return ResponseEntity.badRequest().body(
                    Map.of("error", e.getMessage(),
                            "errorCode", e.getErrorCode()));
        } catch (final Exception e) {
            LOG.error("Unexpected error during {}", operation, e);
            return ResponseEntity.internalServerError().body(
                    Map.of("error", "Internal error: "
                            + String.valueOf(e.getMessage())));
        }
    }

    private static int length(final String document) {
        return document == null ? 0 : document.length();
    }

    /**
     * Request body for analysis and summary.
     *
     * @param document the markup document
     * @param externalStylesheets stylesheet text keyed by href, optional
     */
    public record AnalysisRequest(String document,
            Map<String, String> externalStylesheets) {}

    /**
     * Request body for graph queries.
     *
     * @param document the markup document
     * @param query the colon-separated query string
     * @param externalStylesheets stylesheet text keyed by href, optional
     */
    public record QueryRequest(String document, String query,
            Map<String, String> externalStylesheets) {}
}
