package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.analysis.application.GraphQueryService.GraphQueryResult;
import co.fanki.markupgraph.analysis.domain.MarkupGraph;
import co.fanki.markupgraph.analysis.domain.NodeKind;
import co.fanki.markupgraph.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link AnalysisService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class AnalysisServiceTest {

    @Test
    void whenCreating_givenLowercaseConfig_shouldAcceptIt() {
        final AnalysisService service = new AnalysisService(
                new GraphQueryService(), "ecmascript_2015", "css30");

        final MarkupGraph graph = service.analyze(
                "<script>function f() {}</script>", null);

        assertEquals(1, graph.nodesOfKind(NodeKind.FUNCTION).size());
    }

    @Test
    void whenCreating_givenUnknownLanguageLevel_shouldFailFast() {
        assertThrows(IllegalStateException.class,
                () -> new AnalysisService(new GraphQueryService(),
                        "ECMASCRIPT_1999", "CSS30"));
    }

    @Test
    void whenQuerying_givenDocument_shouldAnalyzeAndRunQuery() {
        final AnalysisService service = new AnalysisService(
                new GraphQueryService(), "ECMASCRIPT_NEXT", "CSS30");

        final GraphQueryResult result = service.query(
                "<link rel=\"stylesheet\" href=\"s.css\"><p id=\"x\"></p>",
                "external-styles", Map.of("s.css", "#x{}"));

        assertEquals(1, result.total());
        assertEquals("s.css", result.results().get(0).get("name"));
    }

    @Test
    void whenQuerying_givenMalformedQuery_shouldNotExecute() {
        final GraphQueryService queryService = mock(GraphQueryService.class);
        final AnalysisService service = new AnalysisService(
                queryService, "ECMASCRIPT_NEXT", "CSS30");

        assertThrows(DomainException.class,
                () -> service.query("<p></p>", "  ", Map.of()));
        verify(queryService, never()).execute(any(), any());
    }
}
