package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.analysis.application.GraphQueryService.GraphQueryResult;
import co.fanki.markupgraph.analysis.domain.MarkupAnalyzer;
import co.fanki.markupgraph.analysis.domain.MarkupGraph;
import co.fanki.markupgraph.analysis.domain.Node;
import co.fanki.markupgraph.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphQueryService}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphQueryServiceTest {

    private static final String DOCUMENT = "<div id=\"app\">"
            + "<p class=\"t\">Hi</p>"
            + "<style>.t{color:red}</style>"
            + "<script>function f(a) { return a; }</script>"
            + "</div>";

    private GraphQueryService queryService;
    private MarkupGraph graph;

    @BeforeEach
    void setUp() {
        queryService = new GraphQueryService();
        graph = new MarkupAnalyzer().analyze(DOCUMENT);
    }

    private GraphQueryResult run(final String query) {
        return queryService.execute(GraphQuery.parse(query), graph);
    }

    private int idOf(final String name) {
        for (final Node node : graph.nodes()) {
            if (node.name().equals(name)) {
                return node.id();
            }
        }
        throw new AssertionError("No node named " + name);
    }

    // -- Keywords ------------------------------------------------------------

    @Test
    void whenQuerying_givenFunctionsKeyword_shouldListFunctions() {
        final GraphQueryResult result = run("functions");

        assertEquals("functions", result.query());
        assertEquals(1, result.total());
        final Map<String, Object> item = result.results().get(0);
        assertEquals("Function: f", item.get("name"));
        assertEquals("function", item.get("type"));
        assertFalse(item.containsKey("content"));
    }

    @Test
    void whenQuerying_givenContentInclude_shouldAddSourceSlice() {
        final GraphQueryResult result = run("elements:+content");

        assertEquals(5, result.total());
        final Map<String, Object> p = result.results().get(4);
        assertEquals("p", p.get("name"));
        assertEquals("<p class=\"t\">Hi</p>", p.get("content"));
    }

    @Test
    void whenQuerying_givenKeywordWithNavigation_shouldThrow() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> run("functions:children"));

        assertEquals(GraphQuery.INVALID_QUERY, ex.getErrorCode());
    }

    // -- Node navigation -----------------------------------------------------

    @Test
    void whenQuerying_givenNodeId_shouldReturnOverview() {
        final int app = idOf("#app");

        final GraphQueryResult result = run(String.valueOf(app));

        assertEquals(1, result.total());
        final Map<String, Object> item = result.results().get(0);
        assertEquals("#app", item.get("name"));
        assertEquals(List.of(idOf("p"), idOf("inline-stylesheet"),
                idOf("inline-script")), item.get("children"));
    }

    @Test
    void whenQuerying_givenChildrenAndParent_shouldNavigateTree() {
        final int app = idOf("#app");

        assertEquals(3, run(app + ":children").total());
        assertEquals(app, run(idOf("p") + ":parent").results().get(0)
                .get("id"));
        assertEquals(0, run("0:parent").total());
    }

    @Test
    void whenQuerying_givenStylesAndTargets_shouldFollowStyleEdges() {
        final GraphQueryResult styles = run(idOf("p") + ":styles");
        assertEquals(1, styles.total());
        assertEquals(idOf("inline-stylesheet"),
                styles.results().get(0).get("id"));
        assertEquals(".t", styles.results().get(0).get("selector"));

        final GraphQueryResult targets =
                run(idOf("inline-stylesheet") + ":targets");
        assertEquals(1, targets.total());
        assertEquals(idOf("p"), targets.results().get(0).get("id"));
    }

    @Test
    void whenQuerying_givenCodeOfScript_shouldReturnText() {
        final GraphQueryResult result = run(idOf("inline-script") + ":code");

        assertEquals("function f(a) { return a; }",
                result.results().get(0).get("code"));
    }

    @Test
    void whenQuerying_givenCodeOfElement_shouldThrow() {
        assertThrows(DomainException.class, () -> run(idOf("p") + ":code"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void whenQuerying_givenEdgesInclude_shouldListNonStructuralEdges() {
        final GraphQueryResult result = run(idOf("Function: f") + ":+edges");

        final List<Map<String, Object>> edges = (List<Map<String, Object>>)
                result.results().get(0).get("edges");
        assertEquals(2, edges.size());
        assertEquals("output", edges.get(0).get("type"));
        assertEquals("Returns: a", edges.get(0).get("label"));
        assertEquals("input", edges.get(1).get("type"));
    }

    // -- Checks --------------------------------------------------------------

    @Test
    void whenChecking_givenChildKind_shouldReportExistence() {
        final int function = idOf("Function: f");

        assertEquals(true, run(function + ":?input").results().get(0)
                .get("exists"));
        assertEquals(false, run(idOf("p") + ":?function").results().get(0)
                .get("exists"));
    }

    @Test
    void whenChecking_givenUnknownKind_shouldThrow() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> run("0:?widget"));

        assertEquals(GraphQuery.INVALID_QUERY, ex.getErrorCode());
    }

    // -- Errors --------------------------------------------------------------

    @Test
    void whenQuerying_givenUnknownTarget_shouldThrow() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> run("widgets"));

        assertEquals(GraphQuery.INVALID_QUERY, ex.getErrorCode());
        assertTrue(ex.getMessage().contains("functions"));
    }

    @Test
    void whenQuerying_givenMissingNode_shouldThrowNotFound() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> run("999"));

        assertEquals("NODE_NOT_FOUND", ex.getErrorCode());
    }

    @Test
    void whenQuerying_givenUnknownNavigation_shouldThrow() {
        assertThrows(DomainException.class, () -> run("0:siblings"));
    }
}
