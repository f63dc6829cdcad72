package co.fanki.markupgraph.analysis.domain.style;

import co.fanki.markupgraph.analysis.domain.AnalysisContext;
import co.fanki.markupgraph.analysis.domain.Edge;
import co.fanki.markupgraph.analysis.domain.EdgeKind;
import co.fanki.markupgraph.analysis.domain.Node;
import co.fanki.markupgraph.analysis.domain.markup.MarkupTreeWalker;
import co.fanki.markupgraph.analysis.domain.style.StyleResolver.ParsedStylesheet;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link StyleResolver}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class StyleResolverTest {

    private AnalysisContext walk(final String markup,
            final Map<String, String> external) {
        final AnalysisContext context = new AnalysisContext(external);
        new MarkupTreeWalker().walk(markup, context);
        return context;
    }

    private List<Edge> styleEdges(final AnalysisContext context) {
        final List<Edge> result = new ArrayList<>();
        for (final Edge edge : context.graph().edges()) {
            if (edge.kind() == EdgeKind.STYLESHEET_USE) {
                result.add(edge);
            }
        }
        return result;
    }

    private Node named(final AnalysisContext context, final String name) {
        for (final Node node : context.graph().nodes()) {
            if (node.name().equals(name)) {
                return node;
            }
        }
        throw new AssertionError("No node named " + name);
    }

    @Test
    void whenResolving_givenInlineStylesheet_shouldLinkSheetToElement() {
        final AnalysisContext context = walk("<div id=\"app\">"
                + "<p class=\"t\">Hi</p><style>.t{color:red}</style></div>",
                Map.of());
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        final List<ParsedStylesheet> sheets = resolver.parseAll(context);
        final int created = resolver.resolve(sheets, context);

        assertEquals(1, created);
        final List<Edge> edges = styleEdges(context);
        assertEquals(1, edges.size());
        assertEquals(named(context, "inline-stylesheet").id(),
                edges.get(0).source());
        assertEquals(named(context, "p").id(), edges.get(0).target());
        assertEquals(".t", edges.get(0).label());
    }

    @Test
    void whenResolving_givenSelectorGroup_shouldCreateOneEdgePerSelector() {
        final AnalysisContext context = walk("<h1 id=\"title\">T</h1>"
                + "<style>#title, h1 { margin: 0 }</style>", Map.of());
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        resolver.resolve(resolver.parseAll(context), context);

        final List<Edge> edges = styleEdges(context);
        assertEquals(2, edges.size());
        assertEquals("#title", edges.get(0).label());
        assertEquals("h1", edges.get(1).label());
        assertEquals(edges.get(0).target(), edges.get(1).target());
    }

    @Test
    void whenResolving_givenSuppliedExternalSheet_shouldLinkFromLinkNode() {
        final AnalysisContext context = walk(
                "<link rel=\"stylesheet\" href=\"site.css\">"
                        + "<p class=\"lead\">x</p>",
                Map.of("site.css", ".lead { font-weight: bold }"));
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        resolver.resolve(resolver.parseAll(context), context);

        final List<Edge> edges = styleEdges(context);
        assertEquals(1, edges.size());
        assertEquals(named(context, "site.css").id(), edges.get(0).source());
    }

    @Test
    void whenParsing_givenSheetThatFails_shouldSkipItWithoutEdges() {
        final StylesheetParser parser = mock(StylesheetParser.class);
        when(parser.parse(anyString()))
                .thenReturn(StylesheetParser.Result.failed());

        final AnalysisContext context = walk(
                "<p class=\"t\">x</p><style>.t{color:red}</style>", Map.of());
        final StyleResolver resolver = new StyleResolver(parser);

        final List<ParsedStylesheet> sheets = resolver.parseAll(context);

        assertTrue(sheets.isEmpty());
        assertEquals(0, resolver.resolve(sheets, context));
        assertTrue(styleEdges(context).isEmpty());
        assertEquals("inline-stylesheet",
                named(context, "inline-stylesheet").name());
    }

    @Test
    void whenResolving_givenSelectorWithNoMatch_shouldCreateNoEdge() {
        final AnalysisContext context = walk(
                "<p>x</p><style>.nothing { color: red }</style>", Map.of());
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        assertEquals(0, resolver.resolve(resolver.parseAll(context),
                context));
    }

    @Test
    void whenResolving_givenChildCombinator_shouldLabelWithSelectorAsWritten() {
        final AnalysisContext context = walk("<div class=\"c\">"
                + "<span>x</span></div><style>.c > span{color:red}</style>",
                Map.of());
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        resolver.resolve(resolver.parseAll(context), context);

        final List<Edge> edges = styleEdges(context);
        assertEquals(1, edges.size());
        assertEquals(named(context, "span").id(), edges.get(0).target());
        assertEquals(".c > span", edges.get(0).label());
    }

    @Test
    void whenResolving_givenSheetWithOneUnsupportedRule_shouldLinkTheRest() {
        final AnalysisContext context = walk("<p class=\"t\">x</p>"
                + "<style>.t:has(> b){color:red} .t{color:blue}</style>",
                Map.of());
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        resolver.resolve(resolver.parseAll(context), context);

        boolean linked = false;
        for (final Edge edge : styleEdges(context)) {
            linked |= ".t".equals(edge.label())
                    && edge.target() == named(context, "p").id();
        }
        assertTrue(linked);
    }

    @Test
    void whenResolving_givenRuleInsideLayer_shouldLinkIt() {
        final AnalysisContext context = walk("<p class=\"t\">x</p>"
                + "<style>@layer base { .t{color:red} }</style>", Map.of());
        final StyleResolver resolver = new StyleResolver(
                new StylesheetParser());

        resolver.resolve(resolver.parseAll(context), context);

        final List<Edge> edges = styleEdges(context);
        assertEquals(1, edges.size());
        assertEquals(".t", edges.get(0).label());
    }
}
