package co.fanki.markupgraph.analysis.domain.style;

import co.fanki.markupgraph.analysis.domain.AnalysisContext;
import co.fanki.markupgraph.analysis.domain.AnalysisContext.DiscoveredStylesheet;
import co.fanki.markupgraph.analysis.domain.EdgeKind;
import co.fanki.markupgraph.analysis.domain.GraphStore;
import co.fanki.markupgraph.analysis.domain.SelectorIndex;
import co.fanki.markupgraph.analysis.domain.style.StylesheetParser.StyleRule;
import co.fanki.markupgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Links stylesheets to the elements their selectors match.
 *
 * <p>Runs in two steps so that parsing and resolution can be reported
 * separately: {@link #parseAll} reads every discovered stylesheet, and
 * {@link #resolve} matches the selectors against the finished element
 * tree, creating one {@code stylesheet-use} edge per matched element and
 * selector, labeled with the selector text.</p>
 *
 * <p>A stylesheet that does not parse keeps its node and gets no
 * edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StyleResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            StyleResolver.class);

    /**
     * The rules of one stylesheet that parsed.
     *
     * @param nodeId the stylesheet node id
     * @param rules the style rules in source order
     */
    public record ParsedStylesheet(int nodeId, List<StyleRule> rules) {}

    private final StylesheetParser parser;

    /**
     * Creates a new resolver.
     *
     * @param theParser the stylesheet parser
     */
    public StyleResolver(final StylesheetParser theParser) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Stylesheet parser is required");
    }

    /**
     * Parses every stylesheet discovered during the markup walk.
     *
     * @param context the analysis context
     * @return the stylesheets that parsed, in discovery order
     */
    public List<ParsedStylesheet> parseAll(final AnalysisContext context) {
        Preconditions.requireNonNull(context, "Analysis context is required");

        final List<ParsedStylesheet> parsed = new ArrayList<>();
        for (final DiscoveredStylesheet sheet
                : context.discoveredStylesheets()) {

            final StylesheetParser.Result result = parser.parse(sheet.text());
            if (!result.parsed()) {
                LOG.warn("Skipping stylesheet {}: text does not parse",
                        sheet.nodeId());
                continue;
            }
            LOG.debug("Stylesheet {} has {} rules", sheet.nodeId(),
                    result.rules().size());
            parsed.add(new ParsedStylesheet(sheet.nodeId(), result.rules()));
        }
        return parsed;
    }

    /**
     * Matches the selectors of the parsed stylesheets and creates the
     * {@code stylesheet-use} edges.
     *
     * @param stylesheets the parsed stylesheets
     * @param context the analysis context, with the markup walk finished
     * @return the number of edges created
     */
    public int resolve(final List<ParsedStylesheet> stylesheets,
            final AnalysisContext context) {
        Preconditions.requireNonNull(stylesheets, "Stylesheets are required");
        Preconditions.requireNonNull(context, "Analysis context is required");

        final GraphStore graph = context.graph();
        final SelectorIndex index = context.selectorIndex();

        int created = 0;
        for (final ParsedStylesheet sheet : stylesheets) {
            for (final StyleRule rule : sheet.rules()) {
                for (final String selector : rule.selectors()) {
                    final Set<Integer> matched =
                            SelectorChain.parse(selector).match(index, graph);
                    for (final Integer target : matched) {
                        graph.createEdge(sheet.nodeId(), target,
                                EdgeKind.STYLESHEET_USE, selector);
                        created++;
                    }
                }
            }
        }
        return created;
    }
}
