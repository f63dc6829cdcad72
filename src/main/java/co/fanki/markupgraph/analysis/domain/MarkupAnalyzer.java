package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.analysis.domain.AnalysisContext.DiscoveredScript;
import co.fanki.markupgraph.analysis.domain.markup.MarkupTreeWalker;
import co.fanki.markupgraph.analysis.domain.script.ScriptAnalyzer;
import co.fanki.markupgraph.analysis.domain.script.ScriptParser;
import co.fanki.markupgraph.analysis.domain.style.StyleResolver;
import co.fanki.markupgraph.analysis.domain.style.StyleResolver.ParsedStylesheet;
import co.fanki.markupgraph.analysis.domain.style.StylesheetParser;
import co.fanki.markupgraph.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Turns one markup document into a {@link MarkupGraph}.
 *
 * <p>Template of a run, all on the calling thread:</p>
 * <ol>
 *   <li>walk the markup tree, building elements and the selector index
 *       ({@link AnalysisMilestone#STRUCTURE_TRAVERSED})</li>
 *   <li>analyze every inline script and parse every stylesheet
 *       ({@link AnalysisMilestone#EXTRACTION_COMPLETE})</li>
 *   <li>resolve selectors against the finished tree
 *       ({@link AnalysisMilestone#STYLES_RESOLVED})</li>
 *   <li>freeze the graph ({@link AnalysisMilestone#DONE}) and hand it to
 *       the listener once</li>
 * </ol>
 *
 * <p>Each run gets a fresh {@link AnalysisContext}, so one analyzer can
 * serve any number of runs. Only an unusable document aborts a run; a
 * script or stylesheet that does not parse is logged and skipped.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MarkupAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            MarkupAnalyzer.class);

    private final MarkupTreeWalker walker;
    private final ScriptAnalyzer scriptAnalyzer;
    private final StyleResolver styleResolver;

    /**
     * Creates an analyzer from its three components.
     *
     * @param theWalker the markup tree walker
     * @param theScriptAnalyzer the script analyzer
     * @param theStyleResolver the style resolver
     */
    public MarkupAnalyzer(final MarkupTreeWalker theWalker,
            final ScriptAnalyzer theScriptAnalyzer,
            final StyleResolver theStyleResolver) {
        this.walker = Preconditions.requireNonNull(theWalker,
                "Markup tree walker is required");
        this.scriptAnalyzer = Preconditions.requireNonNull(theScriptAnalyzer,
                "Script analyzer is required");
        this.styleResolver = Preconditions.requireNonNull(theStyleResolver,
                "Style resolver is required");
    }

    /** Creates an analyzer with default parser settings. */
    public MarkupAnalyzer() {
        this(new MarkupTreeWalker(),
                new ScriptAnalyzer(new ScriptParser()),
                new StyleResolver(new StylesheetParser()));
    }

    /**
     * Analyzes a document with no external stylesheets and no listener.
     *
     * @param markup the markup document
     * @return the finished graph
     * @throws InvalidMarkupException if the document cannot be parsed
     */
    public MarkupGraph analyze(final String markup) {
        return analyze(markup, Map.of(), AnalysisListener.NONE);
    }

    /**
     * Analyzes a document.
     *
     * @param markup the markup document
     * @param externalStylesheets stylesheet text keyed by the href used in
     *        the document; linked sheets not in the map stay unresolved
     * @param listener notified at each milestone and once on completion
     * @return the finished graph
     * @throws InvalidMarkupException if the document cannot be parsed
     */
    public MarkupGraph analyze(final String markup,
            final Map<String, String> externalStylesheets,
            final AnalysisListener listener) {
        Preconditions.requireNonNull(externalStylesheets,
                "External stylesheets map is required");
        Preconditions.requireNonNull(listener, "Listener is required");

        final long start = System.currentTimeMillis();
        final AnalysisContext context =
                new AnalysisContext(externalStylesheets);

        walker.walk(markup, context);
        listener.onProgress(AnalysisMilestone.STRUCTURE_TRAVERSED);

        int skippedScripts = 0;
        for (final DiscoveredScript script : context.discoveredScripts()) {
            if (!scriptAnalyzer.analyze(script.nodeId(), script.text(),
                    context.graph())) {
                skippedScripts++;
            }
        }
        final List<ParsedStylesheet> stylesheets =
                styleResolver.parseAll(context);
        listener.onProgress(AnalysisMilestone.EXTRACTION_COMPLETE);

        final int styleEdges = styleResolver.resolve(stylesheets, context);
        listener.onProgress(AnalysisMilestone.STYLES_RESOLVED);

        final MarkupGraph graph = MarkupGraph.of(context);
        listener.onProgress(AnalysisMilestone.DONE);

        LOG.info("Markup analyzed in {} ms: {} nodes, {} edges,"
                        + " {} scripts ({} skipped), {} stylesheets"
                        + " ({} parsed), {} style links",
                System.currentTimeMillis() - start,
                graph.nodeCount(), graph.edgeCount(),
                context.discoveredScripts().size(), skippedScripts,
                context.discoveredStylesheets().size(), stylesheets.size(),
                styleEdges);

        listener.onComplete(graph);
        return graph;
    }
}
