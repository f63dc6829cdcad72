package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.analysis.application.GraphQueryService.GraphQueryResult;
import co.fanki.markupgraph.analysis.domain.AnalysisListener;
import co.fanki.markupgraph.analysis.domain.AnalysisMilestone;
import co.fanki.markupgraph.analysis.domain.MarkupAnalyzer;
import co.fanki.markupgraph.analysis.domain.MarkupGraph;
import co.fanki.markupgraph.analysis.domain.markup.MarkupTreeWalker;
import co.fanki.markupgraph.analysis.domain.script.ScriptAnalyzer;
import co.fanki.markupgraph.analysis.domain.script.ScriptParser;
import co.fanki.markupgraph.analysis.domain.style.StyleResolver;
import co.fanki.markupgraph.analysis.domain.style.StylesheetParser;
import co.fanki.markupgraph.shared.Preconditions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.helger.css.ECSSVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Application entry point for analyzing documents.
 *
 * <p>Builds one {@link MarkupAnalyzer} from configuration and runs every
 * request through it. Each call is an independent run with its own
 * graph, so the service is safe to share across request threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class AnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            AnalysisService.class);

    private final MarkupAnalyzer analyzer;
    private final GraphQueryService graphQueryService;

    /**
     * Creates a new AnalysisService.
     *
     * @param theGraphQueryService the graph query service
     * @param theLanguageLevel the script language level, a Closure
     *        Compiler {@link LanguageMode} name
     * @param theCssVersion the stylesheet grammar, a {@link ECSSVersion}
     *        name
     */
    public AnalysisService(
            final GraphQueryService theGraphQueryService,
            @Value("${markupgraph.script.language-level:ECMASCRIPT_NEXT}")
            final String theLanguageLevel,
            @Value("${markupgraph.style.css-version:CSS30}")
            final String theCssVersion) {
        this.graphQueryService = Preconditions.requireNonNull(
                theGraphQueryService, "Graph query service is required");

        final LanguageMode languageMode = configValue(LanguageMode.class,
                theLanguageLevel, "markupgraph.script.language-level");
        final ECSSVersion cssVersion = configValue(ECSSVersion.class,
                theCssVersion, "markupgraph.style.css-version");

        LOG.info("Markup analyzer configured: script language {},"
                + " stylesheet grammar {}", languageMode, cssVersion);

        this.analyzer = new MarkupAnalyzer(new MarkupTreeWalker(),
                new ScriptAnalyzer(new ScriptParser(languageMode)),
                new StyleResolver(new StylesheetParser(cssVersion)));
    }

    /**
     * Analyzes a document.
     *
     * @param document the markup document
     * @param externalStylesheets stylesheet text keyed by href, may be null
     * @return the finished graph
     */
    public MarkupGraph analyze(final String document,
            final Map<String, String> externalStylesheets) {
        return analyzer.analyze(document,
                externalStylesheets == null ? Map.of() : externalStylesheets,
                new ProgressLogger());
    }

    /**
     * Analyzes a document and runs a query over the result.
     *
     * <p>The query is parsed before the document, so a malformed query
     * fails without paying for an analysis.</p>
     *
     * @param document the markup document
     * @param query the colon-separated query
     * @param externalStylesheets stylesheet text keyed by href, may be null
     * @return the query result
     */
    public GraphQueryResult query(final String document, final String query,
            final Map<String, String> externalStylesheets) {
        final GraphQuery parsed = GraphQuery.parse(query);
        return graphQueryService.execute(parsed,
                analyze(document, externalStylesheets));
    }

    private static <E extends Enum<E>> E configValue(final Class<E> type,
            final String value, final String property) {
        Preconditions.requireNonBlank(value, property + " is required");
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new IllegalStateException("Unsupported value for "
                    + property + ": " + value, e);
        }
    }

    /** Logs milestones of a run at debug level. */
    private static final class ProgressLogger implements AnalysisListener {

        @Override
        public void onProgress(final AnalysisMilestone milestone) {
            LOG.debug("Analysis {}% ({})", milestone.percent(), milestone);
        }
    }
}
