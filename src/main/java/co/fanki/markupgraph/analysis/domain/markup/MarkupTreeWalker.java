package co.fanki.markupgraph.analysis.domain.markup;

import co.fanki.markupgraph.analysis.domain.AnalysisContext;
import co.fanki.markupgraph.analysis.domain.GraphStore;
import co.fanki.markupgraph.analysis.domain.InvalidMarkupException;
import co.fanki.markupgraph.analysis.domain.NodeKind;
import co.fanki.markupgraph.analysis.domain.SelectorIndex;
import co.fanki.markupgraph.shared.Preconditions;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Range;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Depth-first walk of a parsed markup document.
 *
 * <p>Parses the document with jsoup, keeping source positions, and walks
 * it from the root element. Every element becomes an {@code element} node
 * under its parent and is registered in the selector index under its tag,
 * its id and each of its classes. A {@code style} attribute becomes an
 * {@code inline-style} child.</p>
 *
 * <p>Three elements are special:</p>
 * <ul>
 *   <li>{@code <script>} becomes a {@code script} node; inline text is
 *       queued for the script analyzer, a {@code src} reference is
 *       recorded only</li>
 *   <li>{@code <style>} becomes a {@code stylesheet} node whose text is
 *       queued for the style resolver</li>
 *   <li>{@code <link rel="stylesheet">} becomes an {@code external-style}
 *       node, queued only when the caller supplied its text</li>
 * </ul>
 *
 * <p>Text and comment nodes never reach the graph.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MarkupTreeWalker {

    private static final Logger LOG = LoggerFactory.getLogger(
            MarkupTreeWalker.class);

    static final String INLINE_SCRIPT_NAME = "inline-script";
    static final String INLINE_STYLESHEET_NAME = "inline-stylesheet";
    static final String INLINE_STYLE_NAME = "Inline Style";

    /**
     * Parses the document and walks it into the given context.
     *
     * @param markup the markup document text
     * @param context the analysis context to fill
     * @return the id of the root element node
     * @throws InvalidMarkupException if the document cannot be parsed
     */
    public int walk(final String markup, final AnalysisContext context) {
        Preconditions.requireNonNull(context, "Analysis context is required");
        if (markup == null) {
            throw new InvalidMarkupException("Markup document is required");
        }

        final Document document = parse(markup);
        final Element root = document.children().first();
        if (root == null) {
            throw new InvalidMarkupException(
                    "Invalid markup structure: no root element");
        }

        final int rootId = visit(root, null, markup, context);

        LOG.debug("Markup walk finished: {} nodes, {} selector keys",
                context.graph().nodeCount(),
                context.selectorIndex().size());
        return rootId;
    }

    private Document parse(final String markup) {
        try {
            final Parser parser = Parser.htmlParser().setTrackPosition(true);
            return parser.parseInput(markup, "");
        } catch (final RuntimeException e) {
            throw new InvalidMarkupException(
                    "Invalid markup: " + e.getMessage(), e);
        }
    }

    private int visit(final Element element, final Integer parentId,
            final String markup, final AnalysisContext context) {

        final String tag = element.normalName();

        if ("script".equals(tag)) {
            return visitScript(element, parentId, context);
        }
        if ("style".equals(tag)) {
            return visitStyle(element, parentId, markup, context);
        }
        if ("link".equals(tag) && isStylesheetLink(element)) {
            return visitStylesheetLink(element, parentId, markup, context);
        }

        final GraphStore graph = context.graph();
        final SelectorIndex index = context.selectorIndex();

        final int id = graph.createNode(elementName(element),
                NodeKind.ELEMENT, parentId, sourceSlice(element, markup));

        index.register(tag, id);

        for (final Attribute attribute : element.attributes()) {
            final String key = attribute.getKey();
            final String value = attribute.getValue();

            if ("id".equals(key)) {
                if (!value.isEmpty()) {
                    index.register("#" + value, id);
                }
            } else if ("class".equals(key)) {
                for (final String token : value.trim().split("\\s+")) {
                    if (!token.isEmpty()) {
                        index.register("." + token, id);
                    }
                }
            } else if ("style".equals(key)) {
                graph.createNode(INLINE_STYLE_NAME, NodeKind.INLINE_STYLE,
                        id, value);
            }
        }

        for (final Element child : element.children()) {
            visit(child, id, markup, context);
        }
        return id;
    }

    private int visitScript(final Element element, final Integer parentId,
            final AnalysisContext context) {

        final String src = element.attr("src");
        final boolean external = !src.isBlank();

        final int id = context.graph().createNode(
                external ? src : INLINE_SCRIPT_NAME, NodeKind.SCRIPT,
                parentId, null);

        final String text = element.data();
        if (!external && !text.isBlank()) {
            LOG.debug("Discovered inline script {} ({} chars)", id,
                    text.length());
            context.discoverScript(id, text);
        }
        return id;
    }

    private int visitStyle(final Element element, final Integer parentId,
            final String markup, final AnalysisContext context) {

        final int id = context.graph().createNode(INLINE_STYLESHEET_NAME,
                NodeKind.STYLESHEET, parentId, sourceSlice(element, markup));

        LOG.debug("Discovered inline stylesheet {}", id);
        context.discoverStylesheet(id, element.data());
        return id;
    }

    private int visitStylesheetLink(final Element element,
            final Integer parentId, final String markup,
            final AnalysisContext context) {

        final String href = element.attr("href");
        final int id = context.graph().createNode(
                href.isBlank() ? "external-stylesheet" : href,
                NodeKind.EXTERNAL_STYLE, parentId,
                sourceSlice(element, markup));

        final String text = context.externalStylesheet(href);
        if (text != null) {
            LOG.debug("Discovered external stylesheet {} ({})", id, href);
            context.discoverStylesheet(id, text);
        }
        return id;
    }

    private static boolean isStylesheetLink(final Element element) {
        final String rel = element.attr("rel").toLowerCase(Locale.ROOT);
        for (final String token : rel.trim().split("\\s+")) {
            if ("stylesheet".equals(token)) {
                return true;
            }
        }
        return false;
    }

    /** Labels an element by its id when it has one, else by tag name. */
    static String elementName(final Element element) {
        final String id = element.id();
        return id.isEmpty() ? element.normalName() : "#" + id;
    }

    /**
     * Returns the verbatim markup of an element, from the start of its
     * start tag to the end of its end tag (or of the start tag alone when
     * there is no end tag), or null when the parser reported no position
     * or implied the element.
     */
    static String sourceSlice(final Element element, final String markup) {
        final Range start = element.sourceRange();
        if (!start.isTracked()) {
            return null;
        }
        final int from = start.start().pos();
        int to = start.end().pos();
        // implied by the parser, no start tag in the markup
        if (to <= from) {
            return null;
        }

        final Range end = element.endSourceRange();
        if (end.isTracked() && end.end().pos() > to) {
            to = end.end().pos();
        }

        if (from < 0 || to <= from || to > markup.length()) {
            return null;
        }
        return markup.substring(from, to);
    }
}
