package co.fanki.markupgraph.analysis.domain.style;

import co.fanki.markupgraph.shared.Preconditions;
import com.helger.css.CSSSourceLocation;
import com.helger.css.ECSSVersion;
import com.helger.css.decl.CSSSelector;
import com.helger.css.decl.CSSStyleRule;
import com.helger.css.decl.CSSUnknownRule;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.decl.visit.CSSVisitor;
import com.helger.css.decl.visit.DefaultCSSVisitor;
import com.helger.css.reader.errorhandler.LoggingCSSParseErrorHandler;
import com.helger.css.handler.LoggingCSSParseExceptionCallback;
import com.helger.css.reader.CSSReader;
import com.helger.css.reader.CSSReaderSettings;
import com.helger.css.writer.CSSWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads stylesheet text into its style rules with ph-css.
 *
 * <p>Style rules nested in {@code @media}, {@code @supports} or
 * {@code @layer} blocks are returned alongside the top level ones, in
 * source order. Declarations are not kept: only selector membership is
 * resolved later.</p>
 *
 * <p>The reader runs in browser compliant mode, so a rule the grammar
 * cannot handle is logged and skipped while the rest of the sheet is
 * kept. Selector texts are cut from the sheet as written; the
 * re-serialized form is used only when the parser reports no source
 * position.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class StylesheetParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            StylesheetParser.class);

    /** Tab width the reader uses to count columns. */
    private static final int TAB_SIZE = 8;

    private static final String LAYER_RULE = "@layer";

    /**
     * One style rule.
     *
     * @param selectors the selector texts of the rule, possibly empty
     */
    public record StyleRule(List<String> selectors) {}

    /**
     * Outcome of parsing one stylesheet.
     *
     * @param parsed whether the text parsed
     * @param rules the style rules, empty when parsing failed
     */
    public record Result(boolean parsed, List<StyleRule> rules) {

        static Result failed() {
            return new Result(false, List.of());
        }
    }

    private final ECSSVersion version;
    private final CSSWriterSettings writerSettings;

    /**
     * Creates a parser for the given CSS level.
     *
     * @param theVersion the CSS level
     */
    public StylesheetParser(final ECSSVersion theVersion) {
        this.version = Preconditions.requireNonNull(theVersion,
                "CSS version is required");
        this.writerSettings = new CSSWriterSettings(theVersion, false);
    }

    /** Creates a CSS 3 parser. */
    public StylesheetParser() {
        this(ECSSVersion.CSS30);
    }

    /**
     * Parses a stylesheet.
     *
     * @param text the stylesheet text
     * @return the parse result; never throws for bad input
     */
    public Result parse(final String text) {
        Preconditions.requireNonNull(text, "Stylesheet text is required");

        final CascadingStyleSheet sheet = CSSReader.readFromStringReader(text,
                readerSettings());
        if (sheet == null) {
            return Result.failed();
        }

        final List<StyleRule> rules = new ArrayList<>();
        collect(sheet, new SourceText(text), rules);
        return new Result(true, List.copyOf(rules));
    }

    private CSSReaderSettings readerSettings() {
        return new CSSReaderSettings()
                .setCSSVersion(version)
                .setBrowserCompliantMode(true)
                .setUseSourceLocation(true)
                .setTabSize(TAB_SIZE)
                .setCustomErrorHandler(new LoggingCSSParseErrorHandler())
                .setCustomExceptionHandler(
                        new LoggingCSSParseExceptionCallback());
    }

    private void collect(final CascadingStyleSheet sheet,
            final SourceText source, final List<StyleRule> rules) {

        CSSVisitor.visitCSS(sheet, new DefaultCSSVisitor() {
            @Override
            public void onBeginStyleRule(final CSSStyleRule rule) {
                final List<String> selectors = new ArrayList<>();
                for (final CSSSelector selector : rule.getAllSelectors()) {
                    selectors.add(selectorText(selector, source));
                }
                rules.add(new StyleRule(List.copyOf(selectors)));
            }

            @Override
            public void onUnknownRule(final CSSUnknownRule rule) {
                if (LAYER_RULE.equals(rule.getDeclaration()
                        .toLowerCase(Locale.ROOT))) {
                    collectLayer(rule, rules);
                } else {
                    LOG.debug("Ignoring at-rule {}", rule.getDeclaration());
                }
            }
        });
    }

    private void collectLayer(final CSSUnknownRule rule,
            final List<StyleRule> rules) {
        final String body = blockContent(rule.getBody());
        if (body.isBlank()) {
            return;
        }
        final CascadingStyleSheet layer = CSSReader.readFromStringReader(body,
                readerSettings());
        if (layer == null) {
            LOG.warn("Skipping {} block {}: text does not parse",
                    LAYER_RULE, rule.getParameterList());
            return;
        }
        collect(layer, new SourceText(body), rules);
    }

    private String selectorText(final CSSSelector selector,
            final SourceText source) {
        final String written = source.slice(selector.getSourceLocation());
        if (written != null && !written.isBlank()) {
            return written.trim();
        }
        return selector.getAsCSSString(writerSettings, 0);
    }

    private static String blockContent(final String body) {
        if (body == null) {
            return "";
        }
        String block = body.trim();
        if (block.startsWith("{")) {
            block = block.substring(1);
        }
        if (block.endsWith("}")) {
            block = block.substring(0, block.length() - 1);
        }
        return block;
    }

    /**
     * Maps the reader's line and column positions back to offsets in the
     * stylesheet text. Lines and columns are 1-based, and a tab advances the
     * column to the next multiple of {@link #TAB_SIZE}.
     */
    static final class SourceText {

        private final String text;
        private final List<Integer> lineStarts = new ArrayList<>();

        SourceText(final String theText) {
            this.text = theText;
            lineStarts.add(0);
            for (int i = 0; i < text.length(); i++) {
                final char c = text.charAt(i);
                if (c == '\n' || (c == '\r' && (i + 1 == text.length()
                        || text.charAt(i + 1) != '\n'))) {
                    lineStarts.add(i + 1);
                }
            }
        }

        /**
         * Returns the text between the first token's start and the last
         * token's end, or null when the location is missing or out of
         * range.
         */
        String slice(final CSSSourceLocation location) {
            if (location == null) {
                return null;
            }
            final int from = offset(location.getFirstTokenBeginLineNumber(),
                    location.getFirstTokenBeginColumnNumber());
            final int last = offset(location.getLastTokenEndLineNumber(),
                    location.getLastTokenEndColumnNumber());
            if (from < 0 || last < from) {
                return null;
            }
            return text.substring(from, last + 1);
        }

        /** Offset of the character at a position, or -1 when none. */
        int offset(final int line, final int column) {
            if (line < 1 || line > lineStarts.size() || column < 1) {
                return -1;
            }
            final int end = line == lineStarts.size()
                    ? text.length() : lineStarts.get(line);
            int current = 0;
            for (int i = lineStarts.get(line - 1); i < end; i++) {
                if (text.charAt(i) == '\t') {
                    current += TAB_SIZE - (current % TAB_SIZE);
                } else {
                    current++;
                }
                if (current >= column) {
                    return i;
                }
            }
            return -1;
        }
    }
}
