package co.fanki.markupgraph.analysis.domain.style;

import co.fanki.markupgraph.analysis.domain.GraphStore;
import co.fanki.markupgraph.analysis.domain.SelectorIndex;
import co.fanki.markupgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A selector split into simple parts, outermost ancestor first.
 *
 * <p>Parts are separated by whitespace. The child ({@code >}) and sibling
 * ({@code +}, {@code ~}) combinators are read as descendant separators,
 * which over-approximates them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SelectorChain {

    private final String text;
    private final List<SelectorPart> parts;

    private SelectorChain(final String theText,
            final List<SelectorPart> theParts) {
        this.text = theText;
        this.parts = Collections.unmodifiableList(theParts);
    }

    /**
     * Splits a selector into its parts.
     *
     * @param selector the selector text as written in the stylesheet
     * @return the chain, with no parts for a blank selector
     */
    public static SelectorChain parse(final String selector) {
        Preconditions.requireNonNull(selector, "Selector is required");

        final List<SelectorPart> parts = new ArrayList<>();
        for (final String token : splitParts(selector)) {
            parts.add(SelectorPart.parse(token));
        }
        return new SelectorChain(selector, parts);
    }

    /**
     * Splits on unescaped whitespace and combinators outside brackets.
     */
    private static List<String> splitParts(final String selector) {
        final List<String> tokens = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        int bracketDepth = 0;

        for (int i = 0; i < selector.length(); i++) {
            final char c = selector.charAt(i);

            if (c == '\\' && i + 1 < selector.length()) {
                current.append(c).append(selector.charAt(i + 1));
                i++;
                continue;
            }
            if (c == '[' || c == '(') {
                bracketDepth++;
            } else if ((c == ']' || c == ')') && bracketDepth > 0) {
                bracketDepth--;
            }

            final boolean separator = bracketDepth == 0
                    && (Character.isWhitespace(c)
                    || c == '>' || c == '+' || c == '~');

            if (separator) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * Finds the elements this selector applies to.
     *
     * <p>The rightmost part yields the candidates. For each candidate the
     * remaining parts are checked right to left: walking up the parent
     * table from the current element, some ancestor must be a candidate
     * of the next part. Running past the root rejects the candidate.</p>
     *
     * @param index the selector index of the run
     * @param graph the graph store holding the parent table
     * @return the matched element ids, in candidate order
     */
    public Set<Integer> match(final SelectorIndex index,
            final GraphStore graph) {

        final Set<Integer> matched = new LinkedHashSet<>();
        if (parts.isEmpty()) {
            return matched;
        }

        final List<Set<Integer>> candidatesPerPart = new ArrayList<>();
        for (final SelectorPart part : parts) {
            candidatesPerPart.add(part.candidates(index));
        }

        final int last = parts.size() - 1;
        for (final Integer candidate : candidatesPerPart.get(last)) {
            if (ancestorsMatch(candidate, last - 1, candidatesPerPart,
                    graph)) {
                matched.add(candidate);
            }
        }
        return matched;
    }

    private static boolean ancestorsMatch(final int nodeId,
            final int partIndex, final List<Set<Integer>> candidatesPerPart,
            final GraphStore graph) {

        int current = nodeId;
        for (int i = partIndex; i >= 0; i--) {
            final Set<Integer> expected = candidatesPerPart.get(i);
            Integer parent = graph.parentOf(current);
            while (parent != null && !expected.contains(parent)) {
                parent = graph.parentOf(parent);
            }
            if (parent == null) {
                return false;
            }
            current = parent;
        }
        return true;
    }

    /** Returns the selector as written. */
    public String text() {
        return text;
    }

    /** Returns the parts, outermost ancestor first. */
    public List<SelectorPart> parts() {
        return parts;
    }
}
