package co.fanki.markupgraph.analysis.domain.style;

import co.fanki.markupgraph.analysis.domain.SelectorIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One simple selector of a descendant chain, e.g. {@code div#app.card}.
 *
 * <p>Holds the tag, id and class fragments found in the text. Pseudo
 * classes, pseudo elements and attribute conditions are dropped, since
 * the selector index cannot answer them.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SelectorPart {

    private final String tag;
    private final String id;
    private final List<String> classes;

    private SelectorPart(final String theTag, final String theId,
            final List<String> theClasses) {
        this.tag = theTag;
        this.id = theId;
        this.classes = Collections.unmodifiableList(theClasses);
    }

    /**
     * Parses the text of one simple selector.
     *
     * <p>Everything from the first unescaped {@code :} on is removed, as
     * are bracketed attribute conditions. Backslash escapes inside id and
     * class names are resolved, so {@code .md\:flex} yields the class
     * {@code md:flex}.</p>
     *
     * @param text the simple selector text
     * @return the parsed part, possibly without any fragment
     */
    public static SelectorPart parse(final String text) {
        String tag = null;
        String id = null;
        final List<String> classes = new ArrayList<>();

        final StringBuilder current = new StringBuilder();
        char currentType = 't';
        int bracketDepth = 0;

        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);

            if (c == '\\' && i + 1 < text.length()) {
                if (bracketDepth == 0) {
                    current.append(text.charAt(i + 1));
                }
                i++;
                continue;
            }
            if (c == '[') {
                bracketDepth++;
                continue;
            }
            if (c == ']') {
                bracketDepth = Math.max(0, bracketDepth - 1);
                continue;
            }
            if (bracketDepth > 0) {
                continue;
            }
            if (c == ':') {
                break;
            }
            if (c == '#' || c == '.') {
                final String fragment = current.toString();
                if (currentType == 't') {
                    tag = fragment;
                } else if (currentType == '#') {
                    id = fragment;
                } else {
                    classes.add(fragment);
                }
                current.setLength(0);
                currentType = c;
                continue;
            }
            current.append(c);
        }

        final String last = current.toString();
        if (currentType == 't') {
            tag = last;
        } else if (currentType == '#') {
            id = last;
        } else {
            classes.add(last);
        }

        classes.removeIf(String::isEmpty);
        return new SelectorPart(
                tag == null || tag.isEmpty() || "*".equals(tag)
                        ? null : tag.toLowerCase(Locale.ROOT),
                id == null || id.isEmpty() ? null : id,
                classes);
    }

    /**
     * Returns the selector index keys this part can be looked up by: the
     * tag name, {@code #id} and one {@code .class} per class.
     *
     * @return the keys in tag, id, class order
     */
    public List<String> keys() {
        final List<String> keys = new ArrayList<>();
        if (tag != null) {
            keys.add(tag);
        }
        if (id != null) {
            keys.add("#" + id);
        }
        for (final String cls : classes) {
            keys.add("." + cls);
        }
        return keys;
    }

    /**
     * Resolves the candidate elements of this part.
     *
     * <p>The result is the union of whatever the tag, the id and each
     * class resolve to; a part matches an element when any one of its
     * fragments points at it.</p>
     *
     * @param index the selector index of the current run
     * @return the candidate node ids, empty when nothing resolves
     */
    public Set<Integer> candidates(final SelectorIndex index) {
        final Set<Integer> result = new LinkedHashSet<>();
        for (final String key : keys()) {
            final Integer nodeId = index.resolve(key);
            if (nodeId != null) {
                result.add(nodeId);
            }
        }
        return result;
    }

    public String tag() {
        return tag;
    }

    public String id() {
        return id;
    }

    public List<String> classes() {
        return classes;
    }

    @Override
    public String toString() {
        return String.join("", keys());
    }
}
