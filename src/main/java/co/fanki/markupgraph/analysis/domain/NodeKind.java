package co.fanki.markupgraph.analysis.domain;

/**
 * The kind of entity a graph node stands for.
 *
 * <p>Each kind has a stable wire name, which is what the presentation
 * layer and the query language use.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum NodeKind {

    /** A markup element. */
    ELEMENT("element"),

    /** The value of a {@code style} attribute. */
    INLINE_STYLE("inline-style"),

    /** A {@code <script>} element, inline or by reference. */
    SCRIPT("script"),

    /** An inline {@code <style>} sheet. */
    STYLESHEET("stylesheet"),

    /** A {@code <link rel="stylesheet">} reference. */
    EXTERNAL_STYLE("external-style"),

    /** A function declared in a script. */
    FUNCTION("function"),

    /** A function parameter. */
    INPUT("input"),

    /** A returned value. */
    OUTPUT("output"),

    /** A declared variable. */
    VARIABLE("variable"),

    /** An assignment statement. */
    DOM_CHANGE("dom-change");

    private final String wireName;

    NodeKind(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the name used on the wire, e.g. {@code dom-change}.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a kind by wire name or enum name, ignoring case.
     *
     * @param value the name to look up
     * @return the matching kind, or null if none matches
     */
    public static NodeKind fromName(final String value) {
        if (value == null) {
            return null;
        }
        for (final NodeKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value)
                    || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return null;
    }

}
