package co.fanki.markupgraph.analysis.domain;

/**
 * The relationship an edge expresses.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum EdgeKind {

    /** Parent to child containment. Only the graph store creates these. */
    STRUCTURAL("structural"),

    /** Parameter to function. */
    INPUT("input"),

    /** Scope to a produced value, variable or assignment. */
    OUTPUT("output"),

    /** Stylesheet to an element one of its selectors matches. */
    STYLESHEET_USE("stylesheet-use");

    private final String wireName;

    EdgeKind(final String theWireName) {
        this.wireName = theWireName;
    }

    /**
     * Returns the name used on the wire, e.g. {@code stylesheet-use}.
     *
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }

}
