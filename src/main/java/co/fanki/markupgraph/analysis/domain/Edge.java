package co.fanki.markupgraph.analysis.domain;

import java.util.Objects;

/**
 * A directed edge of the markup graph.
 *
 * <p>Everything but {@code visible} is fixed at creation. The visibility
 * flag belongs to the presentation layer, so it is left out of
 * {@link #equals(Object)} and {@link #hashCode()}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Edge {

    private final int source;
    private final int target;
    private final EdgeKind kind;
    private final String label;
    private boolean visible;

    /**
     * Creates a new visible edge.
     *
     * @param theSource the source node id
     * @param theTarget the target node id
     * @param theKind the edge kind
     * @param theLabel the optional label, may be null
     */
    public Edge(final int theSource, final int theTarget,
            final EdgeKind theKind, final String theLabel) {
        this.source = theSource;
        this.target = theTarget;
        this.kind = theKind;
        this.label = theLabel;
        this.visible = true;
    }

    public int source() {
        return source;
    }

    public int target() {
        return target;
    }

    public EdgeKind kind() {
        return kind;
    }

    public String label() {
        return label;
    }

    public boolean isVisible() {
        return visible;
    }

    /**
     * Shows or hides the edge. Used by the presentation layer only.
     *
     * @param isVisible the new visibility
     */
    public void setVisible(final boolean isVisible) {
        this.visible = isVisible;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Edge)) {
            return false;
        }
        final Edge other = (Edge) o;
        return source == other.source
                && target == other.target
                && kind == other.kind
                && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, kind, label);
    }

    @Override
    public String toString() {
        return "Edge{" + source + " -> " + target
                + ", kind=" + kind.wireName()
                + (label != null ? ", label='" + label + '\'' : "")
                + '}';
    }
}
