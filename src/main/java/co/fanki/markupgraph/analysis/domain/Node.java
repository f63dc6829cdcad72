package co.fanki.markupgraph.analysis.domain;

/**
 * A node of the markup graph.
 *
 * <p>Nodes are created only by {@link GraphStore#createNode} and never
 * change afterwards. The name is a label for humans and is not unique.</p>
 *
 * @param id the dense id assigned at creation
 * @param name the human-readable label
 * @param kind the node kind
 * @param content the source text or value this node carries, may be null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Node(int id, String name, NodeKind kind, String content) {

    /** Checks whether this node carries any content. */
    public boolean hasContent() {
        return content != null;
    }
}
