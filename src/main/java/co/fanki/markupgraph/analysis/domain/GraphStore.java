package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the node and edge tables of one analysis run.
 *
 * <p>Every other component creates nodes and edges through
 * {@link #createNode} and {@link #createEdge}; nothing else mutates the
 * tables. Node ids come from a single counter starting at zero, so they
 * are dense and never reused.</p>
 *
 * <p>Besides the edge list the store keeps a child to parent table,
 * filled whenever a node is created under a parent, so that ancestor
 * walks during selector resolution never scan the edge list.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphStore {

    private final List<Node> nodes;
    private final List<Edge> edges;

    /** Maps a node id to the id of its structural parent. */
    private final Map<Integer, Integer> parents;

    private int nextId;

    /** Creates an empty store. */
    public GraphStore() {
        this.nodes = new ArrayList<>();
        this.edges = new ArrayList<>();
        this.parents = new HashMap<>();
        this.nextId = 0;
    }

    /**
     * Creates a node with no parent.
     *
     * @param name the human-readable label
     * @param kind the node kind
     * @return the new node id
     */
    public int createNode(final String name, final NodeKind kind) {
        return createNode(name, kind, null, null);
    }

    /**
     * Creates a node and, when a parent is given, the structural edge
     * from the parent to it.
     *
     * @param name the human-readable label
     * @param kind the node kind
     * @param parentId the parent node id, or null for a root
     * @param content the content carried by the node, may be null
     * @return the new node id
     */
    public int createNode(final String name, final NodeKind kind,
            final Integer parentId, final String content) {
        Preconditions.requireNonNull(name, "Node name is required");
        Preconditions.requireNonNull(kind, "Node kind is required");

        final int id = nextId++;
        nodes.add(new Node(id, name, kind, content));

        if (parentId != null) {
            edges.add(new Edge(parentId, id, EdgeKind.STRUCTURAL, null));
            parents.put(id, parentId);
        }
        return id;
    }

    /**
     * Appends a visible edge.
     *
     * @param source the source node id
     * @param target the target node id
     * @param kind the edge kind
     * @param label the optional label, may be null
     */
    public void createEdge(final int source, final int target,
            final EdgeKind kind, final String label) {
        Preconditions.requireNonNull(kind, "Edge kind is required");
        edges.add(new Edge(source, target, kind, label));
    }

    /**
     * Returns the structural parent of a node.
     *
     * @param id the node id
     * @return the parent id, or null for a root or unknown id
     */
    public Integer parentOf(final int id) {
        return parents.get(id);
    }

    /**
     * Returns the node with the given id.
     *
     * @param id the node id
     * @return the node, or null if the id was never issued
     */
    public Node node(final int id) {
        if (id < 0 || id >= nodes.size()) {
            return null;
        }
        return nodes.get(id);
    }

    /** Returns the nodes in creation order (unmodifiable). */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /** Returns the edges in creation order (unmodifiable). */
    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /** Returns a copy of the child to parent table. */
    public Map<Integer, Integer> parents() {
        return new HashMap<>(parents);
    }

    /** Returns the number of nodes created so far. */
    public int nodeCount() {
        return nodes.size();
    }

    /** Returns the number of edges created so far. */
    public int edgeCount() {
        return edges.size();
    }
}
