package co.fanki.markupgraph.analysis.domain;

import co.fanki.markupgraph.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The finished result of one analysis run.
 *
 * <p>Holds the nodes and edges in creation order and the raw text of each
 * inline script. Array position carries no meaning beyond the ids inside
 * the records. Besides the tables it answers the navigation questions the
 * query layer and the presentation layer ask: parent, children, incoming
 * and outgoing edges, nodes of a kind.</p>
 *
 * <p>The graph is read-only except for {@link Edge#setVisible}, which is
 * presentation state and not part of the result's identity.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class MarkupGraph {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<Integer, String> scripts;
    private final Map<Integer, Integer> parents;

    /**
     * Creates a graph from the tables of a finished run.
     *
     * @param theNodes the nodes in creation order
     * @param theEdges the edges in creation order
     * @param theScripts script text keyed by script node id
     * @param theParents structural parent keyed by child node id
     */
    public MarkupGraph(final List<Node> theNodes, final List<Edge> theEdges,
            final Map<Integer, String> theScripts,
            final Map<Integer, Integer> theParents) {
        Preconditions.requireNonNull(theNodes, "Nodes are required");
        Preconditions.requireNonNull(theEdges, "Edges are required");
        Preconditions.requireNonNull(theScripts, "Scripts are required");
        Preconditions.requireNonNull(theParents, "Parents are required");
        this.nodes = List.copyOf(theNodes);
        this.edges = List.copyOf(theEdges);
        this.scripts = Collections.unmodifiableMap(
                new LinkedHashMap<>(theScripts));
        this.parents = Map.copyOf(theParents);
    }

    /**
     * Takes the tables out of a finished analysis context.
     *
     * @param context the analysis context
     * @return the graph
     */
    public static MarkupGraph of(final AnalysisContext context) {
        final GraphStore store = context.graph();
        return new MarkupGraph(store.nodes(), store.edges(),
                context.scriptContents().asMap(), store.parents());
    }

    // -- Tables --------------------------------------------------------------

    /** Returns all nodes in creation order. */
    public List<Node> nodes() {
        return nodes;
    }

    /** Returns all edges in creation order. */
    public List<Edge> edges() {
        return edges;
    }

    /** Returns script text keyed by script node id. */
    public Map<Integer, String> scripts() {
        return scripts;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    // -- Navigation ----------------------------------------------------------

    /**
     * Returns a node by id.
     *
     * @param id the node id
     * @return the node, or null if no node has that id
     */
    public Node node(final int id) {
        if (id < 0 || id >= nodes.size()) {
            return null;
        }
        return nodes.get(id);
    }

    /** Checks whether a node with the given id exists. */
    public boolean contains(final int id) {
        return node(id) != null;
    }

    /**
     * Returns the structural parent of a node.
     *
     * @param id the node id
     * @return the parent node, or null for the root or an unknown id
     */
    public Node parentOf(final int id) {
        final Integer parentId = parents.get(id);
        return parentId == null ? null : node(parentId);
    }

    /**
     * Returns the structural children of a node, in creation order.
     *
     * @param id the node id
     * @return the children, empty if none
     */
    public List<Node> children(final int id) {
        final List<Node> result = new ArrayList<>();
        for (final Edge edge : edges) {
            if (edge.kind() == EdgeKind.STRUCTURAL && edge.source() == id) {
                result.add(nodes.get(edge.target()));
            }
        }
        return result;
    }

    /**
     * Returns the nodes of a kind, in creation order.
     *
     * @param kind the node kind
     * @return the matching nodes
     */
    public List<Node> nodesOfKind(final NodeKind kind) {
        final List<Node> result = new ArrayList<>();
        for (final Node node : nodes) {
            if (node.kind() == kind) {
                result.add(node);
            }
        }
        return result;
    }

    /**
     * Returns the edges of a kind, in creation order.
     *
     * @param kind the edge kind
     * @return the matching edges
     */
    public List<Edge> edgesOfKind(final EdgeKind kind) {
        final List<Edge> result = new ArrayList<>();
        for (final Edge edge : edges) {
            if (edge.kind() == kind) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Returns the edges leaving a node.
     *
     * @param id the source node id
     * @return the outgoing edges in creation order
     */
    public List<Edge> outgoing(final int id) {
        final List<Edge> result = new ArrayList<>();
        for (final Edge edge : edges) {
            if (edge.source() == id) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Returns the edges entering a node.
     *
     * @param id the target node id
     * @return the incoming edges in creation order
     */
    public List<Edge> incoming(final int id) {
        final List<Edge> result = new ArrayList<>();
        for (final Edge edge : edges) {
            if (edge.target() == id) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Returns the raw text of an inline script.
     *
     * @param scriptId the script node id
     * @return the text, or null when the node is not an inline script
     */
    public String scriptContent(final int scriptId) {
        return scripts.get(scriptId);
    }

    // -- Summary -------------------------------------------------------------

    /** Counts nodes per kind; kinds with no nodes are left out. */
    public Map<NodeKind, Integer> nodeCountsByKind() {
        final Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        for (final Node node : nodes) {
            counts.merge(node.kind(), 1, Integer::sum);
        }
        return counts;
    }

    /** Counts edges per kind; kinds with no edges are left out. */
    public Map<EdgeKind, Integer> edgeCountsByKind() {
        final Map<EdgeKind, Integer> counts = new EnumMap<>(EdgeKind.class);
        for (final Edge edge : edges) {
            counts.merge(edge.kind(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Returns the counts per node and edge kind keyed by wire name.
     *
     * @return a map with {@code nodes} and {@code edges} entries
     */
    public Map<String, Map<String, Integer>> summary() {
        final Map<String, Integer> nodeCounts = new LinkedHashMap<>();
        nodeCountsByKind().forEach((kind, count) ->
                nodeCounts.put(kind.wireName(), count));

        final Map<String, Integer> edgeCounts = new LinkedHashMap<>();
        edgeCountsByKind().forEach((kind, count) ->
                edgeCounts.put(kind.wireName(), count));

        final Map<String, Map<String, Integer>> result =
                new LinkedHashMap<>();
        result.put("nodes", nodeCounts);
        result.put("edges", edgeCounts);
        return result;
    }

    // -- Serialization -------------------------------------------------------

    /**
     * Builds the presentation format:
     * {@code {nodes:[...], edges:[...], scripts:{id:text}}}.
     *
     * @return the JSON tree
     */
    public ObjectNode toJsonTree() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ArrayNode nodesArray = MAPPER.createArrayNode();
        for (final Node node : nodes) {
            final ObjectNode nodeObj = MAPPER.createObjectNode();
            nodeObj.put("id", node.id());
            nodeObj.put("name", node.name());
            nodeObj.put("type", node.kind().wireName());
            if (node.hasContent()) {
                nodeObj.put("content", node.content());
            } else {
                nodeObj.putNull("content");
            }
            nodesArray.add(nodeObj);
        }
        root.set("nodes", nodesArray);

        final ArrayNode edgesArray = MAPPER.createArrayNode();
        for (final Edge edge : edges) {
            edgesArray.add(edgeJson(edge));
        }
        root.set("edges", edgesArray);

        final ObjectNode scriptsObj = MAPPER.createObjectNode();
        for (final Map.Entry<Integer, String> entry : scripts.entrySet()) {
            scriptsObj.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        root.set("scripts", scriptsObj);

        return root;
    }

    /**
     * Serializes the graph to its JSON presentation format.
     *
     * @return the JSON string
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonTree());
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Failed to serialize MarkupGraph", e);
        }
    }

    /**
     * Builds the JSON object of one edge.
     *
     * @param edge the edge
     * @return the JSON object with source, target, type, label, visible
     */
    public static ObjectNode edgeJson(final Edge edge) {
        final ObjectNode edgeObj = MAPPER.createObjectNode();
        edgeObj.put("source", edge.source());
        edgeObj.put("target", edge.target());
        edgeObj.put("type", edge.kind().wireName());
        if (edge.label() != null) {
            edgeObj.put("label", edge.label());
        }
        edgeObj.put("visible", edge.isVisible());
        return edgeObj;
    }
}
