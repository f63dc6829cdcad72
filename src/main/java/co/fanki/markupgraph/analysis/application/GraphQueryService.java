package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.analysis.domain.Edge;
import co.fanki.markupgraph.analysis.domain.EdgeKind;
import co.fanki.markupgraph.analysis.domain.MarkupGraph;
import co.fanki.markupgraph.analysis.domain.Node;
import co.fanki.markupgraph.analysis.domain.NodeKind;
import co.fanki.markupgraph.shared.DomainException;
import co.fanki.markupgraph.shared.Preconditions;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes graph queries against a finished {@link MarkupGraph}.
 *
 * <p>Supports three query modes:</p>
 * <ul>
 *   <li><b>Keywords</b>: {@code functions}, {@code elements},
 *       {@code stylesheets} and the other plural kind names list every
 *       node of that kind</li>
 *   <li><b>Node</b>: a numeric target navigates to that node, optionally
 *       followed by {@code children}, {@code parent}, {@code styles},
 *       {@code targets} or {@code code}</li>
 *   <li><b>Check</b>: {@code ?kind} tells whether a node has a child of
 *       that kind</li>
 * </ul>
 *
 * <p>{@code +content} adds each node's source slice to the items and
 * {@code +edges} adds its non-structural edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class GraphQueryService {

    private static final Map<String, NodeKind> KEYWORDS = Map.ofEntries(
            Map.entry("elements", NodeKind.ELEMENT),
            Map.entry("inline-styles", NodeKind.INLINE_STYLE),
            Map.entry("scripts", NodeKind.SCRIPT),
            Map.entry("stylesheets", NodeKind.STYLESHEET),
            Map.entry("external-styles", NodeKind.EXTERNAL_STYLE),
            Map.entry("functions", NodeKind.FUNCTION),
            Map.entry("inputs", NodeKind.INPUT),
            Map.entry("outputs", NodeKind.OUTPUT),
            Map.entry("variables", NodeKind.VARIABLE),
            Map.entry("dom-changes", NodeKind.DOM_CHANGE));

    /**
     * Executes a parsed graph query and returns results.
     *
     * @param query the parsed graph query
     * @param graph the graph to query
     * @return the query result
     * @throws DomainException if the query does not fit the graph
     */
    public GraphQueryResult execute(final GraphQuery query,
            final MarkupGraph graph) {
        Preconditions.requireNonNull(query, "Query is required");
        Preconditions.requireNonNull(graph, "Graph is required");

        final String target = query.target();
        final NodeKind kind = KEYWORDS.get(target.toLowerCase());

        if (kind != null) {
            return executeKeyword(query, graph, kind);
        }
        return executeNode(query, graph, resolveNode(target, graph));
    }

    // -- Keywords ------------------------------------------------------------

    private GraphQueryResult executeKeyword(final GraphQuery query,
            final MarkupGraph graph, final NodeKind kind) {

        if (query.hasCheck()) {
            throw new DomainException(
                    "Checks apply to a single node, not to "
                            + query.target(),
                    GraphQuery.INVALID_QUERY);
        }
        if (!query.navigationsFrom(1).isEmpty()) {
            throw new DomainException(
                    "List targets take no navigation. Got: "
                            + query.raw(),
                    GraphQuery.INVALID_QUERY);
        }

        final List<Map<String, Object>> results = new ArrayList<>();
        for (final Node node : graph.nodesOfKind(kind)) {
            results.add(nodeItem(node, graph, query));
        }
        return new GraphQueryResult(query.raw(), results.size(), results);
    }

    // -- Node navigation -----------------------------------------------------

    private GraphQueryResult executeNode(final GraphQuery query,
            final MarkupGraph graph, final Node node) {

        // Check mode: id:?kind
        if (query.hasCheck()) {
            return executeCheck(query, graph, node);
        }

        final List<String> subNavs = query.navigationsFrom(1);
        if (subNavs.isEmpty()) {
            return single(query, overview(node, graph, query));
        }

        final String nav = subNavs.get(0).toLowerCase();
        return switch (nav) {
            case "children" -> list(query, graph, graph.children(node.id()));
            case "parent" -> {
                final Node parent = graph.parentOf(node.id());
                yield parent == null
                        ? list(query, graph, List.of())
                        : single(query, nodeItem(parent, graph, query));
            }
            case "styles" -> styles(query, graph, node);
            case "targets" -> targets(query, graph, node);
            case "code" -> code(query, graph, node);
            default -> throw new DomainException(
                    "Unknown navigation: " + subNavs.get(0)
                            + ". Use children, parent, styles, targets"
                            + " or code",
                    GraphQuery.INVALID_QUERY);
        };
    }

    private GraphQueryResult styles(final GraphQuery query,
            final MarkupGraph graph, final Node element) {
        final List<Map<String, Object>> results = new ArrayList<>();
        for (final Edge edge : graph.incoming(element.id())) {
            if (edge.kind() == EdgeKind.STYLESHEET_USE) {
                final Map<String, Object> item = nodeItem(
                        graph.node(edge.source()), graph, query);
                item.put("selector", edge.label());
                results.add(item);
            }
        }
        return new GraphQueryResult(query.raw(), results.size(), results);
    }

    private GraphQueryResult targets(final GraphQuery query,
            final MarkupGraph graph, final Node stylesheet) {
        final List<Map<String, Object>> results = new ArrayList<>();
        for (final Edge edge : graph.outgoing(stylesheet.id())) {
            if (edge.kind() == EdgeKind.STYLESHEET_USE) {
                final Map<String, Object> item = nodeItem(
                        graph.node(edge.target()), graph, query);
                item.put("selector", edge.label());
                results.add(item);
            }
        }
        return new GraphQueryResult(query.raw(), results.size(), results);
    }

    private GraphQueryResult code(final GraphQuery query,
            final MarkupGraph graph, final Node script) {
        if (script.kind() != NodeKind.SCRIPT) {
            throw new DomainException(
                    "Node " + script.id() + " is a "
                            + script.kind().wireName() + ", not a script",
                    GraphQuery.INVALID_QUERY);
        }
        final Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", script.id());
        item.put("name", script.name());
        item.put("code", graph.scriptContent(script.id()));
        return single(query, item);
    }

    private GraphQueryResult executeCheck(final GraphQuery query,
            final MarkupGraph graph, final Node node) {
        final String value = query.checkValue();
        final NodeKind kind = NodeKind.fromName(value);
        if (kind == null) {
            throw new DomainException("Unknown node kind: " + value,
                    GraphQuery.INVALID_QUERY);
        }

        boolean exists = false;
        for (final Node child : graph.children(node.id())) {
            if (child.kind() == kind) {
                exists = true;
                break;
            }
        }

        final Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", node.id());
        item.put("name", node.name());
        item.put("check", kind.wireName());
        item.put("exists", exists);
        return single(query, item);
    }

    // -- Helpers -------------------------------------------------------------

    private Node resolveNode(final String target, final MarkupGraph graph) {
        final int id;
        try {
            id = Integer.parseInt(target);
        } catch (final NumberFormatException e) {
            throw new DomainException(
                    "Unknown target: " + target + ". Use a node id or one"
                            + " of " + String.join(", ",
                                    KEYWORDS.keySet().stream().sorted()
                                            .toList()),
                    GraphQuery.INVALID_QUERY, e);
        }
        final Node node = graph.node(id);
        if (node == null) {
            throw new DomainException("Node not found: " + id,
                    "NODE_NOT_FOUND");
        }
        return node;
    }

    private Map<String, Object> overview(final Node node,
            final MarkupGraph graph, final GraphQuery query) {
        final Map<String, Object> item = nodeItem(node, graph, query);
        final Node parent = graph.parentOf(node.id());
        item.put("parent", parent != null ? parent.id() : null);
        final List<Integer> children = new ArrayList<>();
        for (final Node child : graph.children(node.id())) {
            children.add(child.id());
        }
        item.put("children", children);
        return item;
    }

    private Map<String, Object> nodeItem(final Node node,
            final MarkupGraph graph, final GraphQuery query) {
        final Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", node.id());
        item.put("name", node.name());
        item.put("type", node.kind().wireName());

        if (query.hasInclude("content")) {
            item.put("content", node.content());
        }
        if (query.hasInclude("edges")) {
            final List<Map<String, Object>> edges = new ArrayList<>();
            for (final Edge edge : graph.outgoing(node.id())) {
                if (edge.kind() != EdgeKind.STRUCTURAL) {
                    edges.add(edgeItem(edge));
                }
            }
            for (final Edge edge : graph.incoming(node.id())) {
                if (edge.kind() != EdgeKind.STRUCTURAL) {
                    edges.add(edgeItem(edge));
                }
            }
            item.put("edges", edges);
        }
        return item;
    }

    private static Map<String, Object> edgeItem(final Edge edge) {
        final Map<String, Object> item = new LinkedHashMap<>();
        item.put("source", edge.source());
        item.put("target", edge.target());
        item.put("type", edge.kind().wireName());
        item.put("label", edge.label());
        return item;
    }

    private GraphQueryResult list(final GraphQuery query,
            final MarkupGraph graph, final List<Node> nodes) {
        final List<Map<String, Object>> results = new ArrayList<>();
        for (final Node node : nodes) {
            results.add(nodeItem(node, graph, query));
        }
        return new GraphQueryResult(query.raw(), results.size(), results);
    }

    private static GraphQueryResult single(final GraphQuery query,
            final Map<String, Object> item) {
        return new GraphQueryResult(query.raw(), 1, List.of(item));
    }

    /**
     * Result of a graph query.
     *
     * @param query the raw query string
     * @param total the number of results
     * @param results the result items
     */
    public record GraphQueryResult(
            String query,
            int total,
            List<Map<String, Object>> results) {}
}
