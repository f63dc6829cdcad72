package co.fanki.markupgraph.analysis.domain.script;

import co.fanki.markupgraph.analysis.domain.EdgeKind;
import co.fanki.markupgraph.analysis.domain.GraphStore;
import co.fanki.markupgraph.analysis.domain.NodeKind;
import co.fanki.markupgraph.shared.Preconditions;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Static extraction of functions, returns, variables and assignments
 * from one inline script.
 *
 * <p>The script is parsed by {@link ScriptParser}; a script that does not
 * parse keeps its node but contributes nothing else. The syntax tree is
 * then visited by node kind:</p>
 * <ul>
 *   <li>function declaration: a {@code function} node under the current
 *       scope, one {@code input} node per parameter, and the body visited
 *       with the function as the new scope</li>
 *   <li>{@code return}: an {@code output} node</li>
 *   <li>{@code var}/{@code let}/{@code const}: one {@code variable} node
 *       per declarator</li>
 *   <li>assignment statement: a {@code dom-change} node</li>
 *   <li>anything else: children are visited, the scope stays the same</li>
 * </ul>
 *
 * <p>All captured text is cut from the script source by the offsets the
 * parser reports; when a node has none, {@link #UNAVAILABLE} is used.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ScriptAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(
            ScriptAnalyzer.class);

    /** Placeholder for text whose source span is unknown. */
    public static final String UNAVAILABLE = "<unavailable>";

    /** Placeholder for an empty return or an uninitialized variable. */
    public static final String UNDEFINED = "undefined";

    private static final Set<Token> COMPOUND_ASSIGNMENTS = EnumSet.of(
            Token.ASSIGN_BITOR, Token.ASSIGN_BITXOR, Token.ASSIGN_BITAND,
            Token.ASSIGN_LSH, Token.ASSIGN_RSH, Token.ASSIGN_URSH,
            Token.ASSIGN_ADD, Token.ASSIGN_SUB, Token.ASSIGN_MUL,
            Token.ASSIGN_DIV, Token.ASSIGN_MOD, Token.ASSIGN_EXPONENT);

    private final ScriptParser parser;

    /**
     * Creates a new analyzer.
     *
     * @param theParser the script parser
     */
    public ScriptAnalyzer(final ScriptParser theParser) {
        this.parser = Preconditions.requireNonNull(theParser,
                "Script parser is required");
    }

    /**
     * Analyzes one script, attaching everything it finds under the
     * script node.
     *
     * @param scriptId the script node id
     * @param source the script text
     * @param graph the graph store of the current run
     * @return true if the script parsed, false if it was skipped
     */
    public boolean analyze(final int scriptId, final String source,
            final GraphStore graph) {
        Preconditions.requireNonNull(source, "Script source is required");
        Preconditions.requireNonNull(graph, "Graph store is required");

        final ScriptParser.Result result =
                parser.parse("script-" + scriptId + ".js", source);

        if (!result.parsed()) {
            LOG.warn("Skipping script {}: {}", scriptId,
                    String.join("; ", result.errors()));
            return false;
        }

        final int before = graph.nodeCount();
        new Visitor(source, graph).visitChildren(result.root(), scriptId);

        LOG.debug("Script {} produced {} nodes", scriptId,
                graph.nodeCount() - before);
        return true;
    }

    /**
     * Cuts the source span of a node from the script text.
     *
     * @param node the syntax tree node, may be null
     * @param source the script text the node was parsed from
     * @return the node's text, or {@link #UNAVAILABLE} when the node has no
     *         usable span
     */
    static String sourceText(final Node node, final String source) {
        if (node == null) {
            return UNAVAILABLE;
        }
        final int offset = node.getSourceOffset();
        final int length = node.getLength();
        if (offset < 0 || length <= 0 || offset + length > source.length()) {
            return UNAVAILABLE;
        }
        return source.substring(offset, offset + length);
    }

    /** Walks one syntax tree, carrying the source and the graph. */
    private static final class Visitor {

        private final String source;
        private final GraphStore graph;

        Visitor(final String theSource, final GraphStore theGraph) {
            this.source = theSource;
            this.graph = theGraph;
        }

        void visit(final Node node, final int scope) {
            if (NodeUtil.isFunctionDeclaration(node)) {
                visitFunction(node, scope);
            } else if (node.isReturn()) {
                visitReturn(node, scope);
            } else if (node.isVar() || node.isLet() || node.isConst()) {
                visitDeclaration(node, scope);
            } else if (node.isExprResult()
                    && isAssignment(node.getFirstChild())) {
                visitAssignment(node.getFirstChild(), scope);
            } else {
                visitChildren(node, scope);
            }
        }

        void visitChildren(final Node node, final int scope) {
            for (Node child = node.getFirstChild(); child != null;
                    child = child.getNext()) {
                visit(child, scope);
            }
        }

        private void visitFunction(final Node function, final int scope) {
            final String name = function.getFirstChild().getString();
            final int functionId = graph.createNode("Function: " + name,
                    NodeKind.FUNCTION, scope, text(function));

            final Node params = function.getSecondChild();
            for (Node param = params.getFirstChild(); param != null;
                    param = param.getNext()) {
                final int inputId = graph.createNode(
                        "Input: " + paramText(param), NodeKind.INPUT,
                        functionId, null);
                graph.createEdge(inputId, functionId, EdgeKind.INPUT, null);
            }

            visitChildren(function.getLastChild(), functionId);
        }

        private void visitReturn(final Node node, final int scope) {
            final Node value = node.getFirstChild();
            final String text = value == null ? UNDEFINED : text(value);

            final int outputId = graph.createNode("Return: " + text,
                    NodeKind.OUTPUT, scope, text);
            graph.createEdge(scope, outputId, EdgeKind.OUTPUT,
                    "Returns: " + text);

            if (value != null) {
                visit(value, scope);
            }
        }

        private void visitDeclaration(final Node declaration,
                final int scope) {
            for (Node declarator = declaration.getFirstChild();
                    declarator != null; declarator = declarator.getNext()) {

                final String name;
                final Node initializer;
                if (declarator.isName()) {
                    name = declarator.getString();
                    initializer = declarator.getFirstChild();
                } else if (declarator.isDestructuringLhs()) {
                    name = text(declarator.getFirstChild());
                    initializer = declarator.getSecondChild();
                } else {
                    visit(declarator, scope);
                    continue;
                }

                final String value = initializer == null
                        ? UNDEFINED : text(initializer);
                final int variableId = graph.createNode("Variable: " + name,
                        NodeKind.VARIABLE, scope, value);
                graph.createEdge(scope, variableId, EdgeKind.OUTPUT,
                        "Sets: " + name + " = " + value);

                if (initializer != null) {
                    visit(initializer, scope);
                }
            }
        }

        private void visitAssignment(final Node assignment, final int scope) {
            final String target = text(assignment.getFirstChild());
            final Node valueNode = assignment.getLastChild();
            final String value = text(valueNode);

            final int changeId = graph.createNode("DOM Change: " + target,
                    NodeKind.DOM_CHANGE, scope, value);
            graph.createEdge(scope, changeId, EdgeKind.OUTPUT,
                    "Modifies: " + target);

            visit(valueNode, scope);
        }

        private static boolean isAssignment(final Node node) {
            return node != null && (node.isAssign()
                    || COMPOUND_ASSIGNMENTS.contains(node.getToken()));
        }

        private String paramText(final Node param) {
            final String text = text(param);
            if (UNAVAILABLE.equals(text) && param.isName()) {
                return param.getString();
            }
            return text;
        }

        private String text(final Node node) {
            return sourceText(node, source);
        }
    }
}
