package org.grapl.engine.graph;

import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.Identifier;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders a graph expression as an undirected Graphviz DOT document.
 * 
 * <pre>
 * graph G {
 *     A;
 *     B;
 *     A -- B;
 * }
 * </pre>
 * 
 * Nodes and edges are listed in sorted order, each undirected edge once.
 * Identifiers are valid DOT IDs as they stand; only DOT keywords are quoted.
 * The graph name may be any string and is quoted unless it is a plain DOT ID
 * or numeral.
 */
public final class DotExporter {

    public static final String DEFAULT_GRAPH_NAME = "G";

    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern NUMERAL = Pattern.compile("-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");

    private static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    private DotExporter() {
        // Static utility class
    }

    public static String export(GraphExpression expr) {
        return export(DEFAULT_GRAPH_NAME, expr);
    }

    public static String export(String graphName, GraphExpression expr) {
        StringBuilder sb = new StringBuilder();
        sb.append("graph ").append(graphId(graphName)).append(" {\n");
        for (Identifier node : GraphProjection.nodes(expr)) {
            sb.append("    ").append(id(node)).append(";\n");
        }
        for (Edge edge : GraphProjection.edges(expr)) {
            if (edge.from().compareTo(edge.to()) < 0) {
                sb.append("    ").append(id(edge.from())).append(" -- ").append(id(edge.to())).append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String id(Identifier identifier) {
        String name = identifier.name();
        return KEYWORDS.contains(name.toLowerCase(Locale.ROOT)) ? quote(name) : name;
    }

    static String graphId(String name) {
        if (NUMERAL.matcher(name).matches()) {
            return name;
        }
        if (PLAIN_ID.matcher(name).matches() && !KEYWORDS.contains(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        return quote(name);
    }

    private static String quote(String name) {
        return "\"" + name.replace("\"", "\\\"") + "\"";
    }
}
