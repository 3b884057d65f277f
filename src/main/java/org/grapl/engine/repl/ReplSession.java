package org.grapl.engine.repl;

import org.grapl.dsl.Assignment;
import org.grapl.dsl.Evaluation;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.GraplParseException;
import org.grapl.dsl.GraplParser;
import org.grapl.dsl.GraplPrinter;
import org.grapl.dsl.Identifier;
import org.grapl.dsl.Program;
import org.grapl.dsl.Statement;
import org.grapl.engine.graph.DotExporter;
import org.grapl.engine.graph.Edge;
import org.grapl.engine.graph.GraphProjection;
import org.grapl.engine.resolve.Environment;
import org.grapl.engine.resolve.GraplResolveException;
import org.grapl.engine.resolve.Resolver;
import org.grapl.engine.resolve.ResolverConfig;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * One evaluation session: an environment plus the stream results go to.
 * 
 * Input lines are:
 * - an assignment {@code G = [A, B]}, bound silently
 * - an expression {@code {X, G}}, printed in normal form
 * - a command: {@code :env}, {@code :nodes EXPR}, {@code :edges EXPR},
 * {@code :dot EXPR}, {@code :help}
 * 
 * Errors are printed and never end the session.
 */
public final class ReplSession {

    private final Environment environment;
    private final PrintStream out;

    public ReplSession(ResolverConfig config, PrintStream out) {
        this.environment = new Environment(config);
        this.out = out;
    }

    /**
     * Evaluates one input line.
     * 
     * @return true if the line was valid input and belongs in the history
     */
    public boolean evaluate(String line) {
        String input = line.strip();
        if (input.isEmpty()) {
            return false;
        }
        try {
            if (input.startsWith(":")) {
                return command(input);
            }
            Statement statement = GraplParser.parseStatement(input);
            if (statement instanceof Assignment assignment) {
                Resolver.resolve(assignment, environment);
            } else {
                GraphExpression resolved = Resolver.resolve(((Evaluation) statement).expression(), environment);
                out.println(GraplPrinter.printCanonical(resolved));
            }
            return true;
        } catch (GraplParseException e) {
            out.println("Error: Invalid syntax (" + e.getMessage() + ")");
            return false;
        } catch (GraplResolveException e) {
            out.println("Error: " + e.getMessage());
            return true;
        }
    }

    /**
     * Resolves a whole program and prints its resolved assignments and result
     * in canonical form, or the result as DOT.
     * 
     * @throws GraplParseException   if the source is not a program
     * @throws GraplResolveException if an assignment breaks the binding policy
     */
    public void runProgram(String source, boolean dot) {
        Program program = GraplParser.parseProgram(source);
        List<Assignment> assignments = Resolver.resolve(program.assignments(), environment);
        GraphExpression result = Resolver.resolve(program.result(), environment);
        if (dot) {
            out.print(DotExporter.export(result));
        } else {
            out.println(GraplPrinter.printCanonical(new Program(assignments, result)));
        }
    }

    public Environment environment() {
        return environment;
    }

    private boolean command(String input) {
        int space = input.indexOf(' ');
        String name = space < 0 ? input : input.substring(0, space);
        String argument = space < 0 ? "" : input.substring(space + 1).strip();

        switch (name) {
            case ":help" -> out.println(help());
            case ":env" -> printEnvironment();
            case ":nodes" -> out.println(joinNodes(GraphProjection.nodes(argumentExpression(argument))));
            case ":edges" -> out.println(joinEdges(GraphProjection.edges(argumentExpression(argument))));
            case ":dot" -> out.print(DotExporter.export(argumentExpression(argument)));
            default -> {
                out.println("Error: Unknown command " + name + " (try :help)");
                return false;
            }
        }
        return true;
    }

    private GraphExpression argumentExpression(String argument) {
        return Resolver.resolve(GraplParser.parseExpression(argument), environment);
    }

    private void printEnvironment() {
        for (Map.Entry<Identifier, GraphExpression> binding : environment.bindings().entrySet()) {
            out.println(GraplPrinter.printCanonical(new Assignment(binding.getKey(), binding.getValue())));
        }
    }

    private static String joinNodes(Iterable<Identifier> nodes) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (Identifier node : nodes) {
            joiner.add(node.name());
        }
        return joiner.toString();
    }

    private static String joinEdges(Iterable<Edge> edges) {
        List<String> pairs = new ArrayList<>();
        for (Edge edge : edges) {
            pairs.add(edge.toString());
        }
        return "[" + String.join(", ", pairs) + "]";
    }

    private static String help() {
        return String.join("\n",
                "G = EXPR      bind G to EXPR",
                "EXPR          print EXPR in normal form",
                ":env          list bindings",
                ":nodes EXPR   list the nodes of EXPR",
                ":edges EXPR   list the edges of EXPR",
                ":dot EXPR     print EXPR as a Graphviz graph",
                ":help         print this message");
    }
}
