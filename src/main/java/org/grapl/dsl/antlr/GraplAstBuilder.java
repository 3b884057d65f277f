package org.grapl.dsl.antlr;

import org.grapl.dsl.Assignment;
import org.grapl.dsl.Connected;
import org.grapl.dsl.Disconnected;
import org.grapl.dsl.Evaluation;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.Identifier;
import org.grapl.dsl.Leaf;
import org.grapl.dsl.Program;
import org.grapl.dsl.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts GraplGrammar parse trees to the Grapl AST.
 * Produces exactly the trees the hand-written GraplParser produces.
 */
public class GraplAstBuilder extends GraplGrammarBaseVisitor<GraphExpression> {

    // ========================================
    // ENTRY POINTS
    // ========================================

    public Program buildProgram(GraplGrammarParser.ProgramContext ctx) {
        return new Program(buildAssignments(ctx.assignment()), visit(ctx.expression()));
    }

    public List<Assignment> buildStatements(GraplGrammarParser.StatementsContext ctx) {
        return buildAssignments(ctx.assignment());
    }

    public Statement buildStatement(GraplGrammarParser.StatementContext ctx) {
        if (ctx.assignment() != null) {
            return buildAssignment(ctx.assignment());
        }
        return new Evaluation(visit(ctx.expression()));
    }

    public Assignment buildAssignment(GraplGrammarParser.AssignmentContext ctx) {
        Identifier name = new Identifier(ctx.IDENTIFIER().getText());
        return new Assignment(name, visit(ctx.expression()));
    }

    @Override
    public GraphExpression visitSingleExpression(GraplGrammarParser.SingleExpressionContext ctx) {
        return visit(ctx.expression());
    }

    // ========================================
    // EXPRESSIONS
    // ========================================

    @Override
    public GraphExpression visitLeafExpression(GraplGrammarParser.LeafExpressionContext ctx) {
        return new Leaf(new Identifier(ctx.IDENTIFIER().getText()));
    }

    @Override
    public GraphExpression visitConnectedExpression(GraplGrammarParser.ConnectedExpressionContext ctx) {
        return new Connected(members(ctx.sequence()));
    }

    @Override
    public GraphExpression visitDisconnectedExpression(GraplGrammarParser.DisconnectedExpressionContext ctx) {
        return new Disconnected(members(ctx.sequence()));
    }

    private List<GraphExpression> members(GraplGrammarParser.SequenceContext ctx) {
        List<GraphExpression> members = new ArrayList<>();
        for (GraplGrammarParser.ExpressionContext exprCtx : ctx.expression()) {
            members.add(visit(exprCtx));
        }
        return members;
    }

    private List<Assignment> buildAssignments(List<GraplGrammarParser.AssignmentContext> contexts) {
        List<Assignment> assignments = new ArrayList<>(contexts.size());
        for (GraplGrammarParser.AssignmentContext assignmentCtx : contexts) {
            assignments.add(buildAssignment(assignmentCtx));
        }
        return assignments;
    }
}
