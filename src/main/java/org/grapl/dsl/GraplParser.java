package org.grapl.dsl;

import org.grapl.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for the Grapl language.
 * 
 * Grammar:
 * 
 * <pre>
 * expression := identifier | '{' sequence '}' | '[' sequence ']'
 * sequence   := (expression (',' expression)* ','?)?
 * assignment := identifier '=' expression
 * program    := assignment* expression
 * </pre>
 * 
 * Every entry point consumes the whole input; trailing tokens are an error.
 */
public final class GraplParser {

    private final String source;
    private final List<Token> tokens;
    private int position;

    public GraplParser(String source) {
        this.source = source;
        this.tokens = new GraplLexer(source).tokenize();
        this.position = 0;
    }

    /**
     * Parses a single expression: [{A, B}, C]
     */
    public static GraphExpression parseExpression(String source) {
        GraplParser parser = new GraplParser(source);
        GraphExpression expr = parser.expression();
        parser.expectEnd();
        return expr;
    }

    /**
     * Parses a single assignment: G = {A, B}
     */
    public static Assignment parseAssignment(String source) {
        GraplParser parser = new GraplParser(source);
        Assignment assignment = parser.assignment();
        parser.expectEnd();
        return assignment;
    }

    /**
     * Parses a sequence of assignments with no trailing expression.
     * Empty input yields an empty list.
     */
    public static List<Assignment> parseStatements(String source) {
        GraplParser parser = new GraplParser(source);
        List<Assignment> assignments = new ArrayList<>();
        while (!parser.check(TokenType.EOF)) {
            assignments.add(parser.assignment());
        }
        return assignments;
    }

    /**
     * Parses a full program: assignments followed by one expression.
     */
    public static Program parseProgram(String source) {
        GraplParser parser = new GraplParser(source);
        List<Assignment> assignments = new ArrayList<>();
        while (parser.atAssignment()) {
            assignments.add(parser.assignment());
        }
        GraphExpression result = parser.expression();
        parser.expectEnd();
        return new Program(assignments, result);
    }

    /**
     * Parses one REPL line: an assignment when the line starts with
     * {@code identifier =}, otherwise an expression to evaluate.
     */
    public static Statement parseStatement(String source) {
        GraplParser parser = new GraplParser(source);
        Statement statement = parser.atAssignment()
                ? parser.assignment()
                : new Evaluation(parser.expression());
        parser.expectEnd();
        return statement;
    }

    private boolean atAssignment() {
        return check(TokenType.IDENTIFIER)
                && position + 1 < tokens.size()
                && tokens.get(position + 1).type() == TokenType.ASSIGN;
    }

    private Assignment assignment() {
        Token name = consume(TokenType.IDENTIFIER, "Expected binding name");
        consume(TokenType.ASSIGN, "Expected '=' after '" + name.value() + "'");
        return new Assignment(new Identifier(name.value()), expression());
    }

    private GraphExpression expression() {
        if (check(TokenType.IDENTIFIER)) {
            return new Leaf(new Identifier(advance().value()));
        }

        if (check(TokenType.LBRACE)) {
            advance();
            return new Connected(sequence(TokenType.RBRACE, "Expected ',' or '}'"));
        }

        if (check(TokenType.LBRACKET)) {
            advance();
            return new Disconnected(sequence(TokenType.RBRACKET, "Expected ',' or ']'"));
        }

        throw error("Expected identifier, '{' or '['");
    }

    /**
     * Parses the members of a group up to and including the closing delimiter.
     * A trailing comma before the delimiter is allowed.
     */
    private List<GraphExpression> sequence(TokenType close, String message) {
        List<GraphExpression> members = new ArrayList<>();
        while (!check(close)) {
            members.add(expression());
            if (!check(close)) {
                consume(TokenType.COMMA, message);
            }
        }
        advance();
        return members;
    }

    private void expectEnd() {
        if (!check(TokenType.EOF)) {
            throw error("Unexpected trailing input");
        }
    }

    private Token peek() {
        return tokens.get(position);
    }

    private boolean check(TokenType type) {
        return position < tokens.size() && peek().type() == type;
    }

    private Token advance() {
        if (position < tokens.size() - 1) {
            return tokens.get(position++);
        }
        return tokens.get(tokens.size() - 1);
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private GraplParseException error(String message) {
        Token token = peek();
        String found = token.type() == TokenType.EOF ? "end of input" : "'" + token.value() + "'";
        return GraplParseException.at(source, token.position(), message + ", got: " + found);
    }
}
