package org.grapl.dsl.antlr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.grapl.dsl.Assignment;
import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.GraplParseException;
import org.grapl.dsl.Program;
import org.grapl.dsl.Statement;

import java.util.List;

/**
 * ANTLR-based Grapl parser using the GraplGrammar grammar.
 * 
 * Accepts the same language as {@link org.grapl.dsl.GraplParser} and builds
 * the same trees. Syntax errors are reported as {@link GraplParseException}
 * with the line and column ANTLR reports.
 */
public final class AntlrGraplParserAdapter {

    private AntlrGraplParserAdapter() {
        // Static utility class
    }

    public static GraphExpression parseExpression(String source) {
        return new GraplAstBuilder().visit(parser(source).singleExpression());
    }

    public static Program parseProgram(String source) {
        return new GraplAstBuilder().buildProgram(parser(source).program());
    }

    public static List<Assignment> parseStatements(String source) {
        return new GraplAstBuilder().buildStatements(parser(source).statements());
    }

    public static Statement parseStatement(String source) {
        return new GraplAstBuilder().buildStatement(parser(source).statement());
    }

    private static GraplGrammarParser parser(String source) {
        GraplGrammarLexer lexer = new GraplGrammarLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ErrorListener());

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        GraplGrammarParser parser = new GraplGrammarParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(new ErrorListener());
        return parser;
    }

    /**
     * Error listener that converts ANTLR errors to GraplParseException.
     */
    private static class ErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                int line, int charPositionInLine, String msg,
                RecognitionException e) {
            throw new GraplParseException(msg, line, charPositionInLine);
        }
    }
}
