package org.grapl.dsl;

import org.grapl.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the Grapl language.
 * Converts Grapl source text into a list of tokens.
 * 
 * Whitespace separates tokens and is otherwise ignored; '#' starts a comment
 * running to the end of the line.
 */
public final class GraplLexer {

    private final String input;
    private int position;

    public GraplLexer(String input) {
        this.input = input;
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     * 
     * @return List of tokens, always terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (position < input.length()) {
            skipWhitespaceAndComments();
            if (position >= input.length())
                break;

            tokens.add(nextToken());
        }

        tokens.add(new Token(TokenType.EOF, null, position));
        return tokens;
    }

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isWhitespace(c)) {
                position++;
            } else if (c == '#') {
                while (position < input.length() && input.charAt(position) != '\n') {
                    position++;
                }
            } else {
                return;
            }
        }
    }

    private Token nextToken() {
        char c = input.charAt(position);
        int start = position;

        TokenType delimiter = switch (c) {
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            case ',' -> TokenType.COMMA;
            case '=' -> TokenType.ASSIGN;
            default -> null;
        };
        if (delimiter != null) {
            position++;
            return new Token(delimiter, String.valueOf(c), start);
        }

        if (isIdentifierStart(c)) {
            return readIdentifier();
        }

        throw GraplParseException.at(input, position, "Unexpected character: '" + c + "'");
    }

    private Token readIdentifier() {
        int start = position;
        while (position < input.length() && isIdentifierPart(input.charAt(position))) {
            position++;
        }
        return new Token(TokenType.IDENTIFIER, input.substring(start, position), start);
    }

    // ASCII only: Character.isLetter would accept non-ASCII letters
    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
