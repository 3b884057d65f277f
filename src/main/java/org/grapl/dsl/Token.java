package org.grapl.dsl;

/**
 * Represents a token in the Grapl lexer.
 * 
 * @param type     The token type
 * @param value    The token text (identifier name or delimiter)
 * @param position The offset in the source string
 */
public record Token(TokenType type, String value, int position) {

    public enum TokenType {
        IDENTIFIER, // A, G1, left_wing

        // Delimiters
        LBRACE, // {
        RBRACE, // }
        LBRACKET, // [
        RBRACKET, // ]
        COMMA, // ,
        ASSIGN, // =

        EOF, // End of input
    }

    @Override
    public String toString() {
        return type + (value != null ? "(" + value + ")" : "") + "@" + position;
    }
}
