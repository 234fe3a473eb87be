package com.actiongate.rules;

/**
 * A lexical token of a rule condition.
 *
 * @param type     token kind
 * @param text     raw text (decoded for string literals, symbol for operators)
 * @param value    literal value for NUMBER (Double), STRING (String) and BOOLEAN (Boolean); null otherwise
 * @param position offset of the first character in the source expression
 */
public record Token(TokenType type, String text, Object value, int position) {

    static Token of(TokenType type, String text, int position) {
        return new Token(type, text, null, position);
    }

    static Token literal(TokenType type, String text, Object value, int position) {
        return new Token(type, text, value, position);
    }
}
