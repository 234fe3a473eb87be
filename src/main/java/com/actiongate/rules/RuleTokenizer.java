package com.actiongate.rules;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a rule condition into tokens.
 *
 * Recognized: dotted identifiers, numbers (optionally negative), single or double quoted
 * strings with backslash escapes, {@code true}/{@code false}, comparison operators,
 * {@code && || !} and the case-insensitive words {@code and or not}, parentheses.
 * Any other character is a syntax error.
 */
public class RuleTokenizer {

    public List<Token> tokenize(String expression) {
        if (expression == null) {
            throw new RuleSyntaxException("condition is null", 0);
        }
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = expression.length();

        while (i < n) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (c == '(') {
                tokens.add(Token.of(TokenType.LPAREN, "(", i++));
                continue;
            }
            if (c == ')') {
                tokens.add(Token.of(TokenType.RPAREN, ")", i++));
                continue;
            }

            String two = i + 1 < n ? expression.substring(i, i + 2) : "";
            switch (two) {
                case "==", "!=", ">=", "<=" -> {
                    tokens.add(Token.of(TokenType.OPERATOR, two, i));
                    i += 2;
                    continue;
                }
                case "&&" -> {
                    tokens.add(Token.of(TokenType.AND, two, i));
                    i += 2;
                    continue;
                }
                case "||" -> {
                    tokens.add(Token.of(TokenType.OR, two, i));
                    i += 2;
                    continue;
                }
                default -> {
                }
            }

            if (c == '>' || c == '<') {
                tokens.add(Token.of(TokenType.OPERATOR, String.valueOf(c), i++));
                continue;
            }
            if (c == '!') {
                tokens.add(Token.of(TokenType.NOT, "!", i++));
                continue;
            }

            if (c == '"' || c == '\'') {
                i = readString(expression, i, tokens);
                continue;
            }

            if (isDigit(c) || (c == '-' && i + 1 < n && isDigit(expression.charAt(i + 1)))) {
                i = readNumber(expression, i, tokens);
                continue;
            }

            if (Character.isLetter(c) || c == '_') {
                i = readIdentifier(expression, i, tokens);
                continue;
            }

            throw new RuleSyntaxException("unexpected character '" + c + "'", i);
        }

        tokens.add(Token.of(TokenType.EOF, "", n));
        return tokens;
    }

    private int readString(String expression, int start, List<Token> tokens) {
        char quote = expression.charAt(start);
        StringBuilder value = new StringBuilder();
        int i = start + 1;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '\\') {
                i++;
                if (i < expression.length()) {
                    value.append(expression.charAt(i));
                }
                i++;
                continue;
            }
            if (c == quote) {
                tokens.add(Token.literal(TokenType.STRING, value.toString(), value.toString(), start));
                return i + 1;
            }
            value.append(c);
            i++;
        }
        throw new RuleSyntaxException("unterminated string literal", start);
    }

    private int readNumber(String expression, int start, List<Token> tokens) {
        int i = start + 1;
        boolean seenDot = false;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '.' && !seenDot) {
                seenDot = true;
            } else if (!isDigit(c)) {
                break;
            }
            i++;
        }
        String text = expression.substring(start, i);
        try {
            tokens.add(Token.literal(TokenType.NUMBER, text, Double.parseDouble(text), start));
        } catch (NumberFormatException ex) {
            throw new RuleSyntaxException("invalid number '" + text + "'", start);
        }
        return i;
    }

    private int readIdentifier(String expression, int start, List<Token> tokens) {
        int i = start + 1;
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.')) {
                break;
            }
            i++;
        }
        String ident = expression.substring(start, i);

        if ("true".equals(ident) || "false".equals(ident)) {
            tokens.add(Token.literal(TokenType.BOOLEAN, ident, Boolean.valueOf(ident), start));
        } else if ("and".equalsIgnoreCase(ident)) {
            tokens.add(Token.of(TokenType.AND, ident, start));
        } else if ("or".equalsIgnoreCase(ident)) {
            tokens.add(Token.of(TokenType.OR, ident, start));
        } else if ("not".equalsIgnoreCase(ident)) {
            tokens.add(Token.of(TokenType.NOT, ident, start));
        } else {
            tokens.add(Token.of(TokenType.IDENT, ident, start));
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
