package com.actiongate.rules;

import java.util.List;

/**
 * Recursive-descent parser for rule conditions.
 *
 * <pre>
 * or         := and (('||' | 'or') and)*
 * and        := not (('&amp;&amp;' | 'and') not)*
 * not        := ('!' | 'not') not | comparison
 * comparison := primary (OP primary)?
 * primary    := '(' or ')' | NUMBER | STRING | BOOLEAN | IDENT
 * </pre>
 */
public class RuleParser {

    private final RuleTokenizer tokenizer = new RuleTokenizer();

    public RuleExpression parse(String condition) {
        return new Cursor(tokenizer.tokenize(condition)).parseAll();
    }

    private static final class Cursor {

        private final List<Token> tokens;
        private int pos;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        RuleExpression parseAll() {
            RuleExpression expr = or();
            Token trailing = peek();
            if (trailing.type() != TokenType.EOF) {
                throw new RuleSyntaxException("unexpected token '" + trailing.text() + "'", trailing.position());
            }
            return expr;
        }

        private RuleExpression or() {
            RuleExpression left = and();
            while (peek().type() == TokenType.OR) {
                advance();
                left = new RuleExpression.Or(left, and());
            }
            return left;
        }

        private RuleExpression and() {
            RuleExpression left = not();
            while (peek().type() == TokenType.AND) {
                advance();
                left = new RuleExpression.And(left, not());
            }
            return left;
        }

        private RuleExpression not() {
            if (peek().type() == TokenType.NOT) {
                advance();
                return new RuleExpression.Not(not());
            }
            return comparison();
        }

        private RuleExpression comparison() {
            RuleExpression left = primary();
            if (peek().type() == TokenType.OPERATOR) {
                Token op = advance();
                RuleExpression right = primary();
                return new RuleExpression.Compare(left, ComparisonOperator.fromSymbol(op.text()), right);
            }
            return left;
        }

        private RuleExpression primary() {
            Token t = advance();
            switch (t.type()) {
                case LPAREN -> {
                    RuleExpression inner = or();
                    Token close = advance();
                    if (close.type() != TokenType.RPAREN) {
                        throw new RuleSyntaxException("expected ')'", close.position());
                    }
                    return inner;
                }
                case NUMBER, STRING, BOOLEAN -> {
                    return new RuleExpression.Literal(t.value());
                }
                case IDENT -> {
                    return new RuleExpression.Path(t.text());
                }
                default -> throw new RuleSyntaxException(
                    t.type() == TokenType.EOF ? "unexpected end of condition" : "unexpected token '" + t.text() + "'",
                    t.position());
            }
        }

        private Token peek() {
            return tokens.get(Math.min(pos, tokens.size() - 1));
        }

        private Token advance() {
            Token t = peek();
            if (pos < tokens.size()) {
                pos++;
            }
            return t;
        }
    }
}
