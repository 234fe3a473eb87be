package com.actiongate.rules;

/**
 * Raised by the tokenizer or parser for a malformed condition.
 */
public class RuleSyntaxException extends RuntimeException {

    private final int position;

    public RuleSyntaxException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
