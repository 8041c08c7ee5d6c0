package com.grammar.exception;

/**
 * Exception thrown when a grammar tree is malformed.
 * Evaluation of the whole tree is aborted.
 */
public class GrammarSyntaxException extends GrammarException {

    private final String reason;

    public GrammarSyntaxException(String reason) {
        super("Invalid grammar syntax: " + reason + ".");
        this.reason = reason;
    }

    /**
     * Get the reason without the common prefix.
     */
    public String getReason() {
        return reason;
    }
}
