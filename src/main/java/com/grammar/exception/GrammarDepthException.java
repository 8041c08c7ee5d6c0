package com.grammar.exception;

/**
 * Exception thrown when grammar nesting exceeds the processor's configured maximum depth.
 */
public class GrammarDepthException extends GrammarSyntaxException {

    private final int maxDepth;

    public GrammarDepthException(int maxDepth) {
        super("grammar is nested deeper than " + maxDepth + " levels");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
