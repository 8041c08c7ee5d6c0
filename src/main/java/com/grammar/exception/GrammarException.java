package com.grammar.exception;

/**
 * Base exception for grammar evaluation.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
