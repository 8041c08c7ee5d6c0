package com.grammar.exception;

/**
 * Exception thrown when a manifest file cannot be read or decoded.
 */
public class GrammarLoadException extends GrammarException {

    public GrammarLoadException(String message) {
        super(message);
    }

    public GrammarLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
