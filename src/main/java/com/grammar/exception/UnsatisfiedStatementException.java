package com.grammar.exception;

/**
 * Exception thrown when evaluation reaches an {@code else fail} clause.
 * Signals that the manifest has no valid alternative for the current context.
 */
public class UnsatisfiedStatementException extends GrammarException {

    private final String statement;

    public UnsatisfiedStatementException(String statement) {
        super("Unable to satisfy '" + statement + "', failure forced.");
        this.statement = statement;
    }

    public String getStatement() {
        return statement;
    }
}
