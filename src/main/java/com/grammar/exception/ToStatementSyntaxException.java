package com.grammar.exception;

/**
 * Malformed 'to' clause.
 */
public class ToStatementSyntaxException extends ClauseSyntaxException {

    public ToStatementSyntaxException(String clause) {
        this(clause, null);
    }

    public ToStatementSyntaxException(String clause, String detail) {
        super("to", clause, detail);
    }
}
