package com.grammar.exception;

/**
 * Malformed 'on' clause.
 */
public class OnStatementSyntaxException extends ClauseSyntaxException {

    public OnStatementSyntaxException(String clause) {
        this(clause, null);
    }

    public OnStatementSyntaxException(String clause, String detail) {
        super("on", clause, detail);
    }
}
