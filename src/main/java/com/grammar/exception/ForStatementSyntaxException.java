package com.grammar.exception;

/**
 * Malformed 'for' clause.
 */
public class ForStatementSyntaxException extends ClauseSyntaxException {

    public ForStatementSyntaxException(String clause) {
        this(clause, null);
    }

    public ForStatementSyntaxException(String clause, String detail) {
        super("for", clause, detail);
    }
}
