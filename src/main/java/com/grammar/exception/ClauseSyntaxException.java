package com.grammar.exception;

/**
 * Exception thrown when a clause keyword such as {@code on amd64} cannot be parsed.
 * <p>
 * Message format: {@code Invalid grammar syntax: '<clause>' is not a valid '<keyword>' clause: <detail>.}
 */
public class ClauseSyntaxException extends GrammarSyntaxException {

    private final String clause;
    private final String keyword;

    public ClauseSyntaxException(String keyword, String clause, String detail) {
        super(describe(keyword, clause, detail));
        this.clause = clause;
        this.keyword = keyword;
    }

    private static String describe(String keyword, String clause, String detail) {
        String base = "'" + clause + "' is not a valid '" + keyword + "' clause";
        return detail == null ? base : base + ": " + detail;
    }

    public String getClause() {
        return clause;
    }

    public String getKeyword() {
        return keyword;
    }
}
