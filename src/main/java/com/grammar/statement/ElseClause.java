package com.grammar.statement;

import java.util.List;
import java.util.Objects;

/**
 * An alternative attached to a statement: either a body or a forced failure.
 *
 * @param body Grammar to evaluate when the statement does not hold; empty for {@code else fail}
 * @param fail Whether this is an {@code else fail} clause
 */
public record ElseClause(List<?> body, boolean fail) {

    private static final ElseClause FAIL = new ElseClause(List.of(), true);

    public ElseClause {
        Objects.requireNonNull(body, "body");
    }

    /**
     * Create an else clause with a body.
     */
    public static ElseClause of(List<?> body) {
        return new ElseClause(body, false);
    }

    /**
     * The {@code else fail} clause.
     */
    public static ElseClause failClause() {
        return FAIL;
    }

    @Override
    public String toString() {
        return fail ? "else fail" : "else " + body;
    }
}
