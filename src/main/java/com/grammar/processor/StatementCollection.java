package com.grammar.processor;

import com.grammar.exception.GrammarSyntaxException;
import com.grammar.statement.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statements finalized within one list of sibling sections.
 * Rejects a statement equal to one already collected.
 */
class StatementCollection {

    private final List<Statement> statements = new ArrayList<>();

    /**
     * Add a finalized statement.
     *
     * @throws GrammarSyntaxException if an equal statement was already added
     */
    void add(Statement statement) {
        if (statement == null) {
            return;
        }
        if (statements.contains(statement)) {
            throw new GrammarSyntaxException("found duplicate '" + statement
                    + "' statements. These should be merged");
        }
        statements.add(statement);
    }

    List<Statement> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    @Override
    public String toString() {
        return "StatementCollection" + statements;
    }
}
