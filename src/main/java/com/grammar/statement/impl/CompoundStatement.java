package com.grammar.statement.impl;

import com.grammar.processor.GrammarProcessor;
import com.grammar.selector.CompoundClause;
import com.grammar.statement.Statement;
import com.grammar.statement.StatementType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Statements that hold only as a group, used for {@code on <arch> to <arch>} clauses.
 * Else clauses attach to the group as a whole.
 */
public class CompoundStatement extends Statement {

    private final List<Statement> statements;

    public CompoundStatement(List<Statement> statements, List<?> body, GrammarProcessor processor) {
        this(statements, body, processor, null);
    }

    public CompoundStatement(List<Statement> statements, List<?> body, GrammarProcessor processor,
                             List<Statement> callStack) {
        super(body, processor, callStack, false);
        this.statements = List.copyOf(statements);
    }

    /**
     * Build the 'on' and 'to' parts of a compound clause.
     * The component bodies are never evaluated.
     */
    public static CompoundStatement of(CompoundClause clause, List<?> body, GrammarProcessor processor,
                                       List<Statement> callStack) {
        List<Statement> parts = List.of(
                new OnStatement(clause.onClause(), body, processor, callStack),
                new ToStatement(clause.toClause(), body, processor, callStack));
        return new CompoundStatement(parts, body, processor, callStack);
    }

    @Override
    public boolean check() {
        for (Statement statement : statements) {
            if (!statement.check()) {
                return false;
            }
        }
        return true;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public StatementType getType() {
        return StatementType.COMPOUND;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return statements.equals(((CompoundStatement) other).statements);
    }

    @Override
    public int hashCode() {
        return statements.hashCode();
    }

    @Override
    public String toString() {
        return statements.stream()
                .map(Statement::toString)
                .collect(Collectors.joining(" "));
    }
}
