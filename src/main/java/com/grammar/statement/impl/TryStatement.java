package com.grammar.statement.impl;

import com.grammar.processor.GrammarProcessor;
import com.grammar.statement.Statement;
import com.grammar.statement.StatementType;

import java.util.List;

/**
 * Statement for legacy {@code try} clauses.
 * <p>
 * Holds when every primitive of the evaluated body passes the processor's checker.
 * Else clauses are checked the same way. Two 'try' statements are never equal, so
 * sibling 'try' clauses are not reported as duplicates.
 */
public class TryStatement extends Statement {

    public TryStatement(List<?> body, GrammarProcessor processor) {
        this(body, processor, null);
    }

    public TryStatement(List<?> body, GrammarProcessor processor, List<Statement> callStack) {
        super(body, processor, callStack, true);
    }

    @Override
    public boolean check() {
        return validatePrimitives(processBody());
    }

    @Override
    public StatementType getType() {
        return StatementType.TRY;
    }

    @Override
    public boolean equals(Object other) {
        return this == other;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return "try";
    }
}
