package com.grammar.statement.impl;

import com.grammar.processor.GrammarProcessor;
import com.grammar.selector.SelectorParser;
import com.grammar.statement.Statement;
import com.grammar.statement.StatementType;

import java.util.List;
import java.util.Set;

/**
 * Statement for {@code on <arch>} clauses. Holds when the host architecture is the selector.
 */
public class OnStatement extends Statement {

    private final Set<String> selectors;

    public OnStatement(String clause, List<?> body, GrammarProcessor processor) {
        this(clause, body, processor, null);
    }

    public OnStatement(String clause, List<?> body, GrammarProcessor processor, List<Statement> callStack) {
        super(body, processor, callStack, false);
        this.selectors = SelectorParser.parseOnSelectors(clause);
        selectors.forEach(processor.getContext()::requireKnownArchitecture);
    }

    @Override
    public boolean check() {
        // Selectors are combined with AND, so only a single selector can ever match
        return selectors.size() == 1 && selectors.contains(processor.getContext().getArch());
    }

    public Set<String> getSelectors() {
        return selectors;
    }

    @Override
    public StatementType getType() {
        return StatementType.ON;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return selectors.equals(((OnStatement) other).selectors);
    }

    @Override
    public int hashCode() {
        return selectors.hashCode();
    }

    @Override
    public String toString() {
        return "on " + String.join(",", selectors);
    }
}
