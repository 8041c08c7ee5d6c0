package com.grammar.statement.impl;

import com.grammar.processor.GrammarProcessor;
import com.grammar.selector.SelectorParser;
import com.grammar.statement.Statement;
import com.grammar.statement.StatementType;

import java.util.List;
import java.util.Set;

/**
 * Statement for {@code to <arch>} clauses. Holds when the target architecture is the selector.
 */
public class ToStatement extends Statement {

    private final Set<String> selectors;

    public ToStatement(String clause, List<?> body, GrammarProcessor processor) {
        this(clause, body, processor, null);
    }

    public ToStatement(String clause, List<?> body, GrammarProcessor processor, List<Statement> callStack) {
        super(body, processor, callStack, false);
        this.selectors = SelectorParser.parseToSelectors(clause);
        selectors.forEach(processor.getContext()::requireKnownArchitecture);
    }

    @Override
    public boolean check() {
        return selectors.size() == 1 && selectors.contains(processor.getContext().getTargetArch());
    }

    public Set<String> getSelectors() {
        return selectors;
    }

    @Override
    public StatementType getType() {
        return StatementType.TO;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return selectors.equals(((ToStatement) other).selectors);
    }

    @Override
    public int hashCode() {
        return selectors.hashCode();
    }

    @Override
    public String toString() {
        return "to " + String.join(",", selectors);
    }
}
