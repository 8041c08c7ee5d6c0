package com.grammar.statement.impl;

import com.grammar.exception.GrammarSyntaxException;
import com.grammar.processor.GrammarProcessor;
import com.grammar.selector.SelectorParser;
import com.grammar.statement.ElseClause;
import com.grammar.statement.Statement;
import com.grammar.statement.StatementType;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Statement for {@code for <platform>} clauses.
 * <p>
 * Holds when the processor was given platforms and the single selector is one of them.
 * 'else' is not supported.
 */
public class ForStatement extends Statement {

    private final Set<String> selectors;

    public ForStatement(String clause, List<?> body, GrammarProcessor processor) {
        this(clause, body, processor, null);
    }

    public ForStatement(String clause, List<?> body, GrammarProcessor processor, List<Statement> callStack) {
        super(body, processor, callStack, false);
        this.selectors = SelectorParser.parseForSelector(clause);
        selectors.forEach(processor.getContext()::requireKnownPlatform);
    }

    @Override
    public boolean check() {
        Optional<Set<String>> platforms = processor.getContext().getPlatforms();
        return platforms.isPresent()
                && selectors.size() == 1
                && platforms.get().containsAll(selectors);
    }

    /**
     * @throws GrammarSyntaxException always
     */
    @Override
    public void addElse(ElseClause elseClause) {
        throw new GrammarSyntaxException("'else' is not supported for 'for'");
    }

    public Set<String> getSelectors() {
        return selectors;
    }

    @Override
    public StatementType getType() {
        return StatementType.FOR;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || other.getClass() != getClass()) {
            return false;
        }
        return selectors.equals(((ForStatement) other).selectors);
    }

    @Override
    public int hashCode() {
        return selectors.hashCode();
    }

    @Override
    public String toString() {
        return "for " + String.join(",", selectors);
    }
}
