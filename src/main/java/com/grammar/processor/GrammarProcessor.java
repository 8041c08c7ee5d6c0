package com.grammar.processor;

import com.grammar.statement.Statement;

import java.util.List;

/**
 * Reduces a grammar tree to the primitives selected for an evaluation context.
 * <p>
 * A processor latches the grammar dialect it observes, so one instance should be used per
 * manifest evaluation. Instances are not thread-safe.
 */
public interface GrammarProcessor {

    /**
     * Process a grammar from the top level.
     *
     * @param grammar Decoded grammar: a list of sections, or a legacy single mapping
     * @return Selected primitives in authored order
     */
    default List<Object> process(Object grammar) {
        return process(grammar, List.of());
    }

    /**
     * Process a grammar nested in the given statements.
     *
     * @param grammar   Decoded grammar
     * @param callStack Statements leading to this grammar, oldest first
     * @return Selected primitives in authored order
     */
    List<Object> process(Object grammar, List<Statement> callStack);

    /**
     * Get the evaluation context.
     */
    EvaluationContext getContext();

    /**
     * Check a primitive with the configured checker.
     */
    boolean isValid(Object primitive);

    /**
     * Get the dialect observed so far.
     */
    Variant getVariant();
}
