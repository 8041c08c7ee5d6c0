package com.grammar.statement;

import com.grammar.exception.UnsatisfiedStatementException;
import com.grammar.processor.GrammarProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Base class for all grammar statements.
 * <p>
 * A statement owns a body, an ordered list of else clauses and the call stack of
 * enclosing statements. {@link #process()} evaluates the body when {@link #check()}
 * holds, otherwise the else clauses in the order they were added.
 * <p>
 * Results are memoized per instance: the evaluation context does not change while a
 * grammar is processed, so repeated calls return the same list without calling
 * {@link #check()} again. Instances are not thread-safe.
 */
public abstract class Statement {

    private static final Logger log = LoggerFactory.getLogger(Statement.class);

    protected final GrammarProcessor processor;
    private final List<?> body;
    private final List<Statement> callStack;
    private final boolean checkPrimitives;
    private final List<ElseClause> elseClauses = new ArrayList<>();

    private Optional<List<Object>> processedBody = Optional.empty();
    private Optional<List<Object>> processedElse = Optional.empty();
    private Optional<List<Object>> result = Optional.empty();

    /**
     * @param body            Body of the clause
     * @param processor       Processor used to evaluate the body and else clauses
     * @param callStack       Statements enclosing this one, oldest first (may be null)
     * @param checkPrimitives Whether else results must pass the processor's checker
     */
    protected Statement(List<?> body, GrammarProcessor processor, List<Statement> callStack,
                        boolean checkPrimitives) {
        this.body = body;
        this.processor = processor;
        this.callStack = callStack == null ? List.of() : List.copyOf(callStack);
        this.checkPrimitives = checkPrimitives;
    }

    /**
     * Add an 'else' clause. Clauses are evaluated in the order they are added.
     */
    public void addElse(ElseClause elseClause) {
        elseClauses.add(elseClause);
    }

    /**
     * Add an 'else' clause with the given body.
     */
    public final void addElse(List<?> elseBody) {
        addElse(ElseClause.of(elseBody));
    }

    /**
     * Add an 'else fail' clause.
     */
    public final void addElseFail() {
        addElse(ElseClause.failClause());
    }

    /**
     * Process this statement.
     *
     * @return Primitives selected by the body or by the else clauses
     */
    public List<Object> process() {
        if (result.isEmpty()) {
            boolean holds = check();
            log.trace("Statement '{}' check = {}", this, holds);
            result = Optional.of(holds ? processBody() : processElse());
        }
        return result.get();
    }

    /**
     * Process the main body, with this statement pushed on the call stack.
     */
    protected List<Object> processBody() {
        if (processedBody.isEmpty()) {
            processedBody = Optional.of(processor.process(body, getCallStack(true)));
        }
        return processedBody.get();
    }

    /**
     * Process the else clauses in order.
     * <p>
     * The first non-empty result is kept. When primitives are checked, later clauses
     * are tried until one produces only valid primitives; if none does, the last
     * non-empty result is kept.
     *
     * @throws UnsatisfiedStatementException if an 'else fail' clause is reached
     */
    protected List<Object> processElse() {
        if (processedElse.isPresent()) {
            return processedElse.get();
        }

        List<Object> selected = List.of();
        for (ElseClause elseClause : elseClauses) {
            if (elseClause.fail()) {
                throw new UnsatisfiedStatementException(toString());
            }

            List<Object> processed = processor.process(elseClause.body(), getCallStack(false));
            if (processed.isEmpty()) {
                continue;
            }
            selected = processed;
            if (!checkPrimitives || validatePrimitives(processed)) {
                break;
            }
            log.trace("Statement '{}': else result {} rejected by checker", this, processed);
        }

        processedElse = Optional.of(selected);
        return selected;
    }

    /**
     * Check every primitive with the processor's checker.
     */
    protected boolean validatePrimitives(List<Object> primitives) {
        for (Object primitive : primitives) {
            if (!processor.isValid(primitive)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Get the call stack used when processing this statement.
     *
     * @param includeSelf Whether this statement is appended (body) or not (else clauses)
     */
    public List<Statement> getCallStack(boolean includeSelf) {
        if (!includeSelf) {
            return callStack;
        }
        List<Statement> extended = new ArrayList<>(callStack.size() + 1);
        extended.addAll(callStack);
        extended.add(this);
        return Collections.unmodifiableList(extended);
    }

    public List<?> getBody() {
        return body;
    }

    public List<ElseClause> getElseClauses() {
        return Collections.unmodifiableList(elseClauses);
    }

    /**
     * Check whether the main body should be processed.
     *
     * @return true for the body, false for the else clauses
     */
    public abstract boolean check();

    /**
     * Get the statement type.
     */
    public abstract StatementType getType();

    /**
     * Statements are equal when they would select on the same thing.
     * Duplicate sibling statements are rejected by the processor.
     */
    @Override
    public abstract boolean equals(Object other);

    @Override
    public abstract int hashCode();

    /**
     * Clause form of the statement, e.g. {@code on amd64}.
     */
    @Override
    public abstract String toString();
}
