package com.grammar.processor;

import com.grammar.exception.GrammarDepthException;
import com.grammar.exception.GrammarSyntaxException;
import com.grammar.selector.ClauseKind;
import com.grammar.selector.CompoundClause;
import com.grammar.selector.SelectorParser;
import com.grammar.statement.ElseClause;
import com.grammar.statement.Statement;
import com.grammar.statement.impl.CompoundStatement;
import com.grammar.statement.impl.ForStatement;
import com.grammar.statement.impl.OnStatement;
import com.grammar.statement.impl.ToStatement;
import com.grammar.statement.impl.TryStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Default implementation of GrammarProcessor.
 * <p>
 * Rules:
 * - Sections are processed in order; output keeps the authored order
 * - A clause mapping opens a statement; following 'else' sections attach to it
 * - Any other section closes the open statement, which is then evaluated
 * - Sibling statements must not be duplicates
 * - Only one dialect ('for' or 'on'/'to') may be used for the processor's lifetime
 */
public class DefaultGrammarProcessor implements GrammarProcessor {

    private static final Logger log = LoggerFactory.getLogger(DefaultGrammarProcessor.class);

    public static final int DEFAULT_MAX_DEPTH = 64;

    static final String VARIANT_CONFLICT = "The 'for' statement can't be used with other grammar statements. "
            + "Either replace all 'for <platform>' statements with 'to <arch>' or "
            + "remove all other grammar statements";

    private final EvaluationContext context;
    private final PrimitiveChecker checker;
    private final PrimitiveTransformer transformer;
    private final int maxDepth;
    private Variant variant;
    private int depth;

    public DefaultGrammarProcessor(EvaluationContext context, PrimitiveChecker checker) {
        this(context, checker, null);
    }

    public DefaultGrammarProcessor(EvaluationContext context, PrimitiveChecker checker,
                                   PrimitiveTransformer transformer) {
        this(context, checker, transformer, Variant.UNKNOWN, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param context     Evaluation context
     * @param checker     Checker for 'try' statements (null accepts everything)
     * @param transformer Transformer for string primitives (null leaves them unchanged)
     * @param variant     Dialect defined by the application, or UNKNOWN to latch the first one seen
     * @param maxDepth    Maximum nesting of grammar bodies
     */
    public DefaultGrammarProcessor(EvaluationContext context, PrimitiveChecker checker,
                                   PrimitiveTransformer transformer, Variant variant, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.context = context;
        this.checker = checker != null ? checker : PrimitiveChecker.acceptAll();
        this.transformer = transformer != null ? transformer : PrimitiveTransformer.identity();
        this.variant = variant != null ? variant : Variant.UNKNOWN;
        this.maxDepth = maxDepth;
    }

    @Override
    public List<Object> process(Object grammar, List<Statement> callStack) {
        List<Statement> stack = callStack != null ? callStack : List.of();
        if (depth >= maxDepth) {
            throw new GrammarDepthException(maxDepth);
        }

        depth++;
        try {
            List<Object> primitives = processSections(normalize(grammar), stack);
            log.debug("Processed grammar at depth {} with {} enclosing statements: {} primitives",
                    depth, stack.size(), primitives.size());
            return primitives;
        } finally {
            depth--;
        }
    }

    private List<Object> processSections(List<?> sections, List<Statement> callStack) {
        List<Object> primitives = new ArrayList<>();
        StatementCollection statements = new StatementCollection();
        Statement statement = null;

        for (Object section : sections) {
            if (section instanceof String text) {
                if (ClauseKind.classify(text) == ClauseKind.ELSE_FAIL) {
                    setVariant(Variant.TO_VARIANT);
                    handleElse(statement, ElseClause.failClause());
                } else {
                    // A primitive closes the open statement, which goes first
                    finalizeStatement(statement, statements, primitives);
                    statement = null;
                    primitives.add(transformer.transform(callStack, text, context.getTargetArch()));
                }
            } else if (section instanceof Map<?, ?> map) {
                SectionResult result = parseSection(map, statement, callStack);
                for (Statement finalized : result.finalized()) {
                    finalizeStatement(finalized, statements, primitives);
                }
                statement = result.open();

                // Not part of a statement: the mapping itself is a primitive
                if (statement == null) {
                    primitives.add(section);
                }
            } else if (section instanceof Number || section instanceof Boolean || section instanceof List) {
                finalizeStatement(statement, statements, primitives);
                statement = null;
                primitives.add(section);
            } else {
                throw new GrammarSyntaxException("expected grammar section to be either of type 'str' or "
                        + "type 'dict', but got " + typeName(section));
            }
        }

        finalizeStatement(statement, statements, primitives);
        return Collections.unmodifiableList(primitives);
    }

    /** Statement left open by a mapping section, and the statements it closed. */
    private record SectionResult(Statement open, List<Statement> finalized) {}

    private SectionResult parseSection(Map<?, ?> section, Statement statement, List<Statement> callStack) {
        List<Statement> finalized = new ArrayList<>();
        Statement open = statement;

        for (Map.Entry<?, ?> entry : section.entrySet()) {
            String key = String.valueOf(entry.getKey());
            // Bodies may be written as a scalar or a list
            List<?> body = asList(entry.getValue());

            ClauseKind kind = ClauseKind.classify(key);
            switch (kind) {
                case ON_TO -> {
                    setVariant(Variant.TO_VARIANT);
                    close(open, finalized);
                    CompoundClause clause = SelectorParser.splitCompound(key)
                            .orElseThrow(() -> new GrammarSyntaxException("'" + key + "' is not a valid 'on' clause"));
                    open = CompoundStatement.of(clause, body, this, callStack);
                }
                case ON -> {
                    setVariant(Variant.TO_VARIANT);
                    close(open, finalized);
                    open = new OnStatement(key, body, this, callStack);
                }
                case FOR -> {
                    setVariant(Variant.FOR_VARIANT);
                    close(open, finalized);
                    open = new ForStatement(key, body, this, callStack);
                }
                case TO -> {
                    setVariant(Variant.TO_VARIANT);
                    close(open, finalized);
                    log.warn("'{}' is deprecated, use 'on <arch> {}' instead", key, key);
                    open = new ToStatement(key, body, this, callStack);
                }
                case TRY -> {
                    setVariant(Variant.TO_VARIANT);
                    close(open, finalized);
                    open = new TryStatement(body, this, callStack);
                }
                case ELSE -> {
                    setVariant(Variant.TO_VARIANT);
                    handleElse(open, ElseClause.of(body));
                }
                case ELSE_FAIL -> {
                    setVariant(Variant.TO_VARIANT);
                    handleElse(open, ElseClause.failClause());
                }
                case NONE -> {
                    close(open, finalized);
                    open = null;
                }
            }
        }

        return new SectionResult(open, finalized);
    }

    private static void close(Statement open, List<Statement> finalized) {
        if (open != null) {
            finalized.add(open);
        }
    }

    private void finalizeStatement(Statement statement, StatementCollection statements, List<Object> primitives) {
        if (statement == null) {
            return;
        }
        statements.add(statement);
        List<Object> processed = statement.process();
        log.debug("Statement '{}' selected {}", statement, processed);
        primitives.addAll(processed);
    }

    private static void handleElse(Statement statement, ElseClause elseClause) {
        if (statement == null) {
            throw new GrammarSyntaxException("'else' doesn't seem to correspond to an 'on' or 'try'");
        }
        statement.addElse(elseClause);
    }

    /**
     * Latch the dialect.
     *
     * @throws GrammarSyntaxException if a different dialect was already observed
     */
    private void setVariant(Variant observed) {
        if (variant == Variant.UNKNOWN) {
            log.debug("Grammar dialect set to {}", observed.getDescription());
            variant = observed;
            return;
        }
        if (variant != observed) {
            throw new GrammarSyntaxException(VARIANT_CONFLICT);
        }
    }

    /**
     * A legacy top-level mapping becomes a list of single-key mappings.
     */
    private static List<?> normalize(Object grammar) {
        if (grammar == null) {
            return List.of();
        }
        if (grammar instanceof List<?> list) {
            return list;
        }
        if (grammar instanceof Map<?, ?> map) {
            List<Object> sections = new ArrayList<>(map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sections.add(Collections.singletonMap(entry.getKey(), entry.getValue()));
            }
            return sections;
        }
        return Collections.singletonList(grammar);
    }

    private static List<?> asList(Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        return Collections.singletonList(value);
    }

    private static String typeName(Object section) {
        return section == null ? "null" : section.getClass().getSimpleName();
    }

    @Override
    public EvaluationContext getContext() {
        return context;
    }

    @Override
    public boolean isValid(Object primitive) {
        return checker.isValid(primitive);
    }

    @Override
    public Variant getVariant() {
        return variant;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
