package com.grammar.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Creates a fresh GrammarProcessor per evaluation.
 * <p>
 * Processors latch the dialect they observe and are not thread-safe, so a shared
 * factory hands out a new one for every manifest.
 */
public class GrammarProcessorFactory {

    private static final Logger log = LoggerFactory.getLogger(GrammarProcessorFactory.class);

    private final EvaluationContext context;
    private final Variant variant;
    private final int maxDepth;

    public GrammarProcessorFactory(EvaluationContext context) {
        this(context, Variant.UNKNOWN, DefaultGrammarProcessor.DEFAULT_MAX_DEPTH);
    }

    public GrammarProcessorFactory(EvaluationContext context, Variant variant, int maxDepth) {
        this.context = context;
        this.variant = variant;
        this.maxDepth = maxDepth;
        log.info("GrammarProcessorFactory initialized: {}, variant: {}", context, variant.getDescription());
    }

    public GrammarProcessor create() {
        return create(null, null);
    }

    public GrammarProcessor create(PrimitiveChecker checker) {
        return create(checker, null);
    }

    public GrammarProcessor create(PrimitiveChecker checker, PrimitiveTransformer transformer) {
        return new DefaultGrammarProcessor(context, checker, transformer, variant, maxDepth);
    }

    /**
     * Evaluate a grammar with a new processor.
     *
     * @param grammar Decoded grammar
     * @param checker Checker for 'try' statements (null accepts everything)
     * @return Selected primitives
     */
    public List<Object> evaluate(Object grammar, PrimitiveChecker checker) {
        return create(checker).process(grammar);
    }

    public EvaluationContext getContext() {
        return context;
    }

    public Variant getVariant() {
        return variant;
    }
}
