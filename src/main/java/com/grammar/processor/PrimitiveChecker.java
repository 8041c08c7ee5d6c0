package com.grammar.processor;

/**
 * Decides whether a primitive is acceptable. Used by 'try' statements.
 */
@FunctionalInterface
public interface PrimitiveChecker {

    /**
     * @param primitive Primitive produced by the grammar
     * @return true if the primitive is valid
     */
    boolean isValid(Object primitive);

    /**
     * Checker that accepts every primitive.
     */
    static PrimitiveChecker acceptAll() {
        return primitive -> true;
    }
}
