package com.grammar.processor;

import com.grammar.statement.Statement;

import java.util.List;

/**
 * Rewrites string primitives as they are collected.
 * <p>
 * Example: qualify a package name with the target architecture when it was selected
 * inside a 'to' statement.
 */
@FunctionalInterface
public interface PrimitiveTransformer {

    /**
     * @param callStack  Statements enclosing the primitive, oldest first
     * @param primitive  String primitive
     * @param targetArch Target architecture of the evaluation context
     * @return Transformed primitive
     */
    String transform(List<Statement> callStack, String primitive, String targetArch);

    /**
     * Transformer that returns the primitive unchanged.
     */
    static PrimitiveTransformer identity() {
        return (callStack, primitive, targetArch) -> primitive;
    }
}
