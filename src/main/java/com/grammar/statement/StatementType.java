package com.grammar.statement;

/**
 * Supported statement kinds.
 */
public enum StatementType {
    // on/to dialect
    ON,
    TO,
    COMPOUND,
    TRY,

    // for dialect
    FOR
}
