package com.grammar.processor;

/**
 * The grammar dialect in use.
 * Once a processor observes a dialect it cannot switch to the other one.
 */
public enum Variant {

    /** No grammar statement processed yet. */
    UNKNOWN("unknown"),

    /** 'on', 'to', 'on ... to', 'try', 'else' and 'else fail'. */
    TO_VARIANT("'to' variant"),

    /** 'for <platform>'. */
    FOR_VARIANT("'for' variant");

    private final String description;

    Variant(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
