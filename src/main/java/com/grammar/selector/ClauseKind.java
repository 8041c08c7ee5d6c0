package com.grammar.selector;

import java.util.regex.Pattern;

import static com.grammar.selector.ClausePatterns.Keywords;

/**
 * Kinds of mapping keys recognised by the grammar, in classification priority order.
 */
public enum ClauseKind {
    ON_TO(Keywords.ON_TO),
    ON(Keywords.ON),
    FOR(Keywords.FOR),
    // Deprecated: 'to' without a leading 'on'
    TO(Keywords.TO),
    TRY(Keywords.TRY),
    ELSE(Keywords.ELSE),
    ELSE_FAIL(Keywords.ELSE_FAIL),

    /** Not a clause; the section is an opaque primitive. */
    NONE(null);

    private final Pattern pattern;

    ClauseKind(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * Classify a mapping key or string section.
     *
     * @param key Key text
     * @return First matching kind, or NONE
     */
    public static ClauseKind classify(String key) {
        for (ClauseKind kind : values()) {
            if (kind.pattern != null && kind.pattern.matcher(key).lookingAt()) {
                return kind;
            }
        }
        return NONE;
    }
}
