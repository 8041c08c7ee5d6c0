package com.grammar.selector;

/**
 * The two halves of an {@code on <arch> to <arch>} clause.
 *
 * @param onClause The 'on' part, e.g. "on amd64"
 * @param toClause The 'to' part, e.g. "to arm64"
 */
public record CompoundClause(String onClause, String toClause) {

    @Override
    public String toString() {
        return onClause + " " + toClause;
    }
}
