package com.grammar.selector;

import com.grammar.exception.ForStatementSyntaxException;
import com.grammar.exception.OnStatementSyntaxException;
import com.grammar.exception.ToStatementSyntaxException;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;

import static com.grammar.selector.ClausePatterns.*;

/**
 * Extracts selector sets from clause keywords.
 * <p>
 * Validation order:
 * <ol>
 *   <li>Missing or malformed selector list</li>
 *   <li>Whitespace inside the selector list</li>
 *   <li>Commas ('for' only, which takes exactly one selector)</li>
 * </ol>
 * Selector sets are sorted and unmodifiable; duplicates collapse.
 */
public final class SelectorParser {

    private SelectorParser() {
    }

    /**
     * Parse the selectors of an 'on' clause.
     * For example {@code "on amd64,i386"} yields {@code [amd64, i386]}.
     *
     * @param clause Clause text
     * @return Selector set
     */
    public static Set<String> parseOnSelectors(String clause) {
        Matcher matcher = Selectors.ON.matcher(clause);
        if (!matcher.matches()) {
            throw new OnStatementSyntaxException(clause, "selectors are missing");
        }
        String group = matcher.group(1);
        if (WHITESPACE.matcher(group).find()) {
            throw new OnStatementSyntaxException(clause, "spaces are not allowed in the selectors");
        }
        return split(group);
    }

    /**
     * Parse the selectors of a 'to' clause.
     *
     * @param clause Clause text
     * @return Selector set
     */
    public static Set<String> parseToSelectors(String clause) {
        Matcher matcher = Selectors.TO.matcher(clause);
        if (!matcher.matches()) {
            throw new ToStatementSyntaxException(clause, "selectors are missing");
        }
        String group = matcher.group(1);
        if (WHITESPACE.matcher(group).find()) {
            throw new ToStatementSyntaxException(clause, "spaces are not allowed in the selectors");
        }
        return split(group);
    }

    /**
     * Parse the single selector of a 'for' clause.
     *
     * @param clause Clause text
     * @return One-element selector set
     */
    public static Set<String> parseForSelector(String clause) {
        Matcher matcher = Selectors.FOR.matcher(clause);
        if (!matcher.matches()) {
            throw new ForStatementSyntaxException(clause, "selector is missing");
        }
        String group = matcher.group(1);
        if (WHITESPACE.matcher(group).find()) {
            throw new ForStatementSyntaxException(clause, "spaces are not allowed in the selector");
        }
        // Other clauses accept commas, so give a specific message
        if (group.indexOf(SELECTOR_SEPARATOR) >= 0) {
            throw new ForStatementSyntaxException(clause, "multiple selectors are not allowed");
        }
        return Collections.singleton(group.strip());
    }

    /**
     * Split an {@code on X to Y} clause into its parts.
     * The parts are not validated here.
     *
     * @param clause Clause text
     * @return Both parts, or empty if this is not a compound clause
     */
    public static Optional<CompoundClause> splitCompound(String clause) {
        Matcher matcher = Keywords.ON_TO.matcher(clause);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new CompoundClause(matcher.group(1), matcher.group(2)));
    }

    private static Set<String> split(String group) {
        Set<String> selectors = new TreeSet<>();
        for (String selector : group.split(String.valueOf(SELECTOR_SEPARATOR))) {
            selectors.add(selector.strip());
        }
        return Collections.unmodifiableSet(selectors);
    }
}
