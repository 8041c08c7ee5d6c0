package com.grammar.selector;

import java.util.regex.Pattern;

/**
 * Patterns for clause keywords and their selector lists.
 */
public final class ClausePatterns {

    // Whitespace classes cover Unicode spaces such as U+00A0
    private static final int UNICODE = Pattern.UNICODE_CHARACTER_CLASS;

    private ClausePatterns() {
    }

    /**
     * Keyword prefixes used to classify mapping keys.
     */
    public static final class Keywords {
        public static final Pattern ON_TO = Pattern.compile("(\\Aon\\s+\\S+)\\s+(to\\s+\\S+)\\z", UNICODE);
        public static final Pattern ON = Pattern.compile("\\Aon\\s+", UNICODE);
        public static final Pattern FOR = Pattern.compile("\\Afor\\s+", UNICODE);
        public static final Pattern TO = Pattern.compile("\\Ato\\s+", UNICODE);
        public static final Pattern TRY = Pattern.compile("\\Atry\\z", UNICODE);
        public static final Pattern ELSE = Pattern.compile("\\Aelse\\z", UNICODE);
        public static final Pattern ELSE_FAIL = Pattern.compile("\\Aelse\\s+fail\\z", UNICODE);

        private Keywords() {
        }
    }

    /**
     * Selector lists: no leading, trailing or doubled commas.
     */
    public static final class Selectors {
        public static final Pattern ON = Pattern.compile("\\Aon\\s+([^,\\s][^,]*(?:,[^,]+)*)\\z", UNICODE);
        public static final Pattern TO = Pattern.compile("\\Ato\\s+([^,\\s][^,]*(?:,[^,]+)*)\\z", UNICODE);
        public static final Pattern FOR = Pattern.compile("\\Afor\\s+(.+)\\z", UNICODE);

        private Selectors() {
        }
    }

    public static final Pattern WHITESPACE = Pattern.compile("\\s", UNICODE);

    public static final char SELECTOR_SEPARATOR = ',';
}
