package com.grammar.statement.impl;

import com.grammar.exception.ForStatementSyntaxException;
import com.grammar.exception.GrammarSyntaxException;
import com.grammar.exception.UnknownPlatformNameException;
import com.grammar.processor.DefaultGrammarProcessor;
import com.grammar.processor.EvaluationContext;
import com.grammar.processor.GrammarProcessor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ForStatement.
 */
class ForStatementTest {

    private static GrammarProcessor processor(List<String> platforms) {
        return new DefaultGrammarProcessor(EvaluationContext.builder()
                .arch("amd64")
                .targetArch("riscv64")
                .platforms(platforms)
                .build(), primitive -> true);
    }

    @Test
    @DisplayName("Matching platform selects the body")
    void matchesPlatform() {
        ForStatement clause = new ForStatement("for test-platform", List.of("foo"),
                processor(List.of("test-platform")));

        assertEquals(List.of("foo"), clause.process());
    }

    @ParameterizedTest
    @DisplayName("Any of several configured platforms matches")
    @ValueSource(strings = {"foo", "bar", "baz", "qux"})
    void manyPlatforms(String platform) {
        ForStatement clause = new ForStatement("for " + platform, List.of("body"),
                processor(List.of("foo", "bar", "baz", "qux")));

        assertEquals(List.of("body"), clause.process());
    }

    @Test
    @DisplayName("Unconfigured platform yields nothing")
    void noMatch() {
        ForStatement clause = new ForStatement("for other", List.of("body"),
                processor(List.of("foo", "bar")));

        assertEquals(List.of(), clause.process());
    }

    @Test
    @DisplayName("Without platforms 'for' never matches")
    void noPlatformsConfigured() {
        ForStatement clause = new ForStatement("for test-platform", List.of("body"), processor(null));

        assertFalse(clause.check());
        assertEquals(List.of(), clause.process());
    }

    @Test
    @DisplayName("'for any' matches whenever platforms are configured")
    void forAny() {
        assertEquals(List.of("body"),
                new ForStatement("for any", List.of("body"), processor(List.of())).process());
        assertEquals(List.of(),
                new ForStatement("for any", List.of("body"), processor(null)).process());
    }

    @Test
    @DisplayName("'else' is rejected")
    void elseRejected() {
        ForStatement clause = new ForStatement("for test-platform", List.of("foo"),
                processor(List.of("test-platform")));

        GrammarSyntaxException error = assertThrows(GrammarSyntaxException.class,
                () -> clause.addElse(List.of("bar")));
        assertEquals("Invalid grammar syntax: 'else' is not supported for 'for'.", error.getMessage());
        assertThrows(GrammarSyntaxException.class, clause::addElseFail);
    }

    @Test
    @DisplayName("Multiple selectors are a syntax error")
    void multipleSelectors() {
        ForStatementSyntaxException error = assertThrows(ForStatementSyntaxException.class,
                () -> new ForStatement("for a,b", List.of("foo"), processor(List.of("a"))));

        assertEquals("Invalid grammar syntax: 'for a,b' is not a valid 'for' clause: "
                + "multiple selectors are not allowed.", error.getMessage());
    }

    @Test
    @DisplayName("Platform outside the allow-list is rejected at construction")
    void unknownPlatform() {
        GrammarProcessor processor = new DefaultGrammarProcessor(EvaluationContext.builder()
                .arch("amd64")
                .targetArch("riscv64")
                .platforms(List.of("test-platform"))
                .validPlatforms(List.of("test-platform", "other-platform"))
                .build(), primitive -> !String.valueOf(primitive).contains("invalid"));

        UnknownPlatformNameException error = assertThrows(UnknownPlatformNameException.class,
                () -> new ForStatement("for invalid-platform", List.of("foo"), processor));
        assertEquals("invalid-platform", error.getPlatform());
        assertEquals("Unknown platform name 'invalid-platform'. Valid platforms are: "
                + "other-platform, test-platform", error.getMessage());
    }

    @Test
    @DisplayName("Equality is by selector")
    void equality() {
        GrammarProcessor processor = processor(List.of("a"));

        assertEquals(new ForStatement("for a", List.of("x"), processor),
                new ForStatement("for  a", List.of("y"), processor));
        assertNotEquals(new ForStatement("for a", List.of("x"), processor),
                new ForStatement("for b", List.of("x"), processor));
        assertEquals("for a", new ForStatement("for a", List.of(), processor).toString());
    }
}
