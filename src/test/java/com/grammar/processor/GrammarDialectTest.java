package com.grammar.processor;

import com.grammar.exception.GrammarSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the 'for' and 'on'/'to' dialects not being mixed.
 */
class GrammarDialectTest {

    private static final String CONFLICT = "Invalid grammar syntax: The 'for' statement can't be used with "
            + "other grammar statements. Either replace all 'for <platform>' statements with 'to <arch>' "
            + "or remove all other grammar statements.";

    private static DefaultGrammarProcessor processor(Variant variant) {
        EvaluationContext context = EvaluationContext.builder()
                .arch("amd64")
                .targetArch("amd64")
                .platforms(List.of("test-platform"))
                .build();
        return new DefaultGrammarProcessor(context, PrimitiveChecker.acceptAll(), null, variant,
                DefaultGrammarProcessor.DEFAULT_MAX_DEPTH);
    }

    private static Map<String, Object> section(String key, Object value) {
        return Map.of(key, value);
    }

    static Stream<Arguments> mixedGrammars() {
        return Stream.of(
                Arguments.of("for and on", Variant.UNKNOWN,
                        List.of(section("for test-platform", List.of("foo")), section("on riscv64", "bar"))),
                Arguments.of("on and for", Variant.UNKNOWN,
                        List.of(section("on riscv64", "bar"), section("for test-platform", List.of("foo")))),
                Arguments.of("for and to", Variant.UNKNOWN,
                        List.of(section("for test-platform", List.of("foo")), section("to riscv64", "bar"))),
                Arguments.of("to and for", Variant.UNKNOWN,
                        List.of(section("to riscv64", "bar"), section("for test-platform", List.of("foo")))),
                Arguments.of("for and else", Variant.UNKNOWN,
                        List.of(section("for test-platform", List.of("foo")), section("else", "bar"))),
                Arguments.of("for and try", Variant.UNKNOWN,
                        List.of(section("for test-platform", List.of("foo")), section("try", "bar"))),
                Arguments.of("try and for", Variant.UNKNOWN,
                        List.of(section("try", "bar"), section("for test-platform", List.of("foo")))),
                Arguments.of("for and on-to", Variant.UNKNOWN,
                        List.of(section("for test-platform", List.of("foo")), section("on riscv64 to amd64", "bar"))),
                Arguments.of("on-to and for", Variant.UNKNOWN,
                        List.of(section("on riscv64 to amd64", "bar"), section("for test-platform", List.of("foo")))),
                Arguments.of("for and many", Variant.UNKNOWN,
                        List.of(section("for test-platform", List.of("foo")),
                                section("on riscv64 to amd64", "bar"),
                                "baz",
                                section("to riscv64", "qux"))),
                Arguments.of("nested on-to in for", Variant.UNKNOWN,
                        List.of(section("for test-platform", section("on amd64 to amd64", "bar")))),
                Arguments.of("nested for in on-to", Variant.UNKNOWN,
                        List.of(section("on amd64 to amd64", List.of(section("for test-platform", "bar"))))),
                Arguments.of("for with preset to dialect", Variant.TO_VARIANT,
                        List.of(section("for test-platform", "foo"))),
                Arguments.of("to with preset for dialect", Variant.FOR_VARIANT,
                        List.of(section("to amd64", "foo"))),
                Arguments.of("on-to with preset for dialect", Variant.FOR_VARIANT,
                        List.of(section("on amd64 to amd64", "foo"))),
                Arguments.of("on with preset for dialect", Variant.FOR_VARIANT,
                        List.of(section("on amd64", "foo"))),
                Arguments.of("else fail with preset for dialect", Variant.FOR_VARIANT,
                        List.of(section("for test-platform", "foo"), "else fail"))
        );
    }

    @ParameterizedTest(name = "{0}")
    @DisplayName("Mixing dialects is rejected")
    @MethodSource("mixedGrammars")
    void mixedDialects(String name, Variant variant, List<?> grammar) {
        GrammarSyntaxException error = assertThrows(GrammarSyntaxException.class,
                () -> processor(variant).process(grammar));

        assertEquals(CONFLICT, error.getMessage());
    }

    @Test
    @DisplayName("Dialect is latched by the first clause")
    void latchesDialect() {
        DefaultGrammarProcessor processor = processor(Variant.UNKNOWN);
        assertEquals(Variant.UNKNOWN, processor.getVariant());

        processor.process(List.of("foo"));
        assertEquals(Variant.UNKNOWN, processor.getVariant());

        processor.process(List.of(section("for test-platform", "foo")));
        assertEquals(Variant.FOR_VARIANT, processor.getVariant());

        assertThrows(GrammarSyntaxException.class,
                () -> processor.process(List.of(section("on amd64", "foo"))));
    }

    @Test
    @DisplayName("'for' statements select platform bodies")
    void forDialect() {
        List<?> grammar = List.of(
                "common",
                section("for test-platform", List.of("foo")),
                section("for other-platform", List.of("bar")),
                section("for any", List.of("baz")));

        assertEquals(List.of("common", "foo", "baz"), processor(Variant.FOR_VARIANT).process(grammar));
    }

    @Test
    @DisplayName("Nested 'for' statements are allowed")
    void nestedFor() {
        List<?> grammar = List.of(
                section("for test-platform", List.of(section("for any", List.of("foo")))));

        assertEquals(List.of("foo"), processor(Variant.UNKNOWN).process(grammar));
    }

    @Test
    @DisplayName("Mixing 'on', 'to' and 'try' is allowed")
    void toDialect() {
        List<?> grammar = List.of(
                section("on amd64", "foo"),
                section("to amd64", "bar"),
                section("on amd64 to amd64", "baz"),
                section("try", "qux"));

        DefaultGrammarProcessor processor = processor(Variant.UNKNOWN);
        assertEquals(List.of("foo", "bar", "baz", "qux"), processor.process(grammar));
        assertEquals(Variant.TO_VARIANT, processor.getVariant());
    }
}
