package com.grammar.processor;

import com.grammar.exception.GrammarSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GrammarProcessorFactory.
 */
class GrammarProcessorFactoryTest {

    private final GrammarProcessorFactory factory = new GrammarProcessorFactory(EvaluationContext.builder()
            .arch("amd64")
            .platforms(List.of("test-platform"))
            .build());

    @Test
    @DisplayName("Each processor latches its own dialect")
    void freshProcessorPerEvaluation() {
        List<Object> forResult = factory.evaluate(List.of(Map.of("for test-platform", "foo")), null);
        List<Object> onResult = factory.evaluate(List.of(Map.of("on amd64", "bar")), null);

        assertEquals(List.of("foo"), forResult);
        assertEquals(List.of("bar"), onResult);
    }

    @Test
    @DisplayName("Created processors share the context")
    void sharesContext() {
        GrammarProcessor first = factory.create();
        GrammarProcessor second = factory.create(primitive -> false);

        assertNotSame(first, second);
        assertSame(factory.getContext(), first.getContext());
        assertFalse(second.isValid("foo"));
        assertTrue(first.isValid("foo"));
    }

    @Test
    @DisplayName("Preset dialect is passed to every processor")
    void presetVariant() {
        GrammarProcessorFactory forOnly = new GrammarProcessorFactory(factory.getContext(),
                Variant.FOR_VARIANT, DefaultGrammarProcessor.DEFAULT_MAX_DEPTH);

        assertEquals(Variant.FOR_VARIANT, forOnly.getVariant());
        assertEquals(Variant.FOR_VARIANT, forOnly.create().getVariant());
        assertThrows(GrammarSyntaxException.class,
                () -> forOnly.evaluate(List.of(Map.of("on amd64", "bar")), null));
    }

    @Test
    @DisplayName("Transformer is passed to created processors")
    void transformer() {
        GrammarProcessor processor = factory.create(null,
                (callStack, primitive, targetArch) -> primitive + "@" + targetArch);

        assertEquals(List.of("foo@amd64"), processor.process(List.of("foo")));
    }
}
