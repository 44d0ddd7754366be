package work.dyncall.engine.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

class ProgramGeneratorTest {
    private static CodeGenerator queue(Object... payloads) {
        LinkedList<Object> remaining = new LinkedList<>(List.of(payloads));
        return request -> {
            Object next = remaining.size() > 1 ? remaining.removeFirst() : remaining.getFirst();
            if (next instanceof RuntimeException ex) {
                throw ex;
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> payload = (Map<String, Object>) next;
            return payload;
        };
    }

    @Test
    void retriesInvalidPayloadsWithFeedback() {
        List<String> prompts = new ArrayList<>();
        CodeGenerator recording = request -> {
            prompts.add(request.userPrompt());
            return request.attempt() == 1 ? Map.of("code", "  ") : Map.of("code", "return 1;");
        };
        var generator = new ProgramGenerator(recording, "m", 2, Duration.ofSeconds(1));

        List<Integer> attempts = new ArrayList<>();
        ProgramGenerator.Generated generated = generator.generate("Calc", "one", "sys", "user", attempts::add);

        assertEquals("return 1;", generated.program().code());
        assertEquals(2, generated.attempt());
        assertEquals(List.of(1, 2), attempts);
        assertEquals("user", prompts.get(0));
        assertTrue(prompts.get(1).contains("Retry 2/2"));
        assertTrue(prompts.get(1).contains("blank `code`"));
    }

    @Test
    void syntaxErrorsCountAsInvalidPayloads() {
        var generator = new ProgramGenerator(queue(Map.of("code", "return (;")), "m", 2, Duration.ofSeconds(1));
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> generator.generate("Calc", "one", "sys", "user", null));
        assertEquals(ErrorType.INVALID_CODE, ex.type());
        assertTrue(ex.retriable());
    }

    @Test
    void badManifestIsNotRetried() {
        List<Integer> attempts = new ArrayList<>();
        var generator = new ProgramGenerator(queue(
            Map.of("code", "return 1;", "dependencies", List.of(
                Map.of("name", "jsoup", "version", "1.0"),
                Map.of("name", "jsoup", "version", "2.0")))),
            "m", 3, Duration.ofSeconds(1));

        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> generator.generate("Calc", "one", "sys", "user", attempts::add));
        assertEquals(ErrorType.INVALID_DEPENDENCY_MANIFEST, ex.type());
        assertEquals(List.of(1), attempts);
    }

    @Test
    void unexpectedGeneratorErrorsBecomeProviderFailures() {
        var generator = new ProgramGenerator(queue(new IllegalStateException("socket closed")), "m", 1, Duration.ofSeconds(1));
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> generator.generate("Calc", "one", "sys", "user", null));
        assertEquals(ErrorType.PROVIDER, ex.type());
        assertTrue(ex.getMessage().contains("socket closed"));
    }

    @Test
    void payloadHintsAreKept() {
        GeneratedProgram program = GeneratedProgram.fromPayload("Calc", "one",
            Map.of("code", "return 1;", "cacheable", false, "cacheability_reason", "depends_on_time"));
        assertEquals(false, program.cacheability("one").cacheable());
        assertEquals("depends_on_time", program.cacheability("one").reason());
        assertEquals(ProgramOrigin.FRESH, program.origin());
    }

    @Test
    void feedbackBlocksFollowFixedOrder() {
        var outcome = RetryFeedback.outcome(Outcome.error("timeout", "slow", true, "A", "b"), 1, 0);
        var execution = RetryFeedback.execution(new DynamicCallException(ErrorType.EXECUTION, "boom"), 1, 1);
        String prompt = PromptComposer.withFeedback("base", List.of(outcome, execution));

        assertTrue(prompt.indexOf("<execution_failure_feedback>") < prompt.indexOf("<outcome_failure_feedback>"));
        assertTrue(prompt.startsWith("base"));
    }
}
