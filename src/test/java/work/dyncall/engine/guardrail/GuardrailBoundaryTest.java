package work.dyncall.engine.guardrail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.api.Outcome;

class GuardrailBoundaryTest {
    private static final Outcome EXHAUSTED = Outcome.error("guardrail_retry_exhausted",
        "Guardrail retries exhausted for Planner.plan: Defining methods on delegated handles is not supported",
        false, Map.of("last_violation_subtype", "singleton_method_mutation"), "Planner", "plan");

    @Test
    void topLevelExhaustionGetsGenericMessage() {
        Outcome normalized = GuardrailBoundary.normalize(EXHAUSTED, 0);

        assertEquals(GuardrailBoundary.USER_MESSAGE, normalized.errorMessage());
        assertEquals("guardrail_retry_exhausted", normalized.errorType());
        assertEquals(true, normalized.metadata().get("normalized"));
        assertEquals(GuardrailBoundary.NORMALIZATION_POLICY, normalized.metadata().get("normalization_policy"));
        assertEquals("singleton_method_mutation", normalized.metadata().get("guardrail_subtype"));
        assertEquals(EXHAUSTED.errorMessage(), normalized.metadata().get("raw_error_message"));
    }

    @Test
    void nestedCallsKeepRawMessage() {
        assertSame(EXHAUSTED, GuardrailBoundary.normalize(EXHAUSTED, 1));
    }

    @Test
    void otherOutcomesAreUntouched() {
        Outcome other = Outcome.error("timeout", "slow", true, "A", "b");
        Outcome ok = Outcome.ok(1, "A", "b");
        assertSame(other, GuardrailBoundary.normalize(other, 0));
        assertSame(ok, GuardrailBoundary.normalize(ok, 0));
    }

    @Test
    void unknownSubtypeIsFilledIn() {
        Outcome bare = Outcome.error("guardrail_retry_exhausted", "raw", false, "A", "b");
        assertEquals(GuardrailViolation.UNKNOWN_SUBTYPE, GuardrailBoundary.normalize(bare, 0).metadata().get("guardrail_subtype"));
    }
}
