package work.dyncall.engine.guardrail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContinuityGuardTest {
    private static ContinuityProfile coordination() {
        return ContinuityProfile.fromMap(Map.of(
            "role", "Cart",
            "version", 1,
            "constraints", Map.of("items", Map.of("methods", List.of("add", "list")))
        ), "Cart");
    }

    private static ContinuityProfile prescriptive() {
        return ContinuityProfile.fromMap(Map.of(
            "role", "Cart",
            "version", 2,
            "constraints", Map.of("items", Map.of("methods", List.of("add", "list"), "mode", "prescriptive",
                "canonical_key", "items"))
        ), "Cart");
    }

    @Test
    void siblingsAgreeingOnSlotPass() {
        var guard = new ContinuityGuard(true, ContinuityGuard.PriorObservations.none());
        guard.evaluate(coordination(), "add", "context.items = (context.items || []).concat(args); return true;");
        ContinuityReport report = guard.evaluate(coordination(), "list", "return context.items || [];");

        assertTrue(report.evaluated());
        assertTrue(report.passed());
        assertEquals(1.0, report.passRate());
        assertTrue(guard.violationFor(report).isEmpty());
    }

    @Test
    void driftingSiblingIsReportedAndEnforced() {
        var guard = new ContinuityGuard(true, ContinuityGuard.PriorObservations.none());
        guard.evaluate(coordination(), "add", "context.items = args; return true;");
        ContinuityReport report = guard.evaluate(coordination(), "list", "return context.cart_items;");

        assertFalse(report.passed());
        assertEquals(List.of("shared_state_slot_drift"), report.violationTypes());
        assertEquals(0.0, report.passRate());
        GuardrailViolation violation = guard.violationFor(report).orElseThrow();
        assertEquals(ContinuityGuard.SUBTYPE, violation.subtype());
    }

    @Test
    void shadowModeReportsWithoutViolation() {
        var guard = new ContinuityGuard(false, ContinuityGuard.PriorObservations.none());
        guard.evaluate(coordination(), "add", "context.items = args; return true;");
        ContinuityReport report = guard.evaluate(coordination(), "list", "return context.cart_items;");

        assertFalse(report.passed());
        assertTrue(guard.violationFor(report).isEmpty());
    }

    @Test
    void prescriptiveKeyMustMatch() {
        var guard = new ContinuityGuard(true, ContinuityGuard.PriorObservations.none());
        ContinuityReport report = guard.evaluate(prescriptive(), "add", "context.basket = args; return true;");

        assertFalse(report.passed());
        assertTrue(report.correctionHint().contains("'items'"));
    }

    @Test
    void persistedObservationsTakePrecedence() {
        var guard = new ContinuityGuard(true, (role, method) -> "add".equals(method) ? Optional.of("items") : Optional.empty());
        ContinuityReport report = guard.evaluate(coordination(), "list", "return context.basket;");
        assertFalse(report.passed());
    }

    @Test
    void methodsOutsideProfileAreNotEvaluated() {
        var guard = new ContinuityGuard(true, ContinuityGuard.PriorObservations.none());
        assertFalse(guard.evaluate(coordination(), "checkout", "return context.total;").evaluated());
        assertNull(guard.evaluate(null, "add", "return 1;"));
    }

    @Test
    void malformedProfilesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ContinuityProfile.fromMap(Map.of("role", "Other", "version", 1), "Cart"));
        assertThrows(IllegalArgumentException.class, () -> ContinuityProfile.fromMap(Map.of("role", "Cart", "version", 0), "Cart"));
        assertThrows(IllegalArgumentException.class, () -> ContinuityProfile.fromMap(Map.of("role", "Cart", "version", 1,
            "constraints", Map.of("x", Map.of("methods", List.of("a"), "mode", "prescriptive"))), "Cart"));
    }

    @Test
    void stateKeysIgnoreToolRegistry() {
        assertEquals(List.of("count", "seen"),
            StateKeys.fromCode("context.tools; context.count++; api.remember('seen', 1); context['count'];"));
    }
}
