package work.dyncall.engine.contract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.api.Outcome;

class OutcomeContractValidatorTest {
    private final OutcomeContractValidator validator = new OutcomeContractValidator();

    @Test
    void missingRequiredKeyIsContractViolation() {
        DeliverableContract contract = DeliverableContract.fromMap(Map.of("required", List.of("body")));
        Outcome produced = Outcome.ok(Map.of("status", 200), "Http", "get");

        var result = validator.validate(produced, contract, List.of(), Map.of());

        assertTrue(result.applied());
        assertEquals("contract_violation", result.outcome().errorType());
        assertFalse(result.outcome().retriable());
        assertEquals("missing_required_key", result.outcome().metadata().get("mismatch"));
        assertEquals(List.of("body"), result.outcome().metadata().get("expected_keys"));
        assertEquals(List.of("status"), result.validation().actualKeys());
    }

    @Test
    void tolerantKeysSatisfyRequiredFields() {
        DeliverableContract contract = DeliverableContract.fromMap(Map.of("required", List.of("created_at")));
        Outcome produced = Outcome.ok(Map.of("createdAt", "2026-01-01"), "Feed", "latest");

        var result = validator.validate(produced, contract, List.of(), Map.of());

        assertTrue(result.outcome().isOk());
        @SuppressWarnings("unchecked")
        Map<String, Object> value = (Map<String, Object>) result.outcome().value();
        assertEquals("2026-01-01", value.get("created_at"));
        assertEquals("2026-01-01", value.get("createdAt"));
    }

    @Test
    void arrayContractChecksMinItems() {
        DeliverableContract contract = DeliverableContract.fromMap(Map.of("type", "array", "min_items", 2));

        var shortList = validator.validate(Outcome.ok(List.of("a"), "News", "top"), contract, List.of(), Map.of());
        var longList = validator.validate(Outcome.ok(List.of("a", "b"), "News", "top"), contract, List.of(), Map.of());
        var notList = validator.validate(Outcome.ok("a", "News", "top"), contract, List.of(), Map.of());

        assertEquals("min_items_violation", shortList.outcome().metadata().get("mismatch"));
        assertEquals(1, shortList.outcome().metadata().get("actual_items"));
        assertTrue(longList.outcome().isOk());
        assertEquals("type_mismatch", notList.outcome().metadata().get("mismatch"));
    }

    @Test
    void propertyConstraintsAreChecked() {
        DeliverableContract contract = DeliverableContract.fromMap(Map.of(
            "required", List.of("items"),
            "constraints", Map.of("properties", Map.of("items", Map.of("type", "array", "min_items", 1)))
        ));

        var wrongType = validator.validate(Outcome.ok(Map.of("items", "x"), "A", "b"), contract, List.of(), Map.of());
        var empty = validator.validate(Outcome.ok(Map.of("items", List.of()), "A", "b"), contract, List.of(), Map.of());

        assertEquals("property_type_mismatch", wrongType.outcome().metadata().get("mismatch"));
        assertEquals("min_items_violation", empty.outcome().metadata().get("mismatch"));
        assertEquals("deliverable.constraints.properties.items.min_items", empty.outcome().metadata().get("constraint_path"));
    }

    @Test
    void nilInputWithEmptyResultIsRejected() {
        DeliverableContract contract = DeliverableContract.fromMap(Map.of("type", "array"));
        var result = validator.validate(Outcome.ok(List.of(), "A", "b"), contract, Arrays.asList((Object) null), Map.of());
        assertEquals("nil_required_input", result.outcome().metadata().get("mismatch"));
    }

    @Test
    void lowUtilitySuccessBecomesError() {
        Outcome signaled = Outcome.ok(Map.of("status", "No_Useful_Result", "message", "page was empty"), "Scraper", "run");

        var result = validator.validate(signaled, null, List.of(), Map.of());

        assertFalse(result.applied());
        assertEquals("low_utility", result.outcome().errorType());
        assertEquals("no_useful_result", result.outcome().metadata().get("signaled_status"));
        assertEquals("page was empty", result.outcome().metadata().get("signaled_message"));
    }

    @Test
    void errorsPassThroughUntouched() {
        Outcome error = Outcome.error("timeout", "slow", true, "A", "b");
        var result = validator.validate(error, DeliverableContract.fromMap(Map.of("required", List.of("x"))), List.of(), Map.of());
        assertSame(error, result.outcome());
        assertNull(result.validation());
    }

    @Test
    void fingerprintIsStable() {
        DeliverableContract contract = DeliverableContract.fromMap(Map.of("required", List.of("body")));
        assertEquals("none", DeliverableContract.fingerprint(null));
        assertTrue(DeliverableContract.fingerprint(contract).startsWith("sha256:"));
        assertEquals(DeliverableContract.fingerprint(contract),
            DeliverableContract.fingerprint(DeliverableContract.fromMap(Map.of("required", List.of("body")))));
        assertNull(DeliverableContract.fromMap(Map.of()));
    }
}
