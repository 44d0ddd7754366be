package work.dyncall.engine.contract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.ErrorType;

/**
 * Checks successful outcomes against a deliverable contract and turns self-declared low-utility
 * successes into {@code low_utility} errors. Error outcomes and calls without a contract pass through.
 */
public final class OutcomeContractValidator {
    static final Set<String> LOW_UTILITY_STATUSES = Set.of(
        "success_no_parse",
        "success_but_unusable",
        "partial_success_unusable",
        "empty_result",
        "no_useful_result",
        "low_utility"
    );

    /**
     * @param outcome the outcome to return, possibly rewritten
     * @param validation {@code null} when no contract applied
     */
    public record Result(Outcome outcome, ContractValidation validation) {
        public boolean applied() {
            return validation != null;
        }
    }

    public Result validate(Outcome outcome, DeliverableContract contract, List<Object> args, Map<String, Object> kwargs) {
        if (outcome == null || !outcome.isOk()) {
            return new Result(outcome, null);
        }
        if (contract == null) {
            return new Result(coerceLowUtility(outcome), null);
        }
        ContractValidation validation = check(contract, outcome.value(), args, kwargs);
        if (!validation.valid()) {
            String mismatch = validation.mismatch() == null ? "contract_violation" : validation.mismatch();
            Outcome violation = Outcome.error(
                ErrorType.CONTRACT_VIOLATION.wireName(),
                "Delegated outcome does not satisfy deliverable contract (" + mismatch + ")",
                false,
                validation.metadata(),
                outcome.role(),
                outcome.method()
            );
            return new Result(violation, validation);
        }
        Outcome validated = Objects.equals(validation.normalizedValue(), outcome.value())
            ? outcome
            : Outcome.ok(validation.normalizedValue(), outcome.role(), outcome.method());
        return new Result(coerceLowUtility(validated), validation);
    }

    public ContractValidation check(DeliverableContract contract, Object value, List<Object> args, Map<String, Object> kwargs) {
        if (nilRequiredInput(args, kwargs) && emptyValue(value)) {
            return ContractValidation.invalid("nil_required_input", "non_nil_input", "nil", List.of(), List.of(), null);
        }
        if (DeliverableContract.OBJECT.equals(contract.type())) {
            return validateObject(contract, value);
        }
        if (DeliverableContract.ARRAY.equals(contract.type())) {
            return validateArray(contract, value);
        }
        return ContractValidation.valid(value);
    }

    private ContractValidation validateObject(DeliverableContract contract, Object value) {
        List<String> expectedKeys = contract.required();
        if (!(value instanceof Map<?, ?> map)) {
            return ContractValidation.invalid("type_mismatch", "object", shapeOf(value), expectedKeys, keysOf(value), null);
        }
        for (String key : expectedKeys) {
            if (!TolerantKeys.contains(map, key)) {
                return ContractValidation.invalid("missing_required_key", "object", "object", expectedKeys, keysOf(value), null);
            }
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        map.forEach((k, v) -> normalized.put(String.valueOf(k), v));
        for (String key : expectedKeys) {
            normalized.putIfAbsent(key, TolerantKeys.get(map, key));
        }

        for (Map.Entry<String, DeliverableContract.PropertyConstraint> entry : contract.properties().entrySet()) {
            String key = entry.getKey();
            if (!TolerantKeys.contains(normalized, key)) {
                continue;
            }
            Object property = TolerantKeys.get(normalized, key);
            DeliverableContract.PropertyConstraint constraint = entry.getValue();
            if (constraint.type() != null && !matchesType(constraint.type(), property)) {
                return ContractValidation.invalid("property_type_mismatch", constraint.type(), shapeOf(property), List.of(key), List.of(),
                    Map.of("constraint_path", "deliverable.constraints.properties." + key + ".type"));
            }
            if (constraint.minItems() != null && !(property instanceof List<?> list && list.size() >= constraint.minItems())) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("constraint_path", "deliverable.constraints.properties." + key + ".min_items");
                details.put("expected_min_items", constraint.minItems());
                details.put("actual_items", property instanceof List<?> list ? list.size() : null);
                return ContractValidation.invalid("min_items_violation", "array", shapeOf(property), List.of(key), List.of(), details);
            }
        }
        return ContractValidation.valid(normalized);
    }

    private ContractValidation validateArray(DeliverableContract contract, Object value) {
        if (!(value instanceof List<?> list)) {
            return ContractValidation.invalid("type_mismatch", "array", shapeOf(value), List.of(), keysOf(value), null);
        }
        Integer minItems = contract.minItems();
        if (minItems != null && list.size() < minItems) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("constraint_path", "deliverable.min_items");
            details.put("expected_min_items", minItems);
            details.put("actual_items", list.size());
            return ContractValidation.invalid("min_items_violation", "array", "array", List.of(), List.of(), details);
        }
        return ContractValidation.valid(value);
    }

    /** Rewrites {@code {status: "no_useful_result", ...}} style successes into a {@code low_utility} error. */
    public Outcome coerceLowUtility(Outcome outcome) {
        if (!outcome.isOk() || !(outcome.value() instanceof Map<?, ?> value)) {
            return outcome;
        }
        if (!(value.get("status") instanceof String status)) {
            return outcome;
        }
        String normalized = status.trim().toLowerCase();
        if (!LOW_UTILITY_STATUSES.contains(normalized)) {
            return outcome;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("mismatch", "low_utility_success_signal");
        metadata.put("signaled_status", normalized);
        Object message = value.get("message");
        if (message != null && !String.valueOf(message).isBlank()) {
            metadata.put("signaled_message", String.valueOf(message));
        }
        return Outcome.error(ErrorType.LOW_UTILITY.wireName(),
            "Tool reported successful execution but signaled low utility output", false, metadata, outcome.role(), outcome.method());
    }

    private static boolean nilRequiredInput(List<Object> args, Map<String, Object> kwargs) {
        return args != null && !args.isEmpty() && args.get(0) == null && (kwargs == null || kwargs.isEmpty());
    }

    private static boolean emptyValue(Object value) {
        return (value instanceof List<?> list && list.isEmpty()) || (value instanceof Map<?, ?> map && map.isEmpty());
    }

    private static boolean matchesType(String type, Object value) {
        return switch (type) {
            case "array" -> value instanceof List;
            case "object" -> value instanceof Map;
            case "string" -> value instanceof String;
            case "number" -> value instanceof Number;
            case "integer" -> value instanceof Integer || value instanceof Long;
            case "boolean" -> value instanceof Boolean;
            default -> true;
        };
    }

    static String shapeOf(Object value) {
        if (value instanceof Map) return "object";
        if (value instanceof List) return "array";
        if (value == null) return "null";
        if (value instanceof String) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        return value.getClass().getSimpleName().toLowerCase();
    }

    private static List<String> keysOf(Object value) {
        List<String> keys = new ArrayList<>();
        if (value instanceof Map<?, ?> map) {
            map.keySet().forEach(key -> keys.add(String.valueOf(key)));
        }
        return keys;
    }
}
