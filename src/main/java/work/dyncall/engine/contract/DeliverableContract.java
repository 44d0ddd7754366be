package work.dyncall.engine.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Hashing;

/**
 * Declared shape a successful value must satisfy: {@code object} with required keys and per-property
 * constraints, or {@code array} with a minimum item count. A contract that lists required keys but no
 * type is an object contract.
 */
public record DeliverableContract(
    String type,
    List<String> required,
    Integer minItems,
    Map<String, PropertyConstraint> properties,
    Map<String, Object> raw
) {
    public static final String OBJECT = "object";
    public static final String ARRAY = "array";

    public DeliverableContract {
        required = List.copyOf(required == null ? List.of() : required);
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties == null ? Map.of() : properties));
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
        if (type == null && !required.isEmpty()) {
            type = OBJECT;
        }
    }

    public static DeliverableContract fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        String type = normalizedType(raw.get("type"));
        LinkedHashSet<String> required = new LinkedHashSet<>();
        for (Object key : JsonValues.asList(raw.get("required"))) {
            String name = JsonValues.optionalString(key);
            if (name != null) {
                required.add(name.trim());
            }
        }
        Map<String, Object> constraints = raw.get("constraints") instanceof Map<?, ?> ? JsonValues.asObject(raw.get("constraints")) : Map.of();
        Integer minItems = minItems(raw.get("min_items"));
        if (minItems == null) {
            minItems = minItems(constraints.get("min_items"));
        }
        Map<String, PropertyConstraint> properties = new LinkedHashMap<>();
        if (constraints.get("properties") instanceof Map<?, ?> props) {
            props.forEach((name, entry) -> {
                if (entry instanceof Map<?, ?> constraint) {
                    properties.put(String.valueOf(name), new PropertyConstraint(
                        normalizedType(constraint.get("type")), minItems(constraint.get("min_items"))));
                }
            });
        }
        return new DeliverableContract(type, new ArrayList<>(required), minItems, properties, raw);
    }

    /** {@code sha256:} digest of the contract JSON, or {@code none} without a contract. */
    public static String fingerprint(DeliverableContract contract) {
        if (contract == null) {
            return "none";
        }
        return Hashing.checksum(JsonValues.render(contract.raw()));
    }

    private static String normalizedType(Object raw) {
        String type = JsonValues.optionalString(raw);
        return type == null ? null : type.trim().toLowerCase();
    }

    private static Integer minItems(Object raw) {
        if (raw == null) {
            return null;
        }
        int value = JsonValues.intValue(raw, -1);
        return value < 0 ? null : value;
    }

    public record PropertyConstraint(String type, Integer minItems) {}
}
