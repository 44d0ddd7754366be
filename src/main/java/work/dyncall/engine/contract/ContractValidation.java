package work.dyncall.engine.contract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of checking one value against a deliverable contract.
 */
public record ContractValidation(boolean valid, Object normalizedValue, Map<String, Object> metadata) {
    public ContractValidation {
        metadata = metadata == null ? Map.of() : metadata;
    }

    static ContractValidation valid(Object normalizedValue) {
        return new ContractValidation(true, normalizedValue, Map.of());
    }

    static ContractValidation invalid(
        String mismatch,
        String expectedShape,
        String actualShape,
        List<String> expectedKeys,
        List<String> actualKeys,
        Map<String, Object> details
    ) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("expected_shape", expectedShape);
        metadata.put("actual_shape", actualShape);
        metadata.put("expected_keys", expectedKeys);
        metadata.put("actual_keys", actualKeys);
        metadata.put("mismatch", mismatch);
        if (details != null) {
            metadata.putAll(details);
        }
        return new ContractValidation(false, null, metadata);
    }

    public String mismatch() {
        Object mismatch = metadata.get("mismatch");
        return mismatch == null ? null : String.valueOf(mismatch);
    }

    @SuppressWarnings("unchecked")
    public List<String> expectedKeys() {
        Object keys = metadata.get("expected_keys");
        return keys instanceof List<?> list ? (List<String>) list : List.of();
    }

    @SuppressWarnings("unchecked")
    public List<String> actualKeys() {
        Object keys = metadata.get("actual_keys");
        return keys instanceof List<?> list ? (List<String>) list : List.of();
    }
}
