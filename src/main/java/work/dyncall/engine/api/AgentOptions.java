package work.dyncall.engine.api;

import java.util.Map;
import work.dyncall.engine.contract.DeliverableContract;
import work.dyncall.engine.guardrail.ContinuityProfile;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Per-agent settings: the deliverable its results must satisfy, the purpose it was delegated for and
 * its continuity profile. All three are optional.
 */
public record AgentOptions(DeliverableContract contract, String purpose, ContinuityProfile profile) {
    public static final String PURPOSE_KEY = "purpose";
    public static final String DELIVERABLE_KEY = "deliverable";
    public static final String CONTINUITY_KEY = "continuity_profile";

    private static final AgentOptions NONE = new AgentOptions(null, null, null);

    public AgentOptions {
        purpose = purpose == null || purpose.isBlank() ? null : purpose.trim();
    }

    public static AgentOptions none() {
        return NONE;
    }

    public AgentOptions withContract(DeliverableContract value) {
        return new AgentOptions(value, purpose, profile);
    }

    public AgentOptions withPurpose(String value) {
        return new AgentOptions(contract, value, profile);
    }

    public AgentOptions withProfile(ContinuityProfile value) {
        return new AgentOptions(contract, purpose, value);
    }

    /**
     * Reads the options map a program passes to {@code api.delegate(role, options)}.
     */
    public static AgentOptions fromDelegateOptions(String role, Map<String, Object> options) {
        if (options == null || options.isEmpty()) {
            return NONE;
        }
        Object deliverable = options.get(DELIVERABLE_KEY);
        Object profile = options.get(CONTINUITY_KEY);
        return new AgentOptions(
            deliverable instanceof Map<?, ?> raw ? DeliverableContract.fromMap(JsonValues.asObject(raw)) : null,
            JsonValues.optionalString(options.get(PURPOSE_KEY)),
            profile instanceof Map<?, ?> raw ? ContinuityProfile.fromMap(JsonValues.asObject(raw), role) : null
        );
    }
}
