package work.dyncall.engine.artifact;

import java.util.Map;

/**
 * Result of one lifecycle evaluation for the version that served a call.
 */
public record PromotionDecision(
    String checksum,
    LifecycleState previousState,
    LifecycleState state,
    String decision,
    String policyVersion,
    Map<String, Object> rationale
) {
    public static final String CONTINUE_PROBATION = "continue_probation";
    public static final String PROMOTE = "promote";
    public static final String DEGRADE = "degrade";
    public static final String HOLD = "hold";
}
