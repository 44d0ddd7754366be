package work.dyncall.engine.artifact;

import work.dyncall.engine.failure.FailureClass;

/**
 * Repair budget for persisted programs. After {@link #MAX_REPAIRS_BEFORE_REGEN} repairs without a
 * regeneration the program is regenerated from scratch instead.
 */
public final class RepairPlanner {
    public static final int MAX_REPAIRS_BEFORE_REGEN = 3;
    public static final String PERSISTED_FAILURE_TRIGGER = "regenerate:persisted_failure";
    public static final String BUDGET_EXHAUSTED_TRIGGER = "regenerate:repair_budget_exhausted";

    private RepairPlanner() {}

    public static boolean budgetAvailable(Artifact artifact) {
        return artifact.repairCountSinceRegen() < MAX_REPAIRS_BEFORE_REGEN;
    }

    public static String repairTrigger(FailureClass failureClass) {
        if (failureClass == null) {
            return "repair:unknown_failure";
        }
        return switch (failureClass) {
            case ADAPTIVE -> "repair:adaptive_failure";
            case INTRINSIC -> "repair:intrinsic_failure";
            case EXTRINSIC -> "repair:unknown_failure";
        };
    }

    /** Trigger for the fresh generation that follows a persisted program which could not be repaired. */
    public static String regenerationTrigger(Artifact artifact) {
        return budgetAvailable(artifact) ? PERSISTED_FAILURE_TRIGGER : BUDGET_EXHAUSTED_TRIGGER;
    }
}
