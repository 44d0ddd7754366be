package work.dyncall.engine.execution;

/**
 * Per-invocation recovery budgets of the fresh generation loop.
 */
public record AttemptBudgets(int guardrailRecovery, int outcomeRepair, int executionRepair) {
    public AttemptBudgets {
        if (guardrailRecovery < 0 || outcomeRepair < 0 || executionRepair < 0) {
            throw new IllegalArgumentException("attempt budgets must be >= 0");
        }
    }

    public static AttemptBudgets defaults() {
        return new AttemptBudgets(1, 1, 1);
    }
}
