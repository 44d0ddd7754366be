package work.dyncall.engine.artifact;

import work.dyncall.engine.runtime.EngineInfo;

/**
 * Thresholds a probation (or recovering) version must meet before it becomes durable.
 */
public record PromotionPolicy(
    String version,
    int minCalls,
    int minSessions,
    double minContractPassRate,
    double minRoleProfilePassRate,
    int maxGuardrailRetryExhausted,
    int maxOutcomeRetryExhausted,
    int maxWrongBoundaryCount,
    int maxProvenanceViolations,
    double minStateKeyConsistencyRatio
) {
    public static PromotionPolicy defaults() {
        return new PromotionPolicy(EngineInfo.PROMOTION_POLICY_VERSION, 10, 2, 0.95, 0.99, 0, 0, 0, 0, 0.5);
    }

    public boolean observationWindowMet(ScorecardMetrics metrics) {
        return metrics.calls() >= minCalls && metrics.sessionCount() >= minSessions;
    }

    /**
     * @param incumbentContractPassRate contract pass rate of the current durable incumbent, 0.0 when
     *     there is none or it has no contract observations
     */
    public boolean gatePasses(ScorecardMetrics metrics, double incumbentContractPassRate) {
        if (!observationWindowMet(metrics)) return false;
        if (metrics.contractPassRate() < minContractPassRate) return false;
        if (metrics.guardrailRetryExhausted() > maxGuardrailRetryExhausted) return false;
        if (metrics.outcomeRetryExhausted() > maxOutcomeRetryExhausted) return false;
        if (metrics.wrongBoundaryCount() > maxWrongBoundaryCount) return false;
        if (metrics.provenanceViolations() > maxProvenanceViolations) return false;
        if (metrics.stateKeyConsistencyRatio() < minStateKeyConsistencyRatio) return false;
        if (metrics.roleProfileObservationCount() > 0 && metrics.roleProfilePassRate() < minRoleProfilePassRate) {
            return false;
        }
        return metrics.contractPassRate() >= incumbentContractPassRate;
    }
}
