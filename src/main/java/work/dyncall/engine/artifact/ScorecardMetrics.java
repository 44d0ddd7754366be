package work.dyncall.engine.artifact;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Derived view of a scorecard (or a recovery window) as compared against the promotion policy.
 */
public record ScorecardMetrics(
    int calls,
    int successes,
    int failures,
    double failureRate,
    int sessionCount,
    double contractPassRate,
    int guardrailRetryExhausted,
    int outcomeRetryExhausted,
    int wrongBoundaryCount,
    int provenanceViolations,
    double stateKeyConsistencyRatio,
    int roleProfileObservationCount,
    double roleProfilePassRate
) {
    public static ScorecardMetrics of(Map<String, Object> scorecard) {
        Map<String, Object> source = scorecard == null ? Map.of() : scorecard;
        int calls = JsonValues.intValue(source.get("calls"), 0);
        int successes = JsonValues.intValue(source.get("successes"), 0);
        int failures = JsonValues.intValue(source.get("failures"), 0);
        int contractPass = JsonValues.intValue(source.get("contract_pass_count"), 0);
        int contractFail = JsonValues.intValue(source.get("contract_fail_count"), 0);
        int contractTotal = contractPass + contractFail;
        int sessions = source.get("sessions") == null ? 0 : new LinkedHashSet<>(JsonValues.asList(source.get("sessions"))).size();
        return new ScorecardMetrics(
            calls,
            successes,
            failures,
            calls == 0 ? 0.0 : Scorecard.round4((double) failures / calls),
            sessions,
            contractTotal == 0 ? 1.0 : Scorecard.round4((double) contractPass / contractTotal),
            JsonValues.intValue(source.get("guardrail_retry_exhausted_count"), 0),
            JsonValues.intValue(source.get("outcome_retry_exhausted_count"), 0),
            JsonValues.intValue(source.get("wrong_boundary_count"), 0),
            JsonValues.intValue(source.get("provenance_violation_count"), 0),
            Scorecard.round4(JsonValues.doubleValue(source.get("state_key_consistency_ratio"), 1.0)),
            JsonValues.intValue(source.get("role_profile_observation_count"), 0),
            Scorecard.round4(JsonValues.doubleValue(source.get("role_profile_pass_rate"), 1.0))
        );
    }

    /** Sustained regression: at least 3 calls, failure rate above 0.6 and more failures than successes. */
    public boolean regressed() {
        return calls >= 3 && failureRate > 0.6 && failures > successes;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("calls", calls);
        map.put("successes", successes);
        map.put("failures", failures);
        map.put("failure_rate", failureRate);
        map.put("session_count", sessionCount);
        map.put("contract_pass_rate", contractPassRate);
        map.put("guardrail_retry_exhausted", guardrailRetryExhausted);
        map.put("outcome_retry_exhausted", outcomeRetryExhausted);
        map.put("wrong_boundary_count", wrongBoundaryCount);
        map.put("provenance_violations", provenanceViolations);
        map.put("state_key_consistency_ratio", stateKeyConsistencyRatio);
        map.put("role_profile_observation_count", roleProfileObservationCount);
        map.put("role_profile_pass_rate", roleProfilePassRate);
        return map;
    }
}
