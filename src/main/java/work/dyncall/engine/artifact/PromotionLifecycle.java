package work.dyncall.engine.artifact;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Moves each artifact version through candidate, probation, durable and degraded based on its
 * scorecard. Decisions are always recorded in shadow mode; enforcement only changes which version is
 * selected for reuse and makes probation errors degrade immediately.
 */
public final class PromotionLifecycle {
    private static final Logger log = LoggerFactory.getLogger(PromotionLifecycle.class);
    static final int MAX_LEDGER_EVALUATIONS = 200;

    private final PromotionPolicy policy;
    private final boolean shadowMode;
    private final boolean enforced;

    public PromotionLifecycle(PromotionPolicy policy, boolean shadowMode, boolean enforced) {
        this.policy = policy == null ? PromotionPolicy.defaults() : policy;
        this.shadowMode = shadowMode;
        this.enforced = enforced;
    }

    public PromotionPolicy policy() {
        return policy;
    }

    public boolean shadowMode() {
        return shadowMode;
    }

    public boolean enforced() {
        return enforced;
    }

    /**
     * Evaluates the version identified by the artifact's current checksum after its scorecard has
     * absorbed {@code observation}. Empty when shadow mode is off or the artifact has no code yet.
     */
    public Optional<PromotionDecision> evaluate(Artifact artifact, CallObservation observation, String timestamp) {
        if (!shadowMode) {
            return Optional.empty();
        }
        String checksum = artifact.codeChecksum();
        if (checksum == null) {
            return Optional.empty();
        }
        Map<String, Object> root = lifecycleRoot(artifact, timestamp);
        Map<String, Object> entry = lifecycleEntry(root, checksum, timestamp);
        LifecycleState current = LifecycleState.fromWireName(JsonValues.optionalString(entry.get("lifecycle_state")));

        Map<String, Object> scorecard = artifact.scorecardFor(checksum);
        String incumbent = JsonValues.optionalString(root.get("incumbent_durable_checksum"));
        if (checksum.equals(incumbent)) {
            incumbent = null;
        }
        double incumbentRate = incumbentContractPassRate(artifact.scorecardFor(incumbent));

        ScorecardMetrics metrics = ScorecardMetrics.of(scorecard);
        Map<String, Object> rationale = rationale(metrics, incumbentRate);

        LifecycleState next;
        String decision;
        if (current == LifecycleState.CANDIDATE && observation.ok()) {
            next = LifecycleState.PROBATION;
            decision = PromotionDecision.CONTINUE_PROBATION;
            rationale.put("candidate_bootstrap", true);
        } else {
            switch (current) {
                case PROBATION -> {
                    if (enforced && !observation.ok()) {
                        next = LifecycleState.DEGRADED;
                        decision = PromotionDecision.DEGRADE;
                        rationale.put("enforced_immediate_regression", true);
                    } else if (policy.gatePasses(metrics, incumbentRate)) {
                        next = LifecycleState.DURABLE;
                        decision = PromotionDecision.PROMOTE;
                    } else if (metrics.regressed()) {
                        next = LifecycleState.DEGRADED;
                        decision = PromotionDecision.DEGRADE;
                    } else {
                        next = LifecycleState.PROBATION;
                        decision = PromotionDecision.CONTINUE_PROBATION;
                    }
                }
                case DURABLE -> {
                    next = metrics.regressed() ? LifecycleState.DEGRADED : LifecycleState.DURABLE;
                    decision = metrics.regressed() ? PromotionDecision.DEGRADE : PromotionDecision.HOLD;
                }
                case DEGRADED -> {
                    ScorecardMetrics recovery = recordRecovery(entry, observation, scorecard);
                    rationale.put("recovery_window", recovery.toMap());
                    boolean recovered = policy.gatePasses(recovery, incumbentRate) && !recovery.regressed();
                    next = recovered ? LifecycleState.DURABLE : LifecycleState.DEGRADED;
                    decision = recovered ? PromotionDecision.PROMOTE : PromotionDecision.HOLD;
                }
                default -> {
                    next = LifecycleState.CANDIDATE;
                    decision = PromotionDecision.HOLD;
                }
            }
        }

        if (next == LifecycleState.DEGRADED && current != LifecycleState.DEGRADED) {
            entry.put("degraded_at", timestamp);
            entry.put("recovery_window", emptyRecoveryWindow(timestamp));
        } else if (next != LifecycleState.DEGRADED) {
            entry.remove("recovery_window");
        }
        entry.put("lifecycle_state", next.wireName());
        entry.put("last_decision", decision);
        entry.put("last_decision_at", timestamp);
        entry.put("policy_version", policy.version());
        if (next == LifecycleState.DURABLE) {
            root.put("incumbent_durable_checksum", checksum);
        }
        appendLedger(root, artifact.role(), checksum, incumbent, decision, rationale, timestamp);

        if (next != current) {
            log.info("Artifact {}.{} version {} {} -> {} ({})", artifact.role(), artifact.methodName(),
                checksum, current.wireName(), next.wireName(), decision);
        }
        return Optional.of(new PromotionDecision(checksum, current, next, decision, policy.version(), rationale));
    }

    /** Lifecycle state recorded for {@code checksum}, or {@code null} when it was never evaluated. */
    public static LifecycleState stateOf(Artifact artifact, String checksum) {
        Map<String, Object> root = artifact.lifecycle();
        if (root == null || checksum == null || !(root.get("versions") instanceof Map<?, ?> versions)) {
            return null;
        }
        if (versions.get(checksum) instanceof Map<?, ?> entry) {
            return LifecycleState.fromWireName(JsonValues.optionalString(entry.get("lifecycle_state")));
        }
        return null;
    }

    private Map<String, Object> lifecycleRoot(Artifact artifact, String timestamp) {
        Map<String, Object> root = artifact.lifecycle();
        if (root == null) {
            root = new LinkedHashMap<>();
            root.put("policy_version", policy.version());
            root.put("incumbent_durable_checksum", null);
            root.put("versions", new LinkedHashMap<String, Object>());
            root.put("created_at", timestamp);
            artifact.put("lifecycle", root);
        }
        root.put("policy_version", policy.version());
        if (!(root.get("versions") instanceof Map)) {
            root.put("versions", new LinkedHashMap<String, Object>());
        }
        Map<String, Object> ledger = root.get("shadow_ledger") instanceof Map<?, ?> raw
            ? JsonValues.asObject(raw)
            : new LinkedHashMap<>();
        if (!(ledger.get("evaluations") instanceof List)) {
            ledger.put("evaluations", new ArrayList<>());
        }
        ledger.put("false_promotion_count", JsonValues.intValue(ledger.get("false_promotion_count"), 0));
        ledger.put("false_hold_count", JsonValues.intValue(ledger.get("false_hold_count"), 0));
        root.put("shadow_ledger", ledger);
        return root;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> lifecycleEntry(Map<String, Object> root, String checksum, String timestamp) {
        Map<String, Object> versions = (Map<String, Object>) root.get("versions");
        if (versions.get(checksum) instanceof Map<?, ?> existing) {
            return (Map<String, Object>) existing;
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("artifact_checksum", checksum);
        entry.put("lifecycle_state", LifecycleState.CANDIDATE.wireName());
        entry.put("policy_version", root.get("policy_version"));
        entry.put("incumbent_artifact_checksum", root.get("incumbent_durable_checksum"));
        entry.put("first_seen_at", timestamp);
        entry.put("last_decision", PromotionDecision.HOLD);
        entry.put("last_decision_at", timestamp);
        versions.put(checksum, entry);
        return entry;
    }

    private Map<String, Object> rationale(ScorecardMetrics metrics, double incumbentRate) {
        Map<String, Object> rationale = metrics.toMap();
        rationale.put("observation_window_met", policy.observationWindowMet(metrics));
        rationale.put("gate_pass", policy.gatePasses(metrics, incumbentRate));
        rationale.put("profile_enabled_role", metrics.roleProfileObservationCount() > 0);
        return rationale;
    }

    /**
     * Only observations made after degradation count towards recovery, so a version cannot return to
     * durable on the strength of the history that preceded its regression.
     */
    private static ScorecardMetrics recordRecovery(Map<String, Object> entry, CallObservation observation,
                                                   Map<String, Object> scorecard) {
        Map<String, Object> window = entry.get("recovery_window") instanceof Map<?, ?> raw
            ? JsonValues.asObject(raw)
            : emptyRecoveryWindow(JsonValues.optionalString(entry.get("degraded_at")));
        Scorecard.recordCounts(window, observation);
        if (scorecard != null) {
            window.put("state_key_consistency_ratio", scorecard.get("state_key_consistency_ratio"));
        }
        if (observation.continuity() != null && observation.continuity().evaluated()) {
            int count = JsonValues.intValue(window.get("role_profile_observation_count"), 0) + 1;
            double rate = JsonValues.doubleValue(window.get("role_profile_pass_rate"), 1.0);
            window.put("role_profile_observation_count", count);
            window.put("role_profile_pass_rate",
                Scorecard.round4(((rate * (count - 1)) + observation.continuity().passRate()) / count));
        }
        entry.put("recovery_window", window);
        return ScorecardMetrics.of(window);
    }

    private static Map<String, Object> emptyRecoveryWindow(String since) {
        Map<String, Object> window = new LinkedHashMap<>();
        window.put("since", since);
        window.put("calls", 0);
        window.put("successes", 0);
        window.put("failures", 0);
        window.put("contract_pass_count", 0);
        window.put("contract_fail_count", 0);
        window.put("guardrail_retry_exhausted_count", 0);
        window.put("outcome_retry_exhausted_count", 0);
        window.put("wrong_boundary_count", 0);
        window.put("provenance_violation_count", 0);
        window.put("sessions", new ArrayList<>());
        return window;
    }

    private static double incumbentContractPassRate(Map<String, Object> scorecard) {
        if (scorecard == null) {
            return 0.0;
        }
        int pass = JsonValues.intValue(scorecard.get("contract_pass_count"), 0);
        int fail = JsonValues.intValue(scorecard.get("contract_fail_count"), 0);
        int total = pass + fail;
        return total == 0 ? 0.0 : Scorecard.round4((double) pass / total);
    }

    @SuppressWarnings("unchecked")
    private void appendLedger(Map<String, Object> root, String role, String checksum, String incumbent,
                              String decision, Map<String, Object> rationale, String timestamp) {
        Map<String, Object> ledger = (Map<String, Object>) root.get("shadow_ledger");
        List<Object> evaluations = JsonValues.asList(ledger.get("evaluations"));
        Map<String, Object> evaluation = new LinkedHashMap<>();
        evaluation.put("decision_type", "promotion_evaluation");
        evaluation.put("tool_name", role);
        evaluation.put("candidate_artifact_id", checksum);
        evaluation.put("incumbent_artifact_id", incumbent);
        evaluation.put("decision", decision);
        evaluation.put("policy_version", policy.version());
        evaluation.put("window", "rolling_medium_window");
        evaluation.put("rationale", rationale);
        evaluation.put("at", timestamp);
        evaluations.add(evaluation);
        if (evaluations.size() > MAX_LEDGER_EVALUATIONS) {
            evaluations = new ArrayList<>(evaluations.subList(evaluations.size() - MAX_LEDGER_EVALUATIONS, evaluations.size()));
        }
        ledger.put("evaluations", evaluations);
    }
}
