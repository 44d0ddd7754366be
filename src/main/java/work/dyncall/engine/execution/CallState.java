package work.dyncall.engine.execution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.artifact.Cacheability;
import work.dyncall.engine.artifact.LifecycleState;
import work.dyncall.engine.artifact.PromotionDecision;
import work.dyncall.engine.artifact.SelectedArtifact;
import work.dyncall.engine.dependency.EnvironmentHandle;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.FailureClass;
import work.dyncall.engine.failure.FailureNormalizer;
import work.dyncall.engine.generation.GeneratedProgram;
import work.dyncall.engine.generation.ProgramOrigin;
import work.dyncall.engine.guardrail.ContinuityReport;
import work.dyncall.engine.runtime.CallFrame;
import work.dyncall.engine.shared.Timestamps;

/**
 * Mutable bookkeeping for one invocation. Only the thread running the invocation touches it.
 */
public final class CallState {
    final CallFrame frame;

    int guardrailAttempts;
    int executionAttempts;
    int outcomeAttempts;
    int generationAttempt;

    GeneratedProgram program;
    Cacheability cacheability;
    EnvironmentHandle environment;
    Long workerPid;
    Integer workerRestartCount;

    FailureClass failureClass;
    boolean contractApplied;
    Boolean contractPassed;
    Map<String, Object> contractMetadata = Map.of();

    boolean guardrailRetryExhausted;
    boolean outcomeRetryExhausted;
    boolean outcomeRepairTriggered;
    boolean rollbackApplied;
    boolean programRejected;
    String lastViolationSubtype;

    SelectedArtifact persisted;
    boolean repairAttempted;
    boolean repaired;
    String trigger;

    String artifactChecksum;
    PromotionDecision decision;
    ContinuityReport continuity;
    List<String> capabilityPatterns = List.of();

    private final List<AttemptFailure> failures = new ArrayList<>();

    public CallState(CallFrame frame) {
        this.frame = frame;
    }

    public CallFrame frame() {
        return frame;
    }

    public int attemptId() {
        return guardrailAttempts + executionAttempts + outcomeAttempts + 1;
    }

    public String code() {
        return program == null ? null : program.code();
    }

    public ProgramOrigin origin() {
        return program == null ? null : program.origin();
    }

    public List<AttemptFailure> failures() {
        return List.copyOf(failures);
    }

    public AttemptFailure latestFailure() {
        return failures.isEmpty() ? null : failures.get(failures.size() - 1);
    }

    void capture(GeneratedProgram generated) {
        this.program = generated;
    }

    void capture(EnvironmentHandle handle) {
        this.environment = handle;
    }

    void recordFailure(AttemptFailure.Stage stage, Throwable error) {
        String errorClass = error instanceof DynamicCallException dce ? dce.errorType() : error.getClass().getSimpleName();
        recordFailure(stage, errorClass, FailureNormalizer.messageOf(error),
            FailureClass.classify(FailureNormalizer.errorTypeOf(error), error));
    }

    void recordFailure(AttemptFailure.Stage stage, Outcome outcome) {
        recordFailure(stage, "outcome_error", outcome.errorType() + ": " + outcome.errorMessage(),
            FailureClass.classify(outcome.errorType()));
    }

    void recordFailure(AttemptFailure.Stage stage, String errorClass, String message, FailureClass classification) {
        failures.add(new AttemptFailure(attemptId(), stage, errorClass, message,
            classification == null ? null : classification.wireName(), Timestamps.now(), frame.callId()));
        while (failures.size() > AttemptFailure.MAX_RECORDED) {
            failures.remove(0);
        }
    }

    /** Diagnostic fields for the call record, keyed the way the record serializes them. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("program_source", program == null ? null : program.origin().wireName());
        map.put("code", code());
        map.put("dependencies", program == null ? List.of() : program.manifest().toList());
        map.put("capability_patterns", capabilityPatterns);
        map.put("generation_attempt", generationAttempt);
        map.put("attempt_id", attemptId());
        map.put("guardrail_recovery_attempts", guardrailAttempts);
        map.put("execution_repair_attempts", executionAttempts);
        map.put("outcome_repair_attempts", outcomeAttempts);
        map.put("guardrail_retry_exhausted", guardrailRetryExhausted);
        map.put("outcome_repair_retry_exhausted", outcomeRetryExhausted);
        map.put("outcome_repair_triggered", outcomeRepairTriggered);
        map.put("attempt_rollback_applied", rollbackApplied);
        map.put("last_violation_subtype", lastViolationSubtype);
        List<Map<String, Object>> failureMaps = new ArrayList<>();
        failures.forEach(failure -> failureMaps.add(failure.toMap()));
        map.put("attempt_failures", failureMaps);
        AttemptFailure latest = latestFailure();
        map.put("latest_failure_stage", latest == null ? null : latest.stage().wireName());
        map.put("latest_failure_class", latest == null ? null : latest.errorClass());
        map.put("latest_failure_message", latest == null ? null : latest.errorMessage());
        map.put("failure_class", failureClass == null ? null : failureClass.wireName());
        if (environment != null) {
            map.putAll(environment.toMap());
        }
        map.put("worker_pid", workerPid);
        map.put("worker_restart_count", workerRestartCount);
        map.put("cacheable", cacheability == null ? null : cacheability.cacheable());
        map.put("cacheability_reason", cacheability == null ? null : cacheability.reason());
        map.put("artifact_hit", persisted != null);
        map.put("artifact_checksum", artifactChecksum);
        map.put("artifact_prompt_version", persisted == null ? null : persisted.promptVersion());
        map.put("artifact_contract_fingerprint", persisted == null ? null : persisted.contractFingerprint());
        LifecycleState selectedState = persisted == null ? null : persisted.lifecycleState();
        map.put("selected_lifecycle_state", selectedState == null ? null : selectedState.wireName());
        map.put("repair_attempted", repairAttempted);
        map.put("repair_succeeded", repaired);
        map.put("artifact_generation_trigger", trigger);
        map.put("contract_validation_applied", contractApplied);
        map.put("contract_validation_passed", contractPassed);
        if (!contractMetadata.isEmpty()) {
            map.put("contract_validation", contractMetadata);
        }
        if (decision != null) {
            map.put("lifecycle_state", decision.state().wireName());
            map.put("lifecycle_decision", decision.decision());
            map.put("promotion_policy_version", decision.policyVersion());
        }
        map.put("continuity", continuity == null ? null : continuity.toMap());
        return map;
    }
}
