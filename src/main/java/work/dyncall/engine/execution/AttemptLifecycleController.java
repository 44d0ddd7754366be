package work.dyncall.engine.execution;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.artifact.ArtifactRecorder;
import work.dyncall.engine.artifact.ArtifactSelector;
import work.dyncall.engine.artifact.ArtifactUpdate;
import work.dyncall.engine.artifact.CallObservation;
import work.dyncall.engine.artifact.Cacheability;
import work.dyncall.engine.artifact.RepairPlanner;
import work.dyncall.engine.artifact.SelectedArtifact;
import work.dyncall.engine.contract.OutcomeContractValidator;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.failure.FailureClass;
import work.dyncall.engine.failure.FailureNormalizer;
import work.dyncall.engine.generation.GeneratedProgram;
import work.dyncall.engine.generation.ProgramGenerator;
import work.dyncall.engine.generation.ProgramOrigin;
import work.dyncall.engine.generation.PromptComposer;
import work.dyncall.engine.generation.RetryFeedback;
import work.dyncall.engine.guardrail.ContinuityGuard;
import work.dyncall.engine.guardrail.ContinuityReport;
import work.dyncall.engine.guardrail.GuardrailBoundary;
import work.dyncall.engine.guardrail.GuardrailPolicy;
import work.dyncall.engine.guardrail.GuardrailStage;
import work.dyncall.engine.guardrail.GuardrailSubject;
import work.dyncall.engine.guardrail.GuardrailViolation;
import work.dyncall.engine.observability.CallRecord;
import work.dyncall.engine.observability.CallRecordSink;
import work.dyncall.engine.registry.CapabilityPatterns;
import work.dyncall.engine.registry.PatternMemoryStore;
import work.dyncall.engine.registry.ToolRegistryStore;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Hashing;

/**
 * Drives one invocation to exactly one {@link Outcome}: a persisted program first, then fresh
 * generation under the guardrail, execution and outcome budgets, then persistence and a single call
 * record. Nothing thrown inside an attempt escapes {@link #execute}.
 */
public final class AttemptLifecycleController {
    private static final Logger log = LoggerFactory.getLogger(AttemptLifecycleController.class);

    static final String PERSISTED_REUSE_TRIGGER = "persisted_reuse";
    static final String FALLBACK_PREFIX = "fallback:";

    private final ProgramGenerator generator;
    private final ArtifactSelector selector;
    private final ArtifactRecorder recorder;
    private final ToolRegistryStore registry;
    private final PatternMemoryStore patterns;
    private final GuardrailPolicy guardrails;
    private final ContinuityGuard continuity;
    private final OutcomeContractValidator validator;
    private final ProgramRunner runner;
    private final AttemptBudgets budgets;
    private final List<CallRecordSink> sinks;

    public AttemptLifecycleController(
        ProgramGenerator generator,
        ArtifactSelector selector,
        ArtifactRecorder recorder,
        ToolRegistryStore registry,
        PatternMemoryStore patterns,
        GuardrailPolicy guardrails,
        ContinuityGuard continuity,
        ProgramRunner runner,
        AttemptBudgets budgets,
        List<CallRecordSink> sinks
    ) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.selector = selector;
        this.recorder = recorder;
        this.registry = registry;
        this.patterns = patterns;
        this.guardrails = Objects.requireNonNull(guardrails, "guardrails");
        this.continuity = continuity == null ? new ContinuityGuard(false, null) : continuity;
        this.validator = new OutcomeContractValidator();
        this.runner = Objects.requireNonNull(runner, "runner");
        this.budgets = budgets == null ? AttemptBudgets.defaults() : budgets;
        this.sinks = List.copyOf(sinks == null ? List.of() : sinks);
    }

    public Outcome execute(CallScope scope) {
        long started = System.nanoTime();
        CallState state = new CallState(scope.invocation().frame());
        Outcome outcome;
        try {
            Optional<Outcome> persisted = runPersisted(scope, state);
            outcome = persisted.isPresent() ? persisted.get() : runFresh(scope, state);
        } catch (DynamicCallException ex) {
            outcome = Outcome.fromException(ex, scope.role(), scope.method());
            if (state.failureClass == null) {
                state.failureClass = FailureClass.classify(outcome.errorType(), ex);
            }
        } catch (RuntimeException ex) {
            log.debug("Unexpected failure in {}.{}", scope.role(), scope.method(), ex);
            outcome = Outcome.fromException(ex, scope.role(), scope.method());
            state.failureClass = FailureClass.classify(outcome.errorType(), ex);
        }
        outcome = GuardrailBoundary.normalize(outcome, scope.depth());
        if (outcome.isError() && state.failureClass == null) {
            state.failureClass = FailureClass.classify(outcome.errorType());
        }
        double durationMs = (System.nanoTime() - started) / 1_000_000.0;
        observeContinuity(scope, state);
        persist(scope, state, outcome, durationMs);
        recordPatterns(scope, state, outcome);
        emit(scope, state, outcome, durationMs);
        return outcome;
    }

    // persisted path

    private Optional<Outcome> runPersisted(CallScope scope, CallState state) {
        Optional<SelectedArtifact> selected;
        try {
            selected = selector == null ? Optional.empty() : selector.select(scope.role(), scope.method(), scope.contractFingerprint());
        } catch (IOException ex) {
            log.warn("Unable to read artifact for {}.{}: {}", scope.role(), scope.method(), ex.getMessage());
            return Optional.empty();
        }
        if (selected.isEmpty()) {
            return Optional.empty();
        }
        SelectedArtifact artifact = selected.get();
        state.persisted = artifact;
        state.trigger = Objects.equals(artifact.checksum(), artifact.artifact().codeChecksum())
            ? PERSISTED_REUSE_TRIGGER
            : FALLBACK_PREFIX + (artifact.lifecycleState() == null ? "unknown" : artifact.lifecycleState().wireName());
        state.cacheability = Cacheability.resolve(scope.method(), artifact.artifact().cacheable(),
            artifact.artifact().cacheabilityReason(), artifact.artifact().inputSensitive());
        AttemptIsolation snapshot = AttemptIsolation.capture(scope.memory(), registry);

        Outcome outcome;
        try {
            GeneratedProgram program = GeneratedProgram.persisted(artifact.code(), artifact.dependencies());
            state.capture(program);
            outcome = runAndValidate(scope, state, program);
        } catch (DynamicCallException ex) {
            FailureClass failureClass = FailureClass.classify(ex.errorType(), ex);
            state.failureClass = failureClass;
            state.recordFailure(AttemptFailure.Stage.EXECUTION, ex);
            if (failureClass == FailureClass.EXTRINSIC) {
                return Optional.of(Outcome.fromException(ex, scope.role(), scope.method()));
            }
            return repairOrRegenerate(scope, state, artifact, snapshot, failureClass, FailureNormalizer.messageOf(ex));
        }
        if (outcome.isOk()) {
            return Optional.of(outcome);
        }
        FailureClass failureClass = FailureClass.classify(outcome.errorType());
        state.failureClass = failureClass;
        if (failureClass != FailureClass.ADAPTIVE) {
            return Optional.of(outcome);
        }
        state.recordFailure(AttemptFailure.Stage.OUTCOME_POLICY, outcome);
        return repairOrRegenerate(scope, state, artifact, snapshot, failureClass, outcome.errorMessage());
    }

    private Optional<Outcome> repairOrRegenerate(CallScope scope, CallState state, SelectedArtifact artifact,
                                                 AttemptIsolation snapshot, FailureClass failureClass, String failureMessage) {
        snapshot.restore(scope.memory(), registry, state);
        if (RepairPlanner.budgetAvailable(artifact.artifact())) {
            Optional<Outcome> repaired = repair(scope, state, artifact, snapshot, failureClass, failureMessage);
            if (repaired.isPresent()) {
                return repaired;
            }
        }
        state.trigger = RepairPlanner.regenerationTrigger(artifact.artifact());
        state.program = null;
        state.failureClass = null;
        log.debug("Persisted program for {}.{} falls through to fresh generation ({})", scope.role(), scope.method(), state.trigger);
        return Optional.empty();
    }

    private Optional<Outcome> repair(CallScope scope, CallState state, SelectedArtifact artifact,
                                     AttemptIsolation snapshot, FailureClass failureClass, String failureMessage) {
        state.repairAttempted = true;
        try {
            String systemPrompt = PromptComposer.systemPrompt(scope.role(), scope.depth(), scope.contract(), scope.purpose());
            String userPrompt = PromptComposer.repairPrompt(scope.method(), scope.invocation().args(), scope.invocation().kwargs(),
                artifact, failureClass, failureMessage);
            GeneratedProgram program = generator
                .generate(scope.role(), scope.method(), systemPrompt, userPrompt, attempt -> state.generationAttempt = attempt)
                .program()
                .withOrigin(ProgramOrigin.REPAIRED);
            state.capture(program);
            state.cacheability = program.cacheability(scope.method());
            state.trigger = RepairPlanner.repairTrigger(failureClass);
            Outcome outcome = runAndValidate(scope, state, program);
            if (outcome.isOk()) {
                state.repaired = true;
                state.failureClass = null;
                return Optional.of(outcome);
            }
            state.recordFailure(AttemptFailure.Stage.OUTCOME_POLICY, outcome);
        } catch (DynamicCallException ex) {
            log.debug("Repair of {}.{} failed: {}", scope.role(), scope.method(), ex.getMessage());
            state.recordFailure(AttemptFailure.Stage.EXECUTION, ex);
        }
        snapshot.restore(scope.memory(), registry, state);
        return Optional.empty();
    }

    // fresh path

    private Outcome runFresh(CallScope scope, CallState state) {
        String systemPrompt = PromptComposer.systemPrompt(scope.role(), scope.depth(), scope.contract(), scope.purpose());
        String userPrompt = PromptComposer.userPrompt(scope.method(), scope.invocation().args(), scope.invocation().kwargs(),
            scope.depth(), scope.memory().view(), knownTools(scope));
        List<RetryFeedback> feedback = new ArrayList<>();
        while (true) {
            GeneratedProgram program = generateFresh(scope, state, systemPrompt, PromptComposer.withFeedback(userPrompt, feedback));
            AttemptIsolation snapshot = AttemptIsolation.capture(scope.memory(), registry);
            Outcome outcome;
            try {
                checkProgram(scope, state, program);
                outcome = runAndValidate(scope, state, program);
                checkOutcome(scope, program, outcome);
            } catch (DynamicCallException ex) {
                if (ex.type() == ErrorType.TOOL_REGISTRY_VIOLATION) {
                    feedback.add(recoverGuardrail(scope, state, snapshot, ex));
                    continue;
                }
                if (executionFault(ex)) {
                    feedback.add(recoverExecution(state, snapshot, scope, ex));
                    continue;
                }
                state.recordFailure(terminalStage(ex), ex);
                throw ex;
            }
            Optional<RetryFeedback> outcomeFeedback = recoverOutcome(scope, state, snapshot, outcome);
            if (outcomeFeedback.isEmpty()) {
                return state.outcomeRetryExhausted ? exhaustedOutcome(scope, state, outcome) : outcome;
            }
            feedback.add(outcomeFeedback.get());
        }
    }

    private GeneratedProgram generateFresh(CallScope scope, CallState state, String systemPrompt, String userPrompt) {
        try {
            GeneratedProgram program = generator
                .generate(scope.role(), scope.method(), systemPrompt, userPrompt, attempt -> state.generationAttempt = attempt)
                .program()
                .withOrigin(ProgramOrigin.FRESH);
            state.capture(program);
            state.cacheability = program.cacheability(scope.method());
            return program;
        } catch (DynamicCallException ex) {
            state.recordFailure(AttemptFailure.Stage.VALIDATION, ex);
            throw ex;
        }
    }

    private void checkProgram(CallScope scope, CallState state, GeneratedProgram program) {
        Optional<GuardrailViolation> violation = guardrails.evaluate(GuardrailStage.PROGRAM,
            GuardrailSubject.program(scope.role(), scope.method(), program.code()));
        if (violation.isPresent()) {
            throw violation.get().toException();
        }
        if (scope.profile() != null) {
            ContinuityReport report = continuity.evaluate(scope.profile(), scope.method(), program.code());
            state.continuity = report;
            Optional<GuardrailViolation> drift = continuity.violationFor(report);
            if (drift.isPresent()) {
                throw drift.get().toException();
            }
        }
    }

    private void checkOutcome(CallScope scope, GeneratedProgram program, Outcome outcome) {
        Optional<GuardrailViolation> violation = guardrails.evaluate(GuardrailStage.OUTCOME,
            GuardrailSubject.outcome(scope.role(), scope.method(), program.code(), outcome, scope.memory().view()));
        if (violation.isPresent()) {
            throw violation.get().toException();
        }
    }

    private RetryFeedback recoverGuardrail(CallScope scope, CallState state, AttemptIsolation snapshot, DynamicCallException ex) {
        snapshot.restore(scope.memory(), registry, state);
        GuardrailViolation violation = GuardrailViolation.fromException(ex);
        state.lastViolationSubtype = violation.subtype();
        state.recordFailure(AttemptFailure.Stage.GUARDRAIL, violation.subtype(), violation.message(), FailureClass.ADAPTIVE);
        if (violation.terminal()) {
            state.programRejected = true;
            throw ex;
        }
        int next = state.guardrailAttempts + 1;
        int remaining = budgets.guardrailRecovery() - next;
        if (remaining < 0) {
            state.guardrailRetryExhausted = true;
            state.programRejected = true;
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("guardrail_recovery_attempts", next);
            metadata.put("guardrail_class", violation.guardrailClass());
            metadata.put("last_violation_type", violation.violationType());
            metadata.put("last_violation_subtype", violation.subtype());
            metadata.put("last_violation_message", violation.message());
            throw new DynamicCallException(ErrorType.GUARDRAIL_RETRY_EXHAUSTED,
                "Recoverable guardrail retries exhausted for " + scope.role() + "." + scope.method(), false, metadata, ex);
        }
        int attemptNumber = state.attemptId() + 1;
        state.guardrailAttempts = next;
        log.debug("Guardrail rejected {}.{} ({}), regenerating with {} retries left", scope.role(), scope.method(),
            violation.subtype(), remaining);
        return RetryFeedback.guardrail(violation, attemptNumber, remaining);
    }

    private static AttemptFailure.Stage terminalStage(DynamicCallException ex) {
        return switch (ex.type()) {
            case INVALID_DEPENDENCY_MANIFEST, DEPENDENCY_MANIFEST_INCOMPATIBLE, DEPENDENCY_POLICY_VIOLATION ->
                AttemptFailure.Stage.VALIDATION;
            default -> AttemptFailure.Stage.EXECUTION;
        };
    }

    private static boolean executionFault(DynamicCallException ex) {
        return ex.type() == ErrorType.EXECUTION
            || ex.type() == ErrorType.WORKER_CRASH
            || ex.type() == ErrorType.NON_SERIALIZABLE_RESULT;
    }

    private RetryFeedback recoverExecution(CallState state, AttemptIsolation snapshot, CallScope scope, DynamicCallException ex) {
        snapshot.restore(scope.memory(), registry, state);
        state.recordFailure(AttemptFailure.Stage.EXECUTION, ex);
        if (state.executionAttempts >= budgets.executionRepair()) {
            throw ex.withRetriable(false);
        }
        int attemptNumber = state.attemptId() + 1;
        state.executionAttempts++;
        log.debug("Execution of {}.{} failed, regenerating: {}", scope.role(), scope.method(), ex.getMessage());
        return RetryFeedback.execution(ex, attemptNumber, budgets.executionRepair() - state.executionAttempts);
    }

    /** Empty when the outcome is final; otherwise the feedback for the next attempt. */
    private Optional<RetryFeedback> recoverOutcome(CallScope scope, CallState state, AttemptIsolation snapshot, Outcome outcome) {
        if (outcome.isOk() || !outcome.retriable()) {
            return Optional.empty();
        }
        if (FailureClass.classify(outcome.errorType()) == FailureClass.EXTRINSIC) {
            return Optional.empty();
        }
        snapshot.restore(scope.memory(), registry, state);
        state.outcomeRepairTriggered = true;
        state.recordFailure(AttemptFailure.Stage.OUTCOME_POLICY, outcome);
        if (state.outcomeAttempts >= budgets.outcomeRepair()) {
            state.outcomeRetryExhausted = true;
            return Optional.empty();
        }
        int attemptNumber = state.attemptId() + 1;
        state.outcomeAttempts++;
        return Optional.of(RetryFeedback.outcome(outcome, attemptNumber, budgets.outcomeRepair() - state.outcomeAttempts));
    }

    private static Outcome exhaustedOutcome(CallScope scope, CallState state, Outcome last) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("outcome_repair_attempts", state.outcomeAttempts);
        metadata.put("last_error_type", last.errorType());
        metadata.put("last_error_message", last.errorMessage());
        return Outcome.error(ErrorType.OUTCOME_REPAIR_RETRY_EXHAUSTED.wireName(),
            "Retriable outcome-error repairs exhausted for " + scope.role() + "." + scope.method(),
            false, metadata, scope.role(), scope.method());
    }

    // shared

    private Outcome runAndValidate(CallScope scope, CallState state, GeneratedProgram program) {
        Outcome raw = runner.run(scope, state, program);
        hydrateTools(scope);
        OutcomeContractValidator.Result result = validator.validate(raw, scope.contract(),
            scope.invocation().args(), scope.invocation().kwargs());
        state.contractApplied = result.applied();
        state.contractPassed = result.applied() ? result.validation().valid() : null;
        state.contractMetadata = result.applied() && !result.validation().valid() ? result.validation().metadata() : Map.of();
        return result.outcome();
    }

    private void hydrateTools(CallScope scope) {
        if (registry == null) {
            return;
        }
        try {
            scope.memory().mergeTools(registry.loadTools());
        } catch (IOException ex) {
            log.warn("Unable to read tool registry {}: {}", registry.path(), ex.getMessage());
        }
    }

    private static Map<String, Object> knownTools(CallScope scope) {
        Object tools = scope.memory().get(RoleMemory.TOOLS_KEY);
        return tools instanceof Map<?, ?> ? JsonValues.asObject(tools) : Map.of();
    }

    private void observeContinuity(CallScope scope, CallState state) {
        if (state.continuity == null && scope.profile() != null && state.code() != null) {
            state.continuity = continuity.evaluate(scope.profile(), scope.method(), state.code());
        }
    }

    private void persist(CallScope scope, CallState state, Outcome outcome, double durationMs) {
        String code = state.code();
        if (code == null || code.isBlank() || state.programRejected) {
            touchRegistry(scope, outcome, code, state);
            return;
        }
        state.artifactChecksum = Hashing.checksum(code);
        if (recorder != null) {
            CallObservation observation = new CallObservation(
                state.frame().traceId(),
                code,
                outcome,
                state.failureClass,
                outcome.errorMessage(),
                state.contractApplied,
                state.contractPassed,
                state.guardrailRetryExhausted,
                state.outcomeRetryExhausted,
                state.continuity
            );
            ArtifactUpdate update = new ArtifactUpdate(scope.role(), scope.method(), code, state.program.dependencies(),
                state.cacheability, scope.contractFingerprint(), generator.model(), state.trigger, triggerFailure(state),
                observation, durationMs);
            try {
                recorder.record(update).ifPresent(recorded -> {
                    state.trigger = recorded.trigger();
                    state.decision = recorded.decision();
                });
            } catch (IOException ex) {
                log.warn("Unable to persist artifact for {}.{}: {}", scope.role(), scope.method(), ex.getMessage());
            }
        }
        touchRegistry(scope, outcome, code, state);
    }

    private void touchRegistry(CallScope scope, Outcome outcome, String code, CallState state) {
        if (registry == null) {
            return;
        }
        try {
            registry.touchUsage(scope.role(), scope.method(), outcome, code, state.decision);
        } catch (IOException ex) {
            log.warn("Unable to update tool registry for {}.{}: {}", scope.role(), scope.method(), ex.getMessage());
        }
    }

    private void recordPatterns(CallScope scope, CallState state, Outcome outcome) {
        ProgramOrigin origin = state.origin();
        if (origin != ProgramOrigin.FRESH && origin != ProgramOrigin.REPAIRED) {
            return;
        }
        state.capabilityPatterns = CapabilityPatterns.labels(state.code());
        if (patterns == null) {
            return;
        }
        try {
            patterns.append(scope.role(),
                PatternMemoryStore.event(scope.role(), scope.method(), state.capabilityPatterns, outcome));
        } catch (IOException ex) {
            log.warn("Unable to record capability patterns for {}.{}: {}", scope.role(), scope.method(), ex.getMessage());
        }
    }

    private static Map<String, Object> triggerFailure(CallState state) {
        AttemptFailure latest = state.latestFailure();
        if (latest == null) {
            return Map.of();
        }
        Map<String, Object> failure = new LinkedHashMap<>();
        failure.put("trigger_stage", latest.stage().wireName());
        failure.put("trigger_error_class", latest.errorClass());
        failure.put("trigger_error_message", latest.errorMessage());
        failure.put("trigger_attempt_id", latest.attemptId());
        return failure;
    }

    private void emit(CallScope scope, CallState state, Outcome outcome, double durationMs) {
        CallRecord record = CallRecord.of(scope.invocation(), outcome, durationMs, state.toMap());
        for (CallRecordSink sink : sinks) {
            try {
                sink.emit(record);
            } catch (IOException | RuntimeException ex) {
                log.warn("Call record sink {} failed for {}.{}: {}", sink.getClass().getSimpleName(), scope.role(),
                    scope.method(), ex.getMessage());
            }
        }
    }
}
