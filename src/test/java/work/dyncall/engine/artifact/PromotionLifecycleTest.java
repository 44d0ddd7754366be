package work.dyncall.engine.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.dyncall.engine.artifact.ArtifactFixtures.failed;
import static work.dyncall.engine.artifact.ArtifactFixtures.ok;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.shared.Hashing;

class PromotionLifecycleTest {
    private static final String CODE = "return 1;";

    private static Artifact artifact() {
        Artifact artifact = Artifact.template(ArtifactFixtures.ROLE, ArtifactFixtures.METHOD, "none", "m");
        artifact.put("code", CODE);
        artifact.put("code_checksum", Hashing.checksum(CODE));
        return artifact;
    }

    private static PromotionDecision observe(PromotionLifecycle lifecycle, Artifact artifact, CallObservation observation) {
        ArtifactMetrics.record(artifact, observation);
        return lifecycle.evaluate(artifact, observation, "2026-01-01T00:00:00Z").orElseThrow();
    }

    @Test
    void candidateBootstrapsIntoProbationThenPromotes() {
        var lifecycle = new PromotionLifecycle(ArtifactFixtures.quickPolicy(3, 2), true, false);
        Artifact artifact = artifact();

        assertEquals(LifecycleState.PROBATION, observe(lifecycle, artifact, ok("s1", CODE)).state());
        assertEquals(PromotionDecision.CONTINUE_PROBATION, observe(lifecycle, artifact, ok("s2", CODE)).decision());
        PromotionDecision promoted = observe(lifecycle, artifact, ok("s1", CODE));

        assertEquals(LifecycleState.DURABLE, promoted.state());
        assertEquals(PromotionDecision.PROMOTE, promoted.decision());
        assertEquals(artifact.codeChecksum(), artifact.lifecycle().get("incumbent_durable_checksum"));
    }

    @Test
    void durableDegradesOnSustainedRegressionAndRecoversOnFreshEvidence() {
        var lifecycle = new PromotionLifecycle(ArtifactFixtures.quickPolicy(3, 2), true, false);
        Artifact artifact = artifact();
        observe(lifecycle, artifact, ok("s1", CODE));
        observe(lifecycle, artifact, ok("s2", CODE));
        observe(lifecycle, artifact, ok("s1", CODE));

        PromotionDecision last = null;
        for (int i = 0; i < 5; i++) {
            last = observe(lifecycle, artifact, failed("s3", CODE));
        }
        assertEquals(LifecycleState.DEGRADED, last.state());
        assertEquals(PromotionDecision.DEGRADE, last.decision());

        assertEquals(PromotionDecision.HOLD, observe(lifecycle, artifact, ok("s4", CODE)).decision());
        assertEquals(LifecycleState.DEGRADED, observe(lifecycle, artifact, ok("s5", CODE)).state());
        PromotionDecision recovered = observe(lifecycle, artifact, ok("s4", CODE));

        assertEquals(LifecycleState.DURABLE, recovered.state());
        assertTrue(recovered.rationale().containsKey("recovery_window"));
    }

    @Test
    void enforcementDegradesProbationOnFirstError() {
        var lifecycle = new PromotionLifecycle(ArtifactFixtures.quickPolicy(3, 2), true, true);
        Artifact artifact = artifact();
        observe(lifecycle, artifact, ok("s1", CODE));

        PromotionDecision decision = observe(lifecycle, artifact, failed("s2", CODE));

        assertEquals(LifecycleState.DEGRADED, decision.state());
        assertEquals(true, decision.rationale().get("enforced_immediate_regression"));
    }

    @Test
    void stateOnlyMovesAlongAllowedTransitions() {
        var lifecycle = new PromotionLifecycle(ArtifactFixtures.quickPolicy(2, 1), true, false);
        Artifact artifact = artifact();
        LifecycleState previous = LifecycleState.CANDIDATE;
        List<CallObservation> observations = List.of(
            ok("a", CODE), failed("a", CODE), ok("b", CODE), ok("b", CODE), failed("c", CODE),
            failed("c", CODE), failed("c", CODE), failed("c", CODE), ok("d", CODE), ok("d", CODE));
        for (CallObservation observation : observations) {
            PromotionDecision decision = observe(lifecycle, artifact, observation);
            assertEquals(previous, decision.previousState());
            assertTrue(allowed(previous, decision.state()), previous + " -> " + decision.state());
            previous = decision.state();
        }
    }

    @Test
    void shadowModeOffSkipsEvaluation() {
        var lifecycle = new PromotionLifecycle(PromotionPolicy.defaults(), false, false);
        Artifact artifact = artifact();
        assertTrue(lifecycle.evaluate(artifact, ok("s1", CODE), "now").isEmpty());
        assertNull(artifact.lifecycle());
        assertNull(PromotionLifecycle.stateOf(artifact, artifact.codeChecksum()));
    }

    @Test
    void ledgerRecordsEveryEvaluation() {
        var lifecycle = new PromotionLifecycle(PromotionPolicy.defaults(), true, false);
        Artifact artifact = artifact();
        observe(lifecycle, artifact, ok("s1", CODE));
        observe(lifecycle, artifact, ok("s2", CODE));

        @SuppressWarnings("unchecked")
        Map<String, Object> ledger = (Map<String, Object>) artifact.lifecycle().get("shadow_ledger");
        assertEquals(2, ((List<?>) ledger.get("evaluations")).size());
    }

    private static boolean allowed(LifecycleState from, LifecycleState to) {
        if (from == to) {
            return true;
        }
        return switch (from) {
            case CANDIDATE -> to == LifecycleState.PROBATION;
            case PROBATION -> to == LifecycleState.DURABLE || to == LifecycleState.DEGRADED;
            case DURABLE -> to == LifecycleState.DEGRADED;
            case DEGRADED -> to == LifecycleState.DURABLE;
        };
    }
}
