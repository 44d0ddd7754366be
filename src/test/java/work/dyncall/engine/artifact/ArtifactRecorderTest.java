package work.dyncall.engine.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.dyncall.engine.artifact.ArtifactFixtures.METHOD;
import static work.dyncall.engine.artifact.ArtifactFixtures.failed;
import static work.dyncall.engine.artifact.ArtifactFixtures.ok;
import static work.dyncall.engine.artifact.ArtifactFixtures.update;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactRecorderTest {
    @TempDir
    Path toolstore;

    private ArtifactRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new ArtifactRecorder(new ArtifactStore(toolstore), new PromotionLifecycle(PromotionPolicy.defaults(), true, false));
    }

    @Test
    void firstRecordIsInitialForge() throws Exception {
        var recorded = recorder.record(update("return 1;", ok("t1", "return 1;"))).orElseThrow();

        assertEquals(ArtifactRecorder.INITIAL_FORGE, recorded.trigger());
        assertEquals(1, recorded.artifact().successCount());
        assertEquals(1, recorded.artifact().history().size());
        assertTrue(recorded.artifact().cacheable());
        assertEquals(LifecycleState.PROBATION, recorded.decision().state());
    }

    @Test
    void sameCodeAccumulatesWithoutNewHistory() throws Exception {
        recorder.record(update("return 1;", ok("t1", "return 1;")));
        var second = recorder.record(update("return 1;", ok("t2", "return 1;"))).orElseThrow();

        assertEquals(2, second.artifact().successCount());
        assertEquals(1, second.artifact().history().size());
    }

    @Test
    void newCodeLinksToParentGeneration() throws Exception {
        var first = recorder.record(update("return 1;", ok("t1", "return 1;"))).orElseThrow();
        var second = recorder.record(update("return 2;", ok("t2", "return 2;"))).orElseThrow();

        assertEquals(ArtifactRecorder.REGENERATE_NEW_CODE, second.trigger());
        var history = second.artifact().history();
        assertEquals(2, history.size());
        assertEquals(first.artifact().history().get(0).get("id"), history.get(0).get("parent_id"));
    }

    @Test
    void historyIsCappedAndVersionsArePruned() throws Exception {
        for (int i = 0; i < 6; i++) {
            String code = "return " + i + ";";
            recorder.record(update(code, ok("t" + i, code)));
        }
        Artifact artifact = new ArtifactStore(toolstore).load(ArtifactFixtures.ROLE, METHOD).orElseThrow();

        assertEquals(Artifact.MAX_HISTORY, artifact.history().size());
        Set<String> referenced = new HashSet<>();
        artifact.history().forEach(entry -> referenced.add(String.valueOf(entry.get("code_checksum"))));
        Map<String, Object> lifecycle = artifact.lifecycle();
        Object incumbent = lifecycle == null ? null : lifecycle.get("incumbent_durable_checksum");
        if (incumbent != null) {
            referenced.add(String.valueOf(incumbent));
        }
        assertTrue(referenced.containsAll(artifact.versions().keySet()));
        assertTrue(artifact.versions().containsKey(artifact.codeChecksum()));
    }

    @Test
    void repairsCountUntilRegeneration() throws Exception {
        recorder.record(update("return 1;", failed("t1", "return 1;")));
        for (int i = 2; i <= 4; i++) {
            String code = "return " + i + ";";
            recorder.record(update(METHOD, code, "repair:adaptive_failure", ok("t" + i, code)));
        }
        Artifact repaired = new ArtifactStore(toolstore).load(ArtifactFixtures.ROLE, METHOD).orElseThrow();
        assertEquals(3, repaired.repairCountSinceRegen());
        assertFalse(RepairPlanner.budgetAvailable(repaired));
        assertEquals(RepairPlanner.BUDGET_EXHAUSTED_TRIGGER, RepairPlanner.regenerationTrigger(repaired));

        var regenerated = recorder.record(update(METHOD, "return 9;", RepairPlanner.BUDGET_EXHAUSTED_TRIGGER, ok("t9", "return 9;")))
            .orElseThrow();
        assertEquals(0, regenerated.artifact().repairCountSinceRegen());
    }

    @Test
    void triggerFailureIsStoredOnHistoryEntry() throws Exception {
        var update = new ArtifactUpdate(ArtifactFixtures.ROLE, METHOD, "return 1;", null, null, "none", "m",
            "regenerate:persisted_failure", Map.of("trigger_stage", "execution", "trigger_error_class", "adaptive"),
            ok("t1", "return 1;"), 2.0);
        var recorded = recorder.record(update).orElseThrow();

        Map<String, Object> entry = recorded.artifact().history().get(0);
        assertEquals("regenerate:persisted_failure", entry.get("trigger"));
        assertEquals("execution", entry.get("trigger_stage"));
    }

    @Test
    void failuresAreCountedByClass() throws Exception {
        var recorded = recorder.record(update("return 1;", failed("t1", "return 1;"))).orElseThrow();
        Artifact artifact = recorded.artifact();
        assertEquals(1, artifact.failureCount());
        assertEquals(1, artifact.counter("adaptive_failure_count"));
        assertEquals("adaptive", artifact.lastFailureClass());
        assertEquals(1.0, artifact.recentFailureRate());
    }

    @Test
    void blankCodeIsNotPersisted() throws Exception {
        assertTrue(recorder.record(update("  ", ok("t1", ""))).isEmpty());
    }

    @Test
    void dynamicDispatchMethodsAreStoredAsNonCacheable() throws Exception {
        var recorded = recorder.record(update("ask", "return 1;", null, ok("t1", "return 1;"))).orElseThrow();
        assertFalse(recorded.artifact().cacheable());
        assertEquals(Cacheability.DYNAMIC_DISPATCH_REASON, recorded.artifact().cacheabilityReason());
    }
}
