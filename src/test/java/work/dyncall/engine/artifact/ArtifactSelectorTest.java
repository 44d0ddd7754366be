package work.dyncall.engine.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.dyncall.engine.artifact.ArtifactFixtures.METHOD;
import static work.dyncall.engine.artifact.ArtifactFixtures.ROLE;
import static work.dyncall.engine.artifact.ArtifactFixtures.failed;
import static work.dyncall.engine.artifact.ArtifactFixtures.ok;
import static work.dyncall.engine.artifact.ArtifactFixtures.update;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArtifactSelectorTest {
    @TempDir
    Path toolstore;

    private ArtifactStore store;
    private ArtifactRecorder recorder;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(toolstore);
        recorder = new ArtifactRecorder(store, new PromotionLifecycle(ArtifactFixtures.quickPolicy(1, 1), true, false));
    }

    @Test
    void healthyArtifactIsSelected() throws Exception {
        recorder.record(update("return 1;", ok("t1", "return 1;")));

        SelectedArtifact selected = new ArtifactSelector(store, false).select(ROLE, METHOD, "none").orElseThrow();
        assertEquals("return 1;", selected.code());
        assertEquals(LifecycleState.PROBATION, selected.lifecycleState());
    }

    @Test
    void contractChangeBlocksReuse() throws Exception {
        recorder.record(update("return 1;", ok("t1", "return 1;")));
        assertTrue(new ArtifactSelector(store, false).select(ROLE, METHOD, "sha256:other").isEmpty());
    }

    @Test
    void nonCacheableMethodsAreNeverReused() throws Exception {
        recorder.record(update("chat", "return 1;", null, ok("t1", "return 1;")));
        assertTrue(new ArtifactSelector(store, false).select(ROLE, "chat", "none").isEmpty());
    }

    @Test
    void tamperedCodeIsRejected() throws Exception {
        recorder.record(update("return 1;", ok("t1", "return 1;")));
        Artifact artifact = store.load(ROLE, METHOD).orElseThrow();
        artifact.put("code", "return 666;");
        store.write(artifact);

        assertTrue(new ArtifactSelector(store, false).select(ROLE, METHOD, "none").isEmpty());
    }

    @Test
    void heuristicallyDegradedArtifactIsSkipped() throws Exception {
        for (int i = 0; i < 3; i++) {
            recorder.record(update("return 1;", failed("t" + i, "return 1;")));
        }
        assertTrue(new ArtifactSelector(store, false).select(ROLE, METHOD, "none").isEmpty());
    }

    @Test
    void enforcedSelectionPrefersDurableIncumbent() throws Exception {
        recorder.record(update("return 1;", ok("t1", "return 1;")));
        recorder.record(update("return 1;", ok("t2", "return 1;")));
        recorder.record(update("return 2;", ok("t3", "return 2;")));

        SelectedArtifact shadow = new ArtifactSelector(store, false).select(ROLE, METHOD, "none").orElseThrow();
        SelectedArtifact enforced = new ArtifactSelector(store, true).select(ROLE, METHOD, "none").orElseThrow();

        assertEquals("return 2;", shadow.code());
        assertEquals("return 1;", enforced.code());
        assertEquals(LifecycleState.DURABLE, enforced.lifecycleState());
        assertEquals(enforced.checksum(), enforced.incumbentChecksum());
    }

    @Test
    void cacheabilityHintsAreHonoured() {
        assertEquals(false, Cacheability.resolve("host", true, null, null).cacheable());
        assertEquals("generator_declined", Cacheability.resolve("lookup", false, null, null).reason());
        assertEquals(Cacheability.STABLE_METHOD_REASON, Cacheability.resolve("lookup", null, null, null).reason());
    }
}
