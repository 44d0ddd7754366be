package work.dyncall.engine.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.dyncall.engine.shared.Hashing;

class ArtifactStoreTest {
    @TempDir
    Path toolstore;

    @Test
    void writesAndLoadsArtifacts() throws Exception {
        var store = new ArtifactStore(toolstore);
        Artifact artifact = Artifact.template("Counter", "increment", "none", "m");
        artifact.put("code", "return 1;");
        artifact.put("code_checksum", Hashing.checksum("return 1;"));
        store.write(artifact);

        Artifact loaded = store.load("Counter", "increment").orElseThrow();
        assertEquals("return 1;", loaded.code());
        assertTrue(loaded.checksumValid());
        assertTrue(Files.isRegularFile(store.pathFor("Counter", "increment")));
    }

    @Test
    void corruptFilesAreQuarantined() throws Exception {
        var store = new ArtifactStore(toolstore);
        Path path = store.pathFor("Counter", "increment");
        Files.createDirectories(path.getParent());
        Files.writeString(path, "{ not json");

        assertTrue(store.load("Counter", "increment").isEmpty());
        assertFalse(Files.exists(path));
        try (Stream<Path> siblings = Files.list(path.getParent())) {
            assertTrue(siblings.anyMatch(p -> p.getFileName().toString().contains(".corrupt-")));
        }
    }

    @Test
    void unknownSchemaVersionIsIgnored() throws Exception {
        var store = new ArtifactStore(toolstore);
        Artifact artifact = Artifact.template("Counter", "increment", "none", "m");
        artifact.put("schema_version", 99);
        store.write(artifact);

        assertTrue(store.load("Counter", "increment").isEmpty());
    }

    @Test
    void tamperedCodeFailsChecksum() {
        Artifact artifact = Artifact.template("Counter", "increment", "none", "m");
        artifact.put("code", "return 2;");
        artifact.put("code_checksum", Hashing.checksum("return 1;"));
        assertFalse(artifact.checksumValid());
    }

    @Test
    void pathSegmentsKeepDistinctNamesApart() {
        assertNotEquals(ArtifactPaths.segment("Foo.Bar"), ArtifactPaths.segment("foo_bar"));
        assertTrue(ArtifactPaths.segment("x".repeat(100)).length() <= 48 + 9);
    }
}
