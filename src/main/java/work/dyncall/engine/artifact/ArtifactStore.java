package work.dyncall.engine.artifact;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.runtime.EngineInfo;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.AtomicFiles;

/**
 * Reads and writes artifact files under {@code <root>/artifacts}.
 */
public final class ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path root;

    public ArtifactStore(Path root) {
        this.root = root;
    }

    public Path root() {
        return root;
    }

    public Path pathFor(String role, String method) {
        return ArtifactPaths.artifactFile(root, role, method);
    }

    /**
     * Loads the artifact for a role and method. A file that is not valid JSON is moved aside and
     * treated as absent; an artifact written with an unknown schema version is ignored.
     */
    public Optional<Artifact> load(String role, String method) throws IOException {
        Path path = pathFor(role, method);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        Map<String, Object> raw;
        try {
            raw = JsonValues.MAPPER.readValue(Files.readString(path), JsonValues.MAP_REF);
        } catch (JsonProcessingException ex) {
            Path moved = AtomicFiles.quarantine(path);
            log.warn("Quarantined corrupt artifact {} ({})", moved.getFileName(), ex.getOriginalMessage());
            return Optional.empty();
        }
        if (raw == null) {
            Path moved = AtomicFiles.quarantine(path);
            log.warn("Quarantined empty artifact {}", moved.getFileName());
            return Optional.empty();
        }
        Artifact artifact = Artifact.fromMap(raw);
        Integer schema = artifact.schemaVersion();
        if (schema != null && schema != EngineInfo.SCHEMA_VERSION) {
            log.debug("Ignoring artifact {}.{} with schema_version={}", role, method, schema);
            return Optional.empty();
        }
        return Optional.of(artifact);
    }

    public void write(Artifact artifact) throws IOException {
        Path path = pathFor(artifact.role(), artifact.methodName());
        AtomicFiles.write(path, JsonValues.PRETTY.writeValueAsString(artifact.toMap()));
    }
}
