package work.dyncall.engine.artifact;

import java.util.List;

/**
 * The program version chosen for reuse together with the stored artifact it came from.
 *
 * @param lifecycleState state of the chosen version, {@code null} when it was never evaluated
 */
public record SelectedArtifact(
    Artifact artifact,
    String code,
    List<Object> dependencies,
    String checksum,
    LifecycleState lifecycleState,
    String incumbentChecksum
) {
    public String promptVersion() {
        return artifact.promptVersion();
    }

    public String contractFingerprint() {
        return artifact.contractFingerprint();
    }
}
