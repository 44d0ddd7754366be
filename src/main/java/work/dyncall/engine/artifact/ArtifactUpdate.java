package work.dyncall.engine.artifact;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to fold one finished call into the stored artifact.
 *
 * @param trigger explicit generation trigger, or {@code null} to derive it from the previous checksum
 * @param triggerFailure failure that preceded this generation ({@code trigger_stage} and friends), may be empty
 */
public record ArtifactUpdate(
    String role,
    String method,
    String code,
    List<Object> dependencies,
    Cacheability cacheability,
    String contractFingerprint,
    String model,
    String trigger,
    Map<String, Object> triggerFailure,
    CallObservation observation,
    double durationMs
) {
}
