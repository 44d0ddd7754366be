package work.dyncall.engine.artifact;

import java.util.Map;
import work.dyncall.engine.failure.FailureClass;

/**
 * Health accounting applied to an artifact after each call it served.
 */
public final class ArtifactMetrics {
    private ArtifactMetrics() {}

    public static void record(Artifact artifact, CallObservation observation) {
        String checksum = artifact.codeChecksum();
        if (checksum != null) {
            Map<String, Object> scorecard = artifact.scorecardFor(checksum);
            if (scorecard == null) {
                scorecard = Scorecard.template(artifact.role(), artifact.methodName(), checksum);
                artifact.scorecards().put(checksum, scorecard);
            }
            Scorecard.record(scorecard, observation);
        }

        if (observation.ok()) {
            artifact.increment("success_count");
        } else {
            artifact.increment("failure_count");
            FailureClass failureClass = failureClassOf(observation);
            artifact.increment(counterKey(failureClass));
            artifact.put("last_failure_class", failureClass.wireName());
            artifact.put("last_failure_reason", observation.errorMessage());
        }
        int successes = artifact.successCount();
        int failures = artifact.failureCount();
        int total = successes + failures;
        artifact.put("recent_failure_rate", total == 0 ? 0.0 : Scorecard.round4((double) failures / total));
    }

    static FailureClass failureClassOf(CallObservation observation) {
        if (observation.failureClass() != null) {
            return observation.failureClass();
        }
        return FailureClass.classify(observation.outcome() == null ? null : observation.outcome().errorType());
    }

    static String counterKey(FailureClass failureClass) {
        return switch (failureClass) {
            case EXTRINSIC -> "extrinsic_failure_count";
            case ADAPTIVE -> "adaptive_failure_count";
            case INTRINSIC -> "intrinsic_failure_count";
        };
    }
}
