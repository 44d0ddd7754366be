package work.dyncall.engine.artifact;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.dyncall.engine.runtime.EngineInfo;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Hashing;
import work.dyncall.engine.shared.Timestamps;

/**
 * Persists the program that served a call: payload, metrics, promotion evaluation, generation history
 * and the per-checksum version payloads.
 */
public final class ArtifactRecorder {
    public static final String INITIAL_FORGE = "initial_forge";
    public static final String REGENERATE_NEW_CODE = "regenerate:new_code";
    public static final String REPAIR_PREFIX = "repair:";
    public static final String REGENERATE_PREFIX = "regenerate:";

    private final ArtifactStore store;
    private final PromotionLifecycle lifecycle;

    public ArtifactRecorder(ArtifactStore store, PromotionLifecycle lifecycle) {
        this.store = store;
        this.lifecycle = lifecycle;
    }

    public record Recorded(Artifact artifact, String trigger, PromotionDecision decision) {}

    /** Returns empty when there is no code to persist. */
    public Optional<Recorded> record(ArtifactUpdate update) throws IOException {
        if (update.code() == null || update.code().isBlank()) {
            return Optional.empty();
        }
        String timestamp = Timestamps.now();
        Artifact artifact = store.load(update.role(), update.method())
            .orElseGet(() -> Artifact.template(update.role(), update.method(), update.contractFingerprint(), update.model()));
        String previousChecksum = artifact.codeChecksum();
        String checksum = Hashing.checksum(update.code());

        updatePayload(artifact, update, checksum, timestamp);
        ArtifactMetrics.record(artifact, update.observation());
        PromotionDecision decision = lifecycle == null
            ? null
            : lifecycle.evaluate(artifact, update.observation(), timestamp).orElse(null);
        String trigger = trigger(update.trigger(), previousChecksum);
        updateHistory(artifact, update, trigger, previousChecksum, checksum, timestamp);
        updateVersions(artifact, update, checksum, timestamp);

        artifact.put("last_used_at", timestamp);
        artifact.put("last_duration_ms", Math.round(update.durationMs() * 10.0) / 10.0);
        store.write(artifact);
        return Optional.of(new Recorded(artifact, trigger, decision));
    }

    static String trigger(String explicit, String previousChecksum) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit;
        }
        return previousChecksum == null ? INITIAL_FORGE : REGENERATE_NEW_CODE;
    }

    private static void updatePayload(Artifact artifact, ArtifactUpdate update, String checksum, String timestamp) {
        Cacheability cacheability = update.cacheability() == null
            ? Cacheability.resolve(update.method(), null, null, null)
            : update.cacheability();
        artifact.put("schema_version", EngineInfo.SCHEMA_VERSION);
        artifact.put("role", update.role());
        artifact.put("method_name", update.method());
        artifact.put("contract_fingerprint", update.contractFingerprint() == null ? "none" : update.contractFingerprint());
        artifact.put("prompt_version", EngineInfo.PROMPT_VERSION);
        artifact.put("runtime_version", EngineInfo.RUNTIME_VERSION);
        artifact.put("model", update.model());
        artifact.put("cacheable", cacheability.cacheable());
        artifact.put("cacheability_reason", cacheability.reason());
        artifact.put("input_sensitive", cacheability.inputSensitive());
        artifact.put("code_checksum", checksum);
        artifact.put("code", update.code());
        artifact.put("dependencies", update.dependencies() == null ? new ArrayList<>() : new ArrayList<>(update.dependencies()));
        if (artifact.get("created_at") == null) {
            artifact.put("created_at", timestamp);
        }
    }

    private static void updateHistory(Artifact artifact, ArtifactUpdate update, String trigger,
                                      String previousChecksum, String checksum, String timestamp) {
        if (trigger.startsWith(REPAIR_PREFIX)) {
            artifact.increment("repair_count_since_regen");
            artifact.put("last_repaired_at", timestamp);
        } else if (trigger.startsWith(REGENERATE_PREFIX) || INITIAL_FORGE.equals(trigger)) {
            artifact.put("repair_count_since_regen", 0);
        }
        if (checksum.equals(previousChecksum)) {
            return;
        }
        List<Map<String, Object>> history = artifact.history();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", "gen-" + Hashing.randomHex(6));
        entry.put("parent_id", history.isEmpty() ? null : history.get(0).get("id"));
        entry.put("trigger", trigger);
        entry.put("created_at", timestamp);
        entry.put("code_checksum", checksum);
        entry.put("prompt_version", EngineInfo.PROMPT_VERSION);
        entry.put("runtime_version", EngineInfo.RUNTIME_VERSION);
        entry.put("model", update.model());
        if (update.triggerFailure() != null) {
            entry.putAll(update.triggerFailure());
        }
        history.add(0, entry);
        while (history.size() > Artifact.MAX_HISTORY) {
            history.remove(history.size() - 1);
        }
    }

    /**
     * Keeps the code of every version still referenced by the head, the durable incumbent or the
     * generation history, so enforced selection can fall back to it.
     */
    private static void updateVersions(Artifact artifact, ArtifactUpdate update, String checksum, String timestamp) {
        Map<String, Object> versions = artifact.versions();
        if (!(versions.get(checksum) instanceof Map)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("code", update.code());
            payload.put("dependencies", update.dependencies() == null ? new ArrayList<>() : new ArrayList<>(update.dependencies()));
            payload.put("created_at", timestamp);
            versions.put(checksum, payload);
        }
        Set<String> referenced = new HashSet<>();
        referenced.add(checksum);
        Map<String, Object> root = artifact.lifecycle();
        if (root != null) {
            String incumbent = JsonValues.optionalString(root.get("incumbent_durable_checksum"));
            if (incumbent != null) {
                referenced.add(incumbent);
            }
        }
        for (Map<String, Object> entry : artifact.history()) {
            String historical = JsonValues.optionalString(entry.get("code_checksum"));
            if (historical != null) {
                referenced.add(historical);
            }
        }
        versions.keySet().retainAll(referenced);
    }
}
