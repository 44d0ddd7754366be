package work.dyncall.engine.artifact;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.runtime.EngineInfo;
import work.dyncall.engine.runtime.JsonValues;
import work.dyncall.engine.shared.Hashing;

/**
 * Reuse gate for persisted programs: cacheability, runtime and contract compatibility, checksum
 * integrity and health. Under promotion enforcement the version is picked by lifecycle state.
 */
public final class ArtifactSelector {
    private static final Logger log = LoggerFactory.getLogger(ArtifactSelector.class);

    private final ArtifactStore store;
    private final boolean enforced;

    public ArtifactSelector(ArtifactStore store, boolean enforced) {
        this.store = store;
        this.enforced = enforced;
    }

    public Optional<SelectedArtifact> select(String role, String method, String contractFingerprint) throws IOException {
        Optional<Artifact> loaded = store.load(role, method);
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        Artifact artifact = loaded.get();
        if (!Cacheability.reusable(artifact, method)) {
            log.debug("Artifact {}.{} is not cacheable ({})", role, method, artifact.cacheabilityReason());
            return Optional.empty();
        }
        SelectedArtifact selected = chooseVersion(artifact);
        if (!compatible(selected, contractFingerprint)) {
            log.debug("Artifact {}.{} rejected by compatibility gate", role, method);
            return Optional.empty();
        }
        if (degraded(selected)) {
            log.debug("Artifact {}.{} version {} is degraded", role, method, selected.checksum());
            return Optional.empty();
        }
        return Optional.of(selected);
    }

    SelectedArtifact chooseVersion(Artifact artifact) {
        LifecycleState currentState = PromotionLifecycle.stateOf(artifact, artifact.codeChecksum());
        Map<String, Object> lifecycle = artifact.lifecycle();
        String incumbent = lifecycle == null ? null : JsonValues.optionalString(lifecycle.get("incumbent_durable_checksum"));
        SelectedArtifact head = new SelectedArtifact(artifact, artifact.code(), artifact.dependencies(),
            artifact.codeChecksum(), currentState, incumbent);
        if (!enforced || lifecycle == null || !(lifecycle.get("versions") instanceof Map<?, ?> entries)) {
            return head;
        }
        Map<String, Object> payloads = artifact.versions();

        String chosen = null;
        LifecycleState chosenState = null;
        if (incumbent != null && payloads.containsKey(incumbent)
            && PromotionLifecycle.stateOf(artifact, incumbent) == LifecycleState.DURABLE) {
            chosen = incumbent;
            chosenState = LifecycleState.DURABLE;
        } else {
            for (LifecycleState wanted : new LifecycleState[] {LifecycleState.DURABLE, LifecycleState.PROBATION, LifecycleState.CANDIDATE}) {
                for (Object key : entries.keySet()) {
                    String checksum = String.valueOf(key);
                    if (payloads.containsKey(checksum) && PromotionLifecycle.stateOf(artifact, checksum) == wanted) {
                        chosen = checksum;
                        chosenState = wanted;
                        break;
                    }
                }
                if (chosen != null) {
                    break;
                }
            }
        }
        if (chosen == null || !(payloads.get(chosen) instanceof Map<?, ?> payload)) {
            return head;
        }
        Object code = payload.get("code");
        Object deps = payload.get("dependencies");
        return new SelectedArtifact(artifact, code == null ? "" : String.valueOf(code),
            deps instanceof List<?> ? JsonValues.asList(deps) : new ArrayList<>(),
            chosen, chosenState, incumbent);
    }

    static boolean compatible(SelectedArtifact selected, String contractFingerprint) {
        String runtime = selected.artifact().runtimeVersion();
        if (runtime != null && !runtime.equals(EngineInfo.RUNTIME_VERSION)) {
            return false;
        }
        String expected = contractFingerprint == null ? "none" : contractFingerprint;
        if (!Objects.equals(selected.contractFingerprint(), expected)) {
            return false;
        }
        return !selected.code().isBlank() && Hashing.checksum(selected.code()).equals(selected.checksum());
    }

    /** Lifecycle state only gates reuse under enforcement; shadow mode just records it. */
    boolean degraded(SelectedArtifact selected) {
        if (enforced && selected.lifecycleState() == LifecycleState.DEGRADED) {
            return true;
        }
        return selected.artifact().heuristicallyDegraded();
    }
}
