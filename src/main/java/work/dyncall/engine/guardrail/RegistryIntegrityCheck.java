package work.dyncall.engine.guardrail;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.sandbox.ExecutableReference;

/**
 * {@code context.tools} must stay a mapping of plain metadata; executable values (functions, handles,
 * outcomes) stored anywhere inside it are reported with their paths.
 */
public final class RegistryIntegrityCheck implements GuardrailCheck {
    public static final String SUBTYPE = "tool_registry_integrity";
    private static final String ROOT = "context.tools";

    @Override
    public String name() {
        return "registry_integrity";
    }

    @Override
    public GuardrailStage stage() {
        return GuardrailStage.OUTCOME;
    }

    @Override
    public Optional<GuardrailViolation> evaluate(GuardrailSubject subject) {
        Object registry = subject.memory().get("tools");
        if (registry == null) {
            return Optional.empty();
        }
        if (!(registry instanceof Map)) {
            return Optional.of(GuardrailViolation.of(SUBTYPE, ROOT + " must be an object keyed by tool name", null));
        }
        List<String> paths = new ArrayList<>();
        collectExecutablePaths(registry, ROOT, paths);
        if (paths.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(GuardrailViolation.of(SUBTYPE,
            "Tool registry metadata cannot store executable objects (" + subject.role() + "." + subject.method() + "): "
                + String.join(", ", paths),
            "Keep context.tools entries as plain metadata (strings, numbers, lists, objects); "
                + "obtain handles with api.tool(name) at call time instead of storing them."));
    }

    static void collectExecutablePaths(Object value, String path, List<String> paths) {
        if (value instanceof ExecutableReference || value instanceof Outcome) {
            paths.add(path);
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((key, entry) -> collectExecutablePaths(entry, path + "[\"" + key + "\"]", paths));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                collectExecutablePaths(list.get(i), path + "[" + i + "]", paths);
            }
        }
    }
}
