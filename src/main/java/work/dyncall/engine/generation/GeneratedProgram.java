package work.dyncall.engine.generation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.dyncall.engine.artifact.Cacheability;
import work.dyncall.engine.dependency.DependencyManifest;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.runtime.JsonValues;

/**
 * A validated program: non-blank source, its declared dependencies and the normalized manifest,
 * plus the generator's optional cacheability hints.
 */
public record GeneratedProgram(
    String code,
    List<Object> dependencies,
    DependencyManifest manifest,
    Boolean cacheableHint,
    String cacheabilityReasonHint,
    Boolean inputSensitiveHint,
    ProgramOrigin origin
) {
    public static GeneratedProgram fromPayload(String role, String method, Object payload) {
        if (!(payload instanceof Map<?, ?> raw)) {
            String actual = payload == null ? "null" : payload.getClass().getSimpleName();
            throw new DynamicCallException(ErrorType.INVALID_CODE,
                "Generator returned invalid program for " + role + "." + method + " (got " + actual + "; expected object)");
        }
        Object code = raw.get("code");
        validateCode(role, method, code);
        Object dependencies = raw.get("dependencies");
        DependencyManifest manifest = DependencyManifest.normalize(dependencies);
        return new GeneratedProgram(
            String.valueOf(code),
            dependencies instanceof List<?> ? JsonValues.asList(dependencies) : new ArrayList<>(),
            manifest,
            raw.get("cacheable") instanceof Boolean flag ? flag : null,
            JsonValues.optionalString(raw.get("cacheability_reason")),
            raw.get("input_sensitive") instanceof Boolean flag ? flag : null,
            ProgramOrigin.FRESH
        );
    }

    /** Program rebuilt from a stored artifact version. */
    public static GeneratedProgram persisted(String code, List<Object> dependencies) {
        return new GeneratedProgram(code, dependencies == null ? new ArrayList<>() : dependencies,
            DependencyManifest.normalize(dependencies), null, null, null, ProgramOrigin.PERSISTED);
    }

    private static void validateCode(String role, String method, Object code) {
        if (code instanceof String text && !text.isBlank()) {
            return;
        }
        String detail;
        if (code == null) {
            detail = "generator returned null `code`";
        } else if (!(code instanceof String)) {
            detail = "generator returned " + code.getClass().getSimpleName() + " for `code`";
        } else {
            detail = "generator returned blank `code`";
        }
        throw new DynamicCallException(ErrorType.INVALID_CODE,
            "Generator returned invalid code for " + role + "." + method + " (" + detail + "; expected non-empty string)");
    }

    public GeneratedProgram withOrigin(ProgramOrigin value) {
        return new GeneratedProgram(code, dependencies, manifest, cacheableHint, cacheabilityReasonHint, inputSensitiveHint, value);
    }

    public Cacheability cacheability(String method) {
        return Cacheability.resolve(method, cacheableHint, cacheabilityReasonHint, inputSensitiveHint);
    }
}
