package work.dyncall.engine.guardrail;

import java.util.Map;
import java.util.Objects;
import work.dyncall.engine.api.Outcome;

/**
 * What a guardrail check looks at. {@code outcome} and {@code memory} are only set for the outcome stage.
 */
public record GuardrailSubject(String role, String method, String code, Outcome outcome, Map<String, Object> memory) {
    public GuardrailSubject {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(method, "method");
        code = code == null ? "" : code;
        memory = memory == null ? Map.of() : memory;
    }

    public static GuardrailSubject program(String role, String method, String code) {
        return new GuardrailSubject(role, method, code, null, Map.of());
    }

    public static GuardrailSubject outcome(String role, String method, String code, Outcome outcome, Map<String, Object> memory) {
        return new GuardrailSubject(role, method, code, outcome, memory);
    }

    /** Program text with {@code //} line comments removed. */
    public String codeWithoutComments() {
        StringBuilder out = new StringBuilder();
        for (String line : code.split("\n", -1)) {
            int idx = line.indexOf("//");
            out.append(idx >= 0 ? line.substring(0, idx) : line).append('\n');
        }
        return out.toString();
    }
}
