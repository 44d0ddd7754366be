package work.dyncall.engine.guardrail;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rejects programs that (re)define members on a delegated handle or on {@code api} itself instead of
 * calling through {@code handle.call(...)}.
 */
public final class DelegatedMemberMutationCheck implements GuardrailCheck {
    public static final String SUBTYPE = "singleton_method_mutation";

    private static final Pattern HANDLE_BINDING = Pattern.compile(
        "\\b(?:const|let|var)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*api\\s*\\.\\s*(?:delegate|tool)\\s*"
            + "\\((?:[^()]|\\([^()]*\\))*\\)\\s*(?:;|$)",
        Pattern.MULTILINE);
    private static final Pattern DIRECT_MUTATION = Pattern.compile(
        "(?:\\bapi|api\\s*\\.\\s*(?:delegate|tool)\\s*\\([^)]*\\))\\s*(?:\\.\\s*[A-Za-z_$][\\w$]*|\\[[^\\]]+\\])\\s*=(?!=)");
    private static final Pattern DEFINE_PROPERTY = Pattern.compile(
        "Object\\s*\\.\\s*(?:defineProperty|defineProperties|assign|setPrototypeOf)\\s*\\(\\s*([A-Za-z_$][\\w$]*)");

    @Override
    public String name() {
        return "delegated_member_mutation";
    }

    @Override
    public GuardrailStage stage() {
        return GuardrailStage.PROGRAM;
    }

    @Override
    public Optional<GuardrailViolation> evaluate(GuardrailSubject subject) {
        String source = subject.codeWithoutComments();
        Set<String> handles = new LinkedHashSet<>();
        handles.add("api");
        Matcher binding = HANDLE_BINDING.matcher(source);
        while (binding.find()) {
            handles.add(binding.group(1));
        }

        boolean mutated = DIRECT_MUTATION.matcher(source).find();
        for (String handle : handles) {
            if (mutated) break;
            Pattern assignment = Pattern.compile(
                "\\b" + Pattern.quote(handle) + "\\s*(?:\\.\\s*[A-Za-z_$][\\w$]*|\\[[^\\]]+\\])\\s*=(?!=)");
            mutated = assignment.matcher(source).find();
        }
        if (!mutated) {
            Matcher define = DEFINE_PROPERTY.matcher(source);
            while (define.find()) {
                if (handles.contains(define.group(1))) {
                    mutated = true;
                    break;
                }
            }
        }
        if (!mutated) {
            return Optional.empty();
        }
        return Optional.of(GuardrailViolation.of(SUBTYPE,
            "Defining methods on delegated handles is not supported; use tool/delegate invocation paths.",
            "Materialize tools with api.tool(\"name\") or api.delegate(\"name\", ...), then invoke them with "
                + ".call(method, args, kwargs); do not assign members on handles or on api."));
    }
}
