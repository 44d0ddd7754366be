package work.dyncall.engine.guardrail;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code context.tools} is a mapping keyed by tool name; array-style access is rejected.
 */
public final class ContextToolsShapeCheck implements GuardrailCheck {
    public static final String SUBTYPE = "context_tools_shape_misuse";

    private static final Pattern ARRAY_USE = Pattern.compile(
        "context\\s*(?:\\.\\s*tools|\\[\\s*[\"']tools[\"']\\s*\\])\\s*(?:"
            + "\\.\\s*(?:map|filter|forEach|find|findIndex|some|every|reduce|length|push|includes|indexOf)\\b"
            + "|\\[\\s*\\d+\\s*\\])");
    private static final Pattern FOR_OF = Pattern.compile(
        "for\\s*\\(\\s*(?:const|let|var)\\s+[A-Za-z_$][\\w$]*\\s+of\\s+context\\s*(?:\\.\\s*tools|\\[\\s*[\"']tools[\"']\\s*\\])\\s*\\)");

    @Override
    public String name() {
        return "context_tools_shape";
    }

    @Override
    public GuardrailStage stage() {
        return GuardrailStage.PROGRAM;
    }

    @Override
    public Optional<GuardrailViolation> evaluate(GuardrailSubject subject) {
        String source = subject.codeWithoutComments();
        if (!ARRAY_USE.matcher(source).find() && !FOR_OF.matcher(source).find()) {
            return Optional.empty();
        }
        return Optional.of(GuardrailViolation.of(SUBTYPE,
            "context.tools is an object keyed by tool name; do not treat it as an array.",
            "Use `\"tool_name\" in context.tools` for existence checks, or iterate "
                + "`Object.entries(context.tools).forEach(([name, metadata]) => ...)`."));
    }
}
