package work.dyncall.engine.guardrail;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetch-like programs may not hand a literal {@code fallback_*} list to {@code api.ok}.
 */
public final class HardcodedFallbackCheck implements GuardrailCheck {
    public static final String SUBTYPE = "hardcoded_external_fallback_success";

    private static final Pattern FALLBACK_LITERAL = Pattern.compile("\\b(fallback_[A-Za-z_]\\w*)\\s*=\\s*\\[");

    @Override
    public String name() {
        return "hardcoded_fallback";
    }

    @Override
    public GuardrailStage stage() {
        return GuardrailStage.PROGRAM;
    }

    @Override
    public Optional<GuardrailViolation> evaluate(GuardrailSubject subject) {
        String source = subject.codeWithoutComments();
        if (!ExternalDataFlow.FETCH_LIKE.matcher(source).find()) {
            return Optional.empty();
        }
        Matcher fallback = FALLBACK_LITERAL.matcher(source);
        if (!fallback.find()) {
            return Optional.empty();
        }
        Pattern okFallback = Pattern.compile("\\bapi\\s*\\.\\s*ok\\(\\s*" + Pattern.quote(fallback.group(1)) + "\\s*\\)");
        if (!okFallback.matcher(source).find()) {
            return Optional.empty();
        }
        return Optional.of(GuardrailViolation.of(SUBTYPE,
            "Hardcoded fallback payloads for external-fetch flows must not return api.ok; "
                + "emit low_utility/unsupported_capability instead.",
            "Do not return hardcoded fallback lists through `api.ok`. Return a typed `low_utility` (or "
                + "`unsupported_capability`) error unless the output is derived from actual fetched results."));
    }
}
