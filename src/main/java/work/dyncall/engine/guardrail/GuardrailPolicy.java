package work.dyncall.engine.guardrail;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, pluggable list of guardrail checks. The first violation for a stage wins.
 */
public final class GuardrailPolicy {
    private static final Logger log = LoggerFactory.getLogger(GuardrailPolicy.class);

    private final List<GuardrailCheck> checks;

    public GuardrailPolicy(List<GuardrailCheck> checks) {
        this.checks = List.copyOf(Objects.requireNonNull(checks, "checks"));
    }

    public static GuardrailPolicy defaults() {
        return new GuardrailPolicy(List.of(
            new DelegatedMemberMutationCheck(),
            new ContextToolsShapeCheck(),
            new HardcodedFallbackCheck(),
            new ExternalProvenanceCheck(),
            new RegistryIntegrityCheck()
        ));
    }

    public GuardrailPolicy with(GuardrailCheck check) {
        List<GuardrailCheck> extended = new ArrayList<>(checks);
        extended.add(Objects.requireNonNull(check, "check"));
        return new GuardrailPolicy(extended);
    }

    public List<GuardrailCheck> checks() {
        return checks;
    }

    public Optional<GuardrailViolation> evaluate(GuardrailStage stage, GuardrailSubject subject) {
        for (GuardrailCheck check : checks) {
            if (check.stage() != stage) {
                continue;
            }
            Optional<GuardrailViolation> violation = check.evaluate(subject);
            if (violation.isPresent()) {
                log.debug("Guardrail {} rejected {}.{}: {}", check.name(), subject.role(), subject.method(), violation.get().message());
                return violation;
            }
        }
        return Optional.empty();
    }
}
