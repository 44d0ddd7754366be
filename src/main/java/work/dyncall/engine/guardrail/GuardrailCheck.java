package work.dyncall.engine.guardrail;

import java.util.Optional;

/**
 * One structural or behavioural check. Checks never throw; they report a violation or nothing.
 */
public interface GuardrailCheck {
    String name();

    GuardrailStage stage();

    Optional<GuardrailViolation> evaluate(GuardrailSubject subject);
}
