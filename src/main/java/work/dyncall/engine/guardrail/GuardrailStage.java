package work.dyncall.engine.guardrail;

/** When a check runs: before execution on the program text, or after execution on its outcome. */
public enum GuardrailStage {
    PROGRAM,
    OUTCOME
}
