package work.dyncall.engine.sandbox;

/**
 * Inert stand-in for a script function that escaped the sandbox as part of a value.
 */
public record ScriptFunctionRef(String source) implements ExecutableReference {
    @Override
    public String describe() {
        return "function";
    }
}
