package work.dyncall.engine.runtime;

/**
 * Executable handler registered in the dispatch table. The returned value is normalized into an
 * {@code Outcome} by the caller.
 */
@FunctionalInterface
public interface MethodHandler {
    Object invoke(Invocation invocation) throws Exception;
}
