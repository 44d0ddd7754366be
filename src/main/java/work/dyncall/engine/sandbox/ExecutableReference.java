package work.dyncall.engine.sandbox;

/**
 * Marks values that stand for something callable. They are never plain data and must not be stored in
 * shared registries or sent across the worker boundary.
 */
public interface ExecutableReference {
    String describe();
}
