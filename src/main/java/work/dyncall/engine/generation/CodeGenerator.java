package work.dyncall.engine.generation;

import java.util.Map;

/**
 * The code-generating service. Implementations return the raw payload: {@code code} and optional
 * {@code dependencies}, {@code cacheable}, {@code cacheability_reason} and {@code input_sensitive}.
 * Transport failures are reported as {@code DynamicCallException} of type {@code provider} or
 * {@code timeout}; malformed payloads are returned as-is and rejected by {@link GeneratedProgram}.
 */
@FunctionalInterface
public interface CodeGenerator {
    Map<String, Object> generate(GenerationRequest request);
}
