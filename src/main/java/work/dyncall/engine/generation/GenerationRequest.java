package work.dyncall.engine.generation;

import java.time.Duration;
import java.util.Map;

/**
 * One request to the code-generating service.
 *
 * @param toolSchema JSON schema of the expected payload ({@code code}, {@code dependencies}, hints)
 * @param attempt 1-based attempt number within the invalid-payload retry loop
 */
public record GenerationRequest(
    String role,
    String method,
    String model,
    String systemPrompt,
    String userPrompt,
    Map<String, Object> toolSchema,
    Duration timeout,
    int attempt
) {
}
