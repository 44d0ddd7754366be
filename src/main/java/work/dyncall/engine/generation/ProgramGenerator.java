package work.dyncall.engine.generation;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.failure.FailureNormalizer;
import work.dyncall.engine.sandbox.ExecutionSandbox;

/**
 * Asks the code generator for a program, retrying invalid payloads up to {@code maxAttempts} times.
 */
public final class ProgramGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProgramGenerator.class);

    private final CodeGenerator generator;
    private final String model;
    private final int maxAttempts;
    private final Duration timeout;

    public ProgramGenerator(CodeGenerator generator, String model, int maxAttempts, Duration timeout) {
        this.generator = Objects.requireNonNull(generator, "generator");
        this.model = model;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("max_generation_attempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.timeout = timeout;
    }

    public String model() {
        return model;
    }

    public record Generated(GeneratedProgram program, int attempt) {}

    /**
     * @param onAttempt notified with the 1-based attempt number before each request
     * @throws DynamicCallException the last failure once every attempt produced an invalid payload
     */
    public Generated generate(String role, String method, String systemPrompt, String userPrompt, IntConsumer onAttempt) {
        DynamicCallException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (onAttempt != null) {
                onAttempt.accept(attempt);
            }
            String prompt = PromptComposer.invalidPayloadRetry(userPrompt, attempt, maxAttempts,
                lastError == null ? null : lastError.getMessage());
            try {
                Map<String, Object> payload = generator.generate(new GenerationRequest(
                    role, method, model, systemPrompt, prompt, PromptComposer.toolSchema(), timeout, attempt));
                GeneratedProgram program = GeneratedProgram.fromPayload(role, method, payload);
                ExecutionSandbox.checkSyntax(role, method, program.code());
                return new Generated(program, attempt);
            } catch (DynamicCallException ex) {
                if (ex.type() == ErrorType.INVALID_DEPENDENCY_MANIFEST) {
                    throw ex;
                }
                lastError = ex;
            } catch (RuntimeException ex) {
                lastError = new DynamicCallException(ErrorType.PROVIDER,
                    "Generator failed for " + role + "." + method + ": " + FailureNormalizer.messageOf(ex), ex);
            }
            if (attempt < maxAttempts) {
                log.debug("Generator output invalid for {}.{}, retrying ({}/{}): {}", role, method, attempt, maxAttempts,
                    lastError.getMessage());
            }
        }
        throw lastError;
    }
}
