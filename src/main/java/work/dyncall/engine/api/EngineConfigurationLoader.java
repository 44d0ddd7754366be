package work.dyncall.engine.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.dyncall.engine.artifact.PromotionPolicy;
import work.dyncall.engine.dependency.DependencyPolicy;
import work.dyncall.engine.execution.AttemptBudgets;
import work.dyncall.engine.generation.CodeGenerator;
import work.dyncall.engine.shared.DurationParser;

/**
 * Reads {@code dyncall.toml} into an {@link EngineConfiguration.Builder}.
 *
 * <pre>
 * [engine]
 * toolstore_root = ".toolstore"
 * model = "default"
 * max_generation_attempts = 2
 * max_delegation_depth = 8
 * generation_timeout = "120s"
 * sandbox_timeout = "30s"
 * continuity_enforced = false
 *
 * [budgets]
 * guardrail_recovery = 1
 * outcome_repair = 1
 * execution_repair = 1
 *
 * [dependencies]
 * env_root = ".toolstore/envs"
 * local_repositories = ["libs"]
 * allowed = ["org.example:lib"]
 * blocked = []
 * source_mode = "public"
 * sources = []
 *
 * [promotion]
 * shadow_mode = true
 * enforced = false
 * min_calls = 10
 * min_sessions = 2
 * min_contract_pass_rate = 0.95
 *
 * [worker]
 * timeout = "30s"
 * max_restarts = 2
 * </pre>
 *
 * Relative paths resolve against the directory holding the file. {@code DYNCALL_TOOLSTORE_ROOT} and
 * {@code DYNCALL_MODEL} override the file.
 */
public final class EngineConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigurationLoader.class);

    public static final String TOOLSTORE_ENV = "DYNCALL_TOOLSTORE_ROOT";
    public static final String MODEL_ENV = "DYNCALL_MODEL";
    public static final Path DEFAULT_TOOLSTORE = Path.of(".toolstore");

    private final Map<String, String> environment;

    public EngineConfigurationLoader() {
        this(System.getenv());
    }

    public EngineConfigurationLoader(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    /** Defaults plus environment overrides, for runs without a configuration file. */
    public EngineConfiguration.Builder defaults(CodeGenerator generator) {
        EngineConfiguration.Builder builder = EngineConfiguration.builder()
            .generator(generator)
            .toolstoreRoot(DEFAULT_TOOLSTORE.toAbsolutePath());
        applyEnvironment(builder, Path.of("").toAbsolutePath());
        return builder;
    }

    public EngineConfiguration.Builder load(Path file, CodeGenerator generator) throws IOException {
        Path absolute = file.toAbsolutePath();
        Path base = absolute.getParent() == null ? Path.of("").toAbsolutePath() : absolute.getParent();
        TomlParseResult toml = Toml.parse(Files.readString(absolute));
        if (toml.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + file + ": " + toml.errors().get(0).toString());
        }
        log.debug("Loading engine configuration from {}", absolute);
        EngineConfiguration.Builder builder = EngineConfiguration.builder()
            .generator(generator)
            .toolstoreRoot(base.resolve(DEFAULT_TOOLSTORE));
        applyEngine(builder, table(toml, "engine"), base);
        applyBudgets(builder, table(toml, "budgets"));
        applyDependencies(builder, table(toml, "dependencies"), base);
        applyPromotion(builder, table(toml, "promotion"));
        applyWorker(builder, table(toml, "worker"));
        applyEnvironment(builder, Path.of("").toAbsolutePath());
        return builder;
    }

    private static void applyEngine(EngineConfiguration.Builder builder, TomlTable engine, Path base) {
        if (engine == null) {
            return;
        }
        String toolstore = engine.getString("toolstore_root");
        if (toolstore != null && !toolstore.isBlank()) {
            builder.toolstoreRoot(base.resolve(toolstore).normalize());
        }
        String model = engine.getString("model");
        if (model != null && !model.isBlank()) {
            builder.model(model.trim());
        }
        Long attempts = engine.getLong("max_generation_attempts");
        if (attempts != null) {
            builder.maxGenerationAttempts(attempts.intValue());
        }
        Long depth = engine.getLong("max_delegation_depth");
        if (depth != null) {
            builder.maxDelegationDepth(depth.intValue());
        }
        Duration generationTimeout = duration(engine, "generation_timeout");
        if (generationTimeout != null) {
            builder.generationTimeout(generationTimeout);
        }
        Duration sandboxTimeout = duration(engine, "sandbox_timeout");
        if (sandboxTimeout != null) {
            builder.sandboxTimeout(sandboxTimeout);
        }
        Boolean continuity = engine.getBoolean("continuity_enforced");
        if (continuity != null) {
            builder.continuityEnforced(continuity);
        }
    }

    private static void applyBudgets(EngineConfiguration.Builder builder, TomlTable budgets) {
        if (budgets == null) {
            return;
        }
        AttemptBudgets defaults = AttemptBudgets.defaults();
        builder.budgets(new AttemptBudgets(
            intOr(budgets, "guardrail_recovery", defaults.guardrailRecovery()),
            intOr(budgets, "outcome_repair", defaults.outcomeRepair()),
            intOr(budgets, "execution_repair", defaults.executionRepair())
        ));
    }

    private static void applyDependencies(EngineConfiguration.Builder builder, TomlTable dependencies, Path base) {
        if (dependencies == null) {
            return;
        }
        String envRoot = dependencies.getString("env_root");
        if (envRoot != null && !envRoot.isBlank()) {
            builder.environmentRoot(base.resolve(envRoot).normalize());
        }
        List<Path> repositories = new ArrayList<>();
        for (String entry : strings(dependencies, "local_repositories")) {
            repositories.add(base.resolve(entry).normalize());
        }
        builder.dependencySources(repositories);
        List<String> allowed = dependencies.contains("allowed") ? strings(dependencies, "allowed") : null;
        builder.dependencyPolicy(new DependencyPolicy(
            allowed,
            strings(dependencies, "blocked"),
            DependencyPolicy.SourceMode.from(dependencies.getString("source_mode")),
            strings(dependencies, "sources")
        ));
    }

    private static void applyPromotion(EngineConfiguration.Builder builder, TomlTable promotion) {
        if (promotion == null) {
            return;
        }
        Boolean shadow = promotion.getBoolean("shadow_mode");
        if (shadow != null) {
            builder.promotionShadowMode(shadow);
        }
        Boolean enforced = promotion.getBoolean("enforced");
        if (enforced != null) {
            builder.promotionEnforced(enforced);
        }
        PromotionPolicy defaults = PromotionPolicy.defaults();
        builder.promotionPolicy(new PromotionPolicy(
            defaults.version(),
            intOr(promotion, "min_calls", defaults.minCalls()),
            intOr(promotion, "min_sessions", defaults.minSessions()),
            doubleOr(promotion, "min_contract_pass_rate", defaults.minContractPassRate()),
            defaults.minRoleProfilePassRate(),
            defaults.maxGuardrailRetryExhausted(),
            defaults.maxOutcomeRetryExhausted(),
            defaults.maxWrongBoundaryCount(),
            defaults.maxProvenanceViolations(),
            defaults.minStateKeyConsistencyRatio()
        ));
    }

    private static void applyWorker(EngineConfiguration.Builder builder, TomlTable worker) {
        if (worker == null) {
            return;
        }
        Duration timeout = duration(worker, "timeout");
        if (timeout != null) {
            builder.workerTimeout(timeout);
        }
        Long restarts = worker.getLong("max_restarts");
        if (restarts != null) {
            builder.workerMaxRestarts(restarts.intValue());
        }
    }

    private void applyEnvironment(EngineConfiguration.Builder builder, Path workingDirectory) {
        String toolstore = environment.get(TOOLSTORE_ENV);
        if (toolstore != null && !toolstore.isBlank()) {
            builder.toolstoreRoot(workingDirectory.resolve(toolstore.trim()).normalize());
        }
        String model = environment.get(MODEL_ENV);
        if (model != null && !model.isBlank()) {
            builder.model(model.trim());
        }
    }

    private static TomlTable table(TomlParseResult toml, String name) {
        return toml.isTable(name) ? toml.getTable(name) : null;
    }

    private static Duration duration(TomlTable table, String key) {
        Object raw = table.get(key);
        if (raw == null) {
            return null;
        }
        if (raw instanceof Long millis) {
            return Duration.ofMillis(millis);
        }
        return DurationParser.parse(String.valueOf(raw)).orElse(null);
    }

    private static int intOr(TomlTable table, String key, int fallback) {
        Long value = table.getLong(key);
        return value == null ? fallback : value.intValue();
    }

    private static double doubleOr(TomlTable table, String key, double fallback) {
        Object value = table.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return fallback;
    }

    private static List<String> strings(TomlTable table, String key) {
        TomlArray array = table.getArray(key);
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (int i = 0; i < array.size(); i++) {
            Object entry = array.get(i);
            if (entry != null) {
                values.add(String.valueOf(entry).trim());
            }
        }
        return values;
    }
}
