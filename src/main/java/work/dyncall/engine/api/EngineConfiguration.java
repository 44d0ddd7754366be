package work.dyncall.engine.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.dyncall.engine.artifact.PromotionPolicy;
import work.dyncall.engine.dependency.DependencyPolicy;
import work.dyncall.engine.execution.AttemptBudgets;
import work.dyncall.engine.generation.CodeGenerator;
import work.dyncall.engine.observability.CallRecordSink;
import work.dyncall.engine.worker.WorkerLauncher;

/**
 * Immutable configuration of a {@link DynamicCallEngine}.
 *
 * @param environmentRoot where dependency environments are materialized; defaults to {@code <toolstore>/envs}
 * @param dependencySources local repository directories the installer resolves artifacts from
 * @param workerLauncher {@code null} selects the JVM subprocess launcher
 */
public record EngineConfiguration(
    CodeGenerator generator,
    Path toolstoreRoot,
    String model,
    int maxGenerationAttempts,
    AttemptBudgets budgets,
    int maxDelegationDepth,
    Duration generationTimeout,
    Duration sandboxTimeout,
    Duration workerTimeout,
    int workerMaxRestarts,
    WorkerLauncher workerLauncher,
    DependencyPolicy dependencyPolicy,
    Path environmentRoot,
    List<Path> dependencySources,
    PromotionPolicy promotionPolicy,
    boolean promotionShadowMode,
    boolean promotionEnforced,
    boolean continuityEnforced,
    List<CallRecordSink> sinks
) {
    public static final String DEFAULT_MODEL = "default";
    public static final int DEFAULT_MAX_GENERATION_ATTEMPTS = 2;
    public static final int DEFAULT_MAX_DELEGATION_DEPTH = 8;
    public static final int DEFAULT_WORKER_MAX_RESTARTS = 2;
    public static final Duration DEFAULT_GENERATION_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_SANDBOX_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_WORKER_TIMEOUT = Duration.ofSeconds(30);

    public EngineConfiguration {
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(toolstoreRoot, "toolstoreRoot");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(budgets, "budgets");
        Objects.requireNonNull(generationTimeout, "generationTimeout");
        Objects.requireNonNull(sandboxTimeout, "sandboxTimeout");
        Objects.requireNonNull(workerTimeout, "workerTimeout");
        Objects.requireNonNull(dependencyPolicy, "dependencyPolicy");
        Objects.requireNonNull(promotionPolicy, "promotionPolicy");
        if (maxGenerationAttempts < 1) {
            throw new IllegalArgumentException("maxGenerationAttempts must be at least 1");
        }
        if (maxDelegationDepth < 0) {
            throw new IllegalArgumentException("maxDelegationDepth must not be negative");
        }
        environmentRoot = environmentRoot == null ? toolstoreRoot.resolve("envs") : environmentRoot;
        dependencySources = List.copyOf(dependencySources == null ? List.of() : dependencySources);
        sinks = List.copyOf(sinks == null ? List.of() : sinks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .generator(generator)
            .toolstoreRoot(toolstoreRoot)
            .model(model)
            .maxGenerationAttempts(maxGenerationAttempts)
            .budgets(budgets)
            .maxDelegationDepth(maxDelegationDepth)
            .generationTimeout(generationTimeout)
            .sandboxTimeout(sandboxTimeout)
            .workerTimeout(workerTimeout)
            .workerMaxRestarts(workerMaxRestarts)
            .workerLauncher(workerLauncher)
            .dependencyPolicy(dependencyPolicy)
            .environmentRoot(environmentRoot)
            .dependencySources(dependencySources)
            .promotionPolicy(promotionPolicy)
            .promotionShadowMode(promotionShadowMode)
            .promotionEnforced(promotionEnforced)
            .continuityEnforced(continuityEnforced);
        sinks.forEach(builder::sink);
        return builder;
    }

    public static final class Builder {
        private CodeGenerator generator;
        private Path toolstoreRoot;
        private String model = DEFAULT_MODEL;
        private int maxGenerationAttempts = DEFAULT_MAX_GENERATION_ATTEMPTS;
        private AttemptBudgets budgets = AttemptBudgets.defaults();
        private int maxDelegationDepth = DEFAULT_MAX_DELEGATION_DEPTH;
        private Duration generationTimeout = DEFAULT_GENERATION_TIMEOUT;
        private Duration sandboxTimeout = DEFAULT_SANDBOX_TIMEOUT;
        private Duration workerTimeout = DEFAULT_WORKER_TIMEOUT;
        private int workerMaxRestarts = DEFAULT_WORKER_MAX_RESTARTS;
        private WorkerLauncher workerLauncher;
        private DependencyPolicy dependencyPolicy = DependencyPolicy.permissive();
        private Path environmentRoot;
        private List<Path> dependencySources = new ArrayList<>();
        private PromotionPolicy promotionPolicy = PromotionPolicy.defaults();
        private boolean promotionShadowMode = true;
        private boolean promotionEnforced;
        private boolean continuityEnforced;
        private final List<CallRecordSink> sinks = new ArrayList<>();

        public Builder generator(CodeGenerator generator) {
            this.generator = generator;
            return this;
        }

        public Builder toolstoreRoot(Path toolstoreRoot) {
            this.toolstoreRoot = toolstoreRoot;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder maxGenerationAttempts(int maxGenerationAttempts) {
            this.maxGenerationAttempts = maxGenerationAttempts;
            return this;
        }

        public Builder budgets(AttemptBudgets budgets) {
            this.budgets = budgets;
            return this;
        }

        public Builder maxDelegationDepth(int maxDelegationDepth) {
            this.maxDelegationDepth = maxDelegationDepth;
            return this;
        }

        public Builder generationTimeout(Duration generationTimeout) {
            this.generationTimeout = generationTimeout;
            return this;
        }

        public Builder sandboxTimeout(Duration sandboxTimeout) {
            this.sandboxTimeout = sandboxTimeout;
            return this;
        }

        public Builder workerTimeout(Duration workerTimeout) {
            this.workerTimeout = workerTimeout;
            return this;
        }

        public Builder workerMaxRestarts(int workerMaxRestarts) {
            this.workerMaxRestarts = workerMaxRestarts;
            return this;
        }

        public Builder workerLauncher(WorkerLauncher workerLauncher) {
            this.workerLauncher = workerLauncher;
            return this;
        }

        public Builder dependencyPolicy(DependencyPolicy dependencyPolicy) {
            this.dependencyPolicy = dependencyPolicy;
            return this;
        }

        public Builder environmentRoot(Path environmentRoot) {
            this.environmentRoot = environmentRoot;
            return this;
        }

        public Builder dependencySources(List<Path> dependencySources) {
            this.dependencySources = new ArrayList<>(dependencySources);
            return this;
        }

        public Builder promotionPolicy(PromotionPolicy promotionPolicy) {
            this.promotionPolicy = promotionPolicy;
            return this;
        }

        public Builder promotionShadowMode(boolean promotionShadowMode) {
            this.promotionShadowMode = promotionShadowMode;
            return this;
        }

        public Builder promotionEnforced(boolean promotionEnforced) {
            this.promotionEnforced = promotionEnforced;
            return this;
        }

        public Builder continuityEnforced(boolean continuityEnforced) {
            this.continuityEnforced = continuityEnforced;
            return this;
        }

        public Builder sink(CallRecordSink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink"));
            return this;
        }

        public EngineConfiguration build() {
            return new EngineConfiguration(
                generator,
                toolstoreRoot,
                model,
                maxGenerationAttempts,
                budgets,
                maxDelegationDepth,
                generationTimeout,
                sandboxTimeout,
                workerTimeout,
                workerMaxRestarts,
                workerLauncher,
                dependencyPolicy,
                environmentRoot,
                dependencySources,
                promotionPolicy,
                promotionShadowMode,
                promotionEnforced,
                continuityEnforced,
                sinks
            );
        }
    }
}
