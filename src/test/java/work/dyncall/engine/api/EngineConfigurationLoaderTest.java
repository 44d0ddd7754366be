package work.dyncall.engine.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.dyncall.engine.dependency.DependencyPolicy;
import work.dyncall.engine.execution.AttemptBudgets;
import work.dyncall.engine.support.EngineTestSupport.ScriptedCodeGenerator;

class EngineConfigurationLoaderTest {
    private static final String FULL_CONFIG = """
        [engine]
        toolstore_root = "store"
        model = "gen-large"
        max_generation_attempts = 3
        max_delegation_depth = 4
        generation_timeout = "90s"
        sandbox_timeout = 1500
        continuity_enforced = true

        [budgets]
        guardrail_recovery = 2
        execution_repair = 0

        [dependencies]
        env_root = "envs"
        local_repositories = ["libs"]
        allowed = ["jsoup"]
        source_mode = "internal_only"
        sources = ["https://nexus.corp.local/repo"]

        [promotion]
        enforced = true
        min_calls = 4
        min_contract_pass_rate = 0.9

        [worker]
        timeout = "12s"
        max_restarts = 5
        """;

    @TempDir
    Path dir;

    private final ScriptedCodeGenerator generator = new ScriptedCodeGenerator();

    @Test
    void readsEverySection() throws Exception {
        Path file = Files.writeString(dir.resolve("dyncall.toml"), FULL_CONFIG);

        EngineConfiguration config = new EngineConfigurationLoader(Map.of()).load(file, generator).build();

        assertEquals(dir.resolve("store").toAbsolutePath().normalize(), config.toolstoreRoot());
        assertEquals("gen-large", config.model());
        assertEquals(3, config.maxGenerationAttempts());
        assertEquals(4, config.maxDelegationDepth());
        assertEquals(Duration.ofSeconds(90), config.generationTimeout());
        assertEquals(Duration.ofMillis(1500), config.sandboxTimeout());
        assertTrue(config.continuityEnforced());
        assertEquals(new AttemptBudgets(2, 1, 0), config.budgets());
        assertEquals(dir.resolve("envs").toAbsolutePath().normalize(), config.environmentRoot());
        assertEquals(List.of(dir.resolve("libs").toAbsolutePath().normalize()), config.dependencySources());
        assertEquals(List.of("jsoup"), config.dependencyPolicy().allowed());
        assertEquals(DependencyPolicy.SourceMode.INTERNAL_ONLY, config.dependencyPolicy().sourceMode());
        assertTrue(config.promotionEnforced());
        assertTrue(config.promotionShadowMode());
        assertEquals(4, config.promotionPolicy().minCalls());
        assertEquals(0.9, config.promotionPolicy().minContractPassRate());
        assertEquals(2, config.promotionPolicy().minSessions());
        assertEquals(Duration.ofSeconds(12), config.workerTimeout());
        assertEquals(5, config.workerMaxRestarts());
    }

    @Test
    void missingSectionsKeepDefaults() throws Exception {
        Path file = Files.writeString(dir.resolve("dyncall.toml"), "[engine]\nmodel = \"small\"\n");

        EngineConfiguration config = new EngineConfigurationLoader(Map.of()).load(file, generator).build();

        assertEquals(dir.resolve(".toolstore").toAbsolutePath(), config.toolstoreRoot());
        assertEquals(AttemptBudgets.defaults(), config.budgets());
        assertEquals(EngineConfiguration.DEFAULT_MAX_DELEGATION_DEPTH, config.maxDelegationDepth());
        assertNull(config.dependencyPolicy().allowed());
        assertFalse(config.promotionEnforced());
        assertEquals(config.toolstoreRoot().resolve("envs"), config.environmentRoot());
    }

    @Test
    void environmentOverridesFile() throws Exception {
        Path file = Files.writeString(dir.resolve("dyncall.toml"), FULL_CONFIG);
        Path override = dir.resolve("elsewhere");
        Map<String, String> env = Map.of(
            EngineConfigurationLoader.TOOLSTORE_ENV, override.toString(),
            EngineConfigurationLoader.MODEL_ENV, " env-model ");

        EngineConfiguration config = new EngineConfigurationLoader(env).load(file, generator).build();

        assertEquals(override, config.toolstoreRoot());
        assertEquals("env-model", config.model());
    }

    @Test
    void defaultsWithoutFile() {
        EngineConfiguration config = new EngineConfigurationLoader(Map.of(EngineConfigurationLoader.MODEL_ENV, "m"))
            .defaults(generator)
            .build();

        assertEquals("m", config.model());
        assertTrue(config.toolstoreRoot().isAbsolute());
        assertTrue(config.toolstoreRoot().endsWith(".toolstore"));
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        Path file = Files.writeString(dir.resolve("dyncall.toml"), "[engine\nmodel = ");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> new EngineConfigurationLoader(Map.of()).load(file, generator));

        assertTrue(ex.getMessage().startsWith("Invalid configuration"));
    }
}
