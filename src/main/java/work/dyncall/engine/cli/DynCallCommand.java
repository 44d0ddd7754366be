package work.dyncall.engine.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.dyncall.engine.api.DynamicCallEngine;
import work.dyncall.engine.api.EngineConfiguration;
import work.dyncall.engine.api.EngineConfigurationLoader;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.generation.FixtureCodeGenerator;
import work.dyncall.engine.observability.JsonlCallRecordSink;
import work.dyncall.engine.observability.LoggingCallRecordSink;
import work.dyncall.engine.runtime.JsonValues;

@CommandLine.Command(
    name = "dyncall",
    description = "Call a method on a role, synthesizing the implementation when none is stored.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class DynCallCommand implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-r", "--role"}, required = true, description = "Role to call.")
    private String role;

    @CommandLine.Option(names = {"-m", "--method"}, required = true, description = "Method to call on the role.")
    private String method;

    @CommandLine.Option(names = "--args", paramLabel = "JSON", description = "Positional arguments as a JSON array.",
        defaultValue = "[]")
    private String argsJson;

    @CommandLine.Option(names = "--kwargs", paramLabel = "JSON", description = "Keyword arguments as a JSON object.",
        defaultValue = "{}")
    private String kwargsJson;

    @CommandLine.Option(names = {"-p", "--programs"}, required = true, paramLabel = "PATH",
        description = "TOML file of programs keyed by [role.method], used as the code generator.")
    private Path programs;

    @CommandLine.Option(names = "--config", paramLabel = "PATH", description = "Engine configuration (dyncall.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private Path config;

    @CommandLine.Option(names = "--toolstore", paramLabel = "DIR", description = "Toolstore root (overrides configuration).",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private Path toolstore;

    @CommandLine.Option(names = "--log", paramLabel = "PATH", description = "Append call records to this JSONL file.",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private Path callLog;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "PATH", description = "Write the outcome JSON to a file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private Path output;

    @Override
    public Integer call() throws Exception {
        requireReadable(programs, "--programs");
        if (config != null) {
            requireReadable(config, "--config");
        }
        List<Object> args = parseArgs();
        Map<String, Object> kwargs = parseKwargs();
        FixtureCodeGenerator generator = FixtureCodeGenerator.load(programs);

        EngineConfigurationLoader loader = new EngineConfigurationLoader();
        EngineConfiguration.Builder builder = config == null ? loader.defaults(generator) : loader.load(config, generator);
        if (toolstore != null) {
            builder.toolstoreRoot(toolstore.toAbsolutePath());
        }
        if (callLog != null) {
            builder.sink(new JsonlCallRecordSink(callLog.toAbsolutePath()));
        }
        builder.sink(new LoggingCallRecordSink());

        Outcome outcome;
        try (DynamicCallEngine engine = new DynamicCallEngine(builder.build())) {
            outcome = engine.agent(role).call(method, args, kwargs);
        }
        String json = JsonValues.PRETTY.writeValueAsString(outcome.toMap());
        if (output != null) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, json + System.lineSeparator());
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.println(json);
            out.flush();
        }
        return outcome.isOk() ? 0 : 1;
    }

    private List<Object> parseArgs() {
        try {
            return JsonValues.MAPPER.readValue(argsJson, JsonValues.LIST_REF);
        } catch (JsonProcessingException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--args must be a JSON array: " + ex.getOriginalMessage());
        }
    }

    private Map<String, Object> parseKwargs() {
        try {
            return JsonValues.MAPPER.readValue(kwargsJson, JsonValues.MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--kwargs must be a JSON object: " + ex.getOriginalMessage());
        }
    }

    private static void requireReadable(Path path, String option) throws IOException {
        if (!Files.isReadable(path)) {
            throw new IOException(option + " file not found: " + path);
        }
    }
}
