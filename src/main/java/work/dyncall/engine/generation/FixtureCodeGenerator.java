package work.dyncall.engine.generation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;
import work.dyncall.engine.shared.TomlValues;

/**
 * Code generator backed by a TOML file of pre-written programs, one table per {@code [role.method]}:
 *
 * <pre>
 * [counter.increment]
 * code = "context.value = (context.value || 0) + 1; return context.value;"
 * dependencies = [{ name = "org.example:lib", version = "1.0" }]
 * </pre>
 */
public final class FixtureCodeGenerator implements CodeGenerator {
    private final Map<String, Map<String, Object>> programs;
    private final AtomicInteger requests = new AtomicInteger();

    public FixtureCodeGenerator(Map<String, Map<String, Object>> programs) {
        this.programs = new LinkedHashMap<>(programs);
    }

    public static FixtureCodeGenerator load(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static FixtureCodeGenerator parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid programs file: " + result.errors().get(0).toString());
        }
        Map<String, Map<String, Object>> programs = new LinkedHashMap<>();
        for (String role : result.keySet()) {
            TomlTable methods = result.getTable(List.of(role));
            if (methods == null) {
                continue;
            }
            for (String method : methods.keySet()) {
                TomlTable program = methods.getTable(List.of(method));
                if (program != null) {
                    programs.put(key(role, method), TomlValues.toMap(program));
                }
            }
        }
        return new FixtureCodeGenerator(programs);
    }

    @Override
    public Map<String, Object> generate(GenerationRequest request) {
        requests.incrementAndGet();
        Map<String, Object> program = programs.get(key(request.role(), request.method()));
        if (program == null) {
            throw new DynamicCallException(ErrorType.PROVIDER,
                "No program registered for " + request.role() + "." + request.method());
        }
        return new LinkedHashMap<>(program);
    }

    public int requestCount() {
        return requests.get();
    }

    private static String key(String role, String method) {
        return role + "\u0000" + method;
    }
}
