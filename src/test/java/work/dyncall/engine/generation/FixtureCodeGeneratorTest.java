package work.dyncall.engine.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

class FixtureCodeGeneratorTest {
    private static Path programs() throws URISyntaxException {
        return Path.of(FixtureCodeGeneratorTest.class.getResource("/fixtures/programs.toml").toURI());
    }

    private static GenerationRequest request(String role, String method) {
        return new GenerationRequest(role, method, "m", "system", "user", Map.of(), Duration.ofSeconds(1), 1);
    }

    @Test
    void servesProgramsByRoleAndMethod() throws Exception {
        FixtureCodeGenerator generator = FixtureCodeGenerator.load(programs());

        Map<String, Object> counter = generator.generate(request("Counter", "increment"));
        Map<String, Object> parser = generator.generate(request("Parser", "parse"));

        assertEquals("context.value = (context.value || 0) + 1; return context.value;", counter.get("code"));
        assertEquals(List.of(Map.of("name", "org.jsoup:jsoup", "version", "1.17.2")), parser.get("dependencies"));
        assertEquals(2, generator.requestCount());
    }

    @Test
    void unknownMethodIsProviderFailure() throws Exception {
        FixtureCodeGenerator generator = FixtureCodeGenerator.parse(Files.readString(programs()));
        DynamicCallException ex = assertThrows(DynamicCallException.class, () -> generator.generate(request("Counter", "reset")));
        assertEquals(ErrorType.PROVIDER, ex.type());
    }

    @Test
    void invalidTomlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> FixtureCodeGenerator.parse("[Counter.increment\ncode = 1"));
    }
}
