package work.dyncall.engine.sandbox;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.dyncall.engine.api.Outcome;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

class ExecutionSandboxTest {
    private final ExecutionSandbox sandbox = new ExecutionSandbox(Duration.ofSeconds(10));

    private static SandboxRequest request(String code, List<Object> args, Map<String, Object> context) {
        return new SandboxRequest("Calc", "run", code, args, Map.of(), context, Map.of());
    }

    @Test
    void returnsPlainValuesAndArguments() {
        SandboxResult result = sandbox.execute(request("return args[0] + args[1];", List.of(2, 3), Map.of()), SandboxCapabilities.none());
        assertEquals(5, result.value());
    }

    @Test
    void memoryChangesComeBackInContext() {
        SandboxResult result = sandbox.execute(
            request("context.count = (context.count || 0) + 1; api.remember('seen', [1, 2]); return context.count;",
                List.of(), Map.of("count", 4)),
            SandboxCapabilities.none());
        assertEquals(5, result.value());
        assertEquals(5, result.context().get("count"));
        assertEquals(List.of(1, 2), result.context().get("seen"));
    }

    @Test
    void explicitOutcomesSurviveTheBoundary() {
        SandboxResult result = sandbox.execute(request("return api.error('missing_input', 'need x');", List.of(), Map.of()),
            SandboxCapabilities.none());
        Outcome outcome = assertInstanceOf(Outcome.class, result.value());
        assertEquals("missing_input", outcome.errorType());
    }

    @Test
    void globalsDoNotLeakBetweenAttempts() {
        sandbox.execute(request("globalThis.leaked = 42; api.helper = function() { return 1; }; return 1;", List.of(), Map.of()),
            SandboxCapabilities.none());
        SandboxResult second = sandbox.execute(
            request("return [typeof globalThis.leaked, typeof api.helper];", List.of(), Map.of()),
            SandboxCapabilities.none());
        assertEquals(List.of("undefined", "undefined"), second.value());
    }

    @Test
    void consoleOutputIsCaptured() {
        SandboxResult result = sandbox.execute(request("console.log('hello', 3); return null;", List.of(), Map.of()),
            SandboxCapabilities.none());
        assertEquals(List.of("hello 3"), result.messages());
    }

    @Test
    void scriptErrorsBecomeExecutionFailures() {
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> sandbox.execute(request("throw new Error('nope');", List.of(), Map.of()), SandboxCapabilities.none()));
        assertEquals(ErrorType.EXECUTION, ex.type());
        assertTrue(ex.getMessage().contains("nope"));
        assertEquals("ScriptError", ex.metadata().get("root_error_class"));
    }

    @Test
    void runawayProgramsTimeOut() {
        ExecutionSandbox strict = new ExecutionSandbox(Duration.ofMillis(300));
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> strict.execute(request("while (true) {}", List.of(), Map.of()), SandboxCapabilities.none()));
        assertEquals(ErrorType.TIMEOUT, ex.type());
        assertTrue(ex.retriable());
    }

    @Test
    void hostClassesAreOutOfReach() {
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> sandbox.execute(request("return Java.type('java.lang.System').getProperty('user.home');", List.of(), Map.of()),
                SandboxCapabilities.none()));
        assertEquals(ErrorType.EXECUTION, ex.type());

        DynamicCallException reflective = assertThrows(DynamicCallException.class,
            () -> sandbox.execute(request("return api.getClass().getName();", List.of(), Map.of()), SandboxCapabilities.none()));
        assertEquals(ErrorType.EXECUTION, reflective.type());
    }

    @Test
    void workerSandboxStillDeniesJdkClasses() {
        ExecutionSandbox worker = ExecutionSandbox.forWorker(Duration.ofSeconds(10));
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> worker.execute(request("return Java.type('java.lang.Runtime').getRuntime().availableProcessors();", List.of(), Map.of()),
                SandboxCapabilities.none()));
        assertEquals(ErrorType.EXECUTION, ex.type());
        assertEquals(3, worker.execute(request("return args[0] + 1;", List.of(2), Map.of()), SandboxCapabilities.none()).value());
    }

    @Test
    void libraryLookupExcludesReservedPackages() {
        assertFalse(ExecutionSandbox.libraryClass("java.lang.ProcessBuilder"));
        assertFalse(ExecutionSandbox.libraryClass("org.graalvm.polyglot.Context"));
        assertFalse(ExecutionSandbox.libraryClass("work.dyncall.engine.api.DynamicCallEngine"));
        assertTrue(ExecutionSandbox.libraryClass("org.apache.commons.text.StringEscapeUtils"));
    }

    @Test
    void syntaxCheckRejectsBrokenCode() {
        assertDoesNotThrow(() -> ExecutionSandbox.checkSyntax("Calc", "run", "return 1;"));
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> ExecutionSandbox.checkSyntax("Calc", "run", "return (1;"));
        assertEquals(ErrorType.INVALID_CODE, ex.type());
    }

    @Test
    void delegationGoesThroughCapabilities() {
        List<String> calls = new ArrayList<>();
        SandboxCapabilities capabilities = new SandboxCapabilities() {
            @Override
            public Outcome delegate(String role, Map<String, Object> options, String method, List<Object> args, Map<String, Object> kwargs) {
                calls.add(role + "." + method + options);
                return Outcome.ok(((Number) args.get(0)).intValue() * 2, role, method);
            }

            @Override
            public boolean hasTool(String name) {
                return false;
            }
        };
        SandboxResult result = sandbox.execute(
            request("const r = api.delegate('Doubler', {purpose: 'double'}).call('twice', [21]); return r.value;", List.of(), Map.of()),
            capabilities);
        assertEquals(42, result.value());
        assertEquals(List.of("Doubler.twice{purpose=double}"), calls);
    }

    @Test
    void unknownToolsAreRejected() {
        DynamicCallException ex = assertThrows(DynamicCallException.class,
            () -> sandbox.execute(request("return api.tool('Nope');", List.of(), Map.of()), SandboxCapabilities.none()));
        assertFalse(ex.retriable());
        assertTrue(ex.getMessage().contains("Unknown tool"));
    }
}
