package work.dyncall.engine.sandbox;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.io.IOAccess;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

/**
 * Runs one program in a freshly built polyglot context that is closed after the attempt, so nothing a
 * program defines on itself or on the global scope outlives it.
 *
 * <p>Programs only reach members annotated with {@link HostAccess.Export}. Host class lookup, IO,
 * threads and process creation are off. A worker sandbox ({@link #forWorker}) may additionally look up
 * classes from its dependency jars, never JDK or engine classes.
 */
public final class ExecutionSandbox {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSandbox.class);
    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "sandbox-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    private static final List<String> RESERVED_PACKAGES = List.of(
        "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.graalvm.", "com.oracle.", "work.dyncall."
    );
    private static final HostAccess LIBRARY_ACCESS = HostAccess.newBuilder(HostAccess.EXPLICIT)
        .allowPublicAccess(true)
        .allowArrayAccess(true)
        .allowListAccess(true)
        .allowMapAccess(true)
        .denyAccess(Class.class)
        .denyAccess(ClassLoader.class)
        .denyAccess(System.class)
        .denyAccess(Runtime.class)
        .denyAccess(ProcessBuilder.class)
        .denyAccess(Process.class)
        .denyAccess(Thread.class)
        .build();

    private final Duration timeout;
    private final boolean libraryAccess;

    public ExecutionSandbox(Duration timeout) {
        this(timeout, false);
    }

    private ExecutionSandbox(Duration timeout, boolean libraryAccess) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.libraryAccess = libraryAccess;
    }

    /** Sandbox for a worker process, whose classpath carries the environment's dependency jars. */
    public static ExecutionSandbox forWorker(Duration timeout) {
        return new ExecutionSandbox(timeout, true);
    }

    static boolean libraryClass(String className) {
        for (String reserved : RESERVED_PACKAGES) {
            if (className.startsWith(reserved)) {
                return false;
            }
        }
        return className.contains(".");
    }

    public SandboxResult execute(SandboxRequest request, SandboxCapabilities capabilities) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(capabilities, "capabilities");
        List<String> messages = new ArrayList<>();
        AtomicBoolean timedOut = new AtomicBoolean(false);

        Context polyglot = Context
            .newBuilder("js")
            .allowHostAccess(libraryAccess ? LIBRARY_ACCESS : HostAccess.EXPLICIT)
            .allowHostClassLookup(libraryAccess ? ExecutionSandbox::libraryClass : className -> false)
            .allowIO(IOAccess.NONE)
            .allowCreateThread(false)
            .allowCreateProcess(false)
            .allowNativeAccess(false)
            .allowEnvironmentAccess(EnvironmentAccess.NONE)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2023")
            .build();
        ScheduledFuture<?> deadline = timeout.isZero() ? null : WATCHDOG.schedule(() -> {
            timedOut.set(true);
            polyglot.close(true);
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            injectConsoleGlobal(polyglot, request, messages);
            Value memory = PolyglotValues.toJsValue(polyglot, request.context());
            if (!memory.hasMembers()) {
                memory = polyglot.eval("js", "({})");
            }
            Value args = PolyglotValues.toJsValue(polyglot, request.args());
            Value kwargs = PolyglotValues.toJsValue(polyglot, request.kwargs());
            Value callInfo = PolyglotValues.toJsValue(polyglot, request.callInfo());
            SandboxBridge api = new SandboxBridge(polyglot, memory, capabilities, request.role(), request.method(), messages);

            Value function = compileProgram(polyglot, request.code());
            Value raw = function.execute(memory, args, kwargs, polyglot.asValue(api), callInfo);
            Object result = PolyglotValues.awaitValue(polyglot, raw);
            Map<String, Object> context = toContextMap(PolyglotValues.valueToJava(memory));
            return new SandboxResult(result, context, messages);
        } catch (PolyglotException ex) {
            throw translate(ex, timedOut.get(), request);
        } catch (IllegalStateException ex) {
            if (timedOut.get()) {
                throw timeoutError(request);
            }
            throw new DynamicCallException(ErrorType.EXECUTION, "Execution error in " + request.role() + "." + request.method() + ": " + ex.getMessage(), ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof DynamicCallException dce) {
                throw dce;
            }
            throw new DynamicCallException(ErrorType.EXECUTION, cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new DynamicCallException(ErrorType.EXECUTION, "Execution interrupted", ex);
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
            if (!timedOut.get()) {
                polyglot.close();
            }
        }
    }

    private static Value compileProgram(Context context, String code) {
        return context.eval("js", wrap(code));
    }

    private static String wrap(String code) {
        return "(function(context, args, kwargs, api, call) {\n" + code + "\n})";
    }

    /**
     * Parses a program without running it. Syntax errors are reported as retriable {@code invalid_code}.
     */
    public static void checkSyntax(String role, String method, String code) {
        try (Context polyglot = Context.newBuilder("js").option("engine.WarnInterpreterOnly", "false").build()) {
            polyglot.parse(Source.create("js", wrap(code)));
        } catch (PolyglotException ex) {
            if (!ex.isSyntaxError()) {
                throw ex;
            }
            throw new DynamicCallException(ErrorType.INVALID_CODE,
                "Generated code has invalid JavaScript syntax in " + role + "." + method + ": " + ex.getMessage(), ex);
        }
    }

    private DynamicCallException translate(PolyglotException ex, boolean timedOut, SandboxRequest request) {
        if (timedOut || ex.isCancelled()) {
            return timeoutError(request);
        }
        if (ex.isHostException()) {
            Throwable host = ex.asHostException();
            if (host instanceof DynamicCallException dce) {
                return dce;
            }
            return new DynamicCallException(ErrorType.EXECUTION,
                "Execution error in " + request.role() + "." + request.method() + ": " + host.getClass().getSimpleName()
                    + ": " + host.getMessage(), host);
        }
        String kind = ex.isSyntaxError() ? "SyntaxError" : "ScriptError";
        String location = ex.getSourceLocation() == null ? null : "line " + ex.getSourceLocation().getStartLine();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("root_error_class", kind);
        if (location != null) {
            metadata.put("failure_location", location);
        }
        return new DynamicCallException(ErrorType.EXECUTION,
            "Execution error in " + request.role() + "." + request.method() + ": " + ex.getMessage(),
            false, metadata, ex);
    }

    private DynamicCallException timeoutError(SandboxRequest request) {
        return new DynamicCallException(ErrorType.TIMEOUT,
            request.role() + "." + request.method() + " exceeded " + timeout.toMillis() + "ms");
    }

    private static Map<String, Object> toContextMap(Object converted) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (converted instanceof Map<?, ?> map) {
            map.forEach((k, v) -> context.put(String.valueOf(k), v));
        }
        return context;
    }

    private static void injectConsoleGlobal(Context context, SandboxRequest request, List<String> messages) {
        Value bindings = context.getBindings("js");
        Value console = context.eval("js", "({})");
        for (String level : List.of("log", "info", "warn", "error", "debug")) {
            console.putMember(level, (ProxyExecutable) args -> {
                StringBuilder builder = new StringBuilder();
                for (int i = 0; i < args.length; i++) {
                    if (i > 0) builder.append(' ');
                    Object value = PolyglotValues.valueToJava(args[i]);
                    builder.append(value == null ? "null" : String.valueOf(value));
                }
                String rendered = builder.toString();
                messages.add(rendered);
                log.debug("[{}.{}] console.{}: {}", request.role(), request.method(), level, rendered);
                return null;
            });
        }
        bindings.putMember("console", console);
    }
}
