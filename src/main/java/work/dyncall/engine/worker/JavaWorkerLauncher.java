package work.dyncall.engine.worker;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.dependency.EnvironmentHandle;

/**
 * Starts {@link WorkerMain} in a child JVM whose class path is this process's class path plus the
 * environment's installed libraries.
 */
public final class JavaWorkerLauncher implements WorkerLauncher {
    private static final Logger log = LoggerFactory.getLogger(JavaWorkerLauncher.class);

    private final String javaExecutable;
    private final String baseClassPath;
    private final List<String> jvmOptions;

    public JavaWorkerLauncher() {
        this(defaultJavaExecutable(), System.getProperty("java.class.path"), List.of("-Xss4m"));
    }

    public JavaWorkerLauncher(String javaExecutable, String baseClassPath, List<String> jvmOptions) {
        this.javaExecutable = javaExecutable;
        this.baseClassPath = baseClassPath == null ? "" : baseClassPath;
        this.jvmOptions = List.copyOf(jvmOptions);
    }

    @Override
    public WorkerExecutor launch(EnvironmentHandle environment) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        command.add("-cp");
        command.add(classPath(environment));
        command.add(WorkerMain.class.getName());

        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(false);
        if (environment != null && Files.isDirectory(environment.directory())) {
            builder.directory(environment.directory().toFile());
        }
        Process process = builder.start();
        log.debug("Started worker pid {} for env {}", process.pid(), environment == null ? "-" : environment.envId());
        return new ProcessWorkerExecutor(process);
    }

    private String classPath(EnvironmentHandle environment) {
        StringBuilder classPath = new StringBuilder(baseClassPath);
        if (environment != null) {
            Path lib = environment.libDirectory();
            if (Files.isDirectory(lib)) {
                if (classPath.length() > 0) {
                    classPath.append(File.pathSeparator);
                }
                classPath.append(lib.toAbsolutePath()).append(File.separator).append('*');
            }
        }
        return classPath.toString();
    }

    private static String defaultJavaExecutable() {
        Path javaHome = Path.of(System.getProperty("java.home"));
        boolean windows = System.getProperty("os.name", "").toLowerCase().contains("win");
        return javaHome.resolve("bin").resolve(windows ? "java.exe" : "java").toString();
    }
}
