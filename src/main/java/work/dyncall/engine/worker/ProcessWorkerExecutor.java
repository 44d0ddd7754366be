package work.dyncall.engine.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.dyncall.engine.failure.DynamicCallException;
import work.dyncall.engine.failure.ErrorType;

/**
 * Talks to a worker process over stdin/stdout, one JSON line per message.
 */
final class ProcessWorkerExecutor implements WorkerExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerExecutor.class);
    private static final Optional<String> EOF = Optional.empty();
    private static final long GRACE_MILLIS = 1000;

    private final Process process;
    private final BufferedWriter stdin;
    private final BlockingQueue<Optional<String>> lines = new LinkedBlockingQueue<>();

    ProcessWorkerExecutor(Process process) {
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        startReader();
        startStderrDrain();
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public boolean alive() {
        return process.isAlive();
    }

    @Override
    public synchronized WorkerResponse execute(WorkerRequest request, Duration timeout) {
        if (!process.isAlive()) {
            throw crash("worker " + pid() + " is not running");
        }
        try {
            stdin.write(WorkerProtocol.encode(request));
            stdin.newLine();
            stdin.flush();
        } catch (IOException ex) {
            throw new DynamicCallException(ErrorType.WORKER_CRASH, "failed to write to worker " + pid() + ": " + ex.getMessage(), ex);
        }

        Optional<String> line;
        try {
            line = timeout == null || timeout.isZero()
                ? lines.take()
                : lines.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw crash("interrupted while waiting for worker " + pid());
        }
        if (line == null) {
            process.destroyForcibly();
            throw new DynamicCallException(ErrorType.TIMEOUT,
                request.role() + "." + request.methodName() + " exceeded " + timeout.toMillis() + "ms in worker " + pid());
        }
        if (line.isEmpty()) {
            throw crash("worker " + pid() + " exited before responding");
        }

        WorkerResponse response;
        try {
            response = WorkerProtocol.decodeResponse(line.get());
        } catch (JsonProcessingException ex) {
            throw crash("worker " + pid() + " sent an unreadable response: " + ex.getOriginalMessage());
        }
        if (request.callId() != null && !request.callId().equals(response.callId())) {
            throw crash("worker " + pid() + " answered call " + response.callId() + " instead of " + request.callId());
        }
        return response;
    }

    @Override
    public void shutdown() {
        try {
            stdin.close();
        } catch (IOException ex) {
            log.debug("Closing stdin of worker {} failed: {}", pid(), ex.getMessage());
        }
        try {
            if (!process.waitFor(GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                process.destroy();
                if (!process.waitFor(GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private DynamicCallException crash(String message) {
        return new DynamicCallException(ErrorType.WORKER_CRASH, message);
    }

    private void startReader() {
        Thread reader = new Thread(() -> {
            try (BufferedReader out = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = out.readLine()) != null) {
                    if (!line.isBlank()) {
                        lines.add(Optional.of(line));
                    }
                }
            } catch (IOException ex) {
                log.debug("Worker {} stdout closed: {}", pid(), ex.getMessage());
            } finally {
                lines.add(EOF);
            }
        }, "worker-" + process.pid() + "-stdout");
        reader.setDaemon(true);
        reader.start();
    }

    private void startStderrDrain() {
        Thread drain = new Thread(() -> {
            try (BufferedReader err = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = err.readLine()) != null) {
                    log.debug("[worker {}] {}", pid(), line);
                }
            } catch (IOException ex) {
                log.debug("Worker {} stderr closed: {}", pid(), ex.getMessage());
            }
        }, "worker-" + process.pid() + "-stderr");
        drain.setDaemon(true);
        drain.start();
    }
}
