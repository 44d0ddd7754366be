package work.dyncall.engine.support;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import work.dyncall.engine.api.EngineConfiguration;
import work.dyncall.engine.generation.CodeGenerator;
import work.dyncall.engine.generation.GenerationRequest;
import work.dyncall.engine.observability.CallRecord;
import work.dyncall.engine.observability.CallRecordSink;

/**
 * Shared helpers for engine test suites: a scripted in-memory code generator and a sink that keeps
 * every call record.
 */
public final class EngineTestSupport {
    private EngineTestSupport() {}

    public static EngineConfiguration.Builder configuration(Path toolstore, CodeGenerator generator, CallRecordSink sink) {
        EngineConfiguration.Builder builder = EngineConfiguration.builder()
            .generator(generator)
            .toolstoreRoot(toolstore)
            .model("test-model")
            .generationTimeout(Duration.ofSeconds(5))
            .sandboxTimeout(Duration.ofSeconds(10))
            .workerTimeout(Duration.ofSeconds(5));
        if (sink != null) {
            builder.sink(sink);
        }
        return builder;
    }

    public static Map<String, Object> program(String code) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code);
        return payload;
    }

    public static Map<String, Object> program(String code, List<Object> dependencies) {
        Map<String, Object> payload = program(code);
        payload.put("dependencies", dependencies);
        return payload;
    }

    /**
     * Answers each {@code role.method} with the scripted payloads in order; the last one repeats.
     * Every request is kept for inspection.
     */
    public static final class ScriptedCodeGenerator implements CodeGenerator {
        private final Map<String, Deque<Map<String, Object>>> scripts = new ConcurrentHashMap<>();
        private final List<GenerationRequest> requests = new ArrayList<>();

        public ScriptedCodeGenerator script(String role, String method, String... codes) {
            for (String code : codes) {
                script(role, method, code == null ? new LinkedHashMap<>() : program(code));
            }
            return this;
        }

        public ScriptedCodeGenerator script(String role, String method, Map<String, Object> payload) {
            scripts.computeIfAbsent(role + "." + method, key -> new ArrayDeque<>()).addLast(payload);
            return this;
        }

        @Override
        public synchronized Map<String, Object> generate(GenerationRequest request) {
            requests.add(request);
            Deque<Map<String, Object>> queue = scripts.get(request.role() + "." + request.method());
            if (queue == null || queue.isEmpty()) {
                throw new IllegalStateException("nothing scripted for " + request.role() + "." + request.method());
            }
            Map<String, Object> next = queue.size() > 1 ? queue.pollFirst() : queue.peekFirst();
            return new LinkedHashMap<>(next);
        }

        public synchronized List<GenerationRequest> requests() {
            return List.copyOf(requests);
        }

        public synchronized int requestCount() {
            return requests.size();
        }

        public synchronized GenerationRequest lastRequest() {
            return requests.isEmpty() ? null : requests.get(requests.size() - 1);
        }
    }

    public static final class RecordingSink implements CallRecordSink {
        private final List<CallRecord> records = new ArrayList<>();

        @Override
        public synchronized void emit(CallRecord record) {
            records.add(record);
        }

        public synchronized List<CallRecord> records() {
            return List.copyOf(records);
        }

        public synchronized CallRecord last() {
            return records.isEmpty() ? null : records.get(records.size() - 1);
        }

        public synchronized List<CallRecord> forRole(String role) {
            List<CallRecord> matching = new ArrayList<>();
            for (CallRecord record : records) {
                if (role.equals(record.role())) {
                    matching.add(record);
                }
            }
            return matching;
        }
    }
}
