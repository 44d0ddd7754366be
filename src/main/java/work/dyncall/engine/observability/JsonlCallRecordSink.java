package work.dyncall.engine.observability;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import work.dyncall.engine.runtime.JsonValues;

/**
 * Appends one JSON object per line.
 */
public final class JsonlCallRecordSink implements CallRecordSink {
    private final Path path;

    public JsonlCallRecordSink(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void emit(CallRecord record) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String line = JsonValues.MAPPER.writeValueAsString(record.fields()) + "\n";
        Files.writeString(path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }
}
