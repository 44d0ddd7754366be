package work.dyncall.engine.shared;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Replace-on-write and quarantine helpers for the JSON files kept under the toolstore.
 */
public final class AtomicFiles {
    private static final DateTimeFormatter QUARANTINE_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private AtomicFiles() {}

    public static void write(Path path, String content) throws IOException {
        write(path, content.getBytes(StandardCharsets.UTF_8));
    }

    public static void write(Path path, byte[] content) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = parent.resolve(path.getFileName() + ".tmp-" + ProcessHandle.current().pid() + "-" + Hashing.randomHex(4));
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Renames a corrupt file to {@code <name>.corrupt-<yyyyMMdd'T'HHmmss>} and returns the new path.
     */
    public static Path quarantine(Path path) throws IOException {
        String suffix = ZonedDateTime.now(ZoneOffset.UTC).format(QUARANTINE_SUFFIX);
        Path target = path.resolveSibling(path.getFileName() + ".corrupt-" + suffix);
        return Files.move(path, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
