package work.dyncall.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses timeout settings written as {@code 250ms}, {@code 30s}, {@code 1.5s}, {@code 2m} or {@code 1h}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        long unitMillis = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            unitMillis = 3_600_000L;
        }
        double amount;
        try {
            amount = Double.parseDouble(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(Math.round(amount * unitMillis)));
    }

    public static Duration parseOr(String raw, Duration fallback) {
        return parse(raw).orElse(fallback);
    }
}
