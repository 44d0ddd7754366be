package work.dyncall.engine.guardrail;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Memory keys a program touches: {@code context.key}, {@code context["key"]} and
 * {@code api.remember("key")}/{@code api.recall("key")}. The registry mirror key {@code tools} is ignored.
 */
public final class StateKeys {
    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("\\bcontext\\s*\\.\\s*([A-Za-z_$][\\w$]*)"),
        Pattern.compile("\\bcontext\\s*\\[\\s*[\"']([A-Za-z0-9_$.-]+)[\"']\\s*\\]"),
        Pattern.compile("\\bapi\\s*\\.\\s*(?:remember|recall)\\s*\\(\\s*[\"']([A-Za-z0-9_$.-]+)[\"']")
    );
    private static final Set<String> IGNORED = Set.of("tools");

    private StateKeys() {}

    public static List<String> fromCode(String code) {
        Set<String> keys = new LinkedHashSet<>();
        if (code == null) {
            return List.of();
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(code);
            while (matcher.find()) {
                String key = matcher.group(1);
                if (!IGNORED.contains(key)) {
                    keys.add(key);
                }
            }
        }
        List<String> sorted = new ArrayList<>(keys);
        sorted.sort(null);
        return sorted;
    }

    /** First key in sort order, or {@code null} when the program touches no memory. */
    public static String primaryKey(String code) {
        List<String> keys = fromCode(code);
        return keys.isEmpty() ? null : keys.get(0);
    }
}
