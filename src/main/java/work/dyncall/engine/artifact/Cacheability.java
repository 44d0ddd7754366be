package work.dyncall.engine.artifact;

import java.util.Locale;
import java.util.Set;

/**
 * Whether a generated program may be reused for later calls of the same method.
 */
public record Cacheability(boolean cacheable, String reason, boolean inputSensitive) {
    public static final Set<String> DYNAMIC_DISPATCH_METHODS = Set.of("ask", "chat", "discuss", "host");
    public static final String DYNAMIC_DISPATCH_REASON = "dynamic_dispatch_method";
    public static final String STABLE_METHOD_REASON = "stable_method";

    public static boolean dynamicDispatch(String method) {
        return method != null && DYNAMIC_DISPATCH_METHODS.contains(method.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Dynamic-dispatch methods are never cacheable; otherwise generator hints win, then the
     * stable-method default.
     */
    public static Cacheability resolve(String method, Boolean hintCacheable, String hintReason, Boolean hintInputSensitive) {
        boolean inputSensitive = Boolean.TRUE.equals(hintInputSensitive);
        if (dynamicDispatch(method)) {
            return new Cacheability(false, DYNAMIC_DISPATCH_REASON, inputSensitive);
        }
        if (hintCacheable != null) {
            String reason = hintReason == null || hintReason.isBlank()
                ? (hintCacheable ? STABLE_METHOD_REASON : "generator_declined")
                : hintReason.trim();
            return new Cacheability(hintCacheable, reason, inputSensitive);
        }
        return new Cacheability(true, STABLE_METHOD_REASON, inputSensitive);
    }

    /** Reuse check for a stored artifact; artifacts without the flag fall back to the method-name rule. */
    public static boolean reusable(Artifact artifact, String method) {
        Boolean flag = artifact.cacheable();
        if (flag != null) {
            return flag;
        }
        return !dynamicDispatch(method);
    }
}
