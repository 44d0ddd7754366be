package work.dyncall.engine.runtime;

/**
 * Version stamps written into artifacts; an artifact from another runtime version is not reused.
 */
public final class EngineInfo {
    public static final String NAME = "dyncall";
    public static final String RUNTIME_VERSION = resolveVersion();
    public static final String PROMPT_VERSION = "js-program-v1";
    public static final int SCHEMA_VERSION = 1;
    public static final String PROMOTION_POLICY_VERSION = "solver_promotion_v1";

    private EngineInfo() {}

    private static String resolveVersion() {
        String version = EngineInfo.class.getPackage().getImplementationVersion();
        return version == null || version.isBlank() ? "0.1.0-SNAPSHOT" : version;
    }
}
