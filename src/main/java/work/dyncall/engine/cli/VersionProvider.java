package work.dyncall.engine.cli;

import picocli.CommandLine;
import work.dyncall.engine.runtime.EngineInfo;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "dyncall (java) " + version,
            "runtime " + EngineInfo.RUNTIME_VERSION + ", prompt " + EngineInfo.PROMPT_VERSION
        };
    }
}
