package work.lcod.assembly.cli;

import picocli.CommandLine;
import work.lcod.assembly.resolve.ResolverSettings;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var pkg = Main.class.getPackage();
        var version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        var defaults = ResolverSettings.defaults();
        return new String[] {
            "lcod-assemble (java) " + version,
            "resolver defaults: autoSourcePrefix=" + defaults.autoSourcePrefix() + ", checkUnits=" + defaults.checkUnits(),
            "runtime: Java " + Runtime.version()
        };
    }
}
