package work.lcod.assembly.loader;

import work.lcod.assembly.resolve.ResolverSettings;

/**
 * Settings read from an {@code assembly.toml} file. {@code logLevel} is null when not configured.
 */
public record AssemblySettings(ResolverSettings resolver, String logLevel) {
    public static AssemblySettings defaults() {
        return new AssemblySettings(ResolverSettings.defaults(), null);
    }
}
