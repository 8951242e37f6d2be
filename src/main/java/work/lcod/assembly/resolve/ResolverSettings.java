package work.lcod.assembly.resolve;

import java.util.Objects;

/**
 * Immutable resolver options.
 *
 * @param autoSourcePrefix namespace under which synthesized sources are created
 * @param checkUnits whether connected units must be dimensionally convertible
 */
public record ResolverSettings(String autoSourcePrefix, boolean checkUnits) {
    public static final String DEFAULT_AUTO_SOURCE_PREFIX = "_auto_ivc";

    public ResolverSettings {
        Objects.requireNonNull(autoSourcePrefix, "autoSourcePrefix");
        if (autoSourcePrefix.isBlank() || autoSourcePrefix.contains(".")) {
            throw new IllegalArgumentException("Invalid auto source prefix: '" + autoSourcePrefix + "'");
        }
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(DEFAULT_AUTO_SOURCE_PREFIX, true);
    }
}
