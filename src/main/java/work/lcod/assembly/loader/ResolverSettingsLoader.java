package work.lcod.assembly.loader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.assembly.resolve.ResolverSettings;

/**
 * Reads {@link AssemblySettings} from {@code assembly.toml} files.
 */
public final class ResolverSettingsLoader {
    public static final String DEFAULT_FILE_NAME = "assembly.toml";

    private ResolverSettingsLoader() {}

    /**
     * Loads the file, falling back to defaults when it does not exist.
     *
     * @throws IllegalStateException when the file cannot be read or is not valid TOML
     */
    public static AssemblySettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return AssemblySettings.defaults();
        }
        try {
            return fromToml(Toml.parse(Files.readString(path)), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static AssemblySettings parse(String text) {
        return fromToml(Toml.parse(text), "<inline>");
    }

    private static AssemblySettings fromToml(TomlParseResult result, String source) {
        if (result.hasErrors()) {
            throw new IllegalStateException("Invalid settings " + source + ": " + result.errors().get(0));
        }
        try {
            TomlTable resolver = result.getTable("resolver");
            String prefix = ResolverSettings.DEFAULT_AUTO_SOURCE_PREFIX;
            boolean checkUnits = true;
            if (resolver != null) {
                prefix = Optional.ofNullable(resolver.getString("autoSourcePrefix")).orElse(prefix);
                checkUnits = Optional.ofNullable(resolver.getBoolean("checkUnits")).orElse(true);
            }
            String logLevel = result.getString("log.level");
            return new AssemblySettings(new ResolverSettings(prefix, checkUnits), logLevel);
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid settings " + source + ": " + ex.getMessage(), ex);
        }
    }
}
