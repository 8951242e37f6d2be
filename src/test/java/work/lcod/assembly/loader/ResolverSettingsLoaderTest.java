package work.lcod.assembly.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.assembly.resolve.ResolverSettings;
import work.lcod.assembly.support.ModelFixtures;

class ResolverSettingsLoaderTest {
    @Test
    void readsResolverAndLogSections() {
        var settings = ResolverSettingsLoader.load(ModelFixtures.resource("settings", "assembly.toml"));

        assertEquals("_ivc", settings.resolver().autoSourcePrefix());
        assertTrue(settings.resolver().checkUnits());
        assertEquals("error", settings.logLevel());
    }

    @Test
    void missingFileFallsBackToDefaults() {
        var settings = ResolverSettingsLoader.load(ModelFixtures.resource("settings", "absent.toml"));
        assertEquals(ResolverSettings.defaults(), settings.resolver());
        assertNull(settings.logLevel());
    }

    @Test
    void partialSectionsKeepDefaults() {
        var settings = ResolverSettingsLoader.parse("[resolver]\ncheckUnits = false\n");
        assertEquals(ResolverSettings.DEFAULT_AUTO_SOURCE_PREFIX, settings.resolver().autoSourcePrefix());
        assertFalse(settings.resolver().checkUnits());
    }

    @Test
    void invalidTomlIsReported() {
        var ex = assertThrows(IllegalStateException.class,
            () -> ResolverSettingsLoader.load(ModelFixtures.resource("settings", "broken.toml")));
        assertTrue(ex.getMessage().contains("broken.toml"));
    }

    @Test
    void invalidValuesAreReported() {
        assertThrows(IllegalStateException.class, () -> ResolverSettingsLoader.parse("[resolver]\ncheckUnits = \"yes\"\n"));
        assertThrows(IllegalStateException.class, () -> ResolverSettingsLoader.parse("[resolver]\nautoSourcePrefix = \"a.b\"\n"));
    }
}
