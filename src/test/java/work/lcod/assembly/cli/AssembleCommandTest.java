package work.lcod.assembly.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.lcod.assembly.support.ModelFixtures;

class AssembleCommandTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int execute(String... args) {
        CommandLine cli = Main.commandLine();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        return cli.execute(args);
    }

    private static String model(String name) {
        return ModelFixtures.resource("models", name).toString();
    }

    @Test
    void printsResolvedModel() {
        int exit = execute("--model", model("scenario-b.yaml"));

        assertEquals(0, exit);
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(out.toString().contains("_auto_ivc.v0"));
    }

    @Test
    void failingModelExitsWithOne() {
        int exit = execute("-m", model("scenario-a.yaml"));

        assertEquals(1, exit);
        assertTrue(out.toString().contains("ambiguous_input_defaults"));
    }

    @Test
    void exitCodeIsWorstOfAllModels() {
        int exit = execute("-m", model("scenario-b.yaml"), model("scenario-a.yaml"));

        assertEquals(1, exit);
        assertTrue(out.toString().contains("\"status\" : \"success\""));
        assertTrue(out.toString().contains("\"status\" : \"failure\""));
    }

    @Test
    void writesReportToOutputFile(@TempDir Path tempDir) throws IOException {
        var report = tempDir.resolve("reports").resolve("sliced.json");

        int exit = execute("-m", model("sliced.yaml"), "--output", report.toString());

        assertEquals(0, exit);
        assertTrue(Files.readString(report).contains("G.out"));
        assertEquals("", out.toString());
    }

    @Test
    void outputRequiresSingleModel(@TempDir Path tempDir) {
        int exit = execute("-m", model("scenario-b.yaml"), model("flat.json"),
            "--output", tempDir.resolve("report.json").toString());

        assertNotEquals(0, exit);
        assertTrue(err.toString().contains("--output is not supported"));
    }

    @Test
    void picksUpSettingsNextToModel(@TempDir Path tempDir) throws IOException {
        var modelFile = tempDir.resolve("scenario-b.yaml");
        Files.copy(ModelFixtures.resource("models", "scenario-b.yaml"), modelFile);
        Files.copy(ModelFixtures.resource("settings", "assembly.toml"), tempDir.resolve("assembly.toml"));

        int exit = execute("-m", modelFile.toString(), "--log-level", "warn");

        assertEquals(0, exit);
        assertTrue(out.toString().contains("_ivc.v0"));
    }

    @Test
    void explicitConfigMustExist() {
        int exit = execute("-m", model("scenario-b.yaml"), "-c", "does-not-exist.toml");

        assertNotEquals(0, exit);
        assertTrue(err.toString().contains("Settings file not found"));
    }

    @Test
    void rejectsUnknownLogLevel() {
        int exit = execute("-m", model("scenario-b.yaml"), "--log-level", "loud");

        assertNotEquals(0, exit);
        assertTrue(err.toString().contains("Unsupported log level"));
    }

    @Test
    void printsVersion() {
        int exit = execute("--version");

        assertEquals(0, exit);
        assertTrue(out.toString().startsWith("lcod-assemble (java) "));
        assertTrue(out.toString().contains("resolver defaults: autoSourcePrefix=_auto_ivc, checkUnits=true"));
    }

    @Test
    void unwritableReportIsAShortError(@TempDir Path tempDir) throws IOException {
        var blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");

        int exit = execute("-m", model("scenario-b.yaml"), "--output", blocker.resolve("report.json").toString());

        assertEquals(1, exit);
        assertTrue(err.toString().contains("lcod-assemble: cannot write report to " + blocker));
    }
}
