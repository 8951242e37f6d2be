package work.lcod.assembly.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.assembly.api.AssemblyRunConfiguration;
import work.lcod.assembly.api.AssemblyRunner;
import work.lcod.assembly.api.LogLevel;
import work.lcod.assembly.api.ModelTarget;
import work.lcod.assembly.api.RunResult;
import work.lcod.assembly.loader.ResolverSettingsLoader;

@CommandLine.Command(
    name = "lcod-assemble",
    description = "Resolve promotions, connections and shapes of a hierarchical model and print the result as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class AssembleCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-m", "--model"},
        required = true,
        description = "Model file path or HTTP(S) URL.",
        arity = "1..*"
    )
    private List<String> models = new ArrayList<>();

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Settings file (default: assembly.toml next to a local model, when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal); overrides the settings file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--output",
        description = "Write the JSON report to this file instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @Override
    public Integer call() throws IOException {
        if (output != null && models.size() > 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "When using multiple --model values, --output is not supported.");
        }
        LogLevel logLevel;
        try {
            logLevel = logLevelRaw == null ? null : LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }

        var runner = new AssemblyRunner();
        int exitCode = 0;
        for (var model : models) {
            var target = ModelTarget.parse(model);
            var configuration = AssemblyRunConfiguration.builder()
                .modelTarget(target)
                .settingsFile(settingsFor(target))
                .logLevel(logLevel)
                .build();
            RunResult result = runner.run(configuration);
            exitCode = Math.max(exitCode, result.status().exitCode());
            var json = result.toPrettyJson();
            if (output != null) {
                var parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(output, json + System.lineSeparator());
            } else {
                spec.commandLine().getOut().println(json);
            }
        }
        spec.commandLine().getOut().flush();
        return exitCode;
    }

    private Path settingsFor(ModelTarget target) {
        if (config != null) {
            if (!Files.isRegularFile(config)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Settings file not found: " + config);
            }
            return config;
        }
        return target.localPath()
            .map(path -> path.toAbsolutePath().resolveSibling(ResolverSettingsLoader.DEFAULT_FILE_NAME))
            .filter(Files::isRegularFile)
            .orElse(null);
    }
}
