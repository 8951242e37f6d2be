package work.lcod.assembly.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.error.ModelResolutionException;
import work.lcod.assembly.error.ResolutionException;
import work.lcod.assembly.error.UnresolvableShapeException;
import work.lcod.assembly.loader.AssemblySettings;
import work.lcod.assembly.loader.ModelLoader;
import work.lcod.assembly.loader.ResolverSettingsLoader;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.resolve.ModelResolver;

/**
 * Public entry point: loads a model file, resolves it and reports the outcome as a
 * {@link RunResult}. Resolution failures are reported, never thrown.
 */
public final class AssemblyRunner {
    private static final Logger LOG = LogManager.getLogger(AssemblyRunner.class);

    public RunResult run(AssemblyRunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("model", configuration.modelTarget().display());
        try {
            var settings = configuration.settingsFile()
                .map(ResolverSettingsLoader::load)
                .orElseGet(AssemblySettings::defaults);
            var level = configuration.logLevel().orElseGet(() -> LogLevel.from(settings.logLevel()));
            level.apply();
            metadata.put("logLevel", level.name());

            var tree = loadModel(configuration.modelTarget());
            var resolved = new ModelResolver(settings.resolver()).resolve(tree);
            metadata.put("status", "ok");
            metadata.putAll(resolved.toSerializableMap());
            return RunResult.success(metadata, started);
        } catch (ResolutionException ex) {
            LOG.error("Model {} failed to resolve: {}", configuration.modelTarget().display(), ex.getMessage());
            var errors = ex instanceof ModelResolutionException multiple
                ? multiple.errors()
                : List.of(ex);
            metadata.put("errors", errors.stream().map(ResolutionException::toMap).toList());
            errors.stream()
                .filter(UnresolvableShapeException.class::isInstance)
                .map(UnresolvableShapeException.class::cast)
                .findFirst()
                .ifPresent(unresolvable -> metadata.put("shapeGraph", unresolvable.shapeGraph().toSerializableMap()));
            return RunResult.failure(ex.getMessage(), metadata, started);
        } catch (RuntimeException ex) {
            LOG.error("Model {} could not be assembled", configuration.modelTarget().display(), ex);
            return RunResult.failure(ex.getMessage(), metadata, started);
        }
    }

    private static ModelTree loadModel(ModelTarget target) {
        return target.remoteUri()
            .map(ModelLoader::loadFromHttp)
            .orElseGet(() -> ModelLoader.loadFromLocalFile(target.localPath().orElseThrow()));
    }
}
