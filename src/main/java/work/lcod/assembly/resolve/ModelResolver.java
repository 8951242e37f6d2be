package work.lcod.assembly.resolve;

import java.util.LinkedHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.model.IoDirection;
import work.lcod.assembly.model.ModelTree;

/**
 * Entry point of a resolution pass: promotions, connections, shapes, then source indices.
 *
 * <p>Each call starts from the immutable declarations and shares nothing with earlier calls. All
 * problems are collected and thrown together at the end; no {@link ResolvedModel} is produced
 * when any were found.
 */
public final class ModelResolver {
    private static final Logger LOG = LogManager.getLogger(ModelResolver.class);

    private final ResolverSettings settings;

    public ModelResolver() {
        this(ResolverSettings.defaults());
    }

    public ModelResolver(ResolverSettings settings) {
        this.settings = settings;
    }

    public ResolverSettings settings() {
        return settings;
    }

    /**
     * @throws work.lcod.assembly.error.ResolutionException the single problem found, or a
     *     {@link work.lcod.assembly.error.ModelResolutionException} listing several
     */
    public ResolvedModel resolve(ModelTree tree) {
        var problems = new ResolutionProblems();
        var promotions = new PromotionResolver(problems).resolve(tree);
        var connections = new ConnectionResolver(settings, problems).resolve(tree, promotions);
        var shapes = new ShapeInferenceEngine(problems).infer(tree, connections);
        var resolvedConnections = new SourceIndexComposer(problems).compose(tree, connections, shapes.shapes());
        if (!problems.isEmpty()) {
            LOG.debug("Resolution found {} problem(s)", problems.errors().size());
        }
        problems.throwIfAny();

        var variables = new LinkedHashMap<String, ResolvedVariable>();
        for (var variable : tree.variables().values()) {
            var decl = variable.decl();
            variables.put(variable.path(), new ResolvedVariable(
                variable.path(),
                promotions.promotedName(variable.path()),
                decl.io(),
                shapes.shapes().get(variable.path()),
                decl.units(),
                decl.defaultValue(),
                decl.discrete(),
                decl.distributed(),
                false
            ));
        }
        for (var auto : connections.autoSources()) {
            variables.put(auto.path(), new ResolvedVariable(
                auto.path(),
                auto.path(),
                IoDirection.OUTPUT,
                shapes.shapes().get(auto.path()),
                auto.units(),
                auto.value(),
                auto.discrete(),
                false,
                true
            ));
        }
        LOG.debug("Resolved model with {} variables and {} connections", variables.size(), resolvedConnections.size());
        return new ResolvedModel(variables, promotions, resolvedConnections, connections.autoSources(), connections.startValues(), shapes.graph());
    }
}
