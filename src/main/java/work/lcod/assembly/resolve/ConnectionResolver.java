package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.error.ConnectionException;
import work.lcod.assembly.error.IncompatibleUnitsException;
import work.lcod.assembly.index.Indexer;
import work.lcod.assembly.model.ConnectionDecl;
import work.lcod.assembly.model.DefaultValue;
import work.lcod.assembly.model.IoDirection;
import work.lcod.assembly.model.ModelPaths;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.ShapeSpec;
import work.lcod.assembly.model.SystemNode;
import work.lcod.assembly.units.Units;

/**
 * Assigns exactly one source to every input.
 *
 * <p>Inputs sharing a top-level promoted name form one group. The group's source is its
 * explicit connection, else the output promoted to the same name, else a synthesized
 * {@link AutoSource}.
 */
public final class ConnectionResolver {
    private static final Logger LOG = LogManager.getLogger(ConnectionResolver.class);

    private record Explicit(String source, String level) {}

    private record ExplicitTarget(String level, Indexer indices) {}

    private final ResolverSettings settings;
    private final ResolutionProblems problems;

    public ConnectionResolver(ResolverSettings settings, ResolutionProblems problems) {
        this.settings = settings;
        this.problems = problems;
    }

    public ConnectionTable resolve(ModelTree tree, PromotionTable promotions) {
        var rootNamespace = promotions.namespace(ModelPaths.ROOT);
        var promotedOutputs = promotedOutputs(tree, rootNamespace);

        var explicitByName = new HashMap<String, Explicit>();
        var explicitTargets = new HashMap<String, ExplicitTarget>();
        for (var system : tree.systems().values()) {
            for (var decl : system.connections()) {
                declare(tree, promotions, system, decl, promotedOutputs, explicitByName, explicitTargets);
            }
        }

        var defaults = new InputDefaultsResolver(tree, promotions, problems);
        var assignments = new ArrayList<ConnectionTable.Assignment>();
        var autoSources = new ArrayList<AutoSource>();
        var startValues = new LinkedHashMap<String, DefaultValue>();
        for (var entry : rootNamespace.entrySet()) {
            var inputs = entry.getValue().stream().filter(path -> tree.variable(path).isInput()).toList();
            if (inputs.isEmpty()) {
                continue;
            }
            var chains = new LinkedHashMap<String, IndexChain>();
            for (var input : inputs) {
                chains.put(input, chain(input, explicitTargets.get(input), promotions));
            }
            var explicit = explicitByName.get(entry.getKey());
            var promoted = promotedOutputs.get(entry.getKey());
            if (explicit != null || promoted != null) {
                var source = explicit != null ? explicit.source() : promoted;
                defaults.checkDiscreteOverrides(inputs);
                for (var input : inputs) {
                    assignments.add(new ConnectionTable.Assignment(source, input, explicitTargets.containsKey(input), chains.get(input)));
                }
                continue;
            }
            var resolved = defaults.resolve(entry.getKey(), inputs, chains);
            var path = ModelPaths.join(settings.autoSourcePrefix(), "v" + autoSources.size());
            var spec = resolved.srcShape() != null ? ShapeSpec.of(resolved.srcShape()) : ShapeSpec.byConnection();
            autoSources.add(new AutoSource(path, entry.getKey(), inputs, resolved.value(), resolved.units(), spec, resolved.discrete()));
            for (var input : inputs) {
                assignments.add(new ConnectionTable.Assignment(path, input, false, chains.get(input)));
                startValues.put(input, startValue(input, resolved, tree.variable(input).decl().units()));
            }
        }

        var order = new HashMap<String, Integer>();
        int position = 0;
        for (var path : tree.variables().keySet()) {
            order.put(path, position++);
        }
        assignments.sort(Comparator.comparingInt(assignment -> order.get(assignment.target())));

        validate(tree, assignments, autoSources);
        LOG.debug("Resolved {} connections ({} explicit) and {} auto sources",
            assignments.size(), assignments.stream().filter(ConnectionTable.Assignment::explicit).count(), autoSources.size());
        return new ConnectionTable(assignments, autoSources, startValues);
    }

    private Map<String, String> promotedOutputs(ModelTree tree, Map<String, List<String>> rootNamespace) {
        var outputs = new HashMap<String, String>();
        for (var entry : rootNamespace.entrySet()) {
            var candidates = entry.getValue().stream().filter(path -> !tree.variable(path).isInput()).toList();
            if (candidates.isEmpty()) {
                continue;
            }
            if (candidates.size() > 1) {
                problems.add(new ConnectionException(
                    "Outputs " + String.join(", ", candidates) + " are all promoted to '" + entry.getKey() + "'.",
                    candidates));
            }
            outputs.put(entry.getKey(), candidates.get(0));
        }
        return outputs;
    }

    private void declare(
        ModelTree tree,
        PromotionTable promotions,
        SystemNode system,
        ConnectionDecl decl,
        Map<String, String> promotedOutputs,
        Map<String, Explicit> explicitByName,
        Map<String, ExplicitTarget> explicitTargets
    ) {
        var level = system.path();
        var where = "Group '" + ModelPaths.display(level) + "': ";
        var sources = endpoint(tree, promotions, level, decl.source());
        var targets = endpoint(tree, promotions, level, decl.target());
        var sourceOutputs = sources.stream().filter(path -> !tree.variable(path).isInput()).toList();
        var targetInputs = targets.stream().filter(path -> tree.variable(path).isInput()).toList();
        if (sources.isEmpty()) {
            problems.add(new ConnectionException(where + "connection source '" + decl.source() + "' does not exist.",
                List.of(ModelPaths.join(level, decl.source()))));
            return;
        }
        if (sourceOutputs.isEmpty()) {
            problems.add(new ConnectionException(
                where + "connection source '" + decl.source() + "' is an input; connections must start at an output.", sources));
            return;
        }
        if (targets.isEmpty()) {
            problems.add(new ConnectionException(where + "connection target '" + decl.target() + "' does not exist.",
                List.of(ModelPaths.join(level, decl.target()))));
            return;
        }
        if (targetInputs.isEmpty()) {
            problems.add(new ConnectionException(
                where + "connection target '" + decl.target() + "' is an output; connections must end at an input.", targets));
            return;
        }
        var source = sourceOutputs.get(0);
        for (var target : targetInputs) {
            var name = promotions.promotedName(target);
            var existing = explicitByName.get(name);
            if (existing != null && !existing.source().equals(source)) {
                problems.add(new ConnectionException(
                    "Input '" + target + "' is connected to both '" + existing.source() + "' and '" + source + "'.",
                    List.of(target, existing.source(), source)));
                continue;
            }
            var promoted = promotedOutputs.get(name);
            if (promoted != null && !promoted.equals(source)) {
                problems.add(new ConnectionException(
                    "Input '" + target + "' is connected to '" + source + "' but is also promoted to the same name as output '"
                        + promoted + "'.",
                    List.of(target, source, promoted)));
                continue;
            }
            explicitByName.putIfAbsent(name, new Explicit(source, level));
            explicitTargets.putIfAbsent(target, new ExplicitTarget(level, decl.srcIndices()));
        }
    }

    /**
     * Variables named {@code name} in the namespace of {@code level}; falls back to a path relative to the level.
     */
    private static List<String> endpoint(ModelTree tree, PromotionTable promotions, String level, String name) {
        var promoted = promotions.resolve(level, name);
        if (!promoted.isEmpty()) {
            return promoted;
        }
        var path = ModelPaths.join(level, name);
        return tree.variable(path) != null ? List.of(path) : List.of();
    }

    private static IndexChain chain(String input, ExplicitTarget explicit, PromotionTable promotions) {
        var levels = new ArrayList<IndexChain.Level>();
        if (explicit != null && explicit.indices() != null) {
            levels.add(new IndexChain.Level(explicit.level(), explicit.indices(), null));
        }
        for (var contribution : promotions.contributions(input)) {
            var rule = contribution.rule();
            if (rule.srcIndices() == null && rule.srcShape() == null) {
                continue;
            }
            if (explicit != null && !ModelPaths.contains(explicit.level(), contribution.level())) {
                LOG.warn("Ignoring src_indices/src_shape of rule {} on '{}': input '{}' is connected explicitly in '{}'",
                    rule, ModelPaths.display(contribution.level()), input, ModelPaths.display(explicit.level()));
                continue;
            }
            levels.add(new IndexChain.Level(contribution.level(), rule.srcIndices(), rule.srcShape()));
        }
        return levels.isEmpty() ? IndexChain.IDENTITY : new IndexChain(levels);
    }

    private static DefaultValue startValue(String input, InputDefaultsResolver.Defaults defaults, String targetUnits) {
        try {
            return Units.convert(defaults.value(), defaults.units(), targetUnits);
        } catch (IllegalArgumentException ex) {
            LOG.warn("Start value of '{}' is kept in '{}' instead of its declared units '{}': {}",
                input, defaults.units(), targetUnits, ex.getMessage());
            return defaults.value();
        }
    }

    private void validate(ModelTree tree, List<ConnectionTable.Assignment> assignments, List<AutoSource> autoSources) {
        var autoByPath = new HashMap<String, AutoSource>();
        autoSources.forEach(auto -> autoByPath.put(auto.path(), auto));
        for (var assignment : assignments) {
            var target = tree.variable(assignment.target()).decl();
            var auto = autoByPath.get(assignment.source());
            boolean sourceDiscrete;
            String sourceUnits;
            if (auto != null) {
                sourceDiscrete = auto.discrete();
                sourceUnits = auto.units();
            } else {
                var source = tree.variable(assignment.source()).decl();
                if (source.io() != IoDirection.OUTPUT) {
                    continue;
                }
                sourceDiscrete = source.discrete();
                sourceUnits = source.units();
            }
            if (sourceDiscrete != target.discrete()) {
                if (auto == null) {
                    problems.add(new ConnectionException(
                        "Cannot connect " + kind(sourceDiscrete) + " output '" + assignment.source() + "' to "
                            + kind(target.discrete()) + " input '" + assignment.target() + "'.",
                        List.of(assignment.source(), assignment.target())));
                }
                continue;
            }
            if (!settings.checkUnits() || target.discrete() || sourceUnits == null || target.units() == null) {
                continue;
            }
            if (!Units.isValid(sourceUnits) || !Units.isValid(target.units()) || !Units.convertible(sourceUnits, target.units())) {
                problems.add(new IncompatibleUnitsException(
                    "Cannot connect '" + assignment.source() + "' (units '" + sourceUnits + "') to '" + assignment.target()
                        + "' (units '" + target.units() + "'): units are not convertible.",
                    List.of(assignment.source(), assignment.target())));
            }
        }
    }

    private static String kind(boolean discrete) {
        return discrete ? "discrete" : "continuous";
    }
}
