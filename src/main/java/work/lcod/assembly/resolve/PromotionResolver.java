package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.error.PromotionException;
import work.lcod.assembly.model.IoDirection;
import work.lcod.assembly.model.ModelPaths;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.PromotionRule;
import work.lcod.assembly.model.SystemNode;

/**
 * Composes every group's promotion rules into a {@link PromotionTable}.
 *
 * <p>A child's namespace is resolved before its parent's rules are matched against it. Within a
 * group, exact and alias rules take precedence over globs; ties go to the first declared rule.
 * Names no rule matches stay qualified by the child name.
 */
public final class PromotionResolver {
    private static final Logger LOG = LogManager.getLogger(PromotionResolver.class);

    private final ResolutionProblems problems;

    public PromotionResolver(ResolutionProblems problems) {
        this.problems = problems;
    }

    public PromotionTable resolve(ModelTree tree) {
        var state = new State(tree);
        visit(tree.root(), state);
        state.levels.values().forEach(Collections::reverse);
        state.contributions.values().forEach(Collections::reverse);
        LOG.debug("Resolved promotions for {} variables ({} top-level names)",
            state.levels.size(), state.namespaces.get(ModelPaths.ROOT).size());
        return new PromotionTable(state.levels, state.contributions, state.namespaces);
    }

    private Map<String, List<String>> visit(SystemNode node, State state) {
        var namespace = new LinkedHashMap<String, List<String>>();
        if (node.leaf()) {
            for (var decl : node.variables()) {
                var path = ModelPaths.join(node.path(), decl.name());
                namespace.put(decl.name(), new ArrayList<>(List.of(path)));
                state.levels.put(path, new ArrayList<>(List.of(new PromotionTable.LevelName(node.path(), decl.name()))));
                state.contributions.put(path, new ArrayList<>());
            }
            state.namespaces.put(node.path(), namespace);
            return namespace;
        }

        var rules = node.promotions();
        var matched = new boolean[rules.size()];
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            if (node.child(rule.child()).isEmpty()) {
                matched[i] = true;
                problems.add(new PromotionException(
                    "Group '" + ModelPaths.display(node.path()) + "' promotes '" + rule.pattern()
                        + "' from unknown subsystem '" + rule.child() + "'.",
                    List.of(ModelPaths.join(node.path(), rule.child()))
                ));
            }
        }

        for (var child : node.children()) {
            var childNamespace = visit(child, state);
            for (var entry : childNamespace.entrySet()) {
                var localName = entry.getKey();
                for (var path : entry.getValue()) {
                    var io = state.tree.variable(path).io();
                    int ruleIndex = selectRule(rules, child.name(), localName, io);
                    String promoted;
                    if (ruleIndex < 0) {
                        promoted = child.name() + "." + localName;
                    } else {
                        var rule = rules.get(ruleIndex);
                        matched[ruleIndex] = true;
                        promoted = rule.promotedName(localName);
                        state.contributions.get(path).add(new PromotionTable.Contribution(node.path(), rule, localName, promoted));
                    }
                    namespace.computeIfAbsent(promoted, key -> new ArrayList<>()).add(path);
                    state.levels.get(path).add(new PromotionTable.LevelName(node.path(), promoted));
                }
            }
        }

        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            if (!matched[i] && !rule.isWildcard()) {
                problems.add(new PromotionException(
                    "Group '" + ModelPaths.display(node.path()) + "' promotes " + describe(rule.filter()) + " '"
                        + rule.pattern() + "' from '" + rule.child() + "', but no such name exists there.",
                    List.of(ModelPaths.join(ModelPaths.join(node.path(), rule.child()), rule.pattern()))
                ));
            }
        }
        state.namespaces.put(node.path(), namespace);
        return namespace;
    }

    private static int selectRule(List<PromotionRule> rules, String child, String name, IoDirection io) {
        int wildcard = -1;
        for (int i = 0; i < rules.size(); i++) {
            var rule = rules.get(i);
            if (!rule.child().equals(child) || !rule.matches(name, io)) {
                continue;
            }
            if (!rule.isWildcard()) {
                return i;
            }
            if (wildcard < 0) {
                wildcard = i;
            }
        }
        return wildcard;
    }

    private static String describe(PromotionRule.Filter filter) {
        return switch (filter) {
            case ANY -> "variable";
            case INPUTS -> "input";
            case OUTPUTS -> "output";
        };
    }

    private static final class State {
        private final ModelTree tree;
        private final Map<String, List<PromotionTable.LevelName>> levels = new LinkedHashMap<>();
        private final Map<String, List<PromotionTable.Contribution>> contributions = new LinkedHashMap<>();
        private final Map<String, Map<String, List<String>>> namespaces = new LinkedHashMap<>();

        private State(ModelTree tree) {
            this.tree = tree;
        }
    }
}
