package work.lcod.assembly.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import work.lcod.assembly.index.Indexer;

/**
 * Immutable model declaration: the system tree plus lookup tables keyed by absolute path, all in
 * declaration (pre-order) order.
 */
public final class ModelTree {
    private final SystemNode root;
    private final Map<String, SystemNode> systems;
    private final Map<String, ModelVariable> variables;

    private ModelTree(SystemNode root) {
        this.root = root;
        var systemIndex = new LinkedHashMap<String, SystemNode>();
        var variableIndex = new LinkedHashMap<String, ModelVariable>();
        index(root, systemIndex, variableIndex);
        this.systems = Collections.unmodifiableMap(systemIndex);
        this.variables = Collections.unmodifiableMap(variableIndex);
    }

    private static void index(SystemNode node, Map<String, SystemNode> systems, Map<String, ModelVariable> variables) {
        systems.put(node.path(), node);
        for (var decl : node.variables()) {
            var path = ModelPaths.join(node.path(), decl.name());
            variables.put(path, new ModelVariable(path, node.path(), decl));
        }
        for (var child : node.children()) {
            index(child, systems, variables);
        }
    }

    public SystemNode root() {
        return root;
    }

    public Map<String, SystemNode> systems() {
        return systems;
    }

    public SystemNode system(String path) {
        return systems.get(path);
    }

    public Map<String, ModelVariable> variables() {
        return variables;
    }

    public ModelVariable variable(String path) {
        return variables.get(path);
    }

    public static GroupBuilder builder() {
        return new GroupBuilder(ModelPaths.ROOT, new long[] { 0L });
    }

    /**
     * A declared variable together with its absolute path and owning system.
     */
    public record ModelVariable(String path, String systemPath, VariableDecl decl) {
        public IoDirection io() {
            return decl.io();
        }

        public boolean isInput() {
            return decl.isInput();
        }
    }

    public static final class GroupBuilder {
        private final String path;
        private final long[] sequence;
        private final List<SystemNode> children = new ArrayList<>();
        private final List<PromotionRule> promotions = new ArrayList<>();
        private final List<ConnectionDecl> connections = new ArrayList<>();
        private final List<InputDefaults> inputDefaults = new ArrayList<>();

        private GroupBuilder(String path, long[] sequence) {
            this.path = path;
            this.sequence = sequence;
        }

        public GroupBuilder group(String name, Consumer<GroupBuilder> body) {
            var child = new GroupBuilder(childPath(name), sequence);
            body.accept(child);
            children.add(child.node());
            return this;
        }

        public GroupBuilder leaf(String name, Consumer<LeafBuilder> body) {
            var child = new LeafBuilder(childPath(name));
            body.accept(child);
            children.add(child.node());
            return this;
        }

        public GroupBuilder promotes(String child, String... names) {
            return promotes(child, PromotionRule.Filter.ANY, names);
        }

        public GroupBuilder promotesInputs(String child, String... names) {
            return promotes(child, PromotionRule.Filter.INPUTS, names);
        }

        public GroupBuilder promotesOutputs(String child, String... names) {
            return promotes(child, PromotionRule.Filter.OUTPUTS, names);
        }

        private GroupBuilder promotes(String child, PromotionRule.Filter filter, String... names) {
            for (var name : names) {
                promote(PromotionRule.parse(child, name).filter(filter));
            }
            return this;
        }

        public GroupBuilder promote(PromotionRule.Builder rule) {
            return promote(rule.build());
        }

        public GroupBuilder promote(PromotionRule rule) {
            promotions.add(rule.withSequence(++sequence[0]));
            return this;
        }

        public GroupBuilder connect(String source, String target) {
            return connect(source, target, null);
        }

        public GroupBuilder connect(String source, String target, Indexer srcIndices) {
            connections.add(new ConnectionDecl(source, target, srcIndices, ++sequence[0]));
            return this;
        }

        public GroupBuilder inputDefaults(String name, InputOverride override) {
            inputDefaults.add(new InputDefaults(name, override, ++sequence[0]));
            return this;
        }

        public ModelTree build() {
            if (!path.isEmpty()) {
                throw new IllegalStateException("Only the root builder can build a model tree");
            }
            return new ModelTree(node());
        }

        private String childPath(String name) {
            checkName(name);
            var childPath = ModelPaths.join(path, name);
            for (var existing : children) {
                if (existing.path().equals(childPath)) {
                    throw new IllegalArgumentException("Duplicate subsystem '" + childPath + "'");
                }
            }
            return childPath;
        }

        private SystemNode node() {
            return new SystemNode(path, false, children, List.of(), promotions, connections, inputDefaults);
        }
    }

    public static final class LeafBuilder {
        private final String path;
        private final Map<String, VariableDecl> variables = new LinkedHashMap<>();

        private LeafBuilder(String path) {
            this.path = path;
        }

        public LeafBuilder add(VariableDecl.Builder builder) {
            return add(builder.build());
        }

        public LeafBuilder add(VariableDecl decl) {
            Objects.requireNonNull(decl, "decl");
            if (variables.putIfAbsent(decl.name(), decl) != null) {
                throw new IllegalArgumentException("Duplicate variable '" + ModelPaths.join(path, decl.name()) + "'");
            }
            return this;
        }

        private SystemNode node() {
            var names = new LinkedHashSet<>(variables.keySet());
            for (var decl : variables.values()) {
                if (decl.shapeSpec().kind() == ShapeSpec.Kind.COPY_SHAPE) {
                    var ref = decl.shapeSpec().copyFrom();
                    if (ref.equals(decl.name()) || !names.contains(ref)) {
                        throw new IllegalArgumentException(
                            "Variable '" + ModelPaths.join(path, decl.name()) + "' copies the shape of unknown sibling '" + ref + "'");
                    }
                }
            }
            return new SystemNode(path, true, List.of(), List.copyOf(variables.values()), List.of(), List.of(), List.of());
        }
    }

    private static void checkName(String name) {
        if (name == null || name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid subsystem name: '" + name + "'");
        }
    }
}
