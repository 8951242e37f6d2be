package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.error.DistributedShapeMismatchException;
import work.lcod.assembly.error.ShapeMismatchException;
import work.lcod.assembly.error.UnresolvableShapeException;
import work.lcod.assembly.model.IoDirection;
import work.lcod.assembly.model.ModelPaths;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.Shape;
import work.lcod.assembly.model.ShapeSpec;

/**
 * Propagates concrete shapes over connections, copy-shape links and computed shape functions
 * until a full scan changes nothing.
 *
 * <p>Connections propagate in both directions. Towards the target the source shape is reduced by
 * the connection's index chain; towards the source only an identity chain or a declared
 * {@code src_shape} says anything about the source.
 */
public final class ShapeInferenceEngine {
    private static final Logger LOG = LogManager.getLogger(ShapeInferenceEngine.class);

    /**
     * Resolved shapes (absolute path to shape) and the diagnostic graph of the pass.
     */
    public record Result(Map<String, Shape> shapes, ShapeGraph graph) {}

    private static final class Node {
        private final String path;
        private final String system;
        private final IoDirection io;
        private final ShapeSpec spec;
        private final boolean distributed;
        private Shape shape;

        private Node(String path, String system, IoDirection io, ShapeSpec spec, boolean distributed) {
            this.path = path;
            this.system = system;
            this.io = io;
            this.spec = spec;
            this.distributed = distributed;
            this.shape = spec.isStatic() ? spec.shape() : null;
        }

        private String localName() {
            return ModelPaths.relative(system, path);
        }

        private boolean acceptsPropagation() {
            return spec.kind() == ShapeSpec.Kind.BY_CONNECTION || spec.kind() == ShapeSpec.Kind.COPY_SHAPE;
        }
    }

    private final ResolutionProblems problems;

    public ShapeInferenceEngine(ResolutionProblems problems) {
        this.problems = problems;
    }

    public Result infer(ModelTree tree, ConnectionTable connections) {
        var nodes = new LinkedHashMap<String, Node>();
        var bySystem = new LinkedHashMap<String, List<Node>>();
        for (var variable : tree.variables().values()) {
            var decl = variable.decl();
            var node = new Node(variable.path(), variable.systemPath(), decl.io(), decl.shapeSpec(), decl.distributed());
            nodes.put(node.path, node);
            bySystem.computeIfAbsent(node.system, key -> new ArrayList<>()).add(node);
        }
        for (var auto : connections.autoSources()) {
            var node = new Node(auto.path(), ModelPaths.parent(auto.path()), IoDirection.OUTPUT, auto.shapeSpec(), false);
            nodes.put(node.path, node);
        }

        checkDistributed(connections, nodes);

        // node paths already reported, plus "source->target" keys of failed propagations
        var failed = new HashSet<String>();
        int passes = 0;
        boolean changed;
        do {
            changed = false;
            passes++;
            for (var assignment : connections.assignments()) {
                changed |= propagate(assignment, nodes.get(assignment.source()), nodes.get(assignment.target()), failed);
            }
            for (var node : nodes.values()) {
                if (node.spec.kind() == ShapeSpec.Kind.COPY_SHAPE) {
                    changed |= copy(node, nodes.get(ModelPaths.join(node.system, node.spec.copyFrom())));
                } else if (node.spec.kind() == ShapeSpec.Kind.COMPUTED && node.shape == null && !failed.contains(node.path)) {
                    changed |= compute(node, bySystem.getOrDefault(node.system, List.of()), failed);
                }
            }
        } while (changed);
        LOG.debug("Shape inference reached a fixed point after {} passes", passes);

        var graph = snapshot(nodes, connections, bySystem);
        var unresolved = graph.unresolved().stream().filter(path -> !failed.contains(path)).toList();
        if (!unresolved.isEmpty()) {
            problems.add(new UnresolvableShapeException(
                "Failed to resolve shapes for " + unresolved.size() + " variable(s):\n  " + String.join("\n  ", unresolved)
                    + "\nDeclare a static shape on one end of each dependency chain, or a src_shape where src_indices are used.",
                unresolved, graph));
        }
        var shapes = new LinkedHashMap<String, Shape>();
        nodes.values().stream().filter(node -> node.shape != null).forEach(node -> shapes.put(node.path, node.shape));
        return new Result(Collections.unmodifiableMap(shapes), graph);
    }

    private void checkDistributed(ConnectionTable connections, Map<String, Node> nodes) {
        for (var assignment : connections.assignments()) {
            var source = nodes.get(assignment.source());
            var target = nodes.get(assignment.target());
            if (source.distributed && !source.spec.isStatic() && !target.distributed && !target.spec.isStatic()) {
                problems.add(new DistributedShapeMismatchException(
                    "Dynamically shaped distributed output '" + source.path + "' cannot feed dynamically shaped "
                        + "non-distributed input '" + target.path + "': its shape may differ on every process.",
                    List.of(source.path, target.path)));
            }
        }
    }

    private boolean propagate(ConnectionTable.Assignment assignment, Node source, Node target, HashSet<String> failed) {
        var chain = assignment.chain();
        if (source.shape != null && target.shape == null && target.acceptsPropagation()) {
            var key = source.path + "->" + target.path;
            if (failed.contains(key)) {
                return false;
            }
            try {
                target.shape = chain.apply(source.shape).shape();
                return true;
            } catch (IllegalArgumentException ex) {
                failed.add(key);
                failed.add(target.path);
                problems.add(new ShapeMismatchException(
                    "Cannot derive the shape of '" + target.path + "' from '" + source.path + "': " + ex.getMessage(),
                    List.of(source.path, target.path)));
                return false;
            }
        }
        if (target.shape != null && source.shape == null && source.acceptsPropagation()) {
            var declared = chain.declaredSourceShape();
            if (declared.isPresent()) {
                source.shape = declared.get();
                return true;
            }
            if (chain.isIdentity()) {
                source.shape = target.shape;
                return true;
            }
        }
        return false;
    }

    private static boolean copy(Node node, Node other) {
        if (node.shape == null && other.shape != null) {
            node.shape = other.shape;
            return true;
        }
        if (node.shape != null && other.shape == null && other.acceptsPropagation()) {
            other.shape = node.shape;
            return true;
        }
        return false;
    }

    private boolean compute(Node node, List<Node> siblings, HashSet<String> failed) {
        var inputs = new LinkedHashMap<String, Shape>();
        for (var sibling : siblings) {
            if (sibling.io == node.io) {
                continue;
            }
            if (sibling.shape == null) {
                return false;
            }
            inputs.put(sibling.localName(), sibling.shape);
        }
        try {
            var shape = node.spec.function().compute(Collections.unmodifiableMap(inputs));
            if (shape == null) {
                throw new IllegalStateException("shape function returned no shape");
            }
            node.shape = shape;
            return true;
        } catch (RuntimeException ex) {
            failed.add(node.path);
            problems.add(new ShapeMismatchException(
                "Shape function of '" + node.path + "' failed for sibling shapes " + inputs + ": " + ex.getMessage(),
                List.of(node.path)));
            return false;
        }
    }

    private static ShapeGraph snapshot(Map<String, Node> nodes, ConnectionTable connections, Map<String, List<Node>> bySystem) {
        var graphNodes = new ArrayList<ShapeGraph.Node>();
        var edges = new ArrayList<ShapeGraph.Edge>();
        for (var node : nodes.values()) {
            ShapeGraph.Status status;
            if (node.spec.isStatic()) {
                status = ShapeGraph.Status.STATIC;
            } else {
                status = node.shape != null ? ShapeGraph.Status.RESOLVED : ShapeGraph.Status.UNRESOLVED;
            }
            graphNodes.add(new ShapeGraph.Node(node.path, node.spec.kind(), status, node.shape));
            switch (node.spec.kind()) {
                case COPY_SHAPE -> edges.add(new ShapeGraph.Edge(
                    ModelPaths.join(node.system, node.spec.copyFrom()), node.path, ShapeGraph.EdgeKind.COPY));
                case COMPUTED -> bySystem.getOrDefault(node.system, List.of()).stream()
                    .filter(sibling -> sibling.io != node.io)
                    .forEach(sibling -> edges.add(new ShapeGraph.Edge(sibling.path, node.path, ShapeGraph.EdgeKind.COMPUTED)));
                case STATIC, BY_CONNECTION -> {
                }
            }
        }
        for (var assignment : connections.assignments()) {
            edges.add(new ShapeGraph.Edge(assignment.source(), assignment.target(), ShapeGraph.EdgeKind.CONNECTION));
        }
        return new ShapeGraph(graphNodes, edges);
    }
}
