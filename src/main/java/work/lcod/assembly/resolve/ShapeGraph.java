package work.lcod.assembly.resolve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.assembly.model.Shape;
import work.lcod.assembly.model.ShapeSpec;

/**
 * Read-only snapshot of the shape dependency graph, produced for rendering and diagnostics.
 */
public final class ShapeGraph {
    public enum Status {
        STATIC,
        RESOLVED,
        UNRESOLVED
    }

    public enum EdgeKind {
        CONNECTION,
        COPY,
        COMPUTED
    }

    public record Node(String path, ShapeSpec.Kind kind, Status status, Shape shape) {}

    public record Edge(String from, String to, EdgeKind kind) {}

    private final List<Node> nodes;
    private final List<Edge> edges;

    ShapeGraph(List<Node> nodes, List<Edge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public Optional<Node> node(String path) {
        return nodes.stream().filter(node -> node.path().equals(path)).findFirst();
    }

    public List<String> unresolved() {
        return nodes.stream().filter(node -> node.status() == Status.UNRESOLVED).map(Node::path).toList();
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("nodes", nodes.stream().map(node -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", node.path());
            entry.put("kind", node.kind().name().toLowerCase());
            entry.put("status", node.status().name().toLowerCase());
            entry.put("shape", node.shape() == null ? null : node.shape().dims());
            return entry;
        }).collect(Collectors.toList()));
        map.put("edges", edges.stream()
            .map(edge -> Map.of("from", edge.from(), "to", edge.to(), "kind", edge.kind().name().toLowerCase()))
            .collect(Collectors.toList()));
        return map;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ShapeGraph that && nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode() * 31 + edges.hashCode();
    }
}
