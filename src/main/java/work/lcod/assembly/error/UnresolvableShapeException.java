package work.lcod.assembly.error;

import java.util.List;
import work.lcod.assembly.resolve.ShapeGraph;

/**
 * Shape inference reached its fixed point with variables still unshaped. The diagnostic graph
 * captured at that point is attached for rendering.
 */
public final class UnresolvableShapeException extends ResolutionException {
    private final transient ShapeGraph shapeGraph;

    public UnresolvableShapeException(String message, List<String> paths, ShapeGraph shapeGraph) {
        super("unresolvable_shape", message, paths);
        this.shapeGraph = shapeGraph;
    }

    public ShapeGraph shapeGraph() {
        return shapeGraph;
    }
}
