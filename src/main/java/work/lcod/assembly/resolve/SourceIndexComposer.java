package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.assembly.error.ShapeMismatchException;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.Shape;

/**
 * Turns each assignment's index chain into the final flat selection over its resolved source and
 * checks the selection fits the target.
 */
public final class SourceIndexComposer {
    private final ResolutionProblems problems;

    public SourceIndexComposer(ResolutionProblems problems) {
        this.problems = problems;
    }

    public List<ResolvedConnection> compose(ModelTree tree, ConnectionTable connections, Map<String, Shape> shapes) {
        var resolved = new ArrayList<ResolvedConnection>();
        for (var assignment : connections.assignments()) {
            var target = tree.variable(assignment.target()).decl();
            if (target.discrete()) {
                resolved.add(new ResolvedConnection(assignment.source(), assignment.target(), ComposedIndex.identity(), assignment.explicit()));
                continue;
            }
            var sourceShape = shapes.get(assignment.source());
            var targetShape = shapes.get(assignment.target());
            if (sourceShape == null || targetShape == null) {
                // already reported as unresolvable
                continue;
            }
            IndexChain.Result result;
            try {
                result = assignment.chain().apply(sourceShape);
            } catch (IllegalArgumentException ex) {
                problems.add(new ShapeMismatchException(
                    "Invalid source indices for the connection '" + assignment.source() + "' to '" + assignment.target()
                        + "': " + ex.getMessage(),
                    List.of(assignment.source(), assignment.target())));
                continue;
            }
            if (!result.shape().compatibleWith(targetShape)) {
                var detail = result.flatIndices() == null
                    ? "The source shape is " + sourceShape + " but the target shape is " + targetShape + "."
                    : "The target shape is " + targetShape + " but the source indices select shape " + result.shape() + ".";
                problems.add(new ShapeMismatchException(
                    "The source and target shapes do not match for the connection '" + assignment.source() + "' to '"
                        + assignment.target() + "'. " + detail,
                    List.of(assignment.source(), assignment.target())));
                continue;
            }
            resolved.add(new ResolvedConnection(
                assignment.source(), assignment.target(), ComposedIndex.of(result.flatIndices()), assignment.explicit()));
        }
        return resolved;
    }
}
