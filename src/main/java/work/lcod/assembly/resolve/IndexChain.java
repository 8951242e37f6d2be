package work.lcod.assembly.resolve;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.assembly.index.Indexer;
import work.lcod.assembly.model.ModelPaths;
import work.lcod.assembly.model.Shape;

/**
 * Ordered (root to leaf) slicing steps between a source and one of its target inputs.
 */
public record IndexChain(List<Level> levels) {
    public static final IndexChain IDENTITY = new IndexChain(List.of());

    /**
     * Slicing declared at one namespace level: {@code srcShape} is the shape this level assumes for
     * its upstream array, {@code indices} the selection applied to it. Either may be null.
     */
    public record Level(String level, Indexer indices, Shape srcShape) {}

    /**
     * Shape after applying the chain, and the composed flat source positions (null when no level slices).
     */
    public record Result(Shape shape, int[] flatIndices) {}

    public IndexChain {
        levels = List.copyOf(Objects.requireNonNull(levels, "levels"));
    }

    public boolean isIdentity() {
        return levels.stream().allMatch(level -> level.indices() == null);
    }

    /**
     * Source shape implied by the chain: the first declared {@code srcShape} reached before any slicing.
     */
    public Optional<Shape> declaredSourceShape() {
        for (var level : levels) {
            if (level.srcShape() != null) {
                return Optional.of(level.srcShape());
            }
            if (level.indices() != null) {
                break;
            }
        }
        return Optional.empty();
    }

    /**
     * Applies every level in order against the resolved source shape.
     *
     * @throws IllegalArgumentException when a level's {@code srcShape} disagrees with the array it
     *     receives, or an index falls outside it
     */
    public Result apply(Shape source) {
        Shape current = source;
        int[] positions = null;
        for (var level : levels) {
            var basis = current;
            if (level.srcShape() != null) {
                if (!level.srcShape().equals(current)) {
                    throw new IllegalArgumentException("level '" + ModelPaths.display(level.level())
                        + "' declares src_shape " + level.srcShape() + " but receives an array of shape " + current);
                }
                basis = level.srcShape();
            }
            if (level.indices() == null) {
                current = basis;
                continue;
            }
            int[] selected;
            try {
                selected = level.indices().flatIndices(basis);
                current = level.indices().resultShape(basis);
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("level '" + ModelPaths.display(level.level())
                    + "' applies " + level.indices() + " to shape " + basis + ": " + ex.getMessage(), ex);
            }
            var composed = new int[selected.length];
            for (int i = 0; i < selected.length; i++) {
                composed[i] = positions == null ? selected[i] : positions[selected[i]];
            }
            positions = composed;
        }
        return new Result(current, positions);
    }
}
