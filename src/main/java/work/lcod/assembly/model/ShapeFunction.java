package work.lcod.assembly.model;

import java.util.Map;

/**
 * Pure function computing a variable shape from the shapes of its opposite-direction siblings,
 * keyed by their local names.
 */
@FunctionalInterface
public interface ShapeFunction {
    Shape compute(Map<String, Shape> siblings);
}
