package work.lcod.assembly.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Concrete array shape. Scalars use the shape {@code (1,)}.
 */
public record Shape(List<Integer> dims) {
    public static final Shape SCALAR = Shape.of(1);

    public Shape {
        Objects.requireNonNull(dims, "dims");
        if (dims.isEmpty()) {
            throw new IllegalArgumentException("Shape must have at least one dimension");
        }
        for (var dim : dims) {
            if (dim == null || dim < 0) {
                throw new IllegalArgumentException("Invalid dimension in shape: " + dims);
            }
        }
        dims = List.copyOf(dims);
    }

    public static Shape of(int... dims) {
        var list = new ArrayList<Integer>(dims.length);
        for (int dim : dims) {
            list.add(dim);
        }
        return new Shape(list);
    }

    public int rank() {
        return dims.size();
    }

    public int dim(int axis) {
        return dims.get(axis);
    }

    public int size() {
        int size = 1;
        for (int dim : dims) {
            size *= dim;
        }
        return size;
    }

    public int[] toArray() {
        return dims.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Two shapes are connection compatible when they hold the same number of entries laid out
     * in the same order, i.e. they only differ by leading or trailing unit dimensions.
     */
    public boolean compatibleWith(Shape other) {
        if (other == null || size() != other.size()) {
            return false;
        }
        return fundamental().equals(other.fundamental());
    }

    private List<Integer> fundamental() {
        int first = -1;
        int last = -1;
        for (int i = 0; i < dims.size(); i++) {
            if (dims.get(i) > 1) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (first < 0) {
            return List.of(1);
        }
        return dims.subList(first, last + 1);
    }

    @Override
    public String toString() {
        if (dims.size() == 1) {
            return "(" + dims.get(0) + ",)";
        }
        return dims.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
