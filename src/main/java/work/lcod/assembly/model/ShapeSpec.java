package work.lcod.assembly.model;

import java.util.Objects;

/**
 * How a variable obtains its shape. Dispatch on {@link #kind()}; the other accessors are only
 * meaningful for their own kind.
 */
public final class ShapeSpec {
    public enum Kind {
        STATIC,
        BY_CONNECTION,
        COPY_SHAPE,
        COMPUTED
    }

    private static final ShapeSpec BY_CONNECTION = new ShapeSpec(Kind.BY_CONNECTION, null, null, null);

    private final Kind kind;
    private final Shape shape;
    private final String copyFrom;
    private final ShapeFunction function;

    private ShapeSpec(Kind kind, Shape shape, String copyFrom, ShapeFunction function) {
        this.kind = kind;
        this.shape = shape;
        this.copyFrom = copyFrom;
        this.function = function;
    }

    public static ShapeSpec of(Shape shape) {
        return new ShapeSpec(Kind.STATIC, Objects.requireNonNull(shape, "shape"), null, null);
    }

    public static ShapeSpec of(int... dims) {
        return of(Shape.of(dims));
    }

    public static ShapeSpec byConnection() {
        return BY_CONNECTION;
    }

    public static ShapeSpec copyShape(String sibling) {
        if (sibling == null || sibling.isBlank()) {
            throw new IllegalArgumentException("copyShape requires a sibling name");
        }
        return new ShapeSpec(Kind.COPY_SHAPE, null, sibling, null);
    }

    public static ShapeSpec computed(ShapeFunction function) {
        return new ShapeSpec(Kind.COMPUTED, null, null, Objects.requireNonNull(function, "function"));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isStatic() {
        return kind == Kind.STATIC;
    }

    public Shape shape() {
        return shape;
    }

    public String copyFrom() {
        return copyFrom;
    }

    public ShapeFunction function() {
        return function;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ShapeSpec that
            && kind == that.kind
            && Objects.equals(shape, that.shape)
            && Objects.equals(copyFrom, that.copyFrom)
            && Objects.equals(function, that.function);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, shape, copyFrom, function);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case STATIC -> "static" + shape;
            case BY_CONNECTION -> "by_connection";
            case COPY_SHAPE -> "copy_shape(" + copyFrom + ")";
            case COMPUTED -> "computed";
        };
    }
}
