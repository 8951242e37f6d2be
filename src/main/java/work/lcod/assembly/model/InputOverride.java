package work.lcod.assembly.model;

/**
 * Explicit default metadata for a promoted input name. Every field is optional.
 */
public record InputOverride(DefaultValue value, String units, Shape srcShape) {
    public static InputOverride of(Object value, String units) {
        return new InputOverride(value == null ? null : DefaultValue.of(value), units, null);
    }

    public static InputOverride discrete(Object value) {
        return new InputOverride(DefaultValue.discrete(value), null, null);
    }

    public InputOverride withSrcShape(Shape shape) {
        return new InputOverride(value, units, shape);
    }

    public boolean isEmpty() {
        return value == null && units == null && srcShape == null;
    }
}
