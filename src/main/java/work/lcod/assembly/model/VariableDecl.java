package work.lcod.assembly.model;

import java.util.Objects;

/**
 * A variable declared by a leaf system, identified by its local name.
 */
public record VariableDecl(
    String name,
    IoDirection io,
    ShapeSpec shapeSpec,
    DefaultValue defaultValue,
    String units,
    boolean discrete,
    boolean distributed
) {
    public VariableDecl {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(shapeSpec, "shapeSpec");
        Objects.requireNonNull(defaultValue, "defaultValue");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid variable name: '" + name + "'");
        }
        if (discrete && units != null) {
            throw new IllegalArgumentException("Discrete variable '" + name + "' cannot declare units");
        }
        if (discrete != defaultValue.isDiscrete()) {
            throw new IllegalArgumentException("Default of '" + name + "' does not match its discrete flag");
        }
    }

    public boolean isInput() {
        return io == IoDirection.INPUT;
    }

    public static Builder input(String name) {
        return new Builder(name, IoDirection.INPUT);
    }

    public static Builder output(String name) {
        return new Builder(name, IoDirection.OUTPUT);
    }

    public static final class Builder {
        private final String name;
        private final IoDirection io;
        private ShapeSpec shapeSpec;
        private Object value;
        private String units;
        private boolean discrete;
        private boolean distributed;

        private Builder(String name, IoDirection io) {
            this.name = name;
            this.io = io;
        }

        public Builder shape(int... dims) {
            this.shapeSpec = ShapeSpec.of(dims);
            return this;
        }

        public Builder shape(ShapeSpec shapeSpec) {
            this.shapeSpec = shapeSpec;
            return this;
        }

        public Builder shapeByConnection() {
            this.shapeSpec = ShapeSpec.byConnection();
            return this;
        }

        public Builder copyShape(String sibling) {
            this.shapeSpec = ShapeSpec.copyShape(sibling);
            return this;
        }

        public Builder computedShape(ShapeFunction function) {
            this.shapeSpec = ShapeSpec.computed(function);
            return this;
        }

        public Builder value(Object value) {
            this.value = value;
            return this;
        }

        public Builder units(String units) {
            this.units = units;
            return this;
        }

        public Builder discrete(boolean discrete) {
            this.discrete = discrete;
            return this;
        }

        public Builder distributed(boolean distributed) {
            this.distributed = distributed;
            return this;
        }

        public VariableDecl build() {
            DefaultValue defaultValue;
            if (discrete) {
                defaultValue = value instanceof DefaultValue dv ? dv : DefaultValue.discrete(value);
            } else {
                defaultValue = value == null ? DefaultValue.ONE : DefaultValue.of(value);
            }
            ShapeSpec spec = shapeSpec;
            if (spec == null) {
                var values = defaultValue.isDiscrete() ? 1 : defaultValue.values().length;
                spec = ShapeSpec.of(values);
            }
            return new VariableDecl(name, io, spec, defaultValue, blankToNull(units), discrete, distributed);
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
