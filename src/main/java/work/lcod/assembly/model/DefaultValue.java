package work.lcod.assembly.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Declared default of a variable: a flat array of doubles for continuous variables, or an
 * arbitrary object for discrete ones.
 */
public final class DefaultValue {
    public static final DefaultValue ONE = continuous(1.0);

    private final double[] values;
    private final Object discrete;
    private final boolean isDiscrete;

    private DefaultValue(double[] values, Object discrete, boolean isDiscrete) {
        this.values = values;
        this.discrete = discrete;
        this.isDiscrete = isDiscrete;
    }

    public static DefaultValue continuous(double... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("continuous default requires at least one value");
        }
        return new DefaultValue(values.clone(), null, false);
    }

    public static DefaultValue discrete(Object value) {
        return new DefaultValue(null, value, true);
    }

    /**
     * Normalizes a loosely typed value (number, numeric array or list of numbers) into a continuous default.
     */
    public static DefaultValue of(Object raw) {
        if (raw instanceof DefaultValue value) {
            return value;
        }
        if (raw instanceof Number number) {
            return continuous(number.doubleValue());
        }
        if (raw instanceof double[] array) {
            return continuous(array);
        }
        if (raw instanceof int[] array) {
            return continuous(Arrays.stream(array).asDoubleStream().toArray());
        }
        if (raw instanceof List<?> list && !list.isEmpty()) {
            var values = new double[list.size()];
            for (int i = 0; i < values.length; i++) {
                if (!(list.get(i) instanceof Number number)) {
                    throw new IllegalArgumentException("Continuous default must be numeric: " + raw);
                }
                values[i] = number.doubleValue();
            }
            return continuous(values);
        }
        throw new IllegalArgumentException("Continuous default must be numeric: " + raw);
    }

    public boolean isDiscrete() {
        return isDiscrete;
    }

    public double[] values() {
        if (isDiscrete) {
            throw new IllegalStateException("Discrete default has no numeric values");
        }
        return values.clone();
    }

    public double scalar() {
        return values()[0];
    }

    public Object discreteValue() {
        return discrete;
    }

    /**
     * JSON friendly form: a number, a list of numbers, or the discrete object.
     */
    public Object toSerializable() {
        if (isDiscrete) {
            return discrete;
        }
        if (values.length == 1) {
            return values[0];
        }
        return Arrays.stream(values).boxed().toList();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DefaultValue that)) {
            return false;
        }
        if (isDiscrete != that.isDiscrete) {
            return false;
        }
        return isDiscrete ? Objects.equals(discrete, that.discrete) : Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return isDiscrete ? Objects.hashCode(discrete) : Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        if (isDiscrete) {
            return String.valueOf(discrete);
        }
        if (values.length == 1) {
            return String.valueOf(values[0]);
        }
        return Arrays.toString(values);
    }
}
