package work.lcod.assembly.index;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Selection applied to one dimension of a source array.
 */
public final class Selector {
    public enum Kind {
        INT,
        SLICE,
        ARRAY
    }

    private static final Selector ALL = new Selector(Kind.SLICE, 0, null, null, null, null);

    private final Kind kind;
    private final int index;
    private final Integer start;
    private final Integer stop;
    private final Integer step;
    private final int[] array;

    private Selector(Kind kind, int index, Integer start, Integer stop, Integer step, int[] array) {
        this.kind = kind;
        this.index = index;
        this.start = start;
        this.stop = stop;
        this.step = step;
        this.array = array;
    }

    public static Selector at(int index) {
        return new Selector(Kind.INT, index, null, null, null, null);
    }

    public static Selector slice(Integer start, Integer stop, Integer step) {
        if (step != null && step == 0) {
            throw new IllegalArgumentException("slice step cannot be zero");
        }
        return new Selector(Kind.SLICE, 0, start, stop, step, null);
    }

    public static Selector all() {
        return ALL;
    }

    public static Selector array(int... indices) {
        if (indices == null || indices.length == 0) {
            throw new IllegalArgumentException("array selector requires at least one index");
        }
        return new Selector(Kind.ARRAY, 0, null, null, null, indices.clone());
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Number of positions of an array selector; 1 for an integer.
     */
    public int size() {
        return kind == Kind.ARRAY ? array.length : 1;
    }

    public boolean dropsDimension() {
        return kind == Kind.INT;
    }

    /**
     * Non-negative positions selected along a dimension of the given extent.
     */
    public int[] positions(int extent) {
        return switch (kind) {
            case INT -> new int[] { normalize(index, extent) };
            case ARRAY -> {
                var out = new int[array.length];
                for (int i = 0; i < array.length; i++) {
                    out[i] = normalize(array[i], extent);
                }
                yield out;
            }
            case SLICE -> slicePositions(extent);
        };
    }

    private int[] slicePositions(int extent) {
        int s = step == null ? 1 : step;
        int first;
        int last;
        if (s > 0) {
            first = start == null ? 0 : clamp(start < 0 ? start + extent : start, 0, extent);
            last = stop == null ? extent : clamp(stop < 0 ? stop + extent : stop, 0, extent);
        } else {
            first = start == null ? extent - 1 : clamp(start < 0 ? start + extent : start, -1, extent - 1);
            last = stop == null ? -1 : clamp(stop < 0 ? stop + extent : stop, -1, extent - 1);
        }
        int count = s > 0 ? Math.max(0, (last - first + s - 1) / s) : Math.max(0, (first - last - s - 1) / -s);
        var out = new int[count];
        for (int i = 0, pos = first; i < count; i++, pos += s) {
            out[i] = pos;
        }
        return out;
    }

    private static int clamp(int value, int low, int high) {
        return Math.max(low, Math.min(high, value));
    }

    static int normalize(int raw, int extent) {
        int value = raw < 0 ? raw + extent : raw;
        if (value < 0 || value >= extent) {
            throw new IllegalArgumentException("index " + raw + " is out of bounds for axis with size " + extent);
        }
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Selector that)) {
            return false;
        }
        return kind == that.kind
            && index == that.index
            && Objects.equals(start, that.start)
            && Objects.equals(stop, that.stop)
            && Objects.equals(step, that.step)
            && Arrays.equals(array, that.array);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, index, start, stop, step, Arrays.hashCode(array));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INT -> String.valueOf(index);
            case ARRAY -> Arrays.stream(array).mapToObj(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
            case SLICE -> {
                var text = bound(start) + ":" + bound(stop);
                yield step == null ? text : text + ":" + step;
            }
        };
    }

    private static String bound(Integer value) {
        return value == null ? "" : value.toString();
    }
}
