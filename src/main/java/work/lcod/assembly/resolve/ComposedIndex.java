package work.lcod.assembly.resolve;

import java.util.Arrays;

/**
 * Final source selection of one connection: either the identity or flat positions into the
 * raveled source array.
 */
public final class ComposedIndex {
    private static final ComposedIndex IDENTITY = new ComposedIndex(null);

    private final int[] flat;

    private ComposedIndex(int[] flat) {
        this.flat = flat;
    }

    public static ComposedIndex identity() {
        return IDENTITY;
    }

    public static ComposedIndex of(int[] flat) {
        return flat == null ? IDENTITY : new ComposedIndex(flat.clone());
    }

    public boolean isIdentity() {
        return flat == null;
    }

    public int[] flatIndices() {
        if (flat == null) {
            throw new IllegalStateException("identity index has no explicit positions");
        }
        return flat.clone();
    }

    public Object toSerializable() {
        return flat == null ? "identity" : Arrays.stream(flat).boxed().toList();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ComposedIndex that && Arrays.equals(flat, that.flat);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(flat);
    }

    @Override
    public String toString() {
        return flat == null ? "identity" : Arrays.toString(flat);
    }
}
