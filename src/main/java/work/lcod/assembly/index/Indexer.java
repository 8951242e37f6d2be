package work.lcod.assembly.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import work.lcod.assembly.model.Shape;

/**
 * Index expression selecting a sub-array of a source variable.
 *
 * <p>The multi-dimensional form holds one {@link Selector} per leading dimension; dimensions
 * without a selector are taken whole. Array selectors, together with any integer selector, are
 * paired element by element into one result dimension, placed where they stand when they are
 * adjacent and first otherwise. The flat form
 * lists positions in the row-major raveled source.
 */
public final class Indexer {
    private final List<Selector> selectors;
    private final int[] flat;

    private Indexer(List<Selector> selectors, int[] flat) {
        this.selectors = selectors;
        this.flat = flat;
    }

    public static Indexer of(Selector... selectors) {
        if (selectors == null || selectors.length == 0) {
            throw new IllegalArgumentException("index requires at least one selector");
        }
        return new Indexer(List.of(selectors), null);
    }

    public static Indexer flat(int... indices) {
        if (indices == null || indices.length == 0) {
            throw new IllegalArgumentException("flat index requires at least one position");
        }
        return new Indexer(List.of(), indices.clone());
    }

    public boolean isFlat() {
        return flat != null;
    }

    public List<Selector> selectors() {
        return selectors;
    }

    public Shape resultShape(Shape source) {
        Objects.requireNonNull(source, "source");
        if (flat != null) {
            checkFlat(source);
            return Shape.of(flat.length);
        }
        var dims = layout(source).terms().stream().map(term -> term.length).toList();
        return dims.isEmpty() ? Shape.SCALAR : new Shape(dims);
    }

    /**
     * Row-major positions in the raveled source for every entry of the selected sub-array.
     */
    public int[] flatIndices(Shape source) {
        Objects.requireNonNull(source, "source");
        if (flat != null) {
            checkFlat(source);
            var out = new int[flat.length];
            for (int i = 0; i < flat.length; i++) {
                out[i] = Selector.normalize(flat[i], source.size());
            }
            return out;
        }
        var layout = layout(source);
        var terms = layout.terms();
        int total = 1;
        for (var term : terms) {
            total *= term.length;
        }
        var out = new int[total];
        if (total == 0) {
            return out;
        }
        var counter = new int[terms.size()];
        for (int k = 0; k < total; k++) {
            int offset = layout.base();
            for (int t = 0; t < terms.size(); t++) {
                offset += terms.get(t)[counter[t]];
            }
            out[k] = offset;
            for (int t = terms.size() - 1; t >= 0; t--) {
                if (++counter[t] < terms.get(t).length) {
                    break;
                }
                counter[t] = 0;
            }
        }
        return out;
    }

    /**
     * Constant offset plus one term per result dimension; a term lists the source offset
     * contributed by each position along that dimension.
     */
    private record Layout(int base, List<int[]> terms) {}

    private Layout layout(Shape source) {
        checkRank(source);
        int rank = source.rank();
        var strides = new int[rank];
        int stride = 1;
        for (int axis = rank - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= source.dim(axis);
        }
        boolean fancy = selectors.stream().anyMatch(selector -> selector.kind() == Selector.Kind.ARRAY);
        int[] advanced = fancy ? advancedOffsets(source, strides) : null;
        int firstAdvanced = -1;
        int lastAdvanced = -1;
        for (int axis = 0; axis < selectors.size(); axis++) {
            if (selectors.get(axis).kind() != Selector.Kind.SLICE) {
                firstAdvanced = firstAdvanced < 0 ? axis : firstAdvanced;
                lastAdvanced = axis;
            }
        }
        boolean adjacent = true;
        for (int axis = firstAdvanced; axis >= 0 && axis <= lastAdvanced; axis++) {
            adjacent &= selectors.get(axis).kind() != Selector.Kind.SLICE;
        }

        int base = 0;
        var terms = new ArrayList<int[]>();
        for (int axis = 0; axis < rank; axis++) {
            var selector = axis < selectors.size() ? selectors.get(axis) : Selector.all();
            if (fancy && selector.kind() != Selector.Kind.SLICE) {
                if (adjacent && axis == firstAdvanced) {
                    terms.add(advanced);
                }
                continue;
            }
            int[] positions = selector.positions(source.dim(axis));
            if (selector.dropsDimension()) {
                base += positions[0] * strides[axis];
                continue;
            }
            var term = new int[positions.length];
            for (int i = 0; i < positions.length; i++) {
                term[i] = positions[i] * strides[axis];
            }
            terms.add(term);
        }
        if (fancy && !adjacent) {
            terms.add(0, advanced);
        }
        return new Layout(base, terms);
    }

    // array and integer selectors broadcast together into a single result dimension
    private int[] advancedOffsets(Shape source, int[] strides) {
        int length = 1;
        for (var selector : selectors) {
            if (selector.kind() != Selector.Kind.ARRAY) {
                continue;
            }
            int size = selector.size();
            if (size != 1 && length != 1 && size != length) {
                throw new IllegalArgumentException(
                    "array selectors of " + this + " cannot be broadcast together (" + length + " vs " + size + ")");
            }
            length = Math.max(length, size);
        }
        var offsets = new int[length];
        for (int axis = 0; axis < selectors.size(); axis++) {
            var selector = selectors.get(axis);
            if (selector.kind() == Selector.Kind.SLICE) {
                continue;
            }
            int[] positions = selector.positions(source.dim(axis));
            for (int i = 0; i < length; i++) {
                offsets[i] += positions[positions.length == 1 ? 0 : i] * strides[axis];
            }
        }
        return offsets;
    }

    private void checkRank(Shape source) {
        if (selectors.size() > source.rank()) {
            throw new IllegalArgumentException(
                "too many indices for source shape " + source + ": " + this);
        }
    }

    private void checkFlat(Shape source) {
        int size = source.size();
        for (int index : flat) {
            Selector.normalize(index, size);
        }
    }

    /**
     * Parses a textual index such as {@code ":, [0, 2]"}, {@code "1"} or {@code "::-1"}.
     */
    public static Indexer parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("index expression must not be blank");
        }
        var parts = splitTopLevel(text.trim());
        var selectors = new Selector[parts.size()];
        for (int i = 0; i < parts.size(); i++) {
            selectors[i] = parseSelector(parts.get(i).trim(), text);
        }
        return of(selectors);
    }

    private static List<String> splitTopLevel(String text) {
        var parts = new ArrayList<String>();
        int depth = 0;
        int begin = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(text.substring(begin, i));
                begin = i + 1;
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("Unbalanced brackets in index expression: " + text);
        }
        parts.add(text.substring(begin));
        return parts;
    }

    private static Selector parseSelector(String part, String whole) {
        try {
            if (part.startsWith("[") && part.endsWith("]")) {
                var body = part.substring(1, part.length() - 1).trim();
                if (body.isEmpty()) {
                    throw new IllegalArgumentException("empty array selector");
                }
                return Selector.array(Arrays.stream(body.split(",")).map(String::trim).mapToInt(Integer::parseInt).toArray());
            }
            if (part.contains(":")) {
                var bounds = part.split(":", -1);
                if (bounds.length > 3) {
                    throw new IllegalArgumentException("too many ':' in slice");
                }
                return Selector.slice(
                    parseBound(bounds[0]),
                    parseBound(bounds[1]),
                    bounds.length == 3 ? parseBound(bounds[2]) : null
                );
            }
            return Selector.at(Integer.parseInt(part));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid index expression '" + whole + "': " + ex.getMessage(), ex);
        }
    }

    private static Integer parseBound(String raw) {
        var trimmed = raw.trim();
        return trimmed.isEmpty() ? null : Integer.valueOf(trimmed);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Indexer that)) {
            return false;
        }
        return selectors.equals(that.selectors) && Arrays.equals(flat, that.flat);
    }

    @Override
    public int hashCode() {
        return 31 * selectors.hashCode() + Arrays.hashCode(flat);
    }

    @Override
    public String toString() {
        if (flat != null) {
            return Arrays.stream(flat).mapToObj(String::valueOf).collect(Collectors.joining(", ", "flat[", "]"));
        }
        return selectors.stream().map(Selector::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
