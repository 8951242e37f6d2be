package work.lcod.assembly.error;

import java.util.List;

/**
 * Inputs sharing a promoted name declare different default metadata and no ancestor override
 * settles the difference.
 */
public final class AmbiguousInputDefaultsException extends ResolutionException {
    private final String promotedName;
    private final List<String> fields;

    public AmbiguousInputDefaultsException(String message, String promotedName, List<String> paths, List<String> fields) {
        super("ambiguous_input_defaults", message, paths);
        this.promotedName = promotedName;
        this.fields = List.copyOf(fields);
    }

    public String promotedName() {
        return promotedName;
    }

    public List<String> fields() {
        return fields;
    }
}
