package work.lcod.assembly.error;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when a resolution pass collected several problems; {@link #errors()} lists each of them
 * in discovery order.
 */
public final class ModelResolutionException extends ResolutionException {
    private final List<ResolutionException> errors;

    public ModelResolutionException(List<ResolutionException> errors) {
        super("multiple", summarize(errors), collectPaths(errors));
        this.errors = List.copyOf(errors);
        errors.forEach(this::addSuppressed);
    }

    public List<ResolutionException> errors() {
        return errors;
    }

    public <T extends ResolutionException> List<T> errorsOf(Class<T> type) {
        var out = new ArrayList<T>();
        for (var error : errors) {
            if (type.isInstance(error)) {
                out.add(type.cast(error));
            }
        }
        return out;
    }

    @Override
    public Map<String, Object> toMap() {
        var map = super.toMap();
        map.put("errors", errors.stream().map(ResolutionException::toMap).collect(Collectors.toList()));
        return map;
    }

    private static String summarize(List<ResolutionException> errors) {
        var header = errors.size() + " problems found while resolving the model:";
        return errors.stream()
            .map(error -> "- " + error.getMessage().replace("\n", "\n  "))
            .collect(Collectors.joining("\n", header + "\n", ""));
    }

    private static List<String> collectPaths(List<ResolutionException> errors) {
        var paths = new LinkedHashSet<String>();
        errors.forEach(error -> paths.addAll(error.paths()));
        return new ArrayList<>(paths);
    }
}
