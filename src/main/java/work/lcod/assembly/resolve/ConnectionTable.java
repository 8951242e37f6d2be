package work.lcod.assembly.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.assembly.model.DefaultValue;

/**
 * Output of {@link ConnectionResolver}: the single source of every input, with its pending
 * index chain, and the synthesized sources.
 */
public record ConnectionTable(List<Assignment> assignments, List<AutoSource> autoSources, Map<String, DefaultValue> startValues) {
    /**
     * {@code target} is fed by {@code source}; {@code explicit} marks a declared connection.
     */
    public record Assignment(String source, String target, boolean explicit, IndexChain chain) {}

    public ConnectionTable {
        assignments = List.copyOf(assignments);
        autoSources = List.copyOf(autoSources);
        startValues = Collections.unmodifiableMap(new LinkedHashMap<>(startValues));
    }
}
