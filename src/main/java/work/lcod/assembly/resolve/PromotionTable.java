package work.lcod.assembly.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.assembly.model.PromotionRule;

/**
 * Tree-wide promotion mapping produced by {@link PromotionResolver}.
 *
 * <p>For every absolute variable path it records the name the variable is visible under at each
 * enclosing system (root first) and the ordered, root-to-leaf list of rules that renamed it.
 */
public final class PromotionTable {
    /**
     * Name of a variable as seen from the namespace of {@code level}.
     */
    public record LevelName(String level, String name) {}

    /**
     * One promotion step: rule declared on {@code level} exposing {@code localName} of a child as
     * {@code promotedName}.
     */
    public record Contribution(String level, PromotionRule rule, String localName, String promotedName) {}

    private final Map<String, List<LevelName>> levels;
    private final Map<String, List<Contribution>> contributions;
    private final Map<String, Map<String, List<String>>> namespaces;

    PromotionTable(
        Map<String, List<LevelName>> levels,
        Map<String, List<Contribution>> contributions,
        Map<String, Map<String, List<String>>> namespaces
    ) {
        this.levels = freeze(levels);
        this.contributions = freeze(contributions);
        var ns = new LinkedHashMap<String, Map<String, List<String>>>();
        namespaces.forEach((level, names) -> ns.put(level, freeze(names)));
        this.namespaces = Collections.unmodifiableMap(ns);
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> source) {
        var copy = new LinkedHashMap<String, List<T>>();
        source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Name at the top-level namespace.
     */
    public String promotedName(String path) {
        var names = levels.get(path);
        if (names == null) {
            throw new IllegalArgumentException("Unknown variable: " + path);
        }
        return names.get(0).name();
    }

    public List<LevelName> levelNames(String path) {
        return levels.getOrDefault(path, List.of());
    }

    public Optional<String> nameAt(String path, String level) {
        return levelNames(path).stream().filter(entry -> entry.level().equals(level)).map(LevelName::name).findFirst();
    }

    public List<Contribution> contributions(String path) {
        return contributions.getOrDefault(path, List.of());
    }

    public Map<String, List<String>> namespace(String level) {
        return namespaces.getOrDefault(level, Map.of());
    }

    /**
     * Absolute paths visible as {@code name} in the namespace of {@code level}.
     */
    public List<String> resolve(String level, String name) {
        return namespace(level).getOrDefault(name, List.of());
    }

    public Map<String, List<LevelName>> levels() {
        return levels;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PromotionTable that)) {
            return false;
        }
        return levels.equals(that.levels) && contributions.equals(that.contributions) && namespaces.equals(that.namespaces);
    }

    @Override
    public int hashCode() {
        return levels.hashCode() * 31 + contributions.hashCode();
    }
}
