package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import work.lcod.assembly.error.AmbiguousInputDefaultsException;
import work.lcod.assembly.error.ConnectionException;
import work.lcod.assembly.error.InvalidDiscreteOverrideException;
import work.lcod.assembly.error.ShapeMismatchException;
import work.lcod.assembly.model.DefaultValue;
import work.lcod.assembly.model.InputOverride;
import work.lcod.assembly.model.ModelPaths;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.Shape;

/**
 * Settles the metadata of the source synthesized for a group of co-promoted inputs.
 *
 * <p>Overrides count when declared on a group where every member is visible under one name.
 * For each field the deepest such group wins, and among overrides of the same group the last
 * declared wins.
 */
final class InputDefaultsResolver {
    record Defaults(DefaultValue value, String units, Shape srcShape, boolean discrete) {}

    private record Entry(String level, String name, long sequence, InputOverride override) {}

    private final ModelTree tree;
    private final PromotionTable promotions;
    private final ResolutionProblems problems;

    InputDefaultsResolver(ModelTree tree, PromotionTable promotions, ResolutionProblems problems) {
        this.tree = tree;
        this.promotions = promotions;
        this.problems = problems;
    }

    Defaults resolve(String promotedName, List<String> members, Map<String, IndexChain> chains) {
        var first = tree.variable(members.get(0)).decl();
        boolean discrete = first.discrete();
        for (var member : members) {
            if (tree.variable(member).decl().discrete() != discrete) {
                problems.add(new ConnectionException(
                    "Inputs promoted to '" + promotedName + "' mix discrete and continuous variables: " + String.join(", ", members),
                    members));
                break;
            }
        }

        var shared = sharedLevels(members);
        var applicable = new ArrayList<Entry>();
        var touching = new LinkedHashMap<Long, Entry>();
        for (var member : members) {
            for (var entry : overridesFor(member)) {
                touching.putIfAbsent(entry.sequence(), entry);
            }
        }
        for (var entry : touching.values()) {
            if (shared.contains(entry.level())) {
                applicable.add(entry);
            }
        }
        applicable.sort(Comparator
            .comparingInt((Entry entry) -> ModelPaths.depth(entry.level())).reversed()
            .thenComparing(Comparator.comparingLong(Entry::sequence).reversed()));

        checkDiscreteOverrides(members);

        DefaultValue value = null;
        boolean valueSettled = false;
        String units = null;
        Shape overrideShape = null;
        for (var entry : applicable) {
            var override = entry.override();
            if (!valueSettled && override.value() != null) {
                valueSettled = true;
                value = coerce(entry, discrete, members);
            }
            if (units == null && override.units() != null && !discrete) {
                units = override.units();
            }
            if (overrideShape == null && override.srcShape() != null && !discrete) {
                overrideShape = override.srcShape();
            }
        }

        var fields = new ArrayList<String>();
        if (!valueSettled && distinct(members, path -> tree.variable(path).decl().defaultValue()) > 1) {
            fields.add("val");
        }
        if (!discrete && units == null && distinct(members, path -> tree.variable(path).decl().units()) > 1) {
            fields.add("units");
        }
        if (!fields.isEmpty()) {
            problems.add(ambiguity(promotedName, members, fields, deepest(shared)));
        }

        var srcShape = resolveSrcShape(promotedName, members, chains, overrideShape);
        return new Defaults(
            value != null ? value : first.defaultValue(),
            discrete ? null : (units != null ? units : first.units()),
            srcShape,
            discrete
        );
    }

    /**
     * Reports every override touching a discrete member that sets units or a src_shape,
     * whichever source the member ends up with.
     */
    void checkDiscreteOverrides(List<String> members) {
        var reported = new HashSet<Long>();
        for (var member : members) {
            if (!tree.variable(member).decl().discrete()) {
                continue;
            }
            for (var entry : overridesFor(member)) {
                var override = entry.override();
                if ((override.units() != null || override.srcShape() != null) && reported.add(entry.sequence())) {
                    problems.add(new InvalidDiscreteOverrideException(
                        "Group '" + ModelPaths.display(entry.level()) + "' overrides discrete input '" + entry.name()
                            + "' with " + (override.units() != null ? "units '" + override.units() + "'" : "src_shape " + override.srcShape())
                            + "; discrete overrides may only set a default value.",
                        members));
                }
            }
        }
    }

    private Shape resolveSrcShape(String promotedName, List<String> members, Map<String, IndexChain> chains, Shape overrideShape) {
        var declared = new LinkedHashMap<String, Shape>();
        for (var member : members) {
            var chain = chains.getOrDefault(member, IndexChain.IDENTITY);
            chain.declaredSourceShape().ifPresent(shape -> declared.put(member, shape));
        }
        var shapes = new LinkedHashSet<>(declared.values());
        if (shapes.size() > 1) {
            problems.add(new ShapeMismatchException(
                "Inputs promoted to '" + promotedName + "' declare conflicting src_shape values:\n"
                    + declared.entrySet().stream().map(e -> "  " + e.getKey() + ": " + e.getValue()).collect(Collectors.joining("\n")),
                new ArrayList<>(declared.keySet())));
            return null;
        }
        var memberShape = shapes.isEmpty() ? null : shapes.iterator().next();
        if (overrideShape != null && memberShape != null && !overrideShape.equals(memberShape)) {
            problems.add(new ShapeMismatchException(
                "Override of '" + promotedName + "' sets src_shape " + overrideShape + " but its inputs declare " + memberShape + ".",
                new ArrayList<>(declared.keySet())));
            return null;
        }
        return overrideShape != null ? overrideShape : memberShape;
    }

    /**
     * Levels at which every member is visible under the same name.
     */
    private Set<String> sharedLevels(List<String> members) {
        var shared = new HashSet<String>();
        for (var levelName : promotions.levelNames(members.get(0))) {
            boolean same = members.stream()
                .allMatch(member -> promotions.nameAt(member, levelName.level()).map(levelName.name()::equals).orElse(false));
            if (same) {
                shared.add(levelName.level());
            }
        }
        return shared;
    }

    private List<Entry> overridesFor(String member) {
        var entries = new ArrayList<Entry>();
        for (var levelName : promotions.levelNames(member)) {
            var system = tree.system(levelName.level());
            if (system == null || system.leaf()) {
                continue;
            }
            for (var defaults : system.inputDefaults()) {
                if (defaults.name().equals(levelName.name())) {
                    entries.add(new Entry(levelName.level(), defaults.name(), defaults.sequence(), defaults.override()));
                }
            }
        }
        for (var contribution : promotions.contributions(member)) {
            var override = contribution.rule().override();
            if (override != null) {
                entries.add(new Entry(contribution.level(), contribution.promotedName(), contribution.rule().sequence(), override));
            }
        }
        return entries;
    }

    private AmbiguousInputDefaultsException ambiguity(String promotedName, List<String> members, List<String> fields, String level) {
        var localName = promotions.nameAt(members.get(0), level).orElse(promotedName);
        var message = new StringBuilder();
        message.append(ModelPaths.display(level)).append(": The following inputs, promoted to '").append(localName)
            .append("', have different default ").append(String.join(" and ", fields)).append(" and no override settles them:\n");
        for (var member : members) {
            var decl = tree.variable(member).decl();
            message.append("  ").append(member).append(": val=").append(decl.defaultValue());
            if (!decl.discrete()) {
                message.append(", units=").append(decl.units() == null ? "None" : "'" + decl.units() + "'");
            }
            message.append('\n');
        }
        message.append("Declare inputDefaults('").append(localName).append("', ...) on group '")
            .append(ModelPaths.display(level)).append("' setting ").append(String.join(" and ", fields))
            .append(" to remove the ambiguity.");
        return new AmbiguousInputDefaultsException(message.toString(), promotedName, members, fields);
    }

    private static String deepest(Set<String> levels) {
        return levels.stream().max(Comparator.comparingInt(ModelPaths::depth)).orElse(ModelPaths.ROOT);
    }

    private static int distinct(List<String> members, Function<String, Object> field) {
        var seen = new ArrayList<Object>();
        for (var member : members) {
            var value = field.apply(member);
            if (seen.stream().noneMatch(existing -> Objects.equals(existing, value))) {
                seen.add(value);
            }
        }
        return seen.size();
    }

    /**
     * The override's value in the group's kind, or null (reported) when a continuous group gets a
     * non-numeric value.
     */
    private DefaultValue coerce(Entry entry, boolean discrete, List<String> members) {
        var value = entry.override().value();
        if (discrete && !value.isDiscrete()) {
            return DefaultValue.discrete(value.toSerializable());
        }
        if (!discrete && value.isDiscrete()) {
            try {
                return DefaultValue.of(value.discreteValue());
            } catch (IllegalArgumentException ex) {
                problems.add(new InvalidDiscreteOverrideException(
                    "Group '" + ModelPaths.display(entry.level()) + "' overrides continuous input '" + entry.name()
                        + "' with non-numeric value " + value + ".",
                    members));
                return null;
            }
        }
        return value;
    }
}
