package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.assembly.model.DefaultValue;

/**
 * Fully resolved model: flat variable table, promotions, final connections with composed indices,
 * auto sources and the shape graph. Only built once a pass found no problem.
 */
public final class ResolvedModel {
    private final Map<String, ResolvedVariable> variables;
    private final PromotionTable promotions;
    private final List<ResolvedConnection> connections;
    private final Map<String, ResolvedConnection> byTarget;
    private final List<AutoSource> autoSources;
    private final Map<String, DefaultValue> startValues;
    private final ShapeGraph shapeGraph;

    ResolvedModel(
        Map<String, ResolvedVariable> variables,
        PromotionTable promotions,
        List<ResolvedConnection> connections,
        List<AutoSource> autoSources,
        Map<String, DefaultValue> startValues,
        ShapeGraph shapeGraph
    ) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        this.promotions = promotions;
        this.connections = List.copyOf(connections);
        var targets = new LinkedHashMap<String, ResolvedConnection>();
        this.connections.forEach(connection -> targets.put(connection.target(), connection));
        this.byTarget = Collections.unmodifiableMap(targets);
        this.autoSources = List.copyOf(autoSources);
        this.startValues = Collections.unmodifiableMap(new LinkedHashMap<>(startValues));
        this.shapeGraph = shapeGraph;
    }

    public Map<String, ResolvedVariable> variables() {
        return variables;
    }

    public ResolvedVariable variable(String path) {
        var variable = variables.get(path);
        if (variable == null) {
            throw new IllegalArgumentException("Unknown variable: " + path);
        }
        return variable;
    }

    public PromotionTable promotions() {
        return promotions;
    }

    public List<ResolvedConnection> connections() {
        return connections;
    }

    public Optional<ResolvedConnection> sourceOf(String target) {
        return Optional.ofNullable(byTarget.get(target));
    }

    public List<ResolvedConnection> targetsOf(String source) {
        return connections.stream().filter(connection -> connection.source().equals(source)).collect(Collectors.toList());
    }

    public List<AutoSource> autoSources() {
        return autoSources;
    }

    public ShapeGraph shapeGraph() {
        return shapeGraph;
    }

    /**
     * Value an input observes before any execution: its auto source's value expressed in the
     * input's own units, or its declared default when a real output feeds it.
     */
    public DefaultValue inputStartValue(String path) {
        var variable = variable(path);
        if (!variable.isInput()) {
            throw new IllegalArgumentException("Not an input: " + path);
        }
        return startValues.getOrDefault(path, variable.value());
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        var vars = new LinkedHashMap<String, Object>();
        variables.forEach((path, variable) -> vars.put(path, variable.toSerializableMap()));
        map.put("variables", vars);
        var conns = new ArrayList<Map<String, Object>>();
        for (var connection : connections) {
            var source = variables.get(connection.source());
            conns.add(connection.toSerializableMap(source == null ? null : source.shape()));
        }
        map.put("connections", conns);
        map.put("autoSources", autoSources.stream().map(auto -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", auto.path());
            entry.put("promotedName", auto.promotedName());
            entry.put("members", auto.members());
            return entry;
        }).collect(Collectors.toList()));
        var starts = new LinkedHashMap<String, Object>();
        startValues.forEach((path, value) -> starts.put(path, value.toSerializable()));
        map.put("startValues", starts);
        return map;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof ResolvedModel that
            && variables.equals(that.variables)
            && promotions.equals(that.promotions)
            && connections.equals(that.connections)
            && autoSources.equals(that.autoSources)
            && startValues.equals(that.startValues)
            && shapeGraph.equals(that.shapeGraph);
    }

    @Override
    public int hashCode() {
        return variables.hashCode() * 31 + connections.hashCode();
    }
}
