package work.lcod.assembly.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable node of the model tree: a leaf owning variables, or a group owning children,
 * promotion rules, explicit connections and input default overrides.
 */
public record SystemNode(
    String path,
    boolean leaf,
    List<SystemNode> children,
    List<VariableDecl> variables,
    List<PromotionRule> promotions,
    List<ConnectionDecl> connections,
    List<InputDefaults> inputDefaults
) {
    public SystemNode {
        Objects.requireNonNull(path, "path");
        children = List.copyOf(children);
        variables = List.copyOf(variables);
        promotions = List.copyOf(promotions);
        connections = List.copyOf(connections);
        inputDefaults = List.copyOf(inputDefaults);
    }

    public String name() {
        return ModelPaths.name(path);
    }

    public Optional<SystemNode> child(String name) {
        return children.stream().filter(child -> child.name().equals(name)).findFirst();
    }

    public Optional<VariableDecl> variable(String name) {
        return variables.stream().filter(variable -> variable.name().equals(name)).findFirst();
    }
}
