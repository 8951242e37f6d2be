package work.lcod.assembly.model;

import java.util.Objects;

/**
 * Group-level default override for an input name promoted into that group's namespace.
 */
public record InputDefaults(String name, InputOverride override, long sequence) {
    public InputDefaults {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(override, "override");
    }
}
