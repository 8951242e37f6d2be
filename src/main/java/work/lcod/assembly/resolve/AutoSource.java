package work.lcod.assembly.resolve;

import java.util.List;
import java.util.Objects;
import work.lcod.assembly.model.DefaultValue;
import work.lcod.assembly.model.ShapeSpec;

/**
 * Output synthesized for a promoted group of inputs that no real output feeds.
 */
public record AutoSource(
    String path,
    String promotedName,
    List<String> members,
    DefaultValue value,
    String units,
    ShapeSpec shapeSpec,
    boolean discrete
) {
    public AutoSource {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(promotedName, "promotedName");
        members = List.copyOf(members);
    }
}
