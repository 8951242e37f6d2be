package work.lcod.assembly.resolve;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.assembly.model.DefaultValue;
import work.lcod.assembly.model.IoDirection;
import work.lcod.assembly.model.Shape;

/**
 * Flat, resolved view of one variable (declared or synthesized).
 *
 * @param promotedName top-level name; equal to {@code path} for auto sources
 */
public record ResolvedVariable(
    String path,
    String promotedName,
    IoDirection io,
    Shape shape,
    String units,
    DefaultValue value,
    boolean discrete,
    boolean distributed,
    boolean autoSource
) {
    public boolean isInput() {
        return io == IoDirection.INPUT;
    }

    Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("promotedName", promotedName);
        map.put("io", io.name().toLowerCase());
        map.put("shape", shape == null ? null : shape.dims());
        map.put("units", units);
        map.put("val", value == null ? null : value.toSerializable());
        map.put("discrete", discrete);
        if (distributed) {
            map.put("distributed", true);
        }
        if (autoSource) {
            map.put("autoSource", true);
        }
        return map;
    }
}
