package work.lcod.assembly.resolve;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.assembly.model.Shape;

/**
 * Final connection handed to data transfer: {@code target} receives {@code srcIndices} of
 * {@code source}.
 */
public record ResolvedConnection(String source, String target, ComposedIndex srcIndices, boolean explicit) {
    public ResolvedConnection {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        srcIndices = srcIndices == null ? ComposedIndex.identity() : srcIndices;
    }

    Map<String, Object> toSerializableMap(Shape sourceShape) {
        var map = new LinkedHashMap<String, Object>();
        map.put("source", source);
        map.put("target", target);
        map.put("explicit", explicit);
        map.put("srcIndices", srcIndices.toSerializable());
        if (sourceShape != null) {
            map.put("sourceShape", sourceShape.dims());
        }
        return map;
    }
}
