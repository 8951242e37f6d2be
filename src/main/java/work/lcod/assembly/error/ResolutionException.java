package work.lcod.assembly.error;

import java.util.List;
import java.util.Map;
import java.util.LinkedHashMap;

/**
 * Base of every model resolution failure. Carries a stable error code and the absolute paths
 * involved, so embedders can report failures without parsing messages.
 */
public class ResolutionException extends RuntimeException {
    private final String code;
    private final List<String> paths;

    public ResolutionException(String code, String message, List<String> paths) {
        super(message);
        this.code = code;
        this.paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public String code() {
        return code;
    }

    public List<String> paths() {
        return paths;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", getMessage());
        if (!paths.isEmpty()) {
            map.put("paths", paths);
        }
        return map;
    }
}
