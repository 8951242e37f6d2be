package work.lcod.assembly.error;

import java.util.List;

public final class ShapeMismatchException extends ResolutionException {
    public ShapeMismatchException(String message, List<String> paths) {
        super("shape_mismatch", message, paths);
    }
}
