package work.lcod.assembly.error;

import java.util.List;

/**
 * A dynamically shaped distributed output feeds a dynamically shaped non-distributed input.
 */
public final class DistributedShapeMismatchException extends ResolutionException {
    public DistributedShapeMismatchException(String message, List<String> paths) {
        super("distributed_shape_mismatch", message, paths);
    }
}
