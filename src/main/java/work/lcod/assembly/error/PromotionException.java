package work.lcod.assembly.error;

import java.util.List;

/**
 * A promotion rule refers to a subsystem or variable that does not exist in its scope.
 */
public final class PromotionException extends ResolutionException {
    public PromotionException(String message, List<String> paths) {
        super("promotion", message, paths);
    }
}
