package work.lcod.assembly.error;

import java.util.List;

/**
 * An override for discrete inputs sets something other than the default value.
 */
public final class InvalidDiscreteOverrideException extends ResolutionException {
    public InvalidDiscreteOverrideException(String message, List<String> paths) {
        super("invalid_discrete_override", message, paths);
    }
}
