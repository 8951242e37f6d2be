package work.lcod.assembly.error;

import java.util.List;

public final class IncompatibleUnitsException extends ResolutionException {
    public IncompatibleUnitsException(String message, List<String> paths) {
        super("incompatible_units", message, paths);
    }
}
