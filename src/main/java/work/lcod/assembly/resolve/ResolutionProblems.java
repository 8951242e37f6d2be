package work.lcod.assembly.resolve;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.error.ModelResolutionException;
import work.lcod.assembly.error.ResolutionException;

/**
 * Collects every problem of a resolution pass so they are reported together at pass end.
 */
public final class ResolutionProblems {
    private static final Logger LOG = LogManager.getLogger(ResolutionProblems.class);

    private final List<ResolutionException> errors = new ArrayList<>();

    public void add(ResolutionException error) {
        LOG.debug("{}: {}", error.code(), error.getMessage());
        errors.add(error);
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public List<ResolutionException> errors() {
        return List.copyOf(errors);
    }

    public void throwIfAny() {
        if (errors.isEmpty()) {
            return;
        }
        if (errors.size() == 1) {
            throw errors.get(0);
        }
        throw new ModelResolutionException(errors);
    }
}
