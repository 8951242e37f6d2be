package work.lcod.assembly.model;

import java.util.Objects;
import work.lcod.assembly.index.Indexer;

/**
 * Explicit connection declared by a group; both endpoints are named in that group's namespace.
 */
public record ConnectionDecl(String source, String target, Indexer srcIndices, long sequence) {
    public ConnectionDecl {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }
}
