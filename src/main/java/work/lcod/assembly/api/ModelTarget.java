package work.lcod.assembly.api;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Represents the model argument (local file or remote URL).
 */
public record ModelTarget(Optional<Path> localPath, Optional<URI> remoteUri) {
    public ModelTarget {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(remoteUri, "remoteUri");
        if (localPath.isEmpty() == remoteUri.isEmpty()) {
            throw new IllegalArgumentException("Exactly one of localPath or remoteUri must be present.");
        }
    }

    public static ModelTarget forLocal(Path path) {
        return new ModelTarget(Optional.of(path), Optional.empty());
    }

    public static ModelTarget forRemote(URI uri) {
        return new ModelTarget(Optional.empty(), Optional.of(uri));
    }

    /**
     * Treats {@code http://} and {@code https://} arguments as remote, anything else as a path.
     */
    public static ModelTarget parse(String raw) {
        var value = Objects.requireNonNull(raw, "raw").trim();
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return forRemote(URI.create(value));
        }
        return forLocal(Path.of(value));
    }

    public boolean isRemote() {
        return remoteUri.isPresent();
    }

    public String display() {
        return localPath.map(Path::toString).or(() -> remoteUri.map(URI::toString)).orElse("unknown");
    }
}
