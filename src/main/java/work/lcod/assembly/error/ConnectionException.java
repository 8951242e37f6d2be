package work.lcod.assembly.error;

import java.util.List;

public final class ConnectionException extends ResolutionException {
    public ConnectionException(String message, List<String> paths) {
        super("connection", message, paths);
    }
}
