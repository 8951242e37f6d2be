package work.lcod.assembly.model;

/**
 * Helpers for dotted absolute paths. The root system has the empty path.
 */
public final class ModelPaths {
    public static final String ROOT = "";

    private ModelPaths() {}

    public static String join(String parent, String name) {
        if (parent == null || parent.isEmpty()) {
            return name;
        }
        return parent + "." + name;
    }

    public static String parent(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? ROOT : path.substring(0, dot);
    }

    public static String name(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }

    public static int depth(String path) {
        if (path == null || path.isEmpty()) {
            return 0;
        }
        int depth = 1;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '.') {
                depth++;
            }
        }
        return depth;
    }

    /**
     * True when {@code ancestor} is {@code path} itself or one of its ancestors.
     */
    public static boolean contains(String ancestor, String path) {
        if (ancestor.isEmpty()) {
            return true;
        }
        return path.equals(ancestor) || path.startsWith(ancestor + ".");
    }

    public static String relative(String ancestor, String path) {
        if (ancestor.isEmpty()) {
            return path;
        }
        if (!contains(ancestor, path) || path.equals(ancestor)) {
            throw new IllegalArgumentException(path + " is not below " + ancestor);
        }
        return path.substring(ancestor.length() + 1);
    }

    public static String display(String path) {
        return path.isEmpty() ? "<model>" : path;
    }
}
