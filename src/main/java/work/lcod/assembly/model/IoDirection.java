package work.lcod.assembly.model;

import java.util.Locale;

public enum IoDirection {
    INPUT,
    OUTPUT;

    public IoDirection opposite() {
        return this == INPUT ? OUTPUT : INPUT;
    }

    public static IoDirection from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("io direction must be provided");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "input", "in" -> INPUT;
            case "output", "out" -> OUTPUT;
            default -> throw new IllegalArgumentException("Unsupported io direction: " + value);
        };
    }
}
