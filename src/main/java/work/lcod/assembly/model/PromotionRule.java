package work.lcod.assembly.model;

import java.util.Objects;
import java.util.regex.Pattern;
import work.lcod.assembly.index.Indexer;

/**
 * Promotion directive declared by a group for one of its direct children.
 *
 * <p>The pattern is an exact name, a glob ({@code *}, {@code ?}, {@code [...]}) or, when
 * {@link #alias()} is set, the local half of an alias pair exposed under the alias.
 */
public record PromotionRule(
    String child,
    String pattern,
    String alias,
    Filter filter,
    Indexer srcIndices,
    Shape srcShape,
    InputOverride override,
    long sequence
) {
    public enum Filter {
        ANY,
        INPUTS,
        OUTPUTS;

        public boolean accepts(IoDirection io) {
            return this == ANY
                || (this == INPUTS && io == IoDirection.INPUT)
                || (this == OUTPUTS && io == IoDirection.OUTPUT);
        }
    }

    public PromotionRule {
        Objects.requireNonNull(child, "child");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(filter, "filter");
        if (alias != null && isGlob(pattern)) {
            throw new IllegalArgumentException("Alias '" + alias + "' cannot be combined with wildcard '" + pattern + "'");
        }
    }

    public boolean isWildcard() {
        return isGlob(pattern);
    }

    public boolean matches(String name, IoDirection io) {
        if (!filter.accepts(io)) {
            return false;
        }
        if (!isWildcard()) {
            return pattern.equals(name);
        }
        return globRegex(pattern).matcher(name).matches();
    }

    public String promotedName(String name) {
        return alias != null ? alias : name;
    }

    PromotionRule withSequence(long value) {
        return new PromotionRule(child, pattern, alias, filter, srcIndices, srcShape, override, value);
    }

    @Override
    public String toString() {
        var text = alias == null ? pattern : pattern + " as " + alias;
        return child + ":" + text;
    }

    static boolean isGlob(String pattern) {
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0;
    }

    private static Pattern globRegex(String glob) {
        var regex = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int close = glob.indexOf(']', i + 1);
                    if (close < 0) {
                        regex.append("\\[");
                    } else {
                        var body = glob.substring(i + 1, close);
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        }
                        regex.append('[').append(body.replace("\\", "\\\\")).append(']');
                        i = close;
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }

    public static Builder builder(String child, String pattern) {
        return new Builder(child, pattern);
    }

    /**
     * Parses {@code "name"} or {@code "local as promoted"}.
     */
    public static Builder parse(String child, String spec) {
        var trimmed = spec.trim();
        int as = trimmed.indexOf(" as ");
        if (as < 0) {
            return builder(child, trimmed);
        }
        return builder(child, trimmed.substring(0, as).trim()).alias(trimmed.substring(as + 4).trim());
    }

    public static final class Builder {
        private final String child;
        private final String pattern;
        private String alias;
        private Filter filter = Filter.ANY;
        private Indexer srcIndices;
        private Shape srcShape;
        private InputOverride override;

        private Builder(String child, String pattern) {
            this.child = child;
            this.pattern = pattern;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder filter(Filter filter) {
            this.filter = filter;
            return this;
        }

        public Builder srcIndices(Indexer srcIndices) {
            this.srcIndices = srcIndices;
            return this;
        }

        public Builder srcShape(Shape srcShape) {
            this.srcShape = srcShape;
            return this;
        }

        public Builder override(InputOverride override) {
            this.override = override;
            return this;
        }

        public PromotionRule build() {
            return new PromotionRule(child, pattern, alias, filter, srcIndices, srcShape, override, 0L);
        }
    }
}
