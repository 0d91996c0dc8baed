package work.lcod.state.serialize;

import java.util.Objects;

/**
 * Immutable settings threaded through one {@link ExpressionSerializer#serialize} call. Only
 * {@code currentDepth} and {@code listItem} change per descent, via {@link #child(boolean)}.
 *
 * <p>A negative {@code expansionThreshold} selects compact output: everything on one line, with
 * no spaces around separators.
 */
public record RenderingContext(
    int currentDepth,
    int maxDepth,
    int expansionThreshold,
    int indentUnit,
    char indentChar,
    boolean strongTyping,
    boolean exploreMode,
    String newline,
    boolean listItem
) {
    public static final int DEFAULT_MAX_DEPTH = 9;

    public RenderingContext {
        Objects.requireNonNull(newline, "newline");
        if (currentDepth < 0) {
            throw new IllegalArgumentException("currentDepth must not be negative");
        }
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative");
        }
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit must not be negative");
        }
    }

    public static RenderingContext defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RenderingContext child(boolean childIsListItem) {
        return new RenderingContext(
            currentDepth + 1,
            maxDepth,
            expansionThreshold,
            indentUnit,
            indentChar,
            strongTyping,
            exploreMode,
            newline,
            childIsListItem
        );
    }

    public boolean compact() {
        return expansionThreshold < 0;
    }

    public boolean depthExhausted() {
        return currentDepth >= maxDepth;
    }

    /**
     * True when containers at this depth go on a single line.
     */
    public boolean inline() {
        return currentDepth >= expansionThreshold - 1;
    }

    public String indent() {
        return indentAt(currentDepth);
    }

    public String childIndent() {
        return indentAt(currentDepth + 1);
    }

    private String indentAt(int depth) {
        return String.valueOf(indentChar).repeat(indentUnit * depth);
    }

    public static final class Builder {
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private Integer expansionThreshold;
        private int indentUnit = 1;
        private char indentChar = '\t';
        private boolean strongTyping;
        private boolean exploreMode;
        private String newline = System.lineSeparator();

        public Builder maxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * Defaults to {@code maxDepth} when never set.
         */
        public Builder expansionThreshold(int expansionThreshold) {
            this.expansionThreshold = expansionThreshold;
            return this;
        }

        public Builder indentUnit(int indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder indentChar(char indentChar) {
            this.indentChar = indentChar;
            return this;
        }

        public Builder strongTyping(boolean strongTyping) {
            this.strongTyping = strongTyping;
            return this;
        }

        public Builder exploreMode(boolean exploreMode) {
            this.exploreMode = exploreMode;
            return this;
        }

        public Builder newline(String newline) {
            this.newline = newline;
            return this;
        }

        public RenderingContext build() {
            return new RenderingContext(
                0,
                maxDepth,
                expansionThreshold == null ? maxDepth : expansionThreshold,
                indentUnit,
                indentChar,
                strongTyping,
                exploreMode,
                newline,
                false
            );
        }
    }
}
