package work.lcod.state.compare;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rules for one {@link StateComparator} call. Nested comparisons get derived copies; an instance is
 * never changed during a traversal.
 */
public record ComparisonOptions(
    Optional<Set<String>> restrictToProperties,
    Set<String> excludeProperties,
    boolean skipTypeChecking,
    boolean sortArraysBeforeCompare,
    boolean alsoCheckReverse
) {
    public ComparisonOptions {
        Objects.requireNonNull(restrictToProperties, "restrictToProperties");
        Objects.requireNonNull(excludeProperties, "excludeProperties");
        restrictToProperties = restrictToProperties.map(ComparisonOptions::freeze);
        excludeProperties = freeze(excludeProperties);
    }

    public static ComparisonOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options for a nested map: every key of the nested desired value counts, and the reverse pass
     * only runs at the top.
     */
    ComparisonOptions forNested() {
        return new ComparisonOptions(Optional.empty(), excludeProperties, skipTypeChecking, sortArraysBeforeCompare, false);
    }

    ComparisonOptions forReverse() {
        return new ComparisonOptions(restrictToProperties, excludeProperties, skipTypeChecking, sortArraysBeforeCompare, false);
    }

    private static Set<String> freeze(Collection<String> names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names));
    }

    public static final class Builder {
        private Set<String> restrictToProperties;
        private Set<String> excludeProperties = Set.of();
        private boolean skipTypeChecking;
        private boolean sortArraysBeforeCompare;
        private boolean alsoCheckReverse;

        public Builder restrictToProperties(Collection<String> properties) {
            this.restrictToProperties = properties == null ? null : new LinkedHashSet<>(properties);
            return this;
        }

        public Builder excludeProperties(Collection<String> properties) {
            this.excludeProperties = properties == null ? Set.of() : new LinkedHashSet<>(properties);
            return this;
        }

        public Builder skipTypeChecking(boolean skipTypeChecking) {
            this.skipTypeChecking = skipTypeChecking;
            return this;
        }

        public Builder sortArraysBeforeCompare(boolean sortArraysBeforeCompare) {
            this.sortArraysBeforeCompare = sortArraysBeforeCompare;
            return this;
        }

        public Builder alsoCheckReverse(boolean alsoCheckReverse) {
            this.alsoCheckReverse = alsoCheckReverse;
            return this;
        }

        public ComparisonOptions build() {
            return new ComparisonOptions(
                Optional.ofNullable(restrictToProperties),
                excludeProperties,
                skipTypeChecking,
                sortArraysBeforeCompare,
                alsoCheckReverse
            );
        }
    }
}
