package work.lcod.state.serialize;

import java.util.Objects;

/**
 * Outcome of {@link ValueClassifier#classify(Object)}.
 *
 * @param category rendering rule
 * @param payload normalized value the rule renders (text for quoted scalars, a list for sequences,
 *     a map for objects, the original value otherwise)
 * @param typeTag cast name emitted in strong typing mode, or {@code null} when the rule never casts
 * @param runtimeType class name of the original value, shown by explore mode with strong typing
 * @param inline whether a sequence always renders on one line (primitive arrays)
 */
public record Classification(Category category, Object payload, String typeTag, String runtimeType, boolean inline) {
    public Classification {
        Objects.requireNonNull(category, "category");
    }

    static Classification of(Category category, Object payload, String typeTag, Object original) {
        return new Classification(category, payload, typeTag, runtimeTypeOf(original), false);
    }

    private static String runtimeTypeOf(Object original) {
        return original == null ? null : original.getClass().getTypeName();
    }
}
