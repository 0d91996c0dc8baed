package work.lcod.state.shared;

import java.util.Collection;
import java.util.Map;

/**
 * Type identity used by the state comparator. Collection shapes collapse onto one name so that a
 * {@code List} and an array of the same elements are considered the same type.
 */
public final class TypeNames {
    public static final String LIST = "java.util.List";
    public static final String MAP = "java.util.Map";

    private TypeNames() {
    }

    public static String of(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?>) {
            return MAP;
        }
        if (value instanceof Collection<?> || value.getClass().isArray()) {
            return LIST;
        }
        return value.getClass().getName();
    }

    public static boolean isListLike(Object value) {
        return value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }
}
