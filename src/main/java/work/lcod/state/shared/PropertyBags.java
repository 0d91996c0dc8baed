package work.lcod.state.shared;

import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns structured objects (records, beans) into property bags using Jackson's bean introspection.
 */
public final class PropertyBags {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String VALUES_PACKAGE = "work.lcod.state.values";

    private PropertyBags() {}

    /**
     * True for values that are neither scalars nor containers: records and application beans.
     */
    public static boolean isStructuredObject(Object value) {
        if (value == null
            || value instanceof Map<?, ?>
            || value instanceof Iterable<?>
            || value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof Enum<?>
            || value instanceof TemporalAccessor
            || value instanceof Date
            || value.getClass().isArray()) {
            return false;
        }
        Class<?> type = value.getClass();
        if (type.isRecord()) {
            return !type.getPackageName().equals(VALUES_PACKAGE);
        }
        return !isPlatformType(type) && !type.getPackageName().equals(VALUES_PACKAGE);
    }

    /**
     * Reads the readable properties of {@code value}, explicitly annotated ones first, then the rest
     * in declaration order. Properties whose accessor fails are left out.
     */
    public static Map<String, Object> toBag(Object value) {
        var bag = new LinkedHashMap<String, Object>();
        if (value == null) {
            return bag;
        }
        JavaType type = JSON.constructType(value.getClass());
        BeanDescription description = JSON.getSerializationConfig().introspect(type);
        List<BeanPropertyDefinition> explicit = new ArrayList<>();
        List<BeanPropertyDefinition> implicit = new ArrayList<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (!property.couldSerialize()) {
                continue;
            }
            (property.isExplicitlyIncluded() ? explicit : implicit).add(property);
        }
        explicit.addAll(implicit);
        for (BeanPropertyDefinition property : explicit) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            try {
                accessor.fixAccess(true);
                bag.put(property.getName(), accessor.getValue(value));
            } catch (RuntimeException ex) {
                // unreadable properties are not part of the bag
            }
        }
        return bag;
    }

    private static boolean isPlatformType(Class<?> type) {
        String name = type.getName();
        return name.startsWith("java.")
            || name.startsWith("javax.")
            || name.startsWith("jdk.")
            || name.startsWith("sun.")
            || name.startsWith("com.sun.")
            || name.startsWith("org.w3c.");
    }
}
