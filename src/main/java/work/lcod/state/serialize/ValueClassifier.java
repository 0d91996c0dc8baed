package work.lcod.state.serialize;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Currency;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import org.w3c.dom.Node;
import work.lcod.state.shared.PropertyBags;
import work.lcod.state.values.Credential;
import work.lcod.state.values.DataTable;
import work.lcod.state.values.MailAddress;
import work.lcod.state.values.NumericValue;
import work.lcod.state.values.OrderedDictionary;
import work.lcod.state.values.ScriptBlock;
import work.lcod.state.values.SecureValue;
import work.lcod.state.values.SemanticVersion;

/**
 * Maps a runtime value to the {@link Category} that renders it. Stateless and side-effect free;
 * the first matching rule wins, in {@link Category} declaration order.
 */
public final class ValueClassifier {
    private static final Set<Class<?>> VALUE_SCALARS = Set.of(
        UUID.class,
        Duration.class,
        Period.class,
        Locale.class,
        Currency.class,
        Path.class
    );

    public Classification classify(Object value) {
        if (value == null) {
            return Classification.of(Category.NULL, null, null, null);
        }
        if (value instanceof Boolean) {
            return Classification.of(Category.BOOLEAN, value, null, value);
        }
        String quotedTag = quotedScalarTag(value);
        if (quotedTag != null) {
            return Classification.of(Category.QUOTED_SCALAR, quotedText(value), quotedTag, value);
        }
        if (value instanceof Number number) {
            return Classification.of(Category.NUMBER, number, numberTag(number), value);
        }
        if (value instanceof CharSequence text) {
            return Classification.of(Category.STRING, text.toString(), "string", value);
        }
        if (value instanceof SecureValue) {
            return Classification.of(Category.SECURE_VALUE, value, null, value);
        }
        if (value instanceof Credential) {
            return Classification.of(Category.CREDENTIAL, value, null, value);
        }
        String isoText = isoText(value);
        if (isoText != null) {
            return Classification.of(Category.DATE_TIME, isoText, "datetime", value);
        }
        if (value instanceof Enum<?> constant) {
            Object payload = constant instanceof NumericValue flags ? (Object) flags.numericValue() : constant.name();
            return Classification.of(Category.ENUMERATION, payload, constant.getDeclaringClass().getSimpleName(), value);
        }
        if (value instanceof ScriptBlock) {
            return Classification.of(Category.CODE_BLOCK, value, "scriptblock", value);
        }
        if (value instanceof ProcessHandle handle) {
            return Classification.of(Category.HANDLE, handle.pid(), "long", value);
        }
        if (value instanceof Node) {
            return Classification.of(Category.MARKUP, value, "xml", value);
        }
        if (value instanceof DataTable table) {
            return Classification.of(Category.TABLE, table.rows(), null, value);
        }
        if (value instanceof OrderedDictionary) {
            return Classification.of(Category.ORDERED_MAP, value, "ordered", value);
        }
        if (isValueScalar(value)) {
            String tag = value instanceof UUID ? "guid" : value instanceof Path ? "string" : value.getClass().getSimpleName();
            return Classification.of(Category.VALUE_SCALAR, String.valueOf(value), tag, value);
        }
        if (value instanceof Map<?, ?>) {
            return Classification.of(Category.MAP, value, "hashtable", value);
        }
        if (value.getClass().isArray()) {
            Class<?> component = value.getClass().getComponentType();
            String tag = component.isPrimitive() ? component.getName() + "[]" : "array";
            return new Classification(
                Category.SEQUENCE,
                arrayElements(value),
                tag,
                value.getClass().getTypeName(),
                component.isPrimitive()
            );
        }
        if (value instanceof Iterable<?> iterable) {
            var items = new ArrayList<Object>();
            iterable.forEach(items::add);
            return Classification.of(Category.SEQUENCE, items, "array", value);
        }
        return Classification.of(Category.OBJECT, PropertyBags.toBag(value), "pscustomobject", value);
    }

    private static String quotedScalarTag(Object value) {
        if (value instanceof Character) {
            return "char";
        }
        if (value instanceof MailAddress) {
            return "mailaddress";
        }
        if (value instanceof Pattern) {
            return "regex";
        }
        if (value instanceof SemanticVersion) {
            return "semver";
        }
        if (value instanceof Class<?>) {
            return "type";
        }
        if (value instanceof Runtime.Version) {
            return "version";
        }
        if (value instanceof URI || value instanceof URL) {
            return "uri";
        }
        return null;
    }

    private static String quotedText(Object value) {
        if (value instanceof Class<?> type) {
            return type.getName();
        }
        if (value instanceof Pattern pattern) {
            return pattern.pattern();
        }
        return String.valueOf(value);
    }

    private static String numberTag(Number number) {
        if (number instanceof Integer || number instanceof AtomicInteger) {
            return "int";
        }
        if (number instanceof Long || number instanceof AtomicLong) {
            return "long";
        }
        if (number instanceof Short) {
            return "short";
        }
        if (number instanceof Byte) {
            return "byte";
        }
        if (number instanceof Double) {
            return "double";
        }
        if (number instanceof Float) {
            return "float";
        }
        if (number instanceof BigDecimal) {
            return "decimal";
        }
        if (number instanceof BigInteger) {
            return "bigint";
        }
        return number.getClass().getSimpleName();
    }

    private static String isoText(Object value) {
        if (value instanceof OffsetDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime);
        }
        if (value instanceof ZonedDateTime dateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(dateTime.toOffsetDateTime());
        }
        if (value instanceof Instant instant) {
            return DateTimeFormatter.ISO_INSTANT.format(instant);
        }
        if (value instanceof LocalDateTime dateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(dateTime);
        }
        if (value instanceof LocalDate date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date);
        }
        if (value instanceof LocalTime time) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(time);
        }
        if (value instanceof OffsetTime time) {
            return DateTimeFormatter.ISO_OFFSET_TIME.format(time);
        }
        if (value instanceof Date date) {
            // java.sql.Date refuses toInstant()
            return DateTimeFormatter.ISO_INSTANT.format(Instant.ofEpochMilli(date.getTime()));
        }
        return null;
    }

    private static boolean isValueScalar(Object value) {
        if (value instanceof ZoneId) {
            return true;
        }
        for (Class<?> type : VALUE_SCALARS) {
            if (type.isInstance(value)) {
                return true;
            }
        }
        // platform value types such as Path or File are Comparable; application records are not scalars
        return value instanceof Comparable<?>
            && !(value instanceof Map<?, ?>)
            && value.getClass().getName().startsWith("java.");
    }

    private static List<Object> arrayElements(Object array) {
        int length = Array.getLength(array);
        var items = new ArrayList<Object>(length);
        for (int i = 0; i < length; i++) {
            items.add(Array.get(array, i));
        }
        return items;
    }
}
