package work.lcod.state.literal;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;
import work.lcod.state.values.MailAddress;
import work.lcod.state.values.OrderedDictionary;
import work.lcod.state.values.ScriptBlock;
import work.lcod.state.values.SemanticVersion;

/**
 * Conversions behind {@code [type]} casts. Only a fixed table of data conversions is known; no
 * type is ever resolved by name, so a cast cannot load or run code.
 */
final class LiteralCasts {
    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("int32", "int"),
        Map.entry("int64", "long"),
        Map.entry("int16", "short"),
        Map.entry("boolean", "bool"),
        Map.entry("single", "float"),
        Map.entry("biginteger", "bigint"),
        Map.entry("numerics.biginteger", "bigint"),
        Map.entry("collections.hashtable", "hashtable"),
        Map.entry("collections.specialized.ordereddictionary", "ordered"),
        Map.entry("management.automation.pscustomobject", "pscustomobject"),
        Map.entry("object[]", "array"),
        Map.entry("management.automation.semanticversion", "semver"),
        Map.entry("net.mail.mailaddress", "mailaddress"),
        Map.entry("text.regularexpressions.regex", "regex")
    );

    private LiteralCasts() {}

    static Object apply(String typeName, Object value) {
        String name = normalize(typeName);
        if (name.endsWith("[]") && !"array".equals(name)) {
            String elementType = name.substring(0, name.length() - 2);
            var converted = new ArrayList<Object>();
            for (Object element : asList(value)) {
                converted.add(apply(elementType, element));
            }
            return converted;
        }
        try {
            return switch (name) {
                case "ordered" -> new OrderedDictionary(requireMap(name, value));
                case "hashtable", "pscustomobject" -> new LinkedHashMap<>(requireMap(name, value));
                case "array" -> asList(value);
                case "string", "xml", "type" -> value == null ? "" : String.valueOf(value);
                case "int" -> number(value, n -> integral(n).intValueExact(), Integer::valueOf);
                case "long" -> number(value, n -> integral(n).longValueExact(), Long::valueOf);
                case "short" -> number(value, n -> integral(n).shortValueExact(), Short::valueOf);
                case "byte" -> number(value, n -> integral(n).byteValueExact(), Byte::valueOf);
                case "double" -> number(value, Number::doubleValue, Double::valueOf);
                case "float" -> number(value, Number::floatValue, Float::valueOf);
                case "decimal" -> number(value, n -> new BigDecimal(n.toString()), BigDecimal::new);
                case "bigint" -> number(value, n -> new BigDecimal(n.toString()).toBigIntegerExact(), BigInteger::new);
                case "bool" -> toBoolean(value);
                case "char" -> toCharacter(value);
                case "datetime" -> toDateTime(String.valueOf(value));
                case "uri" -> URI.create(String.valueOf(value));
                case "version" -> Runtime.Version.parse(String.valueOf(value));
                case "semver" -> SemanticVersion.parse(String.valueOf(value));
                case "regex" -> Pattern.compile(String.valueOf(value));
                case "mailaddress" -> new MailAddress(String.valueOf(value));
                case "guid" -> UUID.fromString(String.valueOf(value));
                case "scriptblock" -> value instanceof ScriptBlock ? value : ScriptBlock.of(String.valueOf(value));
                default -> value;
            };
        } catch (MalformedLiteralException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new MalformedLiteralException("Cannot convert '" + value + "' to [" + typeName + "]", ex);
        }
    }

    static String normalize(String typeName) {
        String name = typeName.trim().toLowerCase(Locale.ROOT);
        if (name.startsWith("system.")) {
            name = name.substring("system.".length());
        }
        return ALIASES.getOrDefault(name, name);
    }

    /**
     * Rounds half to even; values outside the target range fail in the caller's exact conversion.
     */
    private static BigDecimal integral(Number number) {
        return new BigDecimal(number.toString()).setScale(0, RoundingMode.HALF_EVEN);
    }

    private static <T> Object number(Object value, Function<Number, T> fromNumber, Function<String, T> fromText) {
        if (value instanceof Number number) {
            return fromNumber.apply(number);
        }
        if (value instanceof Boolean flag) {
            return fromNumber.apply(flag ? 1 : 0);
        }
        if (value == null) {
            return fromNumber.apply(0);
        }
        return fromText.apply(String.valueOf(value).trim());
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value).trim());
    }

    private static Character toCharacter(Object value) {
        if (value instanceof Number number) {
            return (char) number.intValue();
        }
        String text = String.valueOf(value);
        if (text.length() != 1) {
            throw new IllegalArgumentException("expected a single character");
        }
        return text.charAt(0);
    }

    private static Object toDateTime(String text) {
        List<Function<String, Object>> parsers = List.of(
            OffsetDateTime::parse,
            LocalDateTime::parse,
            LocalDate::parse,
            OffsetTime::parse,
            LocalTime::parse
        );
        DateTimeParseException last = null;
        for (Function<String, Object> parser : parsers) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException ex) {
                last = ex;
            }
        }
        throw last;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> requireMap(String name, Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalArgumentException("[" + name + "] applies to maps only");
    }

    private static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        var single = new ArrayList<Object>();
        single.add(value);
        return single;
    }
}
