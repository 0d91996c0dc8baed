package work.lcod.state.compare;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import work.lcod.state.shared.PropertyBags;
import work.lcod.state.shared.TypeNames;
import work.lcod.state.values.Credential;
import work.lcod.state.values.ScriptBlock;

/**
 * Decides whether a current state satisfies a desired state.
 *
 * <p>Both states are property bags (maps, or structured objects read through their public
 * properties). Every evaluated property produces one {@link TraceLine}. A mismatch on one property
 * never stops the walk: the remaining properties are still evaluated and traced, and a later match
 * cannot turn an earlier mismatch back into a match. Inputs are never modified.
 */
public final class StateComparator {
    private final MessageCatalog messages;

    public StateComparator() {
        this(MessageCatalog.defaults());
    }

    public StateComparator(MessageCatalog messages) {
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    public boolean statesEqual(Object current, Object desired, ComparisonOptions options) {
        return compare(current, desired, options).inDesiredState();
    }

    public ComparisonResult compare(Object current, Object desired, ComparisonOptions options) {
        return compare(current, desired, options, line -> { });
    }

    /**
     * @param listener receives each trace line as soon as it is produced
     * @throws InvalidInputShapeException when either input is null, a scalar or a list
     * @throws MissingPropertyListException when {@code desired} is a structured object and
     *     {@code options} has no property restriction
     */
    public ComparisonResult compare(Object current, Object desired, ComparisonOptions options, Consumer<TraceLine> listener) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(listener, "listener");
        Map<String, Object> currentBag = topLevelBag(current, "current");
        if (PropertyBags.isStructuredObject(desired) && options.restrictToProperties().isEmpty()) {
            throw new MissingPropertyListException(desired);
        }
        Map<String, Object> desiredBag = topLevelBag(desired, "desired");

        var trace = new ArrayList<TraceLine>();
        Consumer<TraceLine> sink = line -> {
            trace.add(line);
            listener.accept(line);
        };
        boolean inDesiredState = compareBags(currentBag, desiredBag, options, sink, "");
        if (options.alsoCheckReverse()) {
            boolean reverse = compareBags(desiredBag, currentBag, options.forReverse(), sink, "");
            inDesiredState = inDesiredState && reverse;
        }
        return new ComparisonResult(inDesiredState, trace);
    }

    private static Map<String, Object> topLevelBag(Object value, String role) {
        if (value instanceof Map<?, ?> map) {
            return copyOf(map);
        }
        if (PropertyBags.isStructuredObject(value)) {
            return PropertyBags.toBag(value);
        }
        throw new InvalidInputShapeException(role, value);
    }

    private boolean compareBags(
        Map<String, Object> current,
        Map<String, Object> desired,
        ComparisonOptions options,
        Consumer<TraceLine> sink,
        String path
    ) {
        Collection<String> keys = options.restrictToProperties().isPresent()
            ? options.restrictToProperties().get()
            : desired.keySet();
        boolean inDesiredState = true;
        for (String key : keys) {
            if (options.excludeProperties().contains(key)) {
                continue;
            }
            String property = path.isEmpty() ? key : path + "." + key;
            if (!compareProperty(property, key, current, desired, options, sink)) {
                inDesiredState = false;
            }
        }
        return inDesiredState;
    }

    private boolean compareProperty(
        String property,
        String key,
        Map<String, Object> current,
        Map<String, Object> desired,
        ComparisonOptions options,
        Consumer<TraceLine> sink
    ) {
        Object currentValue = normalize(current.get(key));
        Object desiredValue = normalize(desired.get(key));

        if (desiredValue instanceof Credential credential) {
            return compareCredential(property, currentValue, credential, sink);
        }
        if (!options.skipTypeChecking() && currentValue != null && desiredValue != null) {
            String currentType = TypeNames.of(currentValue);
            String desiredType = TypeNames.of(desiredValue);
            if (!currentType.equals(desiredType)) {
                return noMatch(sink, property, "comparison.type_mismatch", Map.of(
                    "property", property,
                    "currentType", currentType,
                    "desiredType", desiredType
                ));
            }
        }
        boolean desiredIsList = TypeNames.isListLike(desiredValue);
        if (!desiredIsList && Objects.equals(currentValue, desiredValue)) {
            return match(sink, property, "comparison.match", values(property, currentValue, desiredValue));
        }
        if (!desired.containsKey(key)) {
            return match(sink, property, "comparison.absent", values(property, currentValue, desiredValue));
        }
        if (desiredIsList) {
            return compareLists(property, currentValue, desiredValue, options, sink);
        }
        if (currentValue instanceof Map<?, ?> currentMap && desiredValue instanceof Map<?, ?> desiredMap) {
            boolean nested = compareBags(copyOf(currentMap), copyOf(desiredMap), options.forNested(), sink, property);
            return nested
                ? match(sink, property, "comparison.nested_match", Map.of("property", property))
                : noMatch(sink, property, "comparison.nested_mismatch", Map.of("property", property));
        }
        Object left = unwrapCodeBlock(currentValue, desiredValue);
        Object right = unwrapCodeBlock(desiredValue, currentValue);
        if (looselyEqual(left, right, options)) {
            return match(sink, property, "comparison.match", values(property, left, right));
        }
        return noMatch(sink, property, "comparison.mismatch", values(property, left, right));
    }

    private boolean compareCredential(String property, Object currentValue, Credential desired, Consumer<TraceLine> sink) {
        String currentUser = null;
        if (currentValue instanceof Credential credential) {
            currentUser = credential.userName();
        } else if (currentValue instanceof String text) {
            currentUser = text;
        }
        var values = new LinkedHashMap<String, Object>();
        values.put("property", property);
        values.put("current", display(currentUser));
        values.put("desired", desired.userName());
        if (Objects.equals(currentUser, desired.userName())) {
            return match(sink, property, "credential.match", values);
        }
        return noMatch(sink, property, "credential.mismatch", values);
    }

    private boolean compareLists(
        String property,
        Object currentValue,
        Object desiredValue,
        ComparisonOptions options,
        Consumer<TraceLine> sink
    ) {
        List<Object> desiredItems = asList(desiredValue);
        List<Object> currentItems = currentValue == null ? List.of() : asList(currentValue);
        var counts = new LinkedHashMap<String, Object>();
        counts.put("property", property);
        counts.put("currentCount", currentItems.size());
        counts.put("desiredCount", desiredItems.size());

        if (currentItems.isEmpty() && desiredItems.isEmpty()) {
            return match(sink, property, "array.empty", counts);
        }
        if (currentItems.isEmpty()) {
            return noMatch(sink, property, "array.missing", counts);
        }
        if (currentItems.size() != desiredItems.size()) {
            return noMatch(sink, property, "array.length_mismatch", counts);
        }
        if (options.sortArraysBeforeCompare()) {
            currentItems.sort(StateComparator::compareForSort);
            desiredItems.sort(StateComparator::compareForSort);
        }

        boolean inDesiredState = true;
        for (int i = 0; i < desiredItems.size(); i++) {
            String element = property + "[" + i + "]";
            Object currentItem = normalize(currentItems.get(i));
            Object desiredItem = normalize(desiredItems.get(i));
            if (!options.skipTypeChecking() && currentItem != null && desiredItem != null) {
                String currentType = TypeNames.of(currentItem);
                String desiredType = TypeNames.of(desiredItem);
                if (!currentType.equals(desiredType)) {
                    noMatch(sink, element, "array.element_type_mismatch", Map.of(
                        "property", element,
                        "currentType", currentType,
                        "desiredType", desiredType
                    ));
                    inDesiredState = false;
                    continue;
                }
            }
            if (currentItem instanceof Map<?, ?> currentMap && desiredItem instanceof Map<?, ?> desiredMap) {
                if (!compareBags(copyOf(currentMap), copyOf(desiredMap), options.forNested(), sink, element)) {
                    inDesiredState = false;
                }
                continue;
            }
            if (TypeNames.isListLike(desiredItem)) {
                if (!compareLists(element, currentItem, desiredItem, options, sink)) {
                    inDesiredState = false;
                }
                continue;
            }
            Object left = unwrapCodeBlock(currentItem, desiredItem);
            Object right = unwrapCodeBlock(desiredItem, currentItem);
            if (!looselyEqual(left, right, options)) {
                noMatch(sink, element, "array.element_mismatch", values(element, left, right));
                inDesiredState = false;
            }
        }
        if (inDesiredState) {
            match(sink, property, "array.match", counts);
        }
        return inDesiredState;
    }

    private static Object normalize(Object value) {
        if (value != null && value.getClass().isArray()) {
            return asList(value);
        }
        if (PropertyBags.isStructuredObject(value)) {
            return PropertyBags.toBag(value);
        }
        return value;
    }

    /**
     * A code block compared to a string stands for the result of running it; compared to anything
     * else it stands for its source text.
     */
    private static Object unwrapCodeBlock(Object value, Object other) {
        if (value instanceof ScriptBlock block) {
            return other instanceof String ? block.invoke() : block.source();
        }
        return value;
    }

    private static boolean looselyEqual(Object left, Object right, ComparisonOptions options) {
        if (Objects.equals(left, right)) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number a && right instanceof Number b) {
            try {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
            } catch (NumberFormatException ex) {
                return false;
            }
        }
        if (options.skipTypeChecking() && (left instanceof String || right instanceof String)) {
            return String.valueOf(left).equals(String.valueOf(right));
        }
        return false;
    }

    @SuppressWarnings("unchecked")
    private static int compareForSort(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        if (left.getClass() == right.getClass() && left instanceof Comparable<?>) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        int byType = left.getClass().getName().compareTo(right.getClass().getName());
        return byType != 0 ? byType : String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> items = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
            return items;
        }
        List<Object> single = new ArrayList<>(1);
        single.add(value);
        return single;
    }

    private static Map<String, Object> copyOf(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    private static Map<String, Object> values(String property, Object current, Object desired) {
        var values = new LinkedHashMap<String, Object>();
        values.put("property", property);
        values.put("current", display(current));
        values.put("desired", display(desired));
        return values;
    }

    private static String display(Object value) {
        return value == null ? "$null" : String.valueOf(value);
    }

    private boolean match(Consumer<TraceLine> sink, String property, String key, Map<String, ?> values) {
        sink.accept(new TraceLine(TraceLine.Kind.MATCH, property, messages.format(key, values)));
        return true;
    }

    private boolean noMatch(Consumer<TraceLine> sink, String property, String key, Map<String, ?> values) {
        sink.accept(new TraceLine(TraceLine.Kind.NO_MATCH, property, messages.format(key, values)));
        return false;
    }
}
