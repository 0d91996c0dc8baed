package work.lcod.state.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import work.lcod.state.compare.ComparisonOptions;
import work.lcod.state.compare.ComparisonResult;
import work.lcod.state.compare.InvalidInputShapeException;
import work.lcod.state.compare.MessageCatalog;
import work.lcod.state.compare.StateComparator;
import work.lcod.state.compare.TraceLine;
import work.lcod.state.literal.LiteralExtractor;
import work.lcod.state.literal.UnsupportedArgumentShapeException;
import work.lcod.state.serialize.ExpressionSerializer;
import work.lcod.state.serialize.RenderingContext;
import work.lcod.state.shared.PropertyBags;

/**
 * Public entry point for embedding: writes a property bag as a capability document body, reads
 * one back, and tests a current state against a desired one.
 */
public final class CapabilityState {
    private final ExpressionSerializer serializer = new ExpressionSerializer();
    private final LiteralExtractor extractor = new LiteralExtractor();
    private final RenderingContext rendering;
    private final StateComparator comparator;

    public CapabilityState() {
        this(RenderingContext.defaults(), MessageCatalog.defaults());
    }

    public CapabilityState(RenderingContext rendering, MessageCatalog messages) {
        this.rendering = Objects.requireNonNull(rendering, "rendering");
        this.comparator = new StateComparator(messages);
    }

    /**
     * Renders {@code bag} as a single {@code @{ ... }} expression.
     *
     * @throws InvalidInputShapeException when {@code bag} is neither a map nor a structured object
     */
    public String render(Object bag) {
        Map<String, Object> properties;
        if (bag instanceof Map<?, ?> map) {
            properties = new LinkedHashMap<>();
            for (var entry : map.entrySet()) {
                properties.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        } else if (PropertyBags.isStructuredObject(bag)) {
            properties = PropertyBags.toBag(bag);
        } else {
            throw new InvalidInputShapeException("rendered", bag);
        }
        return serializer.serialize(properties, rendering);
    }

    /**
     * Reads a document holding exactly one map expression.
     *
     * @throws UnsupportedArgumentShapeException when the document holds anything else
     */
    public Map<String, Object> read(String text) {
        Object value = extractor.extractValue(text);
        if (value instanceof Map<?, ?> map) {
            var properties = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> properties.put(String.valueOf(k), v));
            return properties;
        }
        String fragment = text.strip();
        if (fragment.length() > 40) {
            fragment = fragment.substring(0, 40);
        }
        throw new UnsupportedArgumentShapeException("non-map document", fragment, 0);
    }

    public ComparisonResult test(Object current, Object desired, ComparisonOptions options) {
        return comparator.compare(current, desired, options);
    }

    public ComparisonResult test(Object current, Object desired, ComparisonOptions options, Consumer<TraceLine> listener) {
        return comparator.compare(current, desired, options, listener);
    }
}
