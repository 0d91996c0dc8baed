package work.lcod.state.values;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map whose insertion order is part of its meaning; renders with an {@code [ordered]} cast.
 */
public class OrderedDictionary extends LinkedHashMap<String, Object> {
    private static final long serialVersionUID = 1L;

    public OrderedDictionary() {
        super();
    }

    public OrderedDictionary(Map<String, ?> source) {
        super(source);
    }
}
