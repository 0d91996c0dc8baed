package work.lcod.state.literal;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.state.shared.StateException;

/**
 * Raised for well-formed text whose value could only be produced by evaluation: variable
 * references, sub-expressions, commands, expandable strings.
 */
public final class UnsupportedArgumentShapeException extends StateException {
    public static final String CODE = "unsupported_argument_shape";

    public UnsupportedArgumentShapeException(String shape, String fragment, int position) {
        super(CODE, "Unsupported argument shape (" + shape + "): " + fragment + " at offset " + position, data(shape, fragment, position));
    }

    private static Map<String, Object> data(String shape, String fragment, int position) {
        var data = new LinkedHashMap<String, Object>();
        data.put("shape", shape);
        data.put("fragment", fragment);
        data.put("position", position);
        return data;
    }
}
