package work.lcod.state.compare;

import java.util.Map;
import work.lcod.state.shared.StateException;
import work.lcod.state.shared.TypeNames;

/**
 * Raised when a top-level comparison input is neither a map nor a structured object.
 */
public final class InvalidInputShapeException extends StateException {
    public static final String CODE = "invalid_input_shape";

    public InvalidInputShapeException(String role, Object value) {
        super(
            CODE,
            "The " + role + " state must be a map or a structured object, got " + TypeNames.of(value),
            Map.of("role", role, "type", TypeNames.of(value))
        );
    }
}
