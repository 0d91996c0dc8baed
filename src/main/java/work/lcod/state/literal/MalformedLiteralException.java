package work.lcod.state.literal;

import java.util.Map;
import work.lcod.state.shared.StateException;

/**
 * Raised when argument text does not parse, or a cast cannot convert its operand.
 */
public final class MalformedLiteralException extends StateException {
    public static final String CODE = "malformed_literal";

    public MalformedLiteralException(String message, int position) {
        super(CODE, message + " at offset " + position, Map.of("position", position));
    }

    MalformedLiteralException(String message, Throwable cause) {
        super(CODE, message, null, cause);
    }
}
