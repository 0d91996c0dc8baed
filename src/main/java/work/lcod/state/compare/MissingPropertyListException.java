package work.lcod.state.compare;

import java.util.Map;
import work.lcod.state.shared.StateException;

/**
 * Raised when the desired state is a structured object and no property restriction tells which of
 * its properties matter.
 */
public final class MissingPropertyListException extends StateException {
    public static final String CODE = "missing_property_list";

    public MissingPropertyListException(Object desired) {
        super(
            CODE,
            "A desired state of type " + desired.getClass().getName()
                + " needs an explicit list of properties to compare",
            Map.of("type", desired.getClass().getName())
        );
    }
}
