package work.lcod.state.shared;

/**
 * Base for errors raised by the serializer, extractor and comparator. Carries a stable code and
 * optional data so callers can branch without parsing messages.
 */
public class StateException extends RuntimeException {
    private final String code;
    private final Object data;

    public StateException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public StateException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
