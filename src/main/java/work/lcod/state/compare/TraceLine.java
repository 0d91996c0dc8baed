package work.lcod.state.compare;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One diagnostic line emitted while comparing a property.
 */
public record TraceLine(Kind kind, String property, String message) {
    public TraceLine {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(message, "message");
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.label());
        map.put("property", property);
        map.put("message", message);
        return map;
    }

    @Override
    public String toString() {
        return "[" + kind.label() + "] " + message;
    }

    public enum Kind {
        MATCH("match"),
        NO_MATCH("no-match");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
