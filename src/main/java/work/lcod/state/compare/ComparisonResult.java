package work.lcod.state.compare;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Verdict of a comparison plus the trace collected on the way.
 */
public record ComparisonResult(boolean inDesiredState, List<TraceLine> trace) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ComparisonResult {
        trace = List.copyOf(trace);
    }

    /**
     * Properties with at least one no-match line, in trace order.
     */
    public List<String> mismatchedProperties() {
        var properties = new LinkedHashSet<String>();
        for (TraceLine line : trace) {
            if (line.kind() == TraceLine.Kind.NO_MATCH) {
                properties.add(line.property());
            }
        }
        return new ArrayList<>(properties);
    }

    public int exitCode() {
        return inDesiredState ? 0 : 1;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("inDesiredState", inDesiredState);
        serializable.put("mismatches", mismatchedProperties());
        List<Map<String, Object>> lines = new ArrayList<>();
        for (TraceLine line : trace) {
            lines.add(line.toSerializableMap());
        }
        serializable.put("trace", lines);
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }
}
