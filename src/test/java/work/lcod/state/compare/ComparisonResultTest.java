package work.lcod.state.compare;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ComparisonResultTest {
    @Test
    void serializableMapListsMismatchesOnce() {
        var result = new ComparisonResult(false, List.of(
            new TraceLine(TraceLine.Kind.NO_MATCH, "A", "first"),
            new TraceLine(TraceLine.Kind.MATCH, "B", "second"),
            new TraceLine(TraceLine.Kind.NO_MATCH, "A", "third")
        ));

        Map<String, Object> map = result.toSerializableMap();

        assertEquals(false, map.get("inDesiredState"));
        assertEquals(List.of("A"), map.get("mismatches"));
        assertEquals(3, ((List<?>) map.get("trace")).size());
        assertEquals(1, result.exitCode());
    }

    @Test
    void prettyJsonCarriesKindLabels() {
        var result = new ComparisonResult(true, List.of(new TraceLine(TraceLine.Kind.MATCH, "A", "fine")));

        String json = result.toPrettyJson();

        assertTrue(json.contains("\"inDesiredState\" : true"));
        assertTrue(json.contains("\"kind\" : \"match\""));
        assertEquals(0, result.exitCode());
    }
}
