package work.lcod.state.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.state.values.Credential;

class PropertyBagsTest {
    record Endpoint(String host, int port) {}

    public static final class Bean {
        public String getName() {
            return "bean";
        }

        public int getBroken() {
            throw new IllegalStateException("unreadable");
        }
    }

    @Test
    void recordsAndBeansAreStructured() {
        assertTrue(PropertyBags.isStructuredObject(new Endpoint("h", 1)));
        assertTrue(PropertyBags.isStructuredObject(new Bean()));
    }

    @Test
    void scalarsContainersAndValueTypesAreNot() {
        for (Object value : new Object[] {
            null, "x", 1, true, 'c', LocalDate.of(2024, 1, 1), Map.of(), List.of(), new int[0],
            Path.of("a"), Credential.of("u", "p"), Thread.State.NEW
        }) {
            assertFalse(PropertyBags.isStructuredObject(value), String.valueOf(value));
        }
    }

    @Test
    void recordBecomesBagInComponentOrder() {
        assertEquals(List.of("host", "port"), List.copyOf(PropertyBags.toBag(new Endpoint("h", 1)).keySet()));
        assertEquals(Map.of("host", "h", "port", 1), PropertyBags.toBag(new Endpoint("h", 1)));
    }

    @Test
    void unreadablePropertiesAreLeftOut() {
        assertEquals(Map.of("name", "bean"), PropertyBags.toBag(new Bean()));
    }

    @Test
    void typeNamesCollapseCollections() {
        assertEquals(TypeNames.LIST, TypeNames.of(new String[0]));
        assertEquals(TypeNames.LIST, TypeNames.of(List.of()));
        assertEquals(TypeNames.MAP, TypeNames.of(Map.of()));
        assertEquals("java.lang.Integer", TypeNames.of(1));
        assertEquals("null", TypeNames.of(null));
    }
}
