package work.lcod.state.compare;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.state.values.Credential;
import work.lcod.state.values.ScriptBlock;

class StateComparatorTest {
    private final StateComparator comparator = new StateComparator();

    record Service(String name, int port) {}

    private static Map<String, Object> bag(Object... pairs) {
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Test
    void equalBagsAreInDesiredState() {
        var current = bag("Name", "svc", "Retries", 3);
        var desired = bag("Name", "svc", "Retries", 3);

        ComparisonResult result = comparator.compare(current, desired, ComparisonOptions.defaults());

        assertTrue(result.inDesiredState());
        assertEquals(2, result.trace().size());
        assertTrue(result.mismatchedProperties().isEmpty());
    }

    @Test
    void extraCurrentPropertiesAreIgnored() {
        assertTrue(comparator.statesEqual(bag("A", 1, "B", 2), bag("A", 1), ComparisonOptions.defaults()));
    }

    @Test
    void scalarMismatchIsReported() {
        ComparisonResult result = comparator.compare(bag("Port", 80), bag("Port", 443), ComparisonOptions.defaults());

        assertFalse(result.inDesiredState());
        assertEquals(List.of("Port"), result.mismatchedProperties());
        assertEquals(TraceLine.Kind.NO_MATCH, result.trace().get(0).kind());
        assertTrue(result.trace().get(0).message().contains("'80'"));
    }

    @Test
    void numberAndTextDifferUnlessTypeCheckingIsSkipped() {
        var current = bag("Port", 5);
        var desired = bag("Port", "5");

        assertFalse(comparator.statesEqual(current, desired, ComparisonOptions.defaults()));
        assertTrue(comparator.statesEqual(current, desired, ComparisonOptions.builder().skipTypeChecking(true).build()));
    }

    @Test
    void arraysCompareInOrderUnlessSorted() {
        var current = bag("Tags", List.of("b", "a"));
        var desired = bag("Tags", List.of("a", "b"));

        assertFalse(comparator.statesEqual(current, desired, ComparisonOptions.defaults()));
        assertTrue(comparator.statesEqual(current, desired, ComparisonOptions.builder().sortArraysBeforeCompare(true).build()));
    }

    @Test
    void sortingDoesNotTouchInputs() {
        var tags = new ArrayList<>(List.of("b", "a"));
        comparator.statesEqual(bag("Tags", tags), bag("Tags", List.of("a", "b")),
            ComparisonOptions.builder().sortArraysBeforeCompare(true).build());

        assertEquals(List.of("b", "a"), tags);
    }

    @Test
    void arrayLengthMismatch() {
        ComparisonResult result = comparator.compare(
            bag("Tags", List.of("a")),
            bag("Tags", List.of("a", "b")),
            ComparisonOptions.defaults()
        );

        assertFalse(result.inDesiredState());
        assertTrue(result.trace().get(0).message().contains("1 element(s) but 2"));
    }

    @Test
    void emptyAndMissingArrays() {
        assertTrue(comparator.statesEqual(bag("Tags", List.of()), bag("Tags", List.of()), ComparisonOptions.defaults()));
        assertTrue(comparator.statesEqual(bag(), bag("Tags", new String[0]), ComparisonOptions.defaults()));
        assertFalse(comparator.statesEqual(bag(), bag("Tags", List.of("a")), ComparisonOptions.defaults()));
    }

    @Test
    void arrayAndListOfSameElementsMatch() {
        assertTrue(comparator.statesEqual(
            bag("Ports", new int[] {80, 443}),
            bag("Ports", List.of(80, 443)),
            ComparisonOptions.defaults()
        ));
    }

    @Test
    void scalarCurrentIsWrappedWhenTypeCheckingIsSkipped() {
        var options = ComparisonOptions.builder().skipTypeChecking(true).build();
        assertTrue(comparator.statesEqual(bag("Tags", "a"), bag("Tags", List.of("a")), options));
        assertFalse(comparator.statesEqual(bag("Tags", "a"), bag("Tags", List.of("a")), ComparisonOptions.defaults()));
    }

    @Test
    void nestedMapsAreComparedRecursively() {
        var current = bag("Settings", bag("Port", 80, "Host", "x"));
        var desired = bag("Settings", bag("Port", 81));

        ComparisonResult result = comparator.compare(current, desired, ComparisonOptions.defaults());

        assertFalse(result.inDesiredState());
        assertEquals(List.of("Settings.Port", "Settings"), result.mismatchedProperties());
    }

    @Test
    void restrictionDoesNotApplyToNestedMaps() {
        var current = bag("Settings", bag("Port", 80), "Other", 1);
        var desired = bag("Settings", bag("Port", 80), "Other", 2);
        var options = ComparisonOptions.builder().restrictToProperties(List.of("Settings")).build();

        assertTrue(comparator.statesEqual(current, desired, options));
    }

    @Test
    void excludedPropertiesAreSkipped() {
        var options = ComparisonOptions.builder().excludeProperties(List.of("Port")).build();
        assertTrue(comparator.statesEqual(bag("Port", 80, "Name", "a"), bag("Port", 443, "Name", "a"), options));
    }

    @Test
    void restrictedKeyAbsentFromDesiredIsNotAMismatch() {
        var options = ComparisonOptions.builder().restrictToProperties(List.of("Name", "Ghost")).build();
        ComparisonResult result = comparator.compare(bag("Name", "a", "Ghost", 1), bag("Name", "a"), options);

        assertTrue(result.inDesiredState());
        assertEquals(2, result.trace().size());
    }

    @Test
    void typeMismatchIsReported() {
        ComparisonResult result = comparator.compare(bag("Port", 80L), bag("Port", 80), ComparisonOptions.defaults());

        assertFalse(result.inDesiredState());
        assertTrue(result.trace().get(0).message().contains("java.lang.Long"));
    }

    @Test
    void credentialsCompareUserNamesOnly() {
        var desired = bag("Account", Credential.of("admin", "secret"));

        assertTrue(comparator.statesEqual(bag("Account", Credential.of("admin", "other")), desired, ComparisonOptions.defaults()));
        assertTrue(comparator.statesEqual(bag("Account", "admin"), desired, ComparisonOptions.defaults()));
        assertFalse(comparator.statesEqual(bag("Account", Credential.of("root", "secret")), desired, ComparisonOptions.defaults()));
    }

    @Test
    void traceNeverShowsSecrets() {
        ComparisonResult result = comparator.compare(
            bag("Account", Credential.of("root", "hunter2")),
            bag("Account", Credential.of("admin", "hunter2")),
            ComparisonOptions.defaults()
        );

        assertFalse(result.toPrettyJson().contains("hunter2"));
    }

    @Test
    void codeBlockComparedWithTextUsesItsResult() {
        var desired = bag("Value", "42");
        var options = ComparisonOptions.builder().skipTypeChecking(true).build();

        assertTrue(comparator.statesEqual(bag("Value", ScriptBlock.of("6 * 7", () -> "42")), desired, options));
        assertFalse(comparator.statesEqual(bag("Value", ScriptBlock.of("6 * 7")), desired, options));
        assertTrue(comparator.statesEqual(bag("Value", ScriptBlock.of("x")), bag("Value", ScriptBlock.of("x")), ComparisonOptions.defaults()));
    }

    @Test
    void mismatchDoesNotStopTheWalk() {
        var current = bag("A", 1, "B", 2, "C", 3);
        var desired = bag("A", 9, "B", 2, "C", 9);

        ComparisonResult result = comparator.compare(current, desired, ComparisonOptions.defaults());

        assertFalse(result.inDesiredState());
        assertEquals(3, result.trace().size());
        assertEquals(List.of("A", "C"), result.mismatchedProperties());
    }

    @Test
    void reverseCheckFindsExtraCurrentProperties() {
        var current = bag("A", 1, "B", 2);
        var desired = bag("A", 1);
        var options = ComparisonOptions.builder().alsoCheckReverse(true).build();

        assertTrue(comparator.statesEqual(current, desired, ComparisonOptions.defaults()));
        assertFalse(comparator.statesEqual(current, desired, options));
    }

    @Test
    void reverseCheckIsSymmetric() {
        var options = ComparisonOptions.builder().alsoCheckReverse(true).build();
        List<Map<String, Object>> samples = List.of(
            bag("A", 1),
            bag("A", 1, "B", 2),
            bag("A", "1"),
            bag("A", List.of(1, 2)),
            bag("A", List.of(2, 1)),
            bag("A", bag("X", 1)),
            bag("A", bag("X", 1, "Y", 2)),
            bag()
        );
        for (Map<String, Object> left : samples) {
            for (Map<String, Object> right : samples) {
                assertEquals(
                    comparator.statesEqual(left, right, options),
                    comparator.statesEqual(right, left, options),
                    left + " vs " + right
                );
                assertEquals(
                    comparator.statesEqual(left, right, options),
                    comparator.statesEqual(left, right, ComparisonOptions.defaults())
                        && comparator.statesEqual(right, left, ComparisonOptions.defaults()),
                    left + " vs " + right
                );
            }
        }
    }

    @Test
    void structuredObjectsAreReadThroughTheirProperties() {
        var options = ComparisonOptions.builder().restrictToProperties(List.of("name", "port")).build();

        assertTrue(comparator.statesEqual(new Service("web", 80), new Service("web", 80), options));
        assertTrue(comparator.statesEqual(bag("name", "web", "port", 80), new Service("web", 80), options));
        assertFalse(comparator.statesEqual(new Service("web", 8080), new Service("web", 80), options));
    }

    @Test
    void nestedStructuredObjectsBecomeBags() {
        assertTrue(comparator.statesEqual(
            bag("Service", new Service("web", 80)),
            bag("Service", bag("name", "web")),
            ComparisonOptions.defaults()
        ));
    }

    @Test
    void desiredObjectWithoutPropertyListIsRejected() {
        var ex = assertThrows(MissingPropertyListException.class,
            () -> comparator.compare(bag(), new Service("web", 80), ComparisonOptions.defaults()));
        assertEquals(MissingPropertyListException.CODE, ex.code());
    }

    @Test
    void scalarInputsAreRejected() {
        assertThrows(InvalidInputShapeException.class, () -> comparator.compare(null, bag(), ComparisonOptions.defaults()));
        assertThrows(InvalidInputShapeException.class, () -> comparator.compare(bag(), "text", ComparisonOptions.defaults()));
        assertThrows(InvalidInputShapeException.class, () -> comparator.compare(List.of(), bag(), ComparisonOptions.defaults()));
    }

    @Test
    void listenerSeesEveryTraceLine() {
        var seen = new ArrayList<TraceLine>();
        ComparisonResult result = comparator.compare(bag("A", 1, "B", 2), bag("A", 1, "B", 3), ComparisonOptions.defaults(), seen::add);

        assertEquals(result.trace(), seen);
    }

    @Test
    void inputsAreNotModified() {
        var current = bag("Tags", new ArrayList<>(List.of("b", "a")), "Extra", 1);
        var desired = bag("Tags", new ArrayList<>(List.of("a", "b")));
        var currentCopy = new LinkedHashMap<>(current);
        var desiredCopy = new LinkedHashMap<>(desired);

        comparator.compare(current, desired, ComparisonOptions.builder()
            .sortArraysBeforeCompare(true)
            .alsoCheckReverse(true)
            .excludeProperties(List.of("Extra"))
            .build());

        assertEquals(currentCopy, current);
        assertEquals(desiredCopy, desired);
    }

    @Test
    void customMessagesAreUsed() {
        var messages = MessageCatalog.defaults().withOverrides(
            MessageCatalog.of(Map.of("comparison.mismatch", "{property}: {current} -> {desired}"))
        );
        ComparisonResult result = new StateComparator(messages).compare(bag("Port", 80), bag("Port", 443), ComparisonOptions.defaults());

        assertEquals("Port: 80 -> 443", result.trace().get(0).message());
    }
}
