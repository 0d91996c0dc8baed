package work.lcod.state.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import work.lcod.state.values.Credential;
import work.lcod.state.values.DataTable;
import work.lcod.state.values.MailAddress;
import work.lcod.state.values.NumericValue;
import work.lcod.state.values.OrderedDictionary;
import work.lcod.state.values.ScriptBlock;
import work.lcod.state.values.SecureValue;

class ExpressionSerializerTest {
    private final ExpressionSerializer serializer = new ExpressionSerializer();

    record Service(String name, int port) {}

    enum Color { RED, GREEN }

    enum Access implements NumericValue {
        READ(1), WRITE(2);

        private final long bits;

        Access(long bits) {
            this.bits = bits;
        }

        @Override
        public long numericValue() {
            return bits;
        }
    }

    private static RenderingContext.Builder unix() {
        return RenderingContext.builder().newline("\n");
    }

    @Test
    void rendersServiceBagOnTwoIndentedLines() {
        var bag = new LinkedHashMap<String, Object>();
        bag.put("Name", "svc");
        bag.put("Retries", 3);

        String text = serializer.serialize(bag, unix().expansionThreshold(2).build());

        assertEquals("@{\n\t'Name' = 'svc'\n\t'Retries' = 3\n}", text);
    }

    @Test
    void rendersScalars() {
        assertEquals("$Null", serializer.serialize(null));
        assertEquals("$True", serializer.serialize(true));
        assertEquals("$False", serializer.serialize(false));
        assertEquals("42", serializer.serialize(42));
        assertEquals("1.50", serializer.serialize(new BigDecimal("1.50")));
        assertEquals("'it''s'", serializer.serialize("it's"));
        assertEquals("'2024-01-02'", serializer.serialize(LocalDate.of(2024, 1, 2)));
    }

    @Test
    void keepsCastForNonFiniteNumbers() {
        assertEquals("[double]'NaN'", serializer.serialize(Double.NaN));
        assertEquals("[double]'Infinity'", serializer.serialize(Double.POSITIVE_INFINITY));
    }

    @Test
    void multiLineTextBecomesHereString() {
        assertEquals("@'\nfirst\nsecond\n'@", serializer.serialize("first\nsecond", unix().build()));
    }

    @Test
    void hereStringTerminatorAtLineStartFallsBackToQuotedText() {
        assertEquals("'a\n''@'", serializer.serialize("a\n'@", unix().build()));
    }

    @Test
    void textEndingInCarriageReturnStaysQuoted() {
        assertEquals("'a\nb\r'", serializer.serialize("a\nb\r", unix().build()));
    }

    @Test
    void singletonSequenceKeepsLeadingComma() {
        assertEquals(",'a'", serializer.serialize(List.of("a")));
        assertEquals("@{'Tags' = ,'a'}", serializer.serialize(Map.of("Tags", List.of("a"))));
    }

    @Test
    void nestedSingletonIsParenthesized() {
        String text = serializer.serialize(List.of(List.of(1), 2), unix().build());
        assertEquals("@(\n\t(,1),\n\t2\n)", text);
    }

    @Test
    void emptyContainers() {
        assertEquals("@()", serializer.serialize(List.of()));
        assertEquals("@{}", serializer.serialize(Map.of()));
    }

    @Test
    void compactModeDropsSpaces() {
        var bag = new LinkedHashMap<String, Object>();
        bag.put("a", 1);
        bag.put("b", List.of(1, 2));

        String text = serializer.serialize(bag, unix().expansionThreshold(-1).build());

        assertEquals("@{'a'=1;'b'=1,2}", text);
    }

    @Test
    void containersBeyondMaxDepthBecomePlaceholder() {
        var inner = Map.of("A", 1);
        var outer = Map.of("Inner", inner);

        assertEquals("@{'Inner' = '...'}", serializer.serialize(outer, unix().maxDepth(1).build()));
        assertEquals("'...'", serializer.serialize(outer, unix().maxDepth(0).build()));
        assertEquals("@{'Inner' = @{'A' = 1}}", serializer.serialize(outer, unix().maxDepth(2).build()));
    }

    @Test
    void scalarsAtMaxDepthStillRender() {
        assertEquals("@{'A' = 1}", serializer.serialize(Map.of("A", 1), unix().maxDepth(1).build()));
    }

    @Test
    void strongTypingCastsEveryValue() {
        var bag = new LinkedHashMap<String, Object>();
        bag.put("a", 1);
        bag.put("b", "x");

        String text = serializer.serialize(bag, unix().strongTyping(true).expansionThreshold(1).build());

        assertEquals("[hashtable]@{'a' = [int]1; 'b' = [string]'x'}", text);
    }

    @Test
    void weakTypingKeepsOrderedAndObjectCasts() {
        var ordered = new OrderedDictionary();
        ordered.put("a", 1);
        assertEquals("[ordered]@{'a' = 1}", serializer.serialize(ordered));

        String text = serializer.serialize(new Service("svc", 80), unix().expansionThreshold(1).build());
        assertEquals("[pscustomobject]@{'name' = 'svc'; 'port' = 80}", text);
    }

    @Test
    void exploreModeShowsRuntimeTypesOnlyWithStrongTyping() {
        var ordered = new OrderedDictionary();
        ordered.put("a", 1);
        assertEquals("@{'a' = 1}", serializer.serialize(ordered, unix().exploreMode(true).build()));
        assertEquals(
            "[java.lang.Integer]7",
            serializer.serialize(7, unix().exploreMode(true).strongTyping(true).build())
        );
    }

    @Test
    void primitiveArraysStayOnOneLineWithTheirCast() {
        assertEquals("[int[]](1, 2, 3)", serializer.serialize(new int[] {1, 2, 3}, unix().build()));
        assertEquals("[int[]](,7)", serializer.serialize(new int[] {7}, unix().build()));
        assertEquals("[byte[]]@()", serializer.serialize(new byte[0], unix().build()));
        assertEquals("1, 2, 3", serializer.serialize(new int[] {1, 2, 3}, unix().exploreMode(true).build()));
        assertEquals("[int[]]([int]1, [int]2, [int]3)", serializer.serialize(new int[] {1, 2, 3}, unix().strongTyping(true).build()));
    }

    @Test
    void objectArraysNeedNoCastInWeakMode() {
        assertEquals("'a', 'b'", serializer.serialize(new String[] {"a", "b"}, unix().expansionThreshold(1).build()));
    }

    @Test
    void quotedScalarsCarryTheirCastInStrongMode() {
        RenderingContext strong = unix().strongTyping(true).build();

        assertEquals("[char]'c'", serializer.serialize('c', strong));
        assertEquals("[regex]'a+'", serializer.serialize(Pattern.compile("a+"), strong));
        assertEquals("[uri]'http://x'", serializer.serialize(URI.create("http://x"), strong));
        assertEquals("[version]'1.2.3'", serializer.serialize(Runtime.Version.parse("1.2.3"), strong));
        assertEquals("[type]'java.lang.String'", serializer.serialize(String.class, strong));
        assertEquals("[mailaddress]'ops@example.org'", serializer.serialize(new MailAddress("ops@example.org"), strong));
        assertEquals("'a+'", serializer.serialize(Pattern.compile("a+")));
    }

    @Test
    void datesCarryDatetimeCastInStrongMode() {
        assertEquals("[datetime]'2024-01-02'", serializer.serialize(LocalDate.of(2024, 1, 2), unix().strongTyping(true).build()));
    }

    @Test
    void processHandleRendersItsId() {
        ProcessHandle handle = ProcessHandle.current();
        assertEquals(String.valueOf(handle.pid()), serializer.serialize(handle));
        assertEquals("[long]" + handle.pid(), serializer.serialize(handle, unix().strongTyping(true).build()));
    }

    @Test
    void markupIsIndentedWithTheContextIndentChar() throws Exception {
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        var root = document.createElement("root");
        var child = document.createElement("child");
        child.setTextContent("x");
        root.appendChild(child);
        document.appendChild(root);

        String text = serializer.serialize(document, unix().build());

        assertTrue(text.startsWith("@'\n<root>"), text);
        assertTrue(text.contains("\n\t<child>x</child>\n"), text);
        assertTrue(text.endsWith("</root>\n'@"), text);
    }

    @Test
    void enumsRenderByNameOrNumber() {
        assertEquals("'RED'", serializer.serialize(Color.RED));
        assertEquals("[Color]'GREEN'", serializer.serialize(Color.GREEN, unix().strongTyping(true).build()));
        assertEquals("2", serializer.serialize(Access.WRITE));
    }

    @Test
    void secretsRenderAsConversionExpressions() {
        assertEquals(
            "(ConvertTo-SecureString 'p''w' -AsPlainText -Force)",
            serializer.serialize(SecureValue.of("p'w"))
        );
        assertEquals(
            "(New-Object PSCredential 'admin', (ConvertTo-SecureString 'pw' -AsPlainText -Force))",
            serializer.serialize(Credential.of("admin", "pw"))
        );
    }

    @Test
    void codeBlocksKeepSource() {
        assertEquals("{ Get-Date }", serializer.serialize(ScriptBlock.of(" Get-Date ")));
        assertEquals("{1 # note\n}", serializer.serialize(ScriptBlock.of("1 # note"), unix().build()));
    }

    @Test
    void guidCastInStrongMode() {
        UUID id = UUID.fromString("4f1c2a6e-8d5b-4a3f-9c2d-1e0f3b4a5c6d");
        assertEquals("'" + id + "'", serializer.serialize(id));
        assertEquals("[guid]'" + id + "'", serializer.serialize(id, unix().strongTyping(true).build()));
    }

    @Test
    void tablesRenderAsRows() {
        var table = new DataTable(List.of("Name", "Port"));
        table.addRow(List.of("web", "80"));

        assertEquals(",@{'Name' = 'web'; 'Port' = '80'}", serializer.serialize(table, unix().expansionThreshold(1).build()));
    }

    @Test
    void sameInputRendersSameText() {
        var bag = new LinkedHashMap<String, Object>();
        bag.put("Name", "svc");
        bag.put("Ports", List.of(80, 443));
        bag.put("Options", Map.of("Enabled", true));
        RenderingContext context = unix().build();

        assertEquals(serializer.serialize(bag, context), serializer.serialize(bag, context));
    }
}
