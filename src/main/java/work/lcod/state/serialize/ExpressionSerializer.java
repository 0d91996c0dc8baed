package work.lcod.state.serialize;

import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Node;
import work.lcod.state.values.Credential;
import work.lcod.state.values.ScriptBlock;
import work.lcod.state.values.SecureValue;

/**
 * Renders value trees as capability-file literal expressions.
 *
 * <p>Containers deeper than {@link RenderingContext#maxDepth()} collapse to {@code '...'}.
 * Sequences with one element keep a leading comma so they read back as sequences. The output is
 * a pure function of the value and the context.
 */
public final class ExpressionSerializer {
    static final String PLACEHOLDER = "'...'";
    private static final String INDENT_AMOUNT = "{http://xml.apache.org/xslt}indent-amount";

    private final ValueClassifier classifier;

    public ExpressionSerializer() {
        this(new ValueClassifier());
    }

    public ExpressionSerializer(ValueClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public String serialize(Object value) {
        return serialize(value, RenderingContext.defaults());
    }

    public String serialize(Object value, RenderingContext context) {
        Objects.requireNonNull(context, "context");
        return render(value, context).stripTrailing();
    }

    private String render(Object value, RenderingContext ctx) {
        Classification c = classifier.classify(value);
        if (isContainer(c.category()) && ctx.depthExhausted()) {
            return PLACEHOLDER;
        }
        return switch (c.category()) {
            case NULL -> "$Null";
            case BOOLEAN -> Boolean.TRUE.equals(c.payload()) ? "$True" : "$False";
            case QUOTED_SCALAR, DATE_TIME, VALUE_SCALAR -> typed(c, ctx, quote((String) c.payload()));
            case NUMBER -> renderNumber(c, ctx);
            case STRING -> typed(c, ctx, here((String) c.payload(), ctx));
            case SECURE_VALUE -> secureExpression((SecureValue) c.payload());
            case CREDENTIAL -> credentialExpression((Credential) c.payload());
            case ENUMERATION -> typed(c, ctx, c.payload() instanceof Long number ? number.toString() : quote((String) c.payload()));
            case CODE_BLOCK -> typed(c, ctx, codeBlock((ScriptBlock) c.payload(), ctx));
            case HANDLE -> typed(c, ctx, c.payload().toString());
            case MARKUP -> typed(c, ctx, here(markup((Node) c.payload(), ctx), ctx));
            case TABLE -> render(c.payload(), ctx);
            case ORDERED_MAP, MAP, OBJECT -> renderMap((Map<?, ?>) c.payload(), c, ctx);
            case SEQUENCE -> renderSequence((List<?>) c.payload(), c, ctx);
        };
    }

    private String renderSequence(List<?> items, Classification c, RenderingContext ctx) {
        String prefix = castPrefix(c, ctx);
        if (items.isEmpty()) {
            return prefix + "@()";
        }
        if (items.size() == 1) {
            String item = render(items.get(0), ctx.child(true));
            if (ctx.listItem() || !prefix.isEmpty()) {
                return prefix + "(," + item + ")";
            }
            return "," + item;
        }
        List<String> rendered = new ArrayList<>(items.size());
        for (Object item : items) {
            rendered.add(render(item, ctx.child(true)));
        }
        if (ctx.inline() || c.inline()) {
            String joined = String.join(ctx.compact() ? "," : ", ", rendered);
            if (ctx.listItem() || !prefix.isEmpty()) {
                return prefix + "(" + joined + ")";
            }
            return joined;
        }
        String separator = "," + ctx.newline() + ctx.childIndent();
        return prefix + "@(" + ctx.newline() + ctx.childIndent() + String.join(separator, rendered)
            + ctx.newline() + ctx.indent() + ")";
    }

    private String renderMap(Map<?, ?> entries, Classification c, RenderingContext ctx) {
        String prefix = castPrefix(c, ctx);
        if (entries.isEmpty()) {
            return prefix + "@{}";
        }
        String assign = ctx.compact() ? "=" : " = ";
        List<String> pairs = new ArrayList<>(entries.size());
        for (Map.Entry<?, ?> entry : entries.entrySet()) {
            pairs.add(key(entry.getKey()) + assign + render(entry.getValue(), ctx.child(false)));
        }
        if (ctx.inline() || pairs.size() == 1) {
            return prefix + "@{" + String.join(ctx.compact() ? ";" : "; ", pairs) + "}";
        }
        String separator = ctx.newline() + ctx.childIndent();
        return prefix + "@{" + separator + String.join(separator, pairs) + ctx.newline() + ctx.indent() + "}";
    }

    private String renderNumber(Classification c, RenderingContext ctx) {
        Number number = (Number) c.payload();
        if (isNonFinite(number)) {
            // NaN and infinities have no bare literal; keep the cast even in weak mode
            String prefix = castPrefix(c, ctx);
            if (prefix.isEmpty() && !ctx.exploreMode()) {
                prefix = "[" + c.typeTag() + "]";
            }
            return prefix + quote(number.toString());
        }
        String text = number instanceof BigDecimal decimal ? decimal.toPlainString() : number.toString();
        return typed(c, ctx, text);
    }

    private String typed(Classification c, RenderingContext ctx, String expression) {
        return castPrefix(c, ctx) + expression;
    }

    /**
     * Cast shown in front of an expression. Explore mode drops every cast unless strong typing is
     * also on, in which case it shows the runtime type. Weak typing keeps only the casts that change
     * the container a literal reads back as: ordered maps, objects and primitive arrays.
     */
    private static String castPrefix(Classification c, RenderingContext ctx) {
        if (ctx.exploreMode()) {
            return ctx.strongTyping() && c.runtimeType() != null ? "[" + c.runtimeType() + "]" : "";
        }
        if (ctx.strongTyping()) {
            return c.typeTag() == null ? "" : "[" + c.typeTag() + "]";
        }
        if (c.category() == Category.ORDERED_MAP || c.category() == Category.OBJECT
            || (c.category() == Category.SEQUENCE && c.inline())) {
            return "[" + c.typeTag() + "]";
        }
        return "";
    }

    private static String key(Object key) {
        if (key instanceof Number number) {
            return number instanceof BigDecimal decimal ? decimal.toPlainString() : number.toString();
        }
        return quote(String.valueOf(key));
    }

    static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    /**
     * Multi-line text goes into a here-string, unless a line starts with the terminator or the text
     * ends in a carriage return, which would merge with the closing line break.
     */
    private static String here(String text, RenderingContext ctx) {
        if (text.indexOf('\n') < 0 && text.indexOf('\r') < 0) {
            return quote(text);
        }
        if (text.startsWith("'@") || text.contains("\n'@") || text.contains("\r'@") || text.endsWith("\r")) {
            return quote(text);
        }
        return "@'" + ctx.newline() + text + ctx.newline() + "'@";
    }

    private static String codeBlock(ScriptBlock block, RenderingContext ctx) {
        String source = block.source();
        return block.endsInComment() ? "{" + source + ctx.newline() + "}" : "{" + source + "}";
    }

    private static String secureExpression(SecureValue value) {
        return "(ConvertTo-SecureString " + quote(value.reveal()) + " -AsPlainText -Force)";
    }

    private static String credentialExpression(Credential credential) {
        return "(New-Object PSCredential " + quote(credential.userName()) + ", "
            + secureExpression(credential.secret()) + ")";
    }

    private static String markup(Node node, RenderingContext ctx) {
        boolean indent = !ctx.inline();
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, indent ? "yes" : "no");
            if (indent) {
                transformer.setOutputProperty(INDENT_AMOUNT, String.valueOf(ctx.indentUnit()));
            }
            var writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            String text = writer.toString().strip();
            return indent ? reindent(text, ctx) : text;
        } catch (TransformerException ex) {
            throw new IllegalStateException("Unable to render markup: " + ex.getMessage(), ex);
        }
    }

    private static String reindent(String text, RenderingContext ctx) {
        var lines = new ArrayList<String>();
        for (String line : text.split("\\r?\\n")) {
            if (line.isBlank()) {
                continue;
            }
            if (ctx.indentChar() != ' ' && ctx.indentUnit() > 0) {
                int spaces = 0;
                while (spaces < line.length() && line.charAt(spaces) == ' ') {
                    spaces++;
                }
                int levels = spaces / ctx.indentUnit();
                line = String.valueOf(ctx.indentChar()).repeat(levels * ctx.indentUnit()) + line.substring(levels * ctx.indentUnit());
            }
            lines.add(line);
        }
        return String.join(ctx.newline(), lines);
    }

    private static boolean isNonFinite(Number number) {
        if (number instanceof Double value) {
            return value.isNaN() || value.isInfinite();
        }
        if (number instanceof Float value) {
            return value.isNaN() || value.isInfinite();
        }
        return false;
    }

    private static boolean isContainer(Category category) {
        return category == Category.MAP
            || category == Category.ORDERED_MAP
            || category == Category.OBJECT
            || category == Category.SEQUENCE
            || category == Category.TABLE;
    }
}
