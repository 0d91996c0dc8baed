package work.lcod.state.compare;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Message templates for comparison trace lines, keyed by dotted TOML key
 * ({@code comparison.match}, {@code array.length_mismatch}, ...).
 */
public final class MessageCatalog {
    private static final String DEFAULT_RESOURCE = "/lcod-state/messages.toml";
    private static volatile MessageCatalog defaults;

    private final Map<String, String> templates;

    private MessageCatalog(Map<String, String> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    public static MessageCatalog defaults() {
        MessageCatalog loaded = defaults;
        if (loaded == null) {
            synchronized (MessageCatalog.class) {
                loaded = defaults;
                if (loaded == null) {
                    loaded = fromToml(readResource(DEFAULT_RESOURCE));
                    defaults = loaded;
                }
            }
        }
        return loaded;
    }

    public static MessageCatalog of(Map<String, String> templates) {
        return new MessageCatalog(Objects.requireNonNull(templates, "templates"));
    }

    /**
     * @throws IllegalArgumentException when the text is not valid TOML
     */
    public static MessageCatalog fromToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid message catalog: " + result.errors().get(0).toString());
        }
        var templates = new LinkedHashMap<String, String>();
        for (String key : result.dottedKeySet()) {
            if (result.isString(key)) {
                templates.put(key, result.getString(key));
            }
        }
        return new MessageCatalog(templates);
    }

    /**
     * Entries of {@code overrides} replace entries of this catalog; other keys are kept.
     */
    public MessageCatalog withOverrides(MessageCatalog overrides) {
        var merged = new LinkedHashMap<>(templates);
        merged.putAll(overrides.templates);
        return new MessageCatalog(merged);
    }

    public Map<String, String> templates() {
        return templates;
    }

    /**
     * Formats the template registered under {@code key}. Unknown keys format to the key itself and
     * unknown placeholders to an empty string.
     */
    public String format(String key, Map<String, ?> values) {
        String template = templates.get(key);
        if (template == null) {
            return key;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < template.length(); i++) {
            char ch = template.charAt(i);
            if (ch == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    builder.append('{');
                    i += 1;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close == -1) {
                    builder.append(template.substring(i));
                    break;
                }
                String token = template.substring(i + 1, close).trim();
                Object resolved = token.isEmpty() ? null : values.get(token);
                if (resolved != null) {
                    builder.append(resolved);
                }
                i = close;
                continue;
            }
            if (ch == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
                builder.append('}');
                i += 1;
                continue;
            }
            builder.append(ch);
        }
        return builder.toString();
    }

    private static String readResource(String name) {
        try (InputStream in = MessageCatalog.class.getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read bundled resource " + name, ex);
        }
    }
}
