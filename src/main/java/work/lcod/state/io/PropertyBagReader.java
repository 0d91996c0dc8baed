package work.lcod.state.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.state.values.DataTable;

/**
 * Loads property bags and other values from JSON, YAML, TOML or CSV documents.
 *
 * <p>Objects become insertion-ordered maps, arrays become lists. A CSV document becomes a
 * {@link DataTable} whose first record names the columns.
 */
public final class PropertyBagReader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private PropertyBagReader() {}

    public enum Format {
        JSON,
        YAML,
        TOML,
        CSV;

        public static Format fromName(String name) {
            String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
            return switch (normalized) {
                case "json" -> JSON;
                case "yaml", "yml" -> YAML;
                case "toml" -> TOML;
                case "csv" -> CSV;
                default -> throw new IllegalArgumentException("Unsupported document format: " + name);
            };
        }

        /**
         * Picks the format from the file extension, JSON when there is none.
         */
        public static Format forPath(Path path) {
            String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            return dot < 0 ? JSON : fromName(fileName.substring(dot + 1));
        }
    }

    public static Object read(Path path) {
        return read(path, Format.forPath(path));
    }

    public static Object read(Path path, Format format) {
        try {
            return parse(Files.readString(path), format);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read path: " + path, ex);
        }
    }

    /**
     * Reads a document that must hold a single object.
     *
     * @throws IllegalArgumentException when the document is not an object
     */
    public static Map<String, Object> readBag(Path path) {
        Object value = read(path);
        if (value instanceof Map<?, ?> map) {
            var bag = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> bag.put(String.valueOf(k), v));
            return bag;
        }
        throw new IllegalArgumentException("Document " + path + " does not hold an object");
    }

    public static Object parse(String text, Format format) {
        return switch (format) {
            case JSON -> parseJackson(JSON, text, "json");
            case YAML -> parseJackson(YAML, text, "yaml");
            case TOML -> parseToml(text);
            case CSV -> parseCsv(text);
        };
    }

    private static Object parseJackson(ObjectMapper mapper, String text, String label) {
        if (text.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException(label + " parse error: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Map<String, Object> parseToml(String text) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("toml parse error: " + result.errors().get(0).toString());
        }
        return convertTomlTable(result);
    }

    private static DataTable parseCsv(String text) {
        CSVFormat format = CSVFormat.DEFAULT.withFirstRecordAsHeader().withTrim();
        try (CSVParser parser = new CSVParser(new StringReader(text), format)) {
            DataTable table = new DataTable(parser.getHeaderNames());
            for (CSVRecord record : parser) {
                List<Object> cells = new ArrayList<>(record.size());
                for (String cell : record) {
                    cells.add(cell);
                }
                table.addRow(cells);
            }
            return table;
        } catch (IOException ex) {
            throw new IllegalArgumentException("csv parse error: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, Object> convertTomlTable(TomlTable table) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String key : table.keySet()) {
            map.put(key, convertTomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object convertTomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return convertTomlTable(table);
        }
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>();
            for (int i = 0; i < array.size(); i++) {
                list.add(convertTomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }
}
