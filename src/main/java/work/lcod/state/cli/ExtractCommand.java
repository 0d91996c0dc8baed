package work.lcod.state.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.state.literal.LiteralExtractor;
import work.lcod.state.serialize.ExpressionSerializer;
import work.lcod.state.values.ScriptBlock;

@CommandLine.Command(
    name = "extract",
    description = "Read literal arguments out of capability-file text without evaluating it.",
    mixinStandardHelpOptions = true
)
final class ExtractCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        required = true,
        description = "Text to read; use '-' to read from stdin."
    )
    private String input;

    @CommandLine.Option(names = "--json", description = "Print the values as a JSON array instead of normalized expressions.")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        List<Object> values = new LiteralExtractor().extractValues(StateCommand.readText(input));
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            List<Object> plain = new ArrayList<>(values.size());
            for (Object value : values) {
                plain.add(toJsonValue(value));
            }
            out.println(JSON_WRITER.writeValueAsString(plain));
        } else {
            var serializer = new ExpressionSerializer();
            for (Object value : values) {
                out.println(serializer.serialize(value));
            }
        }
        out.flush();
        return 0;
    }

    private static Object toJsonValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof ScriptBlock block) {
            return block.source();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), toJsonValue(v)));
            return copy;
        }
        if (value instanceof Iterable<?> items) {
            List<Object> copy = new ArrayList<>();
            for (Object item : items) {
                copy.add(toJsonValue(item));
            }
            return copy;
        }
        if (value instanceof Object[] array) {
            List<Object> copy = new ArrayList<>(array.length);
            for (Object item : array) {
                copy.add(toJsonValue(item));
            }
            return copy;
        }
        return String.valueOf(value);
    }
}
