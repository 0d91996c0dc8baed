package work.lcod.state.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.state.io.PropertyBagReader;
import work.lcod.state.serialize.ExpressionSerializer;
import work.lcod.state.serialize.RenderingContext;

@CommandLine.Command(
    name = "serialize",
    description = "Render a JSON, YAML, TOML or CSV document as a capability-file expression.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class SerializeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--input"},
        paramLabel = "PATH|-",
        required = true,
        description = "Document to render; use '-' to read from stdin."
    )
    private String input;

    @CommandLine.Option(
        names = "--format",
        description = "Input format (json|yaml|toml|csv); taken from the file extension when omitted.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String format;

    @CommandLine.Option(names = "--depth", description = "Maximum nesting depth before containers are elided.")
    private int depth = RenderingContext.DEFAULT_MAX_DEPTH;

    @CommandLine.Option(
        names = "--expand",
        description = "Levels rendered multi-line; negative for a single line (default: --depth).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer expand;

    @CommandLine.Option(names = "--indent", description = "Indent characters per level.")
    private int indent = 1;

    @CommandLine.Option(names = "--indent-char", description = "Indent character (use 'tab' or 'space' for whitespace).")
    private String indentChar = "tab";

    @CommandLine.Option(names = "--strong", description = "Prefix every value with its type cast.")
    private boolean strong;

    @CommandLine.Option(names = "--explore", description = "Render without casts unless --strong, then with runtime type names.")
    private boolean explore;

    @Override
    public Integer call() throws Exception {
        String text = StateCommand.readText(input);
        PropertyBagReader.Format documentFormat = format != null
            ? PropertyBagReader.Format.fromName(format)
            : "-".equals(input) ? PropertyBagReader.Format.JSON : PropertyBagReader.Format.forPath(Path.of(input));
        Object value = PropertyBagReader.parse(text, documentFormat);

        RenderingContext.Builder context = RenderingContext.builder()
            .maxDepth(depth)
            .indentUnit(indent)
            .indentChar(resolveIndentChar())
            .strongTyping(strong)
            .exploreMode(explore);
        if (expand != null) {
            context.expansionThreshold(expand);
        }
        spec.commandLine().getOut().println(new ExpressionSerializer().serialize(value, context.build()));
        spec.commandLine().getOut().flush();
        return 0;
    }

    private char resolveIndentChar() {
        return switch (indentChar) {
            case "tab", "\t" -> '\t';
            case "space", " " -> ' ';
            default -> {
                if (indentChar.length() != 1) {
                    throw new CommandLine.ParameterException(spec.commandLine(), "--indent-char must be a single character, 'tab' or 'space'.");
                }
                yield indentChar.charAt(0);
            }
        };
    }
}
