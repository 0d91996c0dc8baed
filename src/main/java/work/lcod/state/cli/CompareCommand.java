package work.lcod.state.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.state.api.CapabilityState;
import work.lcod.state.api.LogLevel;
import work.lcod.state.compare.ComparisonOptions;
import work.lcod.state.compare.ComparisonResult;
import work.lcod.state.io.PropertyBagReader;

@CommandLine.Command(
    name = "compare",
    description = "Test whether a current state document satisfies a desired state document.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class CompareCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--current", required = true, description = "Current state document (json|yaml|toml).")
    private Path current;

    @CommandLine.Option(names = "--desired", required = true, description = "Desired state document (json|yaml|toml).")
    private Path desired;

    @CommandLine.Option(names = "--properties", split = ",", description = "Only compare these properties.")
    private List<String> properties;

    @CommandLine.Option(names = "--exclude", split = ",", description = "Never compare these properties.")
    private List<String> exclude = new ArrayList<>();

    @CommandLine.Option(names = "--skip-type-check", description = "Compare values loosely across types.")
    private boolean skipTypeCheck;

    @CommandLine.Option(names = "--sort-arrays", description = "Sort arrays on both sides before comparing elements.")
    private boolean sortArrays;

    @CommandLine.Option(names = "--reverse", description = "Also compare the desired state against the current state.")
    private boolean reverse;

    @CommandLine.Option(
        names = "--log-level",
        description = "Diagnostic threshold (trace|debug|info|warn|error|fatal); trace lines print at debug and trace.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        ComparisonOptions options = ComparisonOptions.builder()
            .restrictToProperties(properties)
            .excludeProperties(exclude)
            .skipTypeChecking(skipTypeCheck)
            .sortArraysBeforeCompare(sortArrays)
            .alsoCheckReverse(reverse)
            .build();

        var err = spec.commandLine().getErr();
        ComparisonResult result = new CapabilityState().test(
            PropertyBagReader.readBag(current),
            PropertyBagReader.readBag(desired),
            options,
            line -> {
                if (logLevel.printsTrace()) {
                    err.println(line);
                }
            }
        );
        err.flush();
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.exitCode();
    }
}
