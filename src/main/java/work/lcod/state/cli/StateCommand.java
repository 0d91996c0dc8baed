package work.lcod.state.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(
    name = "lcod-state",
    description = "Write, read and compare capability-file state literals.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        SerializeCommand.class,
        ExtractCommand.class,
        CompareCommand.class
    }
)
final class StateCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "A subcommand is required (serialize, extract, compare).");
    }

    /**
     * Reads a whole file, or standard input for {@code -}.
     */
    static String readText(String source) throws IOException {
        if ("-".equals(source)) {
            return readStream(System.in);
        }
        return Files.readString(Path.of(source), StandardCharsets.UTF_8);
    }

    private static String readStream(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
}
