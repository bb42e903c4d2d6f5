package guraa.pdfbaseline.cli;

import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine.Option;

/**
 * {@code -v/--verbose}, shared by the subcommands.
 */
public class VerboseOption {

    static final String APPLICATION_LOGGER = "guraa.pdfbaseline";

    @Option(names = {"-v", "--verbose"}, description = "Verbose logging")
    private boolean verbose;

    public boolean isVerbose() {
        return verbose;
    }

    void apply() {
        if (verbose) {
            LoggingSystem.get(VerboseOption.class.getClassLoader()).setLogLevel(APPLICATION_LOGGER, LogLevel.DEBUG);
        }
    }
}
