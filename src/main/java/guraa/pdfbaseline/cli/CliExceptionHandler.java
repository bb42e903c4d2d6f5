package guraa.pdfbaseline.cli;

import guraa.pdfbaseline.config.ConfigException;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Maps exceptions escaping a command to exit codes: configuration errors to
 * {@link ExitCodes#CONFIG_ERROR}, anything else to {@link ExitCodes#NOT_PASSED}.
 */
@Slf4j
public class CliExceptionHandler implements IExecutionExceptionHandler {

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        if (ex instanceof ConfigException) {
            commandLine.getErr().println("Error: " + ex.getMessage());
            return ExitCodes.CONFIG_ERROR;
        }
        log.error("{} failed: {}", commandLine.getCommandName(), ex.getMessage(), ex);
        commandLine.getErr().println("Error: " + ex.getMessage());
        return ExitCodes.NOT_PASSED;
    }
}
