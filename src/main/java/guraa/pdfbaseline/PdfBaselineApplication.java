package guraa.pdfbaseline;

import guraa.pdfbaseline.cli.CliExceptionHandler;
import guraa.pdfbaseline.cli.PdfBaselineCommand;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Main application class for the PDF baseline checker
 */
@SpringBootApplication
public class PdfBaselineApplication implements CommandLineRunner, ExitCodeGenerator {

    private final IFactory factory;
    private final PdfBaselineCommand command;

    private int exitCode;

    public PdfBaselineApplication(IFactory factory, PdfBaselineCommand command) {
        this.factory = factory;
        this.command = command;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PdfBaselineApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = createCommandLine(command, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command line with the application's exception handling, shared with the tests.
     */
    public static CommandLine createCommandLine(PdfBaselineCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler(new CliExceptionHandler());
    }
}
