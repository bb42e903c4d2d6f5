package guraa.pdfbaseline.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; does nothing by itself but print usage.
 */
@Component
@Command(
        name = "pdf-baseline",
        description = "Visual regression checks of PDF output against stored baseline images using SSIM",
        mixinStandardHelpOptions = true,
        version = "pdf-baseline 1.0.0",
        subcommands = {CompareCommand.class, InitCommand.class}
)
public class PdfBaselineCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
