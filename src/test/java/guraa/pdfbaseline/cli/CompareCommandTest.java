package guraa.pdfbaseline.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import guraa.pdfbaseline.TestBeans;
import guraa.pdfbaseline.TestPdfs;
import guraa.pdfbaseline.approval.ApprovalWorkflow;
import guraa.pdfbaseline.approval.ConsoleDecisionSource;
import guraa.pdfbaseline.approval.DecisionSource;
import guraa.pdfbaseline.config.AppProperties;
import guraa.pdfbaseline.render.PdfRenderingService;
import guraa.pdfbaseline.report.DiffImageWriter;
import guraa.pdfbaseline.service.ComparisonEngine;
import guraa.pdfbaseline.service.DocumentScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CompareCommandTest {

    private static final float[] BOX = {40, 120, 60, 60};
    private static final float[] MOVED_BOX = {120, 40, 60, 60};

    @TempDir
    Path tempDir;

    private Path pdfDir;
    private Path refDir;
    private Path outputDir;

    private final PdfRenderingService renderingService = new PdfRenderingService();
    private final DocumentScanner documentScanner = new DocumentScanner();
    private final AppProperties properties = new AppProperties();
    private ComparisonEngine engine;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        pdfDir = Files.createDirectories(tempDir.resolve("pdfs"));
        refDir = tempDir.resolve("baselines");
        outputDir = tempDir.resolve("results");
        engine = TestBeans.comparisonEngine();
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    void unchangedDocumentsPass() throws Exception {
        TestPdfs.withBoxes(pdfDir.resolve("invoice.pdf"), BOX, null);
        TestPdfs.blank(pdfDir.resolve("letter.pdf"), 1);
        initBaselines();

        int exitCode = compare(newCommand());

        assertThat(exitCode).isEqualTo(ExitCodes.PASSED);
        assertThat(out.toString())
                .contains("Comparing: invoice.pdf")
                .contains("Comparing: letter.pdf")
                .contains("Results: 2/2 passed");

        JsonNode report = new ObjectMapper().readTree(outputDir.resolve("comparison_results.json").toFile());
        assertThat(report.get("passed").asLong()).isEqualTo(2);
        assertThat(report.get("documents")).hasSize(2);
        assertThat(report.get("documents").get(0).get("name").asText()).isEqualTo("invoice");
        assertThat(report.get("documents").get(0).get("status").asText()).isEqualTo("PASS");
    }

    @Test
    void changedPageFailsAndWritesDiffImage() throws Exception {
        Path pdf = TestPdfs.withBoxes(pdfDir.resolve("invoice.pdf"), BOX);
        initBaselines();
        TestPdfs.withBoxes(pdf, MOVED_BOX);

        int exitCode = compare(newCommand(), "--threshold", "99.9", "--format", "all");

        assertThat(exitCode).isEqualTo(ExitCodes.NOT_PASSED);
        assertThat(out.toString()).contains("Results: 0/1 passed");
        assertThat(outputDir.resolve("invoice_page_1_diff.png")).exists();
        assertThat(outputDir.resolve("comparison_results.json")).exists();
        assertThat(outputDir.resolve("comparison_results.txt")).exists();
        assertThat(outputDir.resolve("comparison_results.html")).exists();
        assertThat(Files.readString(outputDir.resolve("comparison_results.txt")))
                .contains("[FAIL] invoice")
                .contains("invoice_page_1_diff.png");
    }

    @Test
    void documentWithoutBaselineIsReportedMissing() throws Exception {
        Files.createDirectories(refDir);
        TestPdfs.blank(pdfDir.resolve("new.pdf"), 1);

        int exitCode = compare(newCommand(), "--format", "text");

        assertThat(exitCode).isEqualTo(ExitCodes.NOT_PASSED);
        assertThat(Files.readString(outputDir.resolve("comparison_results.txt")))
                .contains("[MISSING_BASELINE] new");
    }

    @Test
    void pageCountChangeIsReported() throws Exception {
        Path pdf = TestPdfs.blank(pdfDir.resolve("report.pdf"), 2);
        initBaselines();
        TestPdfs.blank(pdf, 3);

        int exitCode = compare(newCommand(), "--format", "text");

        assertThat(exitCode).isEqualTo(ExitCodes.NOT_PASSED);
        assertThat(Files.readString(outputDir.resolve("comparison_results.txt")))
                .contains("[PAGE_COUNT_MISMATCH] report")
                .contains("Page count mismatch: baseline=2 candidate=3");
    }

    @Test
    void corruptCandidateIsAnErrorAndOthersStillRun() throws Exception {
        TestPdfs.blank(pdfDir.resolve("good.pdf"), 1);
        initBaselines();
        TestPdfs.corrupt(pdfDir.resolve("broken.pdf"));

        int exitCode = compare(newCommand());

        assertThat(exitCode).isEqualTo(ExitCodes.NOT_PASSED);
        assertThat(out.toString()).contains("Results: 1/2 passed");
    }

    @Test
    void acceptedChangeBecomesTheNewBaseline() throws Exception {
        Path pdf = TestPdfs.withBoxes(pdfDir.resolve("invoice.pdf"), BOX);
        initBaselines();
        TestPdfs.withBoxes(pdf, MOVED_BOX);

        int exitCode = compare(new ScriptedCompareCommand("y\n"), "--threshold", "99.9", "--interactive");

        assertThat(exitCode).isEqualTo(ExitCodes.PASSED);
        assertThat(out.toString())
                .contains("[1/1] invoice_page_1 - FAIL")
                .contains("Review: 1 accepted, 0 rejected, 0 skipped")
                .contains("Results: 1/1 passed");

        // The next run compares against the accepted page
        out = new StringWriter();
        assertThat(compare(newCommand(), "--threshold", "99.9")).isEqualTo(ExitCodes.PASSED);
    }

    @Test
    void quittingReviewLeavesBaselinesUntouched() throws Exception {
        Path pdf = TestPdfs.withBoxes(pdfDir.resolve("invoice.pdf"), BOX);
        initBaselines();
        byte[] before = Files.readAllBytes(refDir.resolve("invoice_page_1.png"));
        TestPdfs.withBoxes(pdf, MOVED_BOX);

        int exitCode = compare(new ScriptedCompareCommand("q\n"), "--threshold", "99.9", "--interactive");

        assertThat(exitCode).isEqualTo(ExitCodes.NOT_PASSED);
        assertThat(out.toString()).contains("Review: 0 accepted, 0 rejected, 1 skipped");
        assertThat(Files.readAllBytes(refDir.resolve("invoice_page_1.png"))).isEqualTo(before);
    }

    @Test
    void thresholdOutOfRangeIsAConfigurationError() throws Exception {
        Files.createDirectories(refDir);

        int exitCode = compare(newCommand(), "--threshold", "150");

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
        assertThat(err.toString()).contains("Error:").contains("150");
    }

    @Test
    void missingTestDirectoryIsAConfigurationError() throws Exception {
        Files.createDirectories(refDir);

        int exitCode = createCommandLine(newCommand()).execute(
                "-t", tempDir.resolve("nowhere").toString(),
                "-r", refDir.toString(),
                "-o", outputDir.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.CONFIG_ERROR);
        assertThat(err.toString()).contains("Test directory does not exist");
    }

    @Test
    void unknownReportFormatIsAConfigurationError() throws Exception {
        Files.createDirectories(refDir);

        assertThat(compare(newCommand(), "--format", "xml")).isEqualTo(ExitCodes.CONFIG_ERROR);
    }

    private CompareCommand newCommand() {
        return new CompareCommand(engine, new ApprovalWorkflow(engine), renderingService, documentScanner,
                new DiffImageWriter(), TestBeans.reportGenerationService(), properties);
    }

    private void initBaselines() {
        InitCommand init = new InitCommand(renderingService, documentScanner, properties);
        int exitCode = new CommandLine(init)
                .setOut(new PrintWriter(new StringWriter()))
                .execute("-p", pdfDir.toString(), "-r", refDir.toString(), "--dpi", String.valueOf(TestPdfs.TEST_DPI));
        assertThat(exitCode).isEqualTo(ExitCodes.PASSED);
    }

    private int compare(CompareCommand command, String... extraArgs) {
        String[] base = {
                "-t", pdfDir.toString(),
                "-r", refDir.toString(),
                "-o", outputDir.toString(),
                "--dpi", String.valueOf(TestPdfs.TEST_DPI)
        };
        String[] args = new String[base.length + extraArgs.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extraArgs, 0, args, base.length, extraArgs.length);
        return createCommandLine(command).execute(args);
    }

    private CommandLine createCommandLine(CompareCommand command) {
        return new CommandLine(command)
                .setExecutionExceptionHandler(new CliExceptionHandler())
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));
    }

    /**
     * Reads review answers from a fixed script instead of standard input.
     */
    private class ScriptedCompareCommand extends CompareCommand {

        private final String answers;

        ScriptedCompareCommand(String answers) {
            super(engine, new ApprovalWorkflow(engine), renderingService, documentScanner,
                    new DiffImageWriter(), TestBeans.reportGenerationService(), properties);
            this.answers = answers;
        }

        @Override
        DecisionSource decisionSource(PrintWriter out, Path diffDirectory) {
            return new ConsoleDecisionSource(new BufferedReader(new StringReader(answers)), out, diffDirectory);
        }
    }
}
