package guraa.pdfbaseline.cli;

import guraa.pdfbaseline.approval.ApprovalOutcome;
import guraa.pdfbaseline.approval.ApprovalWorkflow;
import guraa.pdfbaseline.approval.ConsoleDecisionSource;
import guraa.pdfbaseline.approval.DecisionSource;
import guraa.pdfbaseline.approval.ReviewState;
import guraa.pdfbaseline.config.AppProperties;
import guraa.pdfbaseline.config.ConfigException;
import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.RunParameters;
import guraa.pdfbaseline.model.RunResult;
import guraa.pdfbaseline.render.CandidatePageIndex;
import guraa.pdfbaseline.render.PdfRenderingService;
import guraa.pdfbaseline.render.RenderedPdfDocument;
import guraa.pdfbaseline.report.DiffImageWriter;
import guraa.pdfbaseline.report.ReportFormat;
import guraa.pdfbaseline.report.ReportGenerationService;
import guraa.pdfbaseline.report.RunReport;
import guraa.pdfbaseline.service.ComparisonEngine;
import guraa.pdfbaseline.service.DocumentScanner;
import guraa.pdfbaseline.store.FileSystemBaselineStore;
import guraa.pdfbaseline.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Compares a directory of candidate PDFs against stored baselines, writes diff images and
 * reports, and optionally lets the operator approve changes page by page.
 */
@Slf4j
@Component
@Command(
        name = "compare",
        description = "Compare test PDFs against baseline images",
        mixinStandardHelpOptions = true
)
public class CompareCommand implements Callable<Integer> {

    private final ComparisonEngine comparisonEngine;
    private final ApprovalWorkflow approvalWorkflow;
    private final PdfRenderingService renderingService;
    private final DocumentScanner documentScanner;
    private final DiffImageWriter diffImageWriter;
    private final ReportGenerationService reportGenerationService;
    private final AppProperties properties;

    @Spec
    private CommandSpec spec;

    @Mixin
    private VerboseOption verboseOption;

    @Option(names = {"-t", "--test-dir"}, description = "Directory containing test PDFs", required = true)
    private Path testDir;

    @Option(names = {"-r", "--ref-dir"}, description = "Directory containing baseline PNGs (default: app.storage.baseline-dir)")
    private Path refDir;

    @Option(names = {"-o", "--output"}, description = "Output directory for reports and diff images (default: app.storage.output-dir)")
    private Path outputDir;

    @Option(names = {"--threshold"}, description = "SSIM threshold in percent, 0-100 (default: app.comparison.threshold)")
    private Double threshold;

    @Option(names = {"--dpi"}, description = "Render DPI (default: app.comparison.dpi)")
    private Integer dpi;

    @Option(names = {"--format"}, description = "Report format: json, text, html or all (default: ${DEFAULT-VALUE})",
            defaultValue = "json")
    private String format;

    @Option(names = {"--interactive"}, description = "Prompt for approval of pages that did not pass")
    private boolean interactive;

    public CompareCommand(ComparisonEngine comparisonEngine, ApprovalWorkflow approvalWorkflow,
                          PdfRenderingService renderingService, DocumentScanner documentScanner,
                          DiffImageWriter diffImageWriter, ReportGenerationService reportGenerationService,
                          AppProperties properties) {
        this.comparisonEngine = comparisonEngine;
        this.approvalWorkflow = approvalWorkflow;
        this.renderingService = renderingService;
        this.documentScanner = documentScanner;
        this.diffImageWriter = diffImageWriter;
        this.reportGenerationService = reportGenerationService;
        this.properties = properties;
    }

    @Override
    public Integer call() throws IOException {
        verboseOption.apply();
        PrintWriter out = spec.commandLine().getOut();

        RunParameters params = RunParameters.builder()
                .threshold(threshold != null ? threshold : properties.getComparison().getThreshold())
                .dpi(dpi != null ? dpi : properties.getComparison().getDpi())
                .interactive(interactive)
                .build()
                .validate();
        ReportFormat reportFormat = ReportFormat.parse(format);
        Path refDir = this.refDir != null ? this.refDir : Path.of(properties.getStorage().getBaselineDir());
        Path outputDir = this.outputDir != null ? this.outputDir : Path.of(properties.getStorage().getOutputDir());
        requireDirectory(testDir, "Test directory");
        requireDirectory(refDir, "Baseline directory");
        FileUtils.createDirectories(outputDir);

        List<Path> pdfs = documentScanner.findPdfs(testDir);
        if (pdfs.isEmpty()) {
            log.warn("No PDFs found in {}", testDir);
        }
        List<RenderedPdfDocument> documents = pdfs.stream()
                .map(pdf -> new RenderedPdfDocument(pdf, params.getDpi(), renderingService))
                .collect(Collectors.toList());
        documents.forEach(doc -> out.println("Comparing: " + doc.getPath().getFileName()));
        out.flush();

        FileSystemBaselineStore store = new FileSystemBaselineStore(refDir);
        RunResult run = comparisonEngine.compare(documents, store, params);
        Set<PageKey> diffWritten = diffImageWriter.writeAll(run, outputDir);

        if (params.isInteractive()) {
            ApprovalOutcome outcome = approvalWorkflow.review(run, CandidatePageIndex.of(documents), store,
                    decisionSource(out, outputDir));
            out.println("Review: " + outcome.count(ReviewState.ACCEPTED) + " accepted, "
                    + outcome.count(ReviewState.REJECTED) + " rejected, "
                    + outcome.count(ReviewState.SKIPPED) + " skipped");
        }

        String generatedAt = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        reportGenerationService.generate(RunReport.from(run, diffWritten, generatedAt), reportFormat, outputDir);

        out.println();
        out.println("Results: " + run.getPassedDocumentCount() + "/" + run.getDocuments().size() + " passed");
        out.flush();
        return run.isPassed() ? ExitCodes.PASSED : ExitCodes.NOT_PASSED;
    }

    /**
     * Operator decisions are read from standard input.
     */
    DecisionSource decisionSource(PrintWriter out, Path diffDirectory) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return new ConsoleDecisionSource(in, out, diffDirectory);
    }

    private static void requireDirectory(Path directory, String what) {
        if (!Files.isDirectory(directory)) {
            throw new ConfigException(what + " does not exist: " + directory);
        }
    }
}
