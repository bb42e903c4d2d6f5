package guraa.pdfbaseline.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import guraa.pdfbaseline.util.FileUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Service for generating comparison reports.
 * Every format is rendered from the same {@link RunReport} and written atomically into
 * the output directory under a fixed file name.
 */
@Slf4j
@Service
public class ReportGenerationService {

    static final String HTML_TEMPLATE = "comparison-report";
    private static final String RULE = "--------------------------------------------------";

    private final ObjectMapper objectMapper;
    private final TemplateEngine templateEngine;

    public ReportGenerationService(ObjectMapper objectMapper, TemplateEngine templateEngine) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.templateEngine = templateEngine;
    }

    /**
     * Generate the reports of the requested format.
     *
     * @param report    The run to report
     * @param format    JSON, TEXT, HTML or ALL
     * @param outputDir Directory to write into
     * @return Paths of the written reports
     * @throws IOException If a report cannot be written
     */
    public List<Path> generate(RunReport report, ReportFormat format, Path outputDir) throws IOException {
        FileUtils.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        for (ReportFormat concrete : format.expand()) {
            Path target = outputDir.resolve(concrete.getFileName());
            FileUtils.writeAtomically(target, render(report, concrete).getBytes(StandardCharsets.UTF_8));
            log.info("{} report: {}", concrete, target);
            written.add(target);
        }
        return written;
    }

    /**
     * Render one concrete format to a string.
     */
    public String render(RunReport report, ReportFormat format) throws IOException {
        switch (format) {
            case JSON:
                return renderJson(report);
            case TEXT:
                return renderText(report);
            case HTML:
                return renderHtml(report);
            default:
                throw new IllegalArgumentException("Not a concrete report format: " + format);
        }
    }

    private String renderJson(RunReport report) throws IOException {
        return objectMapper.writeValueAsString(report) + System.lineSeparator();
    }

    private String renderText(RunReport report) {
        StringBuilder text = new StringBuilder();
        text.append("Comparison Results: ").append(report.getPassed()).append('/').append(report.getTotal())
                .append(" passed").append('\n');
        text.append(RULE).append('\n');

        for (DocumentReport document : report.getDocuments()) {
            text.append('[').append(document.getStatus()).append("] ").append(document.getName()).append('\n');

            if (document.getErrorMessage() != null) {
                text.append("    Error: ").append(document.getErrorMessage()).append('\n');
                continue;
            }
            text.append(String.format(Locale.ROOT, "    SSIM: %.2f%%\n", document.getOverallSimilarityPercent()));
            if (document.getBaselinePageCount() > 0
                    && document.getBaselinePageCount() != document.getCandidatePageCount()) {
                text.append("    Page count mismatch: baseline=").append(document.getBaselinePageCount())
                        .append(" candidate=").append(document.getCandidatePageCount()).append('\n');
            }
            for (PageReport page : document.getPages()) {
                text.append("      Page ").append(page.getPage()).append(": ");
                if (page.getSimilarityPercent() != null) {
                    text.append(String.format(Locale.ROOT, "%.2f%% ", page.getSimilarityPercent()));
                }
                text.append('[').append(page.getStatus()).append(']');
                if (page.getDiffImage() != null) {
                    text.append(" -> ").append(page.getDiffImage());
                }
                text.append('\n');
            }
        }
        return text.toString();
    }

    private String renderHtml(RunReport report) {
        Context context = new Context(Locale.ROOT);
        context.setVariable("report", report);
        return templateEngine.process(HTML_TEMPLATE, context);
    }
}
