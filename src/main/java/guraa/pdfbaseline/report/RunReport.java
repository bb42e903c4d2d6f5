package guraa.pdfbaseline.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import guraa.pdfbaseline.model.DocumentResult;
import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PageResult;
import guraa.pdfbaseline.model.RunResult;
import guraa.pdfbaseline.store.BaselineNaming;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Serialisable view of a whole run; the single input of every report format.
 */
@Data
@Builder
@JsonPropertyOrder({"generatedAt", "threshold", "status", "passed", "total", "documents"})
public class RunReport {

    private String generatedAt;
    private double threshold;
    private String status;
    private long passed;
    private int total;

    @Singular
    private List<DocumentReport> documents;

    /**
     * Build the report view of a run.
     *
     * @param run         The run, after any approvals
     * @param diffWritten Pages whose diff overlay was written to the output directory
     * @param generatedAt Timestamp to print
     */
    public static RunReport from(RunResult run, Set<PageKey> diffWritten, String generatedAt) {
        return RunReport.builder()
                .generatedAt(generatedAt)
                .threshold(run.getThreshold())
                .status(run.getStatus().name())
                .passed(run.getPassedDocumentCount())
                .total(run.getDocuments().size())
                .documents(run.getDocuments().stream()
                        .map(doc -> toDocumentReport(doc, diffWritten))
                        .collect(Collectors.toList()))
                .build();
    }

    private static DocumentReport toDocumentReport(DocumentResult document, Set<PageKey> diffWritten) {
        return DocumentReport.builder()
                .name(document.getDocumentStem())
                .status(document.getStatus().name())
                .passed(document.isPassed())
                .overallSimilarityPercent(round2(document.getOverallSimilarityPercent()))
                .baselinePageCount(document.getBaselinePageCount())
                .candidatePageCount(document.getCandidatePageCount())
                .errorMessage(document.getErrorMessage())
                .pages(document.getPages().stream()
                        .map(page -> toPageReport(page, diffWritten))
                        .collect(Collectors.toList()))
                .build();
    }

    private static PageReport toPageReport(PageResult page, Set<PageKey> diffWritten) {
        return PageReport.builder()
                .page(page.getPageNumber())
                .status(page.getStatus().name())
                .passed(page.isPassed())
                .similarityPercent(page.hasScore() ? round2(page.getSimilarityPercent()) : null)
                .threshold(page.getThresholdUsed())
                .diffImage(page.hasDiffImage() && diffWritten.contains(page.getKey()) ? BaselineNaming.diffFileName(page.getKey()) : null)
                .message(page.getMessage())
                .build();
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
