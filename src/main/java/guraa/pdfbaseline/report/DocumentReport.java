package guraa.pdfbaseline.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Serialisable view of one document result.
 */
@Data
@Builder
@JsonPropertyOrder({"name", "status", "passed", "overallSimilarityPercent",
        "baselinePageCount", "candidatePageCount", "errorMessage", "pages"})
public class DocumentReport {

    private String name;
    private String status;
    private boolean passed;
    private double overallSimilarityPercent;
    private int baselinePageCount;
    private int candidatePageCount;
    private String errorMessage;

    @Singular
    private List<PageReport> pages;
}
