package guraa.pdfbaseline.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

/**
 * Serialisable view of one page result.
 */
@Data
@Builder
@JsonPropertyOrder({"page", "status", "passed", "similarityPercent", "threshold", "diffImage", "message"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageReport {

    private int page;
    private String status;
    private boolean passed;

    /**
     * Rounded to two decimals; absent for unscored pages.
     */
    private Double similarityPercent;

    private double threshold;

    /**
     * File name of the diff overlay in the output directory.
     */
    private String diffImage;

    private String message;
}
