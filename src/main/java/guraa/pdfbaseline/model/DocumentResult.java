package guraa.pdfbaseline.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered page results of one document plus its aggregate status.
 */
@Getter
public class DocumentResult {

    private final String documentStem;
    private final int candidatePageCount;
    private final int baselinePageCount;

    /**
     * Set when the candidate document could not be rendered; the document then has no pages.
     */
    private final String errorMessage;

    @Getter(lombok.AccessLevel.NONE)
    private final List<PageResult> pages;

    public DocumentResult(String documentStem, List<PageResult> pages,
                          int candidatePageCount, int baselinePageCount) {
        this(documentStem, pages, candidatePageCount, baselinePageCount, null);
    }

    private DocumentResult(String documentStem, List<PageResult> pages,
                           int candidatePageCount, int baselinePageCount, String errorMessage) {
        this.documentStem = documentStem;
        this.pages = new ArrayList<>(pages);
        this.candidatePageCount = candidatePageCount;
        this.baselinePageCount = baselinePageCount;
        this.errorMessage = errorMessage;
    }

    /**
     * Result for a document whose candidate side failed to render.
     */
    public static DocumentResult renderFailed(String documentStem, int baselinePageCount, String errorMessage) {
        return new DocumentResult(documentStem, List.of(), 0, baselinePageCount, errorMessage);
    }

    public List<PageResult> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public boolean hasRenderError() {
        return errorMessage != null;
    }

    /**
     * Worst page status; ERROR for a document that failed to render.
     */
    public PageStatus getStatus() {
        PageStatus status = PageStatus.worstOf(pages.stream().map(PageResult::getStatus).collect(Collectors.toList()));
        return hasRenderError() ? PageStatus.worst(status, PageStatus.ERROR) : status;
    }

    public boolean isPassed() {
        return getStatus() == PageStatus.PASS;
    }

    public boolean isPageCountMismatch() {
        return !hasRenderError() && baselinePageCount > 0 && candidatePageCount != baselinePageCount;
    }

    /**
     * Mean similarity percentage across scored pages, 0 when nothing was scored.
     */
    public double getOverallSimilarityPercent() {
        return pages.stream()
                .filter(PageResult::hasScore)
                .mapToDouble(PageResult::getSimilarityPercent)
                .average()
                .orElse(0.0);
    }

    void replacePage(PageResult updated) {
        for (int i = 0; i < pages.size(); i++) {
            if (pages.get(i).getKey().equals(updated.getKey())) {
                pages.set(i, updated);
                return;
            }
        }
        throw new IllegalArgumentException("No page " + updated.getKey() + " in document " + documentStem);
    }
}
