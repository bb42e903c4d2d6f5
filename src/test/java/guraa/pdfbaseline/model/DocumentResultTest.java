package guraa.pdfbaseline.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DocumentResultTest {

    private static PageResult scored(int page, double score, PageStatus status) {
        return PageResult.builder()
                .key(PageKey.of("doc", page))
                .status(status)
                .similarityScore(score)
                .thresholdUsed(95.0)
                .build();
    }

    private static PageResult unscored(int page, PageStatus status) {
        return PageResult.unscored(PageKey.of("doc", page), status, 95.0, "detail");
    }

    @Test
    void aggregateIsTheWorstPageStatus() {
        DocumentResult result = new DocumentResult("doc", List.of(
                scored(1, 1.0, PageStatus.PASS),
                scored(2, 0.5, PageStatus.FAIL),
                unscored(3, PageStatus.ERROR)), 3, 3);

        assertThat(result.getStatus()).isEqualTo(PageStatus.ERROR);
        assertThat(result.isPassed()).isFalse();
    }

    @Test
    void severityOrderPutsPageCountMismatchFirst() {
        assertThat(PageStatus.worstOf(List.of(PageStatus.MISSING_BASELINE, PageStatus.PAGE_COUNT_MISMATCH,
                PageStatus.ERROR, PageStatus.FAIL))).isEqualTo(PageStatus.PAGE_COUNT_MISMATCH);
        assertThat(PageStatus.worst(PageStatus.ERROR, PageStatus.MISSING_BASELINE)).isEqualTo(PageStatus.MISSING_BASELINE);
        assertThat(PageStatus.worst(PageStatus.FAIL, PageStatus.ERROR)).isEqualTo(PageStatus.ERROR);
        assertThat(PageStatus.worstOf(List.of())).isEqualTo(PageStatus.PASS);
    }

    @Test
    void overallSimilarityAveragesScoredPagesOnly() {
        DocumentResult result = new DocumentResult("doc", List.of(
                scored(1, 1.0, PageStatus.PASS),
                scored(2, 0.9, PageStatus.FAIL),
                unscored(3, PageStatus.PAGE_COUNT_MISMATCH)), 2, 3);

        assertThat(result.getOverallSimilarityPercent()).isCloseTo(95.0, within(1e-9));
        assertThat(result.isPageCountMismatch()).isTrue();
    }

    @Test
    void renderFailureIsAnErrorWithoutPages() {
        DocumentResult result = DocumentResult.renderFailed("doc", 2, "broken");

        assertThat(result.getPages()).isEmpty();
        assertThat(result.getStatus()).isEqualTo(PageStatus.ERROR);
        assertThat(result.getErrorMessage()).isEqualTo("broken");
        assertThat(result.isPageCountMismatch()).isFalse();
    }

    @Test
    void unscoredRejectsStatusesThatNeedAScore() {
        assertThatThrownBy(() -> PageResult.unscored(PageKey.of("doc", 1), PageStatus.FAIL, 95.0, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runReplacesOnePageInPlace() {
        RunResult run = new RunResult(List.of(new DocumentResult("doc", List.of(
                scored(1, 0.5, PageStatus.FAIL), scored(2, 1.0, PageStatus.PASS)), 2, 2)), 95.0);

        run.replacePage(scored(1, 1.0, PageStatus.PASS));

        assertThat(run.findPage(PageKey.of("doc", 1))).get()
                .extracting(PageResult::getStatus).isEqualTo(PageStatus.PASS);
        assertThat(run.isPassed()).isTrue();
        assertThat(run.getPassedDocumentCount()).isEqualTo(1);
    }

    @Test
    void replacingAnUnknownPageFails() {
        RunResult run = new RunResult(List.of(new DocumentResult("doc", List.of(
                scored(1, 1.0, PageStatus.PASS)), 1, 1)), 95.0);

        assertThatThrownBy(() -> run.replacePage(scored(5, 1.0, PageStatus.PASS)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> run.replacePage(PageResult.unscored(PageKey.of("other", 1),
                PageStatus.ERROR, 95.0, "x")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
