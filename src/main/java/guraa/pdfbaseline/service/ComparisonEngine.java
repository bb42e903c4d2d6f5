package guraa.pdfbaseline.service;

import guraa.pdfbaseline.model.DocumentResult;
import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PageResult;
import guraa.pdfbaseline.model.PageStatus;
import guraa.pdfbaseline.model.PixelGrid;
import guraa.pdfbaseline.model.RunParameters;
import guraa.pdfbaseline.model.RunResult;
import guraa.pdfbaseline.render.CandidateDocument;
import guraa.pdfbaseline.render.RenderException;
import guraa.pdfbaseline.store.BaselineReadException;
import guraa.pdfbaseline.store.BaselineStore;
import guraa.pdfbaseline.visual.DiffOverlayBuilder;
import guraa.pdfbaseline.visual.ScoreResult;
import guraa.pdfbaseline.visual.ShapeMismatchException;
import guraa.pdfbaseline.visual.SimilarityScorer;
import lombok.extern.slf4j.Slf4j;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Compares candidate documents page by page against the baseline store and classifies every
 * page as PASS, FAIL, ERROR, MISSING_BASELINE or PAGE_COUNT_MISMATCH.
 * <p>
 * Pages of a document are scored concurrently on the comparison executor; results are
 * assembled by page number, so completion order does not matter. The engine never writes
 * to the store or the file system.
 */
@Slf4j
public class ComparisonEngine {

    private final SimilarityScorer scorer;
    private final DiffOverlayBuilder overlayBuilder;
    private final Color highlightColor;
    private final Executor executor;

    public ComparisonEngine(SimilarityScorer scorer, DiffOverlayBuilder overlayBuilder,
                            Color highlightColor, Executor executor) {
        this.scorer = scorer;
        this.overlayBuilder = overlayBuilder;
        this.highlightColor = highlightColor;
        this.executor = executor;
    }

    /**
     * Compare every document, in the given order.
     *
     * @param documents Candidate documents
     * @param store     Baselines to compare against
     * @param params    Run parameters, validated before any work starts
     * @return A fresh run result
     * @throws guraa.pdfbaseline.config.ConfigException if the parameters are invalid
     */
    public RunResult compare(List<? extends CandidateDocument> documents, BaselineStore store, RunParameters params) {
        params.validate();
        double threshold = params.getThreshold();

        log.info("Comparing {} document(s) at threshold {}%", documents.size(), threshold);
        List<DocumentResult> results = new ArrayList<>();
        for (CandidateDocument document : documents) {
            results.add(compareDocument(document, store, threshold));
        }
        return new RunResult(results, threshold);
    }

    /**
     * Compare one document. A render failure is recorded on the document and does not
     * propagate.
     */
    public DocumentResult compareDocument(CandidateDocument document, BaselineStore store, double threshold) {
        String stem = document.getStem();
        SortedSet<Integer> baselinePages = store.pageNumbers(stem);
        int baselineCount = baselinePages.size();

        List<PixelGrid> candidatePages;
        try {
            candidatePages = document.getPages();
        } catch (RenderException e) {
            log.error("Failed to render {}: {}", stem, e.getMessage());
            return DocumentResult.renderFailed(stem, baselineCount, e.getMessage());
        }

        int candidateCount = candidatePages.size();
        boolean noBaseline = baselinePages.isEmpty();
        boolean countMismatch = !noBaseline && candidateCount != baselineCount;
        int shorter = Math.min(candidateCount, baselineCount);
        int lastPage = noBaseline ? candidateCount : Math.max(candidateCount, baselinePages.last());

        if (noBaseline) {
            log.warn("No baseline found for {}", stem);
        } else if (countMismatch) {
            log.warn("Page count changed for {}: baseline={} candidate={}", stem, baselineCount, candidateCount);
        }

        List<CompletableFuture<PageResult>> tasks = new ArrayList<>();
        for (int page = 1; page <= lastPage; page++) {
            PageKey key = PageKey.of(stem, page);

            if (noBaseline) {
                tasks.add(CompletableFuture.completedFuture(PageResult.unscored(key, PageStatus.MISSING_BASELINE,
                        threshold, "No baseline for " + stem)));
            } else if (page > candidateCount || (countMismatch && page > shorter)) {
                tasks.add(CompletableFuture.completedFuture(PageResult.unscored(key, PageStatus.PAGE_COUNT_MISMATCH,
                        threshold, "Page count mismatch: baseline=" + baselineCount + " candidate=" + candidateCount)));
            } else {
                PixelGrid candidate = candidatePages.get(page - 1);
                tasks.add(CompletableFuture.supplyAsync(() -> comparePage(key, candidate, store, threshold), executor));
            }
        }

        List<PageResult> pages = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            pages.add(await(tasks.get(i), PageKey.of(stem, i + 1), threshold));
        }

        DocumentResult result = new DocumentResult(stem, pages, candidateCount, baselineCount);
        log.info("{}: {} ({} page(s))", stem, result.getStatus(), pages.size());
        return result;
    }

    /**
     * Compare one candidate page against whatever the store currently holds for its key.
     * Used for the initial run and for re-comparison after an approval.
     */
    public PageResult comparePage(PageKey key, PixelGrid candidate, BaselineStore store, double threshold) {
        Optional<PixelGrid> baseline;
        try {
            baseline = store.load(key);
        } catch (BaselineReadException e) {
            log.warn("Page {}: {}", key, e.getMessage());
            return PageResult.unscored(key, PageStatus.ERROR, threshold, e.getMessage());
        }

        if (baseline.isEmpty()) {
            return PageResult.unscored(key, PageStatus.MISSING_BASELINE, threshold, "No baseline for page " + key);
        }
        return scorePage(key, candidate, baseline.get(), threshold);
    }

    /**
     * Score a page against a given baseline and classify it.
     */
    public PageResult scorePage(PageKey key, PixelGrid candidate, PixelGrid baseline, double threshold) {
        ScoreResult score;
        try {
            score = scorer.score(candidate, baseline);
        } catch (ShapeMismatchException e) {
            log.warn("Page {}: {} (was the DPI changed?)", key, e.getMessage());
            return PageResult.unscored(key, PageStatus.ERROR, threshold, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Page {}: comparison failed: {}", key, e.getMessage(), e);
            return PageResult.unscored(key, PageStatus.ERROR, threshold, "Comparison failed: " + e.getMessage());
        }

        double similarity = score.getSimilarity();
        PageStatus status = ThresholdClassifier.classify(similarity, threshold);

        PixelGrid overlay = null;
        if (status == PageStatus.FAIL) {
            overlay = buildOverlaySafely(key, candidate, baseline, score);
        }

        log.info("Page {}: SSIM {}% - {}", key, String.format("%.2f", similarity * 100.0), status);
        return PageResult.builder()
                .key(key)
                .status(status)
                .similarityScore(similarity)
                .thresholdUsed(threshold)
                .diffImage(overlay)
                .build();
    }

    /**
     * The overlay is advisory: any failure leaves the page without one and its status unchanged.
     */
    private PixelGrid buildOverlaySafely(PageKey key, PixelGrid candidate, PixelGrid baseline, ScoreResult score) {
        try {
            return overlayBuilder.buildOverlay(candidate, baseline, score.getStructuralDiff(), highlightColor);
        } catch (RuntimeException e) {
            log.warn("Page {}: diff overlay not generated: {}", key, e.getMessage());
            return null;
        }
    }

    private PageResult await(CompletableFuture<PageResult> task, PageKey key, double threshold) {
        try {
            return task.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Page {}: comparison task failed: {}", key, cause.getMessage(), cause);
            return PageResult.unscored(key, PageStatus.ERROR, threshold, "Comparison failed: " + cause.getMessage());
        }
    }
}
