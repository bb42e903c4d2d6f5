package guraa.pdfbaseline.approval;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PageResult;
import guraa.pdfbaseline.model.PixelGrid;
import guraa.pdfbaseline.model.RunResult;
import guraa.pdfbaseline.render.CandidatePageIndex;
import guraa.pdfbaseline.service.ComparisonEngine;
import guraa.pdfbaseline.store.BaselineStore;
import guraa.pdfbaseline.store.BaselineWriteHandle;
import guraa.pdfbaseline.store.StoreWriteException;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Sequential review of every non-PASS page of a run.
 * <p>
 * Pages are presented in run order (document order, then page order). Accepting a page
 * writes its candidate raster into the baseline store under an exclusive write handle,
 * re-compares the page and replaces its record in the run. Rejecting or skipping changes
 * nothing. Aborting leaves every undecided page as it was and reports it as SKIPPED.
 * Must be called on a single thread after all scoring for the run has finished.
 */
@Slf4j
public class ApprovalWorkflow {

    private final ComparisonEngine engine;

    public ApprovalWorkflow(ComparisonEngine engine) {
        this.engine = engine;
    }

    /**
     * Pages that can be reviewed: non-PASS pages that have a candidate raster. Pages present
     * only in the baseline cannot be accepted, since that would need a deletion.
     */
    public List<PageResult> reviewQueue(RunResult run, CandidatePageIndex candidates) {
        return run.allPages().stream()
                .filter(page -> !page.isPassed())
                .filter(page -> candidates.contains(page.getKey()))
                .collect(Collectors.toList());
    }

    /**
     * Run the review loop.
     *
     * @param run        Results to review; accepted pages are replaced in place
     * @param candidates Candidate rasters of the run
     * @param store      Baseline store to promote accepted pages into
     * @param decisions  Source of operator decisions
     * @return Final state of every queued page
     */
    public ApprovalOutcome review(RunResult run, CandidatePageIndex candidates,
                                  BaselineStore store, DecisionSource decisions) {
        List<PageResult> queue = reviewQueue(run, candidates);
        Map<PageKey, ReviewState> states = new LinkedHashMap<>();
        Map<PageKey, String> writeFailures = new LinkedHashMap<>();
        queue.forEach(page -> states.put(page.getKey(), ReviewState.PENDING));

        log.info("Reviewing {} page(s) that did not pass", queue.size());
        boolean aborted = false;

        for (int i = 0; i < queue.size(); i++) {
            PageResult page = queue.get(i);
            ReviewItem item = new ReviewItem(i + 1, queue.size(), page);
            ReviewDecision decision = decisions.decide(item);

            if (decision == null || decision == ReviewDecision.ABORT) {
                log.info("Review aborted at page {} ({} of {})", page.getKey(), i + 1, queue.size());
                aborted = true;
                break;
            }

            switch (decision) {
                case ACCEPT:
                    try {
                        accept(run, page, candidates, store);
                        states.put(page.getKey(), ReviewState.ACCEPTED);
                        decisions.accepted(new ReviewItem(i + 1, queue.size(),
                                run.findPage(page.getKey()).orElse(page)));
                    } catch (StoreWriteException e) {
                        log.error("Could not store baseline for {}: {}", page.getKey(), e.getMessage(), e);
                        writeFailures.put(page.getKey(), e.getMessage());
                        decisions.writeFailed(item, e);
                    }
                    break;
                case REJECT:
                    log.info("Rejected change to {}", page.getKey());
                    states.put(page.getKey(), ReviewState.REJECTED);
                    break;
                case SKIP:
                default:
                    log.info("Skipped {}", page.getKey());
                    states.put(page.getKey(), ReviewState.SKIPPED);
                    break;
            }
        }

        // Undecided pages, including failed writes, are reported as skipped
        states.replaceAll((key, state) -> state == ReviewState.PENDING ? ReviewState.SKIPPED : state);

        ApprovalOutcome outcome = new ApprovalOutcome(states, writeFailures, aborted);
        log.info("Review finished: {}", outcome);
        return outcome;
    }

    /**
     * Promote the candidate to baseline and re-compare the page against it.
     */
    private void accept(RunResult run, PageResult page, CandidatePageIndex candidates, BaselineStore store)
            throws StoreWriteException {
        PageKey key = page.getKey();
        PixelGrid candidate = candidates.get(key)
                .orElseThrow(() -> new IllegalStateException("No candidate raster for " + key));

        try (BaselineWriteHandle handle = store.openForWrite()) {
            handle.write(key, candidate);
        }

        PageResult updated = engine.comparePage(key, candidate, store, page.getThresholdUsed());
        run.replacePage(updated);
        log.info("Accepted {}: baseline updated, now {}", key, updated.getStatus());
    }
}
