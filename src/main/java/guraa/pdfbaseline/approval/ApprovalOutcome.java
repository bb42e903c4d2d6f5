package guraa.pdfbaseline.approval;

import guraa.pdfbaseline.model.PageKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Final review state of every queued page, in queue order.
 */
public class ApprovalOutcome {

    private final Map<PageKey, ReviewState> states;
    private final Map<PageKey, String> writeFailures;
    private final boolean aborted;

    ApprovalOutcome(Map<PageKey, ReviewState> states, Map<PageKey, String> writeFailures, boolean aborted) {
        this.states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        this.writeFailures = Collections.unmodifiableMap(new LinkedHashMap<>(writeFailures));
        this.aborted = aborted;
    }

    public Map<PageKey, ReviewState> getStates() {
        return states;
    }

    public ReviewState stateOf(PageKey key) {
        return states.get(key);
    }

    /**
     * Pages whose accepted baseline could not be stored, with the reason.
     */
    public Map<PageKey, String> getWriteFailures() {
        return writeFailures;
    }

    public boolean isAborted() {
        return aborted;
    }

    public List<PageKey> pagesIn(ReviewState state) {
        return states.entrySet().stream()
                .filter(entry -> entry.getValue() == state)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public int count(ReviewState state) {
        return pagesIn(state).size();
    }

    @Override
    public String toString() {
        return "ApprovalOutcome{accepted=" + count(ReviewState.ACCEPTED)
                + ", rejected=" + count(ReviewState.REJECTED)
                + ", skipped=" + count(ReviewState.SKIPPED)
                + ", aborted=" + aborted + "}";
    }
}
