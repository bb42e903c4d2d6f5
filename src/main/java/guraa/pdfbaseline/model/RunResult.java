package guraa.pdfbaseline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Document results of one comparison run, in caller-supplied document order.
 * The only permitted change after construction is {@link #replacePage(PageResult)},
 * used when an approved page is re-compared against its new baseline.
 */
public class RunResult {

    private final List<DocumentResult> documents;
    private final double threshold;

    public RunResult(List<DocumentResult> documents, double threshold) {
        this.documents = Collections.unmodifiableList(new ArrayList<>(documents));
        this.threshold = threshold;
    }

    public List<DocumentResult> getDocuments() {
        return documents;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * All pages in document order, then page order.
     */
    public List<PageResult> allPages() {
        return documents.stream()
                .flatMap(doc -> doc.getPages().stream())
                .collect(Collectors.toList());
    }

    public Optional<PageResult> findPage(PageKey key) {
        return findDocument(key.getDocumentStem())
                .flatMap(doc -> doc.getPages().stream()
                        .filter(page -> page.getKey().equals(key))
                        .findFirst());
    }

    public Optional<DocumentResult> findDocument(String documentStem) {
        return documents.stream()
                .filter(doc -> doc.getDocumentStem().equals(documentStem))
                .findFirst();
    }

    /**
     * Replace the record of one page in place.
     *
     * @param updated The new result; its key must already be present
     */
    public void replacePage(PageResult updated) {
        DocumentResult document = findDocument(updated.getKey().getDocumentStem())
                .orElseThrow(() -> new IllegalArgumentException("Unknown document: "
                        + updated.getKey().getDocumentStem()));
        document.replacePage(updated);
    }

    /**
     * Worst status across every document; drives the process exit status.
     */
    public PageStatus getStatus() {
        return PageStatus.worstOf(documents.stream().map(DocumentResult::getStatus).collect(Collectors.toList()));
    }

    public long getPassedDocumentCount() {
        return documents.stream().filter(DocumentResult::isPassed).count();
    }

    public boolean isPassed() {
        return getStatus() == PageStatus.PASS;
    }
}
