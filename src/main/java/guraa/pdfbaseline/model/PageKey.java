package guraa.pdfbaseline.model;

import lombok.Value;

import java.util.Comparator;

/**
 * Identity of a page across the candidate and baseline sides.
 */
@Value
public class PageKey implements Comparable<PageKey> {

    private static final Comparator<PageKey> ORDER = Comparator
            .comparing(PageKey::getDocumentStem)
            .thenComparingInt(PageKey::getPageNumber);

    String documentStem;
    int pageNumber;

    public PageKey(String documentStem, int pageNumber) {
        if (documentStem == null || documentStem.isBlank()) {
            throw new IllegalArgumentException("Document stem must not be blank");
        }
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers are 1-based, got " + pageNumber);
        }
        this.documentStem = documentStem;
        this.pageNumber = pageNumber;
    }

    public static PageKey of(String documentStem, int pageNumber) {
        return new PageKey(documentStem, pageNumber);
    }

    @Override
    public int compareTo(PageKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return documentStem + "_page_" + pageNumber;
    }
}
