package guraa.pdfbaseline.render;

import guraa.pdfbaseline.model.PageKey;
import guraa.pdfbaseline.model.PixelGrid;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Candidate rasters by page key, built from the documents of a run.
 * Documents that fail to render contribute no pages.
 */
@Slf4j
public class CandidatePageIndex {

    private final Map<PageKey, PixelGrid> pages;

    private CandidatePageIndex(Map<PageKey, PixelGrid> pages) {
        this.pages = pages;
    }

    public static CandidatePageIndex of(List<? extends CandidateDocument> documents) {
        Map<PageKey, PixelGrid> pages = new LinkedHashMap<>();
        for (CandidateDocument document : documents) {
            try {
                List<PixelGrid> rendered = document.getPages();
                for (int i = 0; i < rendered.size(); i++) {
                    pages.put(PageKey.of(document.getStem(), i + 1), rendered.get(i));
                }
            } catch (RenderException e) {
                log.debug("No candidate pages for {}: {}", document.getStem(), e.getMessage());
            }
        }
        return new CandidatePageIndex(pages);
    }

    public Optional<PixelGrid> get(PageKey key) {
        return Optional.ofNullable(pages.get(key));
    }

    public boolean contains(PageKey key) {
        return pages.containsKey(key);
    }

    public int size() {
        return pages.size();
    }
}
