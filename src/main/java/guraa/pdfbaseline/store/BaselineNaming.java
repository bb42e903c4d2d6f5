package guraa.pdfbaseline.store;

import guraa.pdfbaseline.model.PageKey;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Baseline files are named {@code {document_stem}_page_{n}.png}.
 */
public final class BaselineNaming {

    public static final String EXTENSION = ".png";

    // Greedy stem so a stem that itself contains "_page_" still parses on the last marker
    private static final Pattern FILE_NAME = Pattern.compile("^(.+)_page_(\\d+)\\.png$");

    private BaselineNaming() {
    }

    public static String fileName(PageKey key) {
        return key.getDocumentStem() + "_page_" + key.getPageNumber() + EXTENSION;
    }

    /**
     * Name of the diff overlay written next to the reports for a page.
     */
    public static String diffFileName(PageKey key) {
        return key.getDocumentStem() + "_page_" + key.getPageNumber() + "_diff" + EXTENSION;
    }

    /**
     * Parse a baseline file name back into its key.
     *
     * @return The key, or empty if the name does not follow the convention
     */
    public static Optional<PageKey> parse(String fileName) {
        Matcher matcher = FILE_NAME.matcher(fileName);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            int page = Integer.parseInt(matcher.group(2));
            return page >= 1 ? Optional.of(PageKey.of(matcher.group(1), page)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
