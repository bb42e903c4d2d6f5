package guraa.pdfbaseline.approval;

import guraa.pdfbaseline.model.PageResult;
import guraa.pdfbaseline.store.BaselineNaming;
import guraa.pdfbaseline.store.StoreWriteException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Interactive review on a terminal. End of input counts as quit.
 */
@Slf4j
public class ConsoleDecisionSource implements DecisionSource {

    static final String PROMPT = "Accept as new baseline? [y]es / [n]o / [s]kip / [q]uit: ";

    private final BufferedReader in;
    private final PrintWriter out;
    private final Path diffDirectory;

    /**
     * @param in            Operator answers, one per line
     * @param out           Where pages and prompts are printed
     * @param diffDirectory Directory holding the diff images, or null to not print their paths
     */
    public ConsoleDecisionSource(BufferedReader in, PrintWriter out, Path diffDirectory) {
        this.in = in;
        this.out = out;
        this.diffDirectory = diffDirectory;
    }

    @Override
    public ReviewDecision decide(ReviewItem item) {
        describe(item);

        while (true) {
            out.print(PROMPT);
            out.flush();

            String line;
            try {
                line = in.readLine();
            } catch (IOException e) {
                log.warn("Could not read review input: {}", e.getMessage());
                return ReviewDecision.ABORT;
            }
            if (line == null) {
                out.println();
                return ReviewDecision.ABORT;
            }

            ReviewDecision decision = parse(line);
            if (decision != null) {
                return decision;
            }
            out.println("Please answer y, n, s or q.");
        }
    }

    @Override
    public void writeFailed(ReviewItem item, StoreWriteException error) {
        out.println("  ERROR: could not update baseline for " + item.getKey() + ": " + error.getMessage());
        out.println("  The page was left unchanged.");
        out.flush();
    }

    @Override
    public void accepted(ReviewItem item) {
        PageResult result = item.getResult();
        out.println("  Baseline updated for " + item.getKey() + ", now " + result.getStatus());
        out.flush();
    }

    /**
     * Map an answer to a decision, or null when it is not recognised.
     */
    static ReviewDecision parse(String answer) {
        switch (answer.trim().toLowerCase(Locale.ROOT)) {
            case "y":
            case "yes":
                return ReviewDecision.ACCEPT;
            case "n":
            case "no":
                return ReviewDecision.REJECT;
            case "s":
            case "skip":
                return ReviewDecision.SKIP;
            case "q":
            case "quit":
                return ReviewDecision.ABORT;
            default:
                return null;
        }
    }

    private void describe(ReviewItem item) {
        PageResult result = item.getResult();
        out.println();
        out.println("[" + item.getPosition() + "/" + item.getQueueSize() + "] " + item.getKey()
                + " - " + result.getStatus());
        if (result.hasScore()) {
            out.println(String.format(Locale.ROOT, "  Similarity: %.2f%% (threshold %.2f%%)",
                    result.getSimilarityPercent(), result.getThresholdUsed()));
        }
        if (result.getMessage() != null) {
            out.println("  " + result.getMessage());
        }
        if (result.hasDiffImage() && diffDirectory != null) {
            out.println("  Diff image: " + diffDirectory.resolve(BaselineNaming.diffFileName(item.getKey())));
        }
    }
}
