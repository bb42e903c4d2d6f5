package guraa.pdfbaseline.cli;

/**
 * Process exit codes.
 */
public final class ExitCodes {

    /** Every document passed. */
    public static final int PASSED = 0;

    /** At least one document did not pass, or a document could not be processed. */
    public static final int NOT_PASSED = 1;

    /** Invalid configuration or arguments; nothing was compared. */
    public static final int CONFIG_ERROR = 2;

    private ExitCodes() {
    }
}
