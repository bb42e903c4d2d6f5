package guraa.pdfbaseline.report;

import guraa.pdfbaseline.config.ConfigException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Report formats selectable on the command line.
 */
public enum ReportFormat {
    JSON("comparison_results.json"),
    TEXT("comparison_results.txt"),
    HTML("comparison_results.html"),
    ALL(null);

    private final String fileName;

    ReportFormat(String fileName) {
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Concrete formats this selection produces.
     */
    public Set<ReportFormat> expand() {
        return this == ALL ? EnumSet.of(JSON, TEXT, HTML) : EnumSet.of(this);
    }

    public static ReportFormat parse(String value) {
        if (value != null) {
            for (ReportFormat format : values()) {
                if (format.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return format;
                }
            }
        }
        throw new ConfigException("Unknown report format: " + value + " (expected json, text, html or all)");
    }
}
