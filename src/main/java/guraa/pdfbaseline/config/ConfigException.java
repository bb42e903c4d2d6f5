package guraa.pdfbaseline.config;

/**
 * Invalid run or application configuration. Raised before any comparison starts.
 */
public class ConfigException extends IllegalArgumentException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
