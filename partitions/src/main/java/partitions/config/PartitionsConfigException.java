package partitions.config;

/**
 * Exception thrown when partitions configuration cannot be loaded.
 *
 * <p>Thrown when a configuration file exists but cannot be read or parsed.
 * Invalid individual values are logged and replaced by defaults instead.
 *
 * @see PartitionsConfigLoader
 */
public class PartitionsConfigException extends RuntimeException {

    /**
     * @param message a description of the configuration problem
     */
    public PartitionsConfigException(String message) {
        super(message);
    }

    /**
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public PartitionsConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
