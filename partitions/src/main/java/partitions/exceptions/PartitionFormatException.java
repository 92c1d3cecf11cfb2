package partitions.exceptions;

/**
 * Exception thrown when a group, partition or scheme reference is invalid.
 *
 * <p>This is the single validation error raised by the partitions library.
 * It is thrown when:
 * <ul>
 *   <li>A serialized group or partition is missing a required key</li>
 *   <li>A serialized group or partition carries an unsupported version</li>
 *   <li>A scheme name is not known to the scheme registry</li>
 *   <li>An id cannot be coerced to an integer</li>
 *   <li>JSON text cannot be parsed</li>
 * </ul>
 *
 * <p>Errors are never recovered inside the library. Deserialization either
 * returns a fully built value or throws this exception.
 *
 * @see partitions.Group#fromJson(Object)
 * @see partitions.UserPartition#fromJson(Object)
 */
public class PartitionFormatException extends RuntimeException {

    /**
     * Creates a new exception with the specified message.
     *
     * @param message a description of the invalid input
     */
    public PartitionFormatException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the specified message and cause.
     *
     * @param message a description of the invalid input
     * @param cause the underlying failure (e.g., NumberFormatException, JSON parse error)
     */
    public PartitionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
