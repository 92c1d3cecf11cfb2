package partitions.annotations;

import java.lang.annotation.*;

/**
 * Marks a class as a discoverable partition scheme.
 *
 * <p>The annotated class must implement {@link partitions.scheme.UserPartitionScheme}
 * and declare either a constructor taking a {@link partitions.scheme.SchemeExtension}
 * or a no-arg constructor. Scheme names must be unique across the scanned packages.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}PartitionScheme("cohort")
 * public class CohortScheme extends AbstractUserPartitionScheme {
 *     public CohortScheme(SchemeExtension extension) {
 *         super(extension);
 *     }
 *     ...
 * }
 * </pre>
 *
 * @see partitions.scanner.SchemeScanner
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface PartitionScheme {

    /** The scheme name partitions refer to. */
    String value();
}
