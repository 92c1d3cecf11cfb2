package partitions.scheme;

/**
 * Base class for schemes built from a {@link SchemeExtension}.
 *
 * <p>The scheme name is taken from the extension, so a scheme registered as
 * {@code "cohort"} reports {@code "cohort"} as its name.
 */
public abstract class AbstractUserPartitionScheme implements UserPartitionScheme {

    private final SchemeExtension extension;

    /**
     * @param extension the registry entry this scheme is built from, or null
     */
    protected AbstractUserPartitionScheme(SchemeExtension extension) {
        this.extension = extension;
    }

    /** Returns the registry entry this scheme was built from, or null. */
    public SchemeExtension extension() { return extension; }

    @Override
    public String name() {
        return extension != null ? extension.name() : null;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name() + ", dynamic=" + isDynamic() + '}';
    }
}
