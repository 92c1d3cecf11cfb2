package partitions.scheme;

import java.util.Objects;

/**
 * A named entry in the {@link SchemeRegistry}.
 *
 * <p>The factory receives the extension itself, so the built scheme can
 * derive its name (and any other registration context) from it.
 *
 * @see SchemeRegistry#register(String, Factory)
 */
public final class SchemeExtension {

    /**
     * Builds a scheme from its registry entry.
     */
    @FunctionalInterface
    public interface Factory {
        UserPartitionScheme create(SchemeExtension extension);
    }

    private final String name;
    private final Factory factory;

    /**
     * @param name the scheme name
     * @param factory the factory building the scheme
     */
    public SchemeExtension(String name, Factory factory) {
        this.name = Objects.requireNonNull(name, "name");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /** Returns the scheme name. */
    public String name() { return name; }

    /** Returns the factory. */
    public Factory factory() { return factory; }

    /**
     * Builds a new scheme instance, passing this extension to the factory.
     *
     * @return the new scheme
     * @throws IllegalStateException if the factory returns null
     */
    public UserPartitionScheme instantiate() {
        UserPartitionScheme scheme = factory.create(this);
        if (scheme == null) {
            throw new IllegalStateException("Scheme factory for '" + name + "' returned null");
        }
        return scheme;
    }

    @Override
    public String toString() {
        return "SchemeExtension{name='" + name + "'}";
    }
}
