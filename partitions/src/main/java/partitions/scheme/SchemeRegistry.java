package partitions.scheme;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registration table mapping scheme names to {@link SchemeExtension}s.
 *
 * <p>Populated at process start, either programmatically or by
 * {@link partitions.scanner.SchemeScanner}. Lookups return an empty
 * {@link Optional} for unknown names.
 *
 * <h2>Usage:</h2>
 * <pre>
 * SchemeRegistry registry = new SchemeRegistry()
 *         .register("random", RandomScheme::new)
 *         .register("cohort", CohortScheme::new);
 * </pre>
 *
 * @see SchemeResolver
 */
public final class SchemeRegistry {

    private final Map<String, SchemeExtension> extensions = new ConcurrentHashMap<>();

    /**
     * Registers a scheme factory under the given name.
     *
     * @param name the scheme name
     * @param factory builds the scheme from its extension
     * @return this registry
     * @throws IllegalStateException if the name is already registered
     */
    public SchemeRegistry register(String name, SchemeExtension.Factory factory) {
        return register(new SchemeExtension(name, factory));
    }

    /**
     * Registers an extension.
     *
     * @param extension the extension to add
     * @return this registry
     * @throws IllegalStateException if an extension with the same name is already registered
     */
    public SchemeRegistry register(SchemeExtension extension) {
        SchemeExtension existing = extensions.putIfAbsent(extension.name(), extension);
        if (existing != null) {
            throw new IllegalStateException(
                    "Multiple schemes registered as '" + extension.name() + "'");
        }
        return this;
    }

    /**
     * Looks up the extension registered under the given name.
     *
     * @param name the scheme name
     * @return the extension, or empty if none is registered
     */
    public Optional<SchemeExtension> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(extensions.get(name));
    }

    /** Returns the registered scheme names, sorted. */
    public List<String> names() {
        return extensions.keySet().stream().sorted().collect(Collectors.toList());
    }

    /** Returns the number of registered schemes. */
    public int size() {
        return extensions.size();
    }

    @Override
    public String toString() {
        return "SchemeRegistry" + names();
    }
}
