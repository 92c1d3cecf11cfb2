package partitions.scheme;

import partitions.config.PartitionsConfig;
import partitions.config.PartitionsConfigLoader;
import partitions.exceptions.PartitionFormatException;
import partitions.scanner.SchemeScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves scheme names to scheme instances, building each one at most once.
 *
 * <p>Instances are memoized by name for the lifetime of the resolver. There
 * is no invalidation: the process-wide resolver returned by {@link #global()}
 * keeps its instances until the process exits.
 *
 * <p>The global resolver is initialized on first use from
 * {@link PartitionsConfigLoader#load()}: when scanning is enabled its registry
 * holds every {@code @PartitionScheme} class found in the configured packages.
 *
 * @see SchemeRegistry
 * @see partitions.UserPartition#getScheme(String)
 */
public final class SchemeResolver {

    private static final Logger log = LoggerFactory.getLogger(SchemeResolver.class);

    private static volatile SchemeResolver global;

    private final SchemeRegistry registry;
    private final Map<String, UserPartitionScheme> schemes = new ConcurrentHashMap<>();
    private final Object buildLock = new Object();

    /**
     * @param registry the registry to resolve names against
     */
    public SchemeResolver(SchemeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Returns the process-wide resolver, creating it on first call.
     *
     * @return the global resolver
     * @throws partitions.config.PartitionsConfigException if configuration cannot be read
     * @throws IllegalStateException if scheme discovery finds an invalid scheme class
     */
    public static SchemeResolver global() {
        SchemeResolver resolver = global;
        if (resolver == null) {
            synchronized (SchemeResolver.class) {
                resolver = global;
                if (resolver == null) {
                    resolver = fromConfig(PartitionsConfigLoader.load());
                    global = resolver;
                }
            }
        }
        return resolver;
    }

    /**
     * Creates a resolver whose registry is populated according to the given configuration.
     *
     * @param config the partitions configuration
     * @return a new resolver
     */
    public static SchemeResolver fromConfig(PartitionsConfig config) {
        SchemeRegistry registry = config.isSchemeScanEnabled()
                ? SchemeScanner.scan(config.schemePackages(), Thread.currentThread().getContextClassLoader())
                : new SchemeRegistry();
        log.info("Scheme registry initialized with {}", registry.names());
        return new SchemeResolver(registry);
    }

    /** Returns the registry backing this resolver. */
    public SchemeRegistry registry() { return registry; }

    /**
     * Returns the scheme registered under the given name.
     *
     * <p>The first call for a name builds the scheme through its extension's
     * factory. Later calls return the same instance. A factory may resolve
     * other schemes of this resolver while it runs.
     *
     * @param name the scheme name
     * @return the scheme instance
     * @throws PartitionFormatException if no scheme is registered under the name
     */
    public UserPartitionScheme resolve(String name) {
        if (name == null) {
            throw unrecognized(null);
        }
        UserPartitionScheme scheme = schemes.get(name);
        if (scheme != null) {
            return scheme;
        }
        // Reentrant: a factory resolving another name re-enters on the same thread.
        synchronized (buildLock) {
            scheme = schemes.get(name);
            if (scheme == null) {
                scheme = create(name);
                schemes.put(name, scheme);
            }
            return scheme;
        }
    }

    /**
     * Returns true if an instance for the given name has already been built.
     */
    public boolean isCached(String name) {
        return name != null && schemes.containsKey(name);
    }

    private UserPartitionScheme create(String name) {
        SchemeExtension extension = registry.lookup(name)
                .orElseThrow(() -> unrecognized(name));
        UserPartitionScheme scheme = extension.instantiate();
        log.debug("Instantiated scheme '{}' as {}", name, scheme.getClass().getName());
        return scheme;
    }

    private static PartitionFormatException unrecognized(String name) {
        return new PartitionFormatException("Unrecognized scheme " + name);
    }
}
