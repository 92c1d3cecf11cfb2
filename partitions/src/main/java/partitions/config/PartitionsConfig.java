package partitions.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for scheme discovery.
 *
 * <p>Loaded from {@code partitions.properties} or {@code partitions.yml} by
 * {@link PartitionsConfigLoader}.
 *
 * @see PartitionsConfigLoader
 * @see partitions.scheme.SchemeResolver#fromConfig(PartitionsConfig)
 */
public final class PartitionsConfig {

    /** Package scanned for schemes when none is configured. */
    public static final String DEFAULT_SCHEME_PACKAGE = "partitions.schemes";

    public static final PartitionsConfig DEFAULTS = builder().build();

    private final List<String> schemePackages;
    private final boolean schemeScanEnabled;

    private PartitionsConfig(Builder b) {
        this.schemePackages = List.copyOf(b.schemePackages);
        this.schemeScanEnabled = b.schemeScanEnabled;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the packages scanned for {@code @PartitionScheme} classes. */
    public List<String> schemePackages() { return schemePackages; }

    /** Returns true if schemes are discovered by classpath scanning. */
    public boolean isSchemeScanEnabled() { return schemeScanEnabled; }

    @Override
    public String toString() {
        return "PartitionsConfig{" +
                "schemePackages=" + schemePackages +
                ", schemeScanEnabled=" + schemeScanEnabled +
                '}';
    }

    /**
     * Builder for constructing {@link PartitionsConfig} instances.
     */
    public static final class Builder {
        private List<String> schemePackages = List.of(DEFAULT_SCHEME_PACKAGE);
        private boolean schemeScanEnabled = true;

        public Builder schemePackages(List<String> packages) {
            List<String> cleaned = new ArrayList<>();
            for (String pkg : packages) {
                String trimmed = pkg.trim();
                if (!trimmed.isEmpty()) {
                    cleaned.add(trimmed);
                }
            }
            if (cleaned.isEmpty()) throw new IllegalArgumentException("schemePackages must not be empty");
            this.schemePackages = cleaned;
            return this;
        }

        public Builder schemePackages(String commaSeparated) {
            return schemePackages(List.of(commaSeparated.split(",")));
        }

        public Builder schemeScanEnabled(boolean enabled) {
            this.schemeScanEnabled = enabled;
            return this;
        }

        public PartitionsConfig build() {
            return new PartitionsConfig(this);
        }
    }
}
