package partitions.scheme;

import partitions.Group;
import partitions.UserPartition;
import partitions.config.PartitionsConfig;
import partitions.exceptions.PartitionFormatException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SchemeResolver")
class SchemeResolverTest {

    private final AtomicInteger created = new AtomicInteger();
    private SchemeResolver resolver;

    private class CountingScheme extends AbstractUserPartitionScheme {
        CountingScheme(SchemeExtension extension) {
            super(extension);
            created.incrementAndGet();
        }

        @Override
        public Group getGroupForUser(UserPartition partition) {
            return partition.groups().get(0);
        }
    }

    @BeforeEach
    void setUp() {
        resolver = new SchemeResolver(new SchemeRegistry().register("counting", CountingScheme::new));
    }

    @Test
    @DisplayName("should return the identical instance for repeated lookups")
    void shouldReturnIdenticalInstance() {
        UserPartitionScheme first = resolver.resolve("counting");
        UserPartitionScheme second = resolver.resolve("counting");

        assertThat(first).isSameAs(second);
        assertThat(created).hasValue(1);
        assertThat(first.name()).isEqualTo("counting");
    }

    @Test
    @DisplayName("should report cached names")
    void shouldReportCachedNames() {
        assertThat(resolver.isCached("counting")).isFalse();

        resolver.resolve("counting");

        assertThat(resolver.isCached("counting")).isTrue();
        assertThat(resolver.isCached(null)).isFalse();
    }

    @Test
    @DisplayName("should throw for unrecognized scheme and cache nothing")
    void shouldThrowForUnrecognizedScheme() {
        assertThatThrownBy(() -> resolver.resolve("missing"))
                .isInstanceOf(PartitionFormatException.class)
                .hasMessage("Unrecognized scheme missing");
        assertThat(resolver.isCached("missing")).isFalse();
    }

    @Test
    @DisplayName("should throw for null name")
    void shouldThrowForNullName() {
        assertThatThrownBy(() -> resolver.resolve(null))
                .isInstanceOf(PartitionFormatException.class)
                .hasMessage("Unrecognized scheme null");
    }

    @Test
    @DisplayName("should allow a scheme factory to resolve another scheme")
    void shouldAllowFactoryToResolveAnotherScheme() {
        SchemeRegistry registry = new SchemeRegistry().register("counting", CountingScheme::new);
        SchemeResolver nested = new SchemeResolver(registry);
        List<UserPartitionScheme> wrapped = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            registry.register("composite" + i, extension -> {
                wrapped.add(nested.resolve("counting"));
                return new CountingScheme(extension);
            });
        }

        for (int i = 0; i < 64; i++) {
            assertThat(nested.resolve("composite" + i).name()).isEqualTo("composite" + i);
        }

        assertThat(wrapped).hasSize(64).allSatisfy(s -> assertThat(s).isSameAs(nested.resolve("counting")));
        assertThat(created).hasValue(65);
    }

    @Test
    @DisplayName("should build one instance under concurrent lookups")
    void shouldBuildOneInstanceUnderConcurrentLookups() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<UserPartitionScheme>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return resolver.resolve("counting");
                }));
            }
            start.countDown();

            Set<UserPartitionScheme> seen = ConcurrentHashMap.newKeySet();
            for (Future<UserPartitionScheme> f : futures) {
                seen.add(f.get(5, TimeUnit.SECONDS));
            }

            assertThat(seen).hasSize(1);
            assertThat(created).hasValue(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("should build an empty registry when scanning is disabled")
    void shouldBuildEmptyRegistryWhenScanDisabled() {
        SchemeResolver fromConfig = SchemeResolver.fromConfig(
                PartitionsConfig.builder().schemeScanEnabled(false).build());

        assertThat(fromConfig.registry().size()).isZero();
    }

    @Test
    @DisplayName("should discover test schemes in the global resolver")
    void shouldDiscoverTestSchemesInGlobalResolver() {
        assertThat(SchemeResolver.global()).isSameAs(SchemeResolver.global());
        assertThat(SchemeResolver.global().registry().names()).contains("cohort", "random");
    }
}
