package partitions.scheme;

import partitions.Group;
import partitions.UserPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SchemeRegistry")
class SchemeRegistryTest {

    static class NamedScheme extends AbstractUserPartitionScheme {
        NamedScheme(SchemeExtension extension) {
            super(extension);
        }

        @Override
        public Group getGroupForUser(UserPartition partition) {
            return null;
        }
    }

    private SchemeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SchemeRegistry();
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("should list registered names sorted")
        void shouldListRegisteredNamesSorted() {
            registry.register("random", NamedScheme::new).register("cohort", NamedScheme::new);

            assertThat(registry.names()).containsExactly("cohort", "random");
            assertThat(registry.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject duplicate name")
        void shouldRejectDuplicateName() {
            registry.register("random", NamedScheme::new);

            assertThatThrownBy(() -> registry.register("random", NamedScheme::new))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Multiple schemes registered as 'random'");
        }

        @Test
        @DisplayName("should reject null name")
        void shouldRejectNullName() {
            assertThatThrownBy(() -> registry.register(null, NamedScheme::new))
                    .isInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("lookup")
    class Lookup {

        @Test
        @DisplayName("should find registered extension")
        void shouldFindRegisteredExtension() {
            registry.register("random", NamedScheme::new);

            assertThat(registry.lookup("random"))
                    .hasValueSatisfying(ext -> assertThat(ext.name()).isEqualTo("random"));
        }

        @Test
        @DisplayName("should return empty for unknown or null name")
        void shouldReturnEmptyForUnknownName() {
            assertThat(registry.lookup("missing")).isEmpty();
            assertThat(registry.lookup(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("SchemeExtension")
    class Extension {

        @Test
        @DisplayName("should pass itself to the factory")
        void shouldPassItselfToFactory() {
            SchemeExtension extension = new SchemeExtension("random", NamedScheme::new);

            UserPartitionScheme scheme = extension.instantiate();

            assertThat(scheme).isInstanceOf(NamedScheme.class);
            assertThat(((NamedScheme) scheme).extension()).isSameAs(extension);
            assertThat(scheme.name()).isEqualTo("random");
            assertThat(scheme.isDynamic()).isFalse();
        }

        @Test
        @DisplayName("should build a new instance on each call")
        void shouldBuildNewInstanceOnEachCall() {
            SchemeExtension extension = new SchemeExtension("random", NamedScheme::new);

            assertThat(extension.instantiate()).isNotSameAs(extension.instantiate());
        }

        @Test
        @DisplayName("should reject factory returning null")
        void shouldRejectFactoryReturningNull() {
            SchemeExtension extension = new SchemeExtension("broken", ext -> null);

            assertThatThrownBy(extension::instantiate)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("'broken' returned null");
        }

        @Test
        @DisplayName("should have null name without extension")
        void shouldHaveNullNameWithoutExtension() {
            assertThat(new NamedScheme(null).name()).isNull();
        }
    }
}
