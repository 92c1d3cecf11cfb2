package partitions.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PartitionsConfigTest {

    @Test
    void defaults() {
        PartitionsConfig c = PartitionsConfig.DEFAULTS;

        assertEquals(List.of("partitions.schemes"), c.schemePackages());
        assertTrue(c.isSchemeScanEnabled());
    }

    @Test
    void commaSeparatedPackagesAreTrimmed() {
        PartitionsConfig c = PartitionsConfig.builder()
                .schemePackages(" com.example.a , com.example.b ,")
                .build();

        assertEquals(List.of("com.example.a", "com.example.b"), c.schemePackages());
    }

    @Test
    void emptyPackagesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> PartitionsConfig.builder().schemePackages(" , "));
    }

    @Test
    void toStringShowsFields() {
        String s = PartitionsConfig.builder().schemeScanEnabled(false).build().toString();

        assertTrue(s.contains("schemeScanEnabled=false"));
        assertTrue(s.contains("partitions.schemes"));
    }
}
