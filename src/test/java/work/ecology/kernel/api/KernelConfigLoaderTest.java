package work.ecology.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KernelConfigLoaderTest {

    @Test
    void bundledDefaultsMatchBuilderDefaults() {
        assertEquals(KernelConfiguration.defaults(), KernelConfigLoader.load());
        var defaults = KernelConfiguration.defaults();
        assertEquals(Duration.ofSeconds(5), defaults.executorTimeout());
        assertEquals(List.of("math", "json", "random", "datetime"), defaults.preloadedModules());
        assertEquals(2, defaults.invokeComputeCost());
        assertEquals(1000, defaults.computeQuota());
    }

    @Test
    void overrideFileReplacesOnlyGivenKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("kernel.toml");
        Files.writeString(file, """
            [executor]
            timeout = "750ms"
            preloaded_modules = ["math"]

            [costs]
            rate_output = 4
            """);

        var config = KernelConfigLoader.load(file);

        assertEquals(Duration.ofMillis(750), config.executorTimeout());
        assertEquals(List.of("math"), config.preloadedModules());
        assertEquals(4.0, config.rateOutput());
        assertEquals(1.0, config.rateInput());
        assertEquals(2, config.invokeComputeCost());
    }

    @Test
    void integerTimeoutIsMilliseconds() {
        assertEquals(Duration.ofMillis(1200), KernelConfigLoader.fromToml("[executor]\ntimeout = 1200\n").executorTimeout());
    }

    @Test
    void missingOverrideFileIsReported(@TempDir Path dir) {
        var ex = assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.load(dir.resolve("absent.toml")));
        assertTrue(ex.getMessage().startsWith("Config file not found: "));
    }

    @Test
    void invalidValuesAreRejected() {
        var syntax = assertThrows(IllegalArgumentException.class, () -> KernelConfigLoader.fromToml("[executor\n"));
        assertTrue(syntax.getMessage().startsWith("Invalid TOML in <inline>"));

        assertThrows(IllegalArgumentException.class,
            () -> KernelConfigLoader.fromToml("[executor]\npreloaded_modules = [\"os\"]\n"));
        assertThrows(IllegalArgumentException.class,
            () -> KernelConfigLoader.fromToml("[costs]\ncompute_quota = \"lots\"\n"));
        assertThrows(IllegalArgumentException.class,
            () -> KernelConfigLoader.fromToml("[executor]\ntimeout = \"0s\"\n"));
        assertThrows(IllegalArgumentException.class,
            () -> KernelConfigLoader.fromToml("[costs]\nrate_input = -1.0\n"));
    }

    @Test
    void toBuilderRoundTrips() {
        var config = KernelConfiguration.defaults().toBuilder().computeQuota(50).build();
        assertEquals(50, config.computeQuota());
        assertEquals(config, config.toBuilder().build());
    }
}
