package work.ecology.kernel.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.ecology.kernel.shared.DurationParser;

/**
 * Loads {@link KernelConfiguration} from TOML: the bundled {@code kernel.toml} first, then an
 * optional override file. Keys missing from a file keep their previous value.
 */
public final class KernelConfigLoader {
    private static final Logger LOG = LoggerFactory.getLogger(KernelConfigLoader.class);
    static final String DEFAULT_RESOURCE = "/kernel.toml";

    private KernelConfigLoader() {}

    public static KernelConfiguration load() {
        return load(null);
    }

    public static KernelConfiguration load(Path override) {
        KernelConfiguration.Builder builder = KernelConfiguration.builder();
        try (InputStream in = KernelConfigLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                apply(builder, parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), DEFAULT_RESOURCE));
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read bundled " + DEFAULT_RESOURCE + ": " + ex.getMessage(), ex);
        }
        if (override != null) {
            if (!Files.isRegularFile(override)) {
                throw new IllegalArgumentException("Config file not found: " + override);
            }
            try {
                apply(builder, parse(Files.readString(override), override.toString()));
            } catch (IOException ex) {
                throw new IllegalArgumentException("Unable to read config file " + override + ": " + ex.getMessage(), ex);
            }
            LOG.debug("Applied kernel configuration from {}", override);
        }
        return builder.build();
    }

    /**
     * Parses TOML text on top of the defaults.
     */
    public static KernelConfiguration fromToml(String toml) {
        KernelConfiguration.Builder builder = KernelConfiguration.builder();
        apply(builder, parse(toml, "<inline>"));
        return builder.build();
    }

    private static TomlParseResult parse(String text, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid TOML in " + origin + ": " + result.errors().get(0).toString());
        }
        return result;
    }

    private static void apply(KernelConfiguration.Builder builder, TomlParseResult toml) {
        TomlTable executor = toml.getTable("executor");
        if (executor != null) {
            Object timeout = executor.get("timeout");
            if (timeout instanceof String text) {
                DurationParser.parse(text).ifPresent(builder::executorTimeout);
            } else if (timeout instanceof Long millis) {
                builder.executorTimeout(Duration.ofMillis(millis));
            } else if (timeout != null) {
                throw new IllegalArgumentException("executor.timeout must be a duration string such as \"5s\"");
            }
            TomlArray modules = executor.getArray("preloaded_modules");
            if (modules != null) {
                List<String> names = new ArrayList<>();
                for (int i = 0; i < modules.size(); i++) {
                    Object name = modules.get(i);
                    if (!(name instanceof String s)) {
                        throw new IllegalArgumentException("executor.preloaded_modules must contain strings");
                    }
                    names.add(s);
                }
                builder.preloadedModules(names);
            }
            Long cost = integer(executor, "invoke_compute_cost", "executor");
            if (cost != null) {
                builder.invokeComputeCost(cost);
            }
        }
        TomlTable costs = toml.getTable("costs");
        if (costs != null) {
            Double rateInput = number(costs, "rate_input");
            if (rateInput != null) {
                builder.rateInput(rateInput);
            }
            Double rateOutput = number(costs, "rate_output");
            if (rateOutput != null) {
                builder.rateOutput(rateOutput);
            }
            Long quota = integer(costs, "compute_quota", "costs");
            if (quota != null) {
                builder.computeQuota(quota);
            }
        }
        TomlTable oracle = toml.getTable("oracle");
        if (oracle != null) {
            Long maxContent = integer(oracle, "max_content_length", "oracle");
            if (maxContent != null) {
                builder.maxContentLength(Math.toIntExact(maxContent));
            }
        }
    }

    private static Long integer(TomlTable table, String key, String section) {
        Object value = table.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Long l) {
            return l;
        }
        throw new IllegalArgumentException(section + "." + key + " must be an integer, got " + value);
    }

    private static Double number(TomlTable table, String key) {
        Object value = table.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        throw new IllegalArgumentException("costs." + key + " must be a number, got " + value);
    }
}
