package work.ecology.kernel.artifact;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Who pays the execution charge when an executable artifact is invoked.
 */
public enum ResourcePolicy {
    CALLER_PAYS("caller_pays"),
    OWNER_PAYS("owner_pays");

    private final String wireName;

    ResourcePolicy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ResourcePolicy> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.wireName.equals(normalized)).findFirst();
    }

    public static String legalValues() {
        return Arrays.stream(values()).map(ResourcePolicy::wireName).collect(Collectors.joining(", "));
    }
}
