package work.ecology.kernel.intent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only kernel queries an agent may issue through {@code query_kernel}, with the params each
 * one accepts and requires.
 */
public final class KernelQueries {
    private static final Map<String, Query> QUERIES = new LinkedHashMap<>();

    static {
        define("artifacts", List.of("owner", "type", "executable", "name_pattern", "limit", "offset"), List.of());
        define("artifact", List.of("artifact_id"), List.of("artifact_id"));
        define("principals", List.of("limit"), List.of());
        define("principal", List.of("principal_id"), List.of("principal_id"));
        define("balances", List.of("principal_id"), List.of());
        define("resources", List.of("principal_id", "resource"), List.of("principal_id"));
        define("quotas", List.of("principal_id", "resource"), List.of("principal_id"));
        define("mint", List.of("status", "history", "limit"), List.of());
        define("events", List.of("limit"), List.of());
        define("invocations", List.of("artifact_id", "invoker_id", "limit"), List.of());
        define("frozen", List.of("agent_id"), List.of());
        define("libraries", List.of("principal_id"), List.of("principal_id"));
        define("dependencies", List.of("artifact_id"), List.of("artifact_id"));
    }

    private KernelQueries() {}

    private static void define(String type, List<String> params, List<String> required) {
        QUERIES.put(type, new Query(type, params, required));
    }

    public static Optional<Query> find(String queryType) {
        return Optional.ofNullable(QUERIES.get(queryType));
    }

    public static List<String> queryTypes() {
        return QUERIES.keySet().stream().sorted().toList();
    }

    public record Query(String type, List<String> params, List<String> required) {}
}
