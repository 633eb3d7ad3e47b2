package work.ecology.kernel.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores contract methods keyed by artifact id and method name.
 */
public final class ContractRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ContractRegistry.class);

    private final Map<String, Map<String, ContractMethod>> contracts = new ConcurrentHashMap<>();

    public ContractRegistry register(String artifactId, String method, ContractMethod fn) {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(fn, "fn");
        contracts.computeIfAbsent(artifactId, id -> new ConcurrentHashMap<>()).put(method, fn);
        return this;
    }

    public boolean hasContract(String artifactId) {
        return artifactId != null && contracts.containsKey(artifactId);
    }

    public List<String> methods(String artifactId) {
        Map<String, ContractMethod> methods = contracts.get(artifactId);
        if (methods == null) {
            return List.of();
        }
        List<String> names = new ArrayList<>(methods.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Dispatches to a registered method. Unknown targets and exceptions become error maps.
     */
    public Map<String, Object> invoke(String invokerId, String artifactId, String method, List<Object> args) {
        Map<String, ContractMethod> methods = artifactId == null ? null : contracts.get(artifactId);
        if (methods == null) {
            return ContractResults.resource("Artifact '" + artifactId + "' is not a kernel contract", ErrorCode.NOT_FOUND);
        }
        ContractMethod fn = method == null ? null : methods.get(method);
        if (fn == null) {
            return ContractResults.validation(
                "Method '" + method + "' not found on " + artifactId + ". Available: " + String.join(", ", methods(artifactId)),
                ErrorCode.INVALID_ARGUMENT
            );
        }
        try {
            Map<String, Object> result = fn.invoke(invokerId, args == null ? List.of() : args);
            return result == null ? ContractResults.ok() : result;
        } catch (Exception ex) {
            LOG.warn("Contract {}.{} failed for {}", artifactId, method, invokerId, ex);
            return ContractResults.system(artifactId + "." + method + " failed: " + ex.getMessage());
        }
    }
}
