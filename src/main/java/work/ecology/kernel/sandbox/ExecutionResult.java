package work.ecology.kernel.sandbox;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of one sandboxed execution. Exactly one of {@code result} (on success) or
 * {@code error}/{@code failure} (on failure) is meaningful.
 */
public record ExecutionResult(
    boolean success,
    Object result,
    String error,
    FailureKind failure,
    double executionTimeMs,
    List<Map<String, Object>> payments
) {
    public ExecutionResult {
        payments = payments == null ? List.of() : List.copyOf(payments);
    }

    public static ExecutionResult success(Object result, double executionTimeMs, List<Map<String, Object>> payments) {
        return new ExecutionResult(true, result, null, null, executionTimeMs, payments);
    }

    public static ExecutionResult failure(FailureKind kind, String error, double executionTimeMs, List<Map<String, Object>> payments) {
        return new ExecutionResult(false, null, error, kind, executionTimeMs, payments);
    }

    static ExecutionResult rejected(FailureKind kind, String error) {
        return failure(kind, error, 0, List.of());
    }

    public boolean timedOut() {
        return failure == FailureKind.TIMEOUT;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("success", success);
        if (success) {
            serializable.put("result", result);
        } else {
            serializable.put("error", error);
            serializable.put("failure", failure.name().toLowerCase(Locale.ROOT));
        }
        serializable.put("execution_time_ms", executionTimeMs);
        if (!payments.isEmpty()) {
            serializable.put("payments", payments);
        }
        return serializable;
    }
}
