package work.ecology.kernel.api;

import java.util.LinkedHashMap;
import java.util.Map;
import work.ecology.kernel.sandbox.ExecutionResult;

/**
 * Outcome of invoking an executable artifact: what was charged to whom, plus the sandbox result
 * when the code actually ran ({@code execution} is null when the invocation was refused up front).
 */
public record InvocationResult(
    boolean success,
    String error,
    ExecutionResult execution,
    String chargedTo,
    long computeCharged,
    long pricePaid
) {
    static InvocationResult refused(String error, String chargedTo) {
        return new InvocationResult(false, error, null, chargedTo, 0, 0);
    }

    static InvocationResult ran(ExecutionResult execution, String chargedTo, long computeCharged, long pricePaid) {
        return new InvocationResult(execution.success(), execution.error(), execution, chargedTo, computeCharged, pricePaid);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        if (error != null) {
            map.put("error", error);
        }
        map.put("charged_to", chargedTo);
        map.put("compute_charged", computeCharged);
        map.put("price_paid", pricePaid);
        if (execution != null) {
            map.put("execution", execution.toSerializableMap());
        }
        return map;
    }
}
