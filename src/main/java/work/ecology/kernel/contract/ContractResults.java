package work.ecology.kernel.contract;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the structured maps contracts return. Failures always carry
 * {@code success=false}, {@code error}, {@code error_code}, {@code category} and {@code retriable}.
 */
public final class ContractResults {
    private ContractResults() {}

    public static Map<String, Object> ok() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        return result;
    }

    public static Map<String, Object> validation(String message, ErrorCode code) {
        return error(message, code, ErrorCategory.VALIDATION, false, Map.of());
    }

    public static Map<String, Object> permission(String message, ErrorCode code, Map<String, Object> details) {
        return error(message, code, ErrorCategory.PERMISSION, false, details);
    }

    public static Map<String, Object> resource(String message, ErrorCode code) {
        return error(message, code, ErrorCategory.RESOURCE, false, Map.of());
    }

    public static Map<String, Object> execution(String message, ErrorCode code, boolean retriable) {
        return error(message, code, ErrorCategory.EXECUTION, retriable, Map.of());
    }

    public static Map<String, Object> system(String message) {
        return error(message, ErrorCode.INTERNAL_ERROR, ErrorCategory.SYSTEM, true, Map.of());
    }

    public static Map<String, Object> error(
        String message,
        ErrorCode code,
        ErrorCategory category,
        boolean retriable,
        Map<String, Object> details
    ) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", false);
        result.put("error", message);
        result.put("error_code", code.wireName());
        result.put("category", category.wireName());
        result.put("retriable", retriable);
        if (details != null && !details.isEmpty()) {
            result.put("details", new LinkedHashMap<>(details));
        }
        return result;
    }

    public static boolean succeeded(Map<String, Object> result) {
        return result != null && Boolean.TRUE.equals(result.get("success"));
    }
}
