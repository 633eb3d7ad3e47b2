package work.ecology.kernel.intent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.ecology.kernel.artifact.ResourcePolicy;
import work.ecology.kernel.shared.Integrals;

/**
 * Turns agent output into typed {@link ActionIntent}s.
 */
public final class IntentParser {
    private IntentParser() {}

    public static IntentParse parseIntentFromJson(String callerId, String text) {
        Objects.requireNonNull(callerId, "callerId");
        ActionValidation validation = ActionSchema.validateActionJson(text);
        if (!validation.isValid()) {
            return IntentParse.invalid(validation.error());
        }
        Map<String, Object> data = validation.action();
        ActionType type = ActionType.fromWire((String) data.get("action_type")).orElseThrow();
        return switch (type) {
            case NOOP -> IntentParse.ok(new NoopIntent(callerId));
            case READ_ARTIFACT -> IntentParse.ok(new ReadArtifactIntent(callerId, string(data, "artifact_id")));
            case DELETE_ARTIFACT -> IntentParse.ok(new DeleteArtifactIntent(callerId, string(data, "artifact_id")));
            case EDIT_ARTIFACT -> IntentParse.ok(new EditArtifactIntent(
                callerId, string(data, "artifact_id"), string(data, "old_string"), string(data, "new_string")));
            case INVOKE_ARTIFACT -> IntentParse.ok(new InvokeArtifactIntent(
                callerId, string(data, "artifact_id"), string(data, "method"), args(data.get("args"))));
            case SUBMIT_TO_TASK -> IntentParse.ok(new SubmitToTaskIntent(
                callerId, string(data, "artifact_id"), string(data, "task_id")));
            case QUERY_KERNEL -> IntentParse.ok(new QueryKernelIntent(
                callerId, string(data, "query_type"), params(data.get("params"))));
            case WRITE_ARTIFACT -> parseWrite(callerId, data);
        };
    }

    private static IntentParse parseWrite(String callerId, Map<String, Object> data) {
        Optional<ResourcePolicy> policy;
        Object rawPolicy = data.get("resource_policy");
        if (rawPolicy == null) {
            policy = Optional.of(ResourcePolicy.CALLER_PAYS);
        } else {
            policy = rawPolicy instanceof String s ? ResourcePolicy.fromWire(s) : Optional.empty();
        }
        if (policy.isEmpty()) {
            return IntentParse.invalid("Invalid resource_policy '" + rawPolicy + "'. Must be one of: "
                + ResourcePolicy.legalValues());
        }

        boolean executable = Boolean.TRUE.equals(data.get("executable"));
        Object rawPrice = data.getOrDefault("price", 0);
        Long price = Integrals.exact(rawPrice).orElse(null);
        String code = data.get("code") instanceof String s ? s : "";
        if (executable) {
            if (price == null || price < 0) {
                return IntentParse.invalid("executable artifact requires non-negative integer 'price'");
            }
            if (code.isBlank()) {
                return IntentParse.invalid("executable artifact requires 'code' with a run() function");
            }
        }
        String artifactType = data.get("artifact_type") instanceof String s ? s : "generic";
        String content = data.get("content") instanceof String s ? s : "";
        return IntentParse.ok(new WriteArtifactIntent(
            callerId,
            string(data, "artifact_id"),
            artifactType,
            content,
            executable,
            price == null || price < 0 ? 0 : price,
            code,
            policy.get()
        ));
    }

    private static String string(Map<String, Object> data, String field) {
        return (String) data.get(field);
    }

    private static List<Object> args(Object raw) {
        return raw instanceof List<?> list ? new ArrayList<>(list) : List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> params(Object raw) {
        return raw instanceof Map<?, ?> map ? new LinkedHashMap<>((Map<String, Object>) map) : Map.of();
    }
}
