package work.ecology.kernel.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.ecology.kernel.shared.JsonExtractor;

/**
 * Gate between raw agent output and the kernel's action handlers.
 *
 * <p>{@link #validateActionJson(String)} never throws: malformed text, unknown action types and
 * missing fields all come back as {@link ActionValidation#invalid(String)}.
 */
public final class ActionSchema {
    private static final ObjectMapper JSON = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String TRANSFER_GUIDANCE =
        "transfer is not a kernel action. Use: invoke_artifact('genesis_ledger', 'transfer', [from_id, to_id, amount])";

    /** Instructions handed to agents describing the expected output. */
    public static final String PROMPT = """
        You must respond with a single JSON object representing your action.

        Actions:
        - {"action_type": "noop"}
        - {"action_type": "read_artifact", "artifact_id": "<id>"}
        - {"action_type": "write_artifact", "artifact_id": "<id>", "artifact_type": "<type>", "content": "<content>"}
          Executable: add "executable": true, "price": <scrip>, "code": "<javascript defining function run(...)>",
          and optionally "resource_policy": "caller_pays" | "owner_pays".
          Code may use math, json, random and datetime; nothing else can be imported.
        - {"action_type": "edit_artifact", "artifact_id": "<id>", "old_string": "<text>", "new_string": "<text>"}
        - {"action_type": "delete_artifact", "artifact_id": "<id>"}
        - {"action_type": "invoke_artifact", "artifact_id": "<id>", "method": "<method>", "args": [...]}
        - {"action_type": "submit_to_task", "artifact_id": "<id>", "task_id": "<task>"}
        - {"action_type": "query_kernel", "query_type": "<type>", "params": {...}}

        genesis_ledger methods: balance([id]), all_balances([]), transfer([from, to, amount]).
        To send scrip: invoke_artifact("genesis_ledger", "transfer", [your_id, target_id, amount]).

        Respond with ONLY the JSON object, no other text.
        """;

    private ActionSchema() {}

    public static ActionValidation validateActionJson(String text) {
        Optional<String> extracted = JsonExtractor.extract(text);
        if (extracted.isEmpty()) {
            return ActionValidation.invalid("No JSON object found in response");
        }
        Map<String, Object> data;
        try {
            data = JSON.readValue(extracted.get(), MAP_TYPE);
        } catch (JsonProcessingException ex) {
            return ActionValidation.invalid("Invalid JSON: " + ex.getOriginalMessage());
        }
        if (data == null) {
            return ActionValidation.invalid("Response must be a JSON object");
        }
        Object rawType = data.get("action_type");
        if (rawType == null) {
            return ActionValidation.invalid("Missing 'action_type'. Valid types: " + String.join(", ", ActionType.wireNames()));
        }
        if (!(rawType instanceof String typeName)) {
            return ActionValidation.invalid("Invalid action_type: " + rawType);
        }
        Optional<ActionType> type = ActionType.fromWire(typeName);
        if (type.isEmpty()) {
            if ("transfer".equalsIgnoreCase(typeName)) {
                return ActionValidation.invalid(TRANSFER_GUIDANCE);
            }
            return ActionValidation.invalid("Invalid action_type: " + typeName
                + ". Valid types: " + String.join(", ", ActionType.wireNames()));
        }
        Optional<String> error = checkFields(type.get(), data);
        return error.map(ActionValidation::invalid).orElseGet(() -> ActionValidation.ok(data));
    }

    static Optional<String> checkFields(ActionType type, Map<String, Object> data) {
        for (String field : type.requiredFields()) {
            Object value = data.get(field);
            if (value == null || (value instanceof String s && s.isEmpty())) {
                return Optional.of(type.wireName() + " requires '" + field + "'");
            }
            if (!(value instanceof String)) {
                return Optional.of(field + " must be a string");
            }
        }
        return switch (type) {
            case INVOKE_ARTIFACT -> data.containsKey("args") && !(data.get("args") instanceof List<?>)
                ? Optional.of("invoke_artifact 'args' must be a list")
                : Optional.empty();
            case QUERY_KERNEL -> checkQuery((String) data.get("query_type"), data.get("params"));
            default -> Optional.empty();
        };
    }

    private static Optional<String> checkQuery(String queryType, Object rawParams) {
        Optional<KernelQueries.Query> query = KernelQueries.find(queryType);
        if (query.isEmpty()) {
            return Optional.of("Unknown query_type '" + queryType + "'. Valid types: "
                + String.join(", ", KernelQueries.queryTypes()));
        }
        if (rawParams != null && !(rawParams instanceof Map<?, ?>)) {
            return Optional.of("query_kernel 'params' must be an object");
        }
        Map<?, ?> params = rawParams == null ? Map.of() : (Map<?, ?>) rawParams;
        for (Object name : params.keySet()) {
            if (!query.get().params().contains(String.valueOf(name))) {
                return Optional.of("Unknown param '" + name + "' for " + queryType + " query. Valid params: "
                    + String.join(", ", query.get().params()));
            }
        }
        for (String required : query.get().required()) {
            if (params.get(required) == null) {
                return Optional.of("Query '" + queryType + "' requires '" + required + "' param");
            }
        }
        return Optional.empty();
    }
}
