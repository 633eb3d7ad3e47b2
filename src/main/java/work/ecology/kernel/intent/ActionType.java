package work.ecology.kernel.intent;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kernel action vocabulary. Currency transfers are deliberately absent; they go through the
 * {@code genesis_ledger} contract via {@link #INVOKE_ARTIFACT}.
 */
public enum ActionType {
    NOOP("noop", List.of()),
    READ_ARTIFACT("read_artifact", List.of("artifact_id")),
    WRITE_ARTIFACT("write_artifact", List.of("artifact_id")),
    EDIT_ARTIFACT("edit_artifact", List.of("artifact_id", "old_string", "new_string")),
    DELETE_ARTIFACT("delete_artifact", List.of("artifact_id")),
    INVOKE_ARTIFACT("invoke_artifact", List.of("artifact_id", "method")),
    SUBMIT_TO_TASK("submit_to_task", List.of("artifact_id", "task_id")),
    QUERY_KERNEL("query_kernel", List.of("query_type"));

    private final String wireName;
    private final List<String> requiredFields;

    ActionType(String wireName, List<String> requiredFields) {
        this.wireName = wireName;
        this.requiredFields = requiredFields;
    }

    public String wireName() {
        return wireName;
    }

    /** String fields that must be present and non-empty. */
    public List<String> requiredFields() {
        return requiredFields;
    }

    public static Optional<ActionType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        var normalized = value.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.wireName.equals(normalized)).findFirst();
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(ActionType::wireName).toList();
    }
}
