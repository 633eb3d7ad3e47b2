package work.ecology.kernel.intent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Submits an artifact as the solution to a mint task.
 */
public record SubmitToTaskIntent(String principalId, String artifactId, String taskId) implements ActionIntent {
    @Override
    public ActionType actionType() {
        return ActionType.SUBMIT_TO_TASK;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        map.put("artifact_id", artifactId);
        map.put("task_id", taskId);
        return map;
    }
}
