package work.ecology.kernel.intent;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces {@code oldString} with {@code newString} in an existing artifact's content.
 */
public record EditArtifactIntent(String principalId, String artifactId, String oldString, String newString)
    implements ActionIntent {

    @Override
    public ActionType actionType() {
        return ActionType.EDIT_ARTIFACT;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        map.put("artifact_id", artifactId);
        map.put("old_string", ActionIntent.preview(oldString));
        map.put("new_string", ActionIntent.preview(newString));
        return map;
    }
}
