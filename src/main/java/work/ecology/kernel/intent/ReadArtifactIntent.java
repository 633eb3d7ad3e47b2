package work.ecology.kernel.intent;

import java.util.LinkedHashMap;
import java.util.Map;

public record ReadArtifactIntent(String principalId, String artifactId) implements ActionIntent {
    @Override
    public ActionType actionType() {
        return ActionType.READ_ARTIFACT;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        map.put("artifact_id", artifactId);
        return map;
    }
}
