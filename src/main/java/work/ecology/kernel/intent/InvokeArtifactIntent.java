package work.ecology.kernel.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record InvokeArtifactIntent(String principalId, String artifactId, String method, List<Object> args)
    implements ActionIntent {

    public InvokeArtifactIntent {
        // JSON args may contain nulls, so no List.copyOf here.
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    @Override
    public ActionType actionType() {
        return ActionType.INVOKE_ARTIFACT;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        map.put("artifact_id", artifactId);
        map.put("method", method);
        map.put("args", args);
        return map;
    }
}
