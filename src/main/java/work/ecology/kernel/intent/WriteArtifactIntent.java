package work.ecology.kernel.intent;

import java.util.LinkedHashMap;
import java.util.Map;
import work.ecology.kernel.artifact.Artifact;
import work.ecology.kernel.artifact.ResourcePolicy;

/**
 * Creates or replaces an artifact owned by the issuing principal.
 */
public record WriteArtifactIntent(
    String principalId,
    String artifactId,
    String artifactType,
    String content,
    boolean executable,
    long price,
    String code,
    ResourcePolicy resourcePolicy
) implements ActionIntent {

    public WriteArtifactIntent {
        artifactType = artifactType == null ? "generic" : artifactType;
        content = content == null ? "" : content;
        code = code == null ? "" : code;
        resourcePolicy = resourcePolicy == null ? ResourcePolicy.CALLER_PAYS : resourcePolicy;
    }

    @Override
    public ActionType actionType() {
        return ActionType.WRITE_ARTIFACT;
    }

    public Artifact toArtifact() {
        return new Artifact(artifactId, principalId, artifactType, content, executable, price, code, resourcePolicy);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("action_type", actionType().wireName());
        map.put("principal_id", principalId);
        map.put("artifact_id", artifactId);
        map.put("artifact_type", artifactType);
        map.put("content", ActionIntent.preview(content));
        if (executable) {
            map.put("executable", true);
            map.put("price", price);
            map.put("code", ActionIntent.preview(code));
        }
        map.put("resource_policy", resourcePolicy.wireName());
        return map;
    }
}
