package work.ecology.kernel.artifact;

import java.util.Objects;

/**
 * A named unit of content or executable code owned by a principal.
 */
public record Artifact(
    String id,
    String ownerId,
    String type,
    String content,
    boolean executable,
    long price,
    String code,
    ResourcePolicy resourcePolicy
) {
    public Artifact {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "ownerId");
        type = type == null ? "generic" : type;
        content = content == null ? "" : content;
        code = code == null ? "" : code;
        resourcePolicy = resourcePolicy == null ? ResourcePolicy.CALLER_PAYS : resourcePolicy;
        if (price < 0) {
            throw new IllegalArgumentException("Artifact price must be non-negative, got " + price);
        }
    }

    public static Artifact document(String id, String ownerId, String content) {
        return new Artifact(id, ownerId, "generic", content, false, 0, "", ResourcePolicy.CALLER_PAYS);
    }

    public static Artifact executable(String id, String ownerId, String code, long price, ResourcePolicy policy) {
        return new Artifact(id, ownerId, "executable", "", true, price, code, policy);
    }
}
