package work.ecology.kernel.artifact;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ArtifactTest {
    @Test
    void defaultsFillMissingFields() {
        var artifact = new Artifact("a", "alice", null, null, false, 0, null, null);
        assertEquals("generic", artifact.type());
        assertEquals("", artifact.content());
        assertEquals(ResourcePolicy.CALLER_PAYS, artifact.resourcePolicy());
    }

    @Test
    void negativePriceIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> Artifact.executable("a", "alice", "function run() {}", -1, ResourcePolicy.CALLER_PAYS));
    }

    @Test
    void resourcePolicyWireNames() {
        assertEquals(Optional.of(ResourcePolicy.OWNER_PAYS), ResourcePolicy.fromWire("owner_pays"));
        assertTrue(ResourcePolicy.fromWire("free").isEmpty());
        assertEquals("caller_pays, owner_pays", ResourcePolicy.legalValues());
    }
}
