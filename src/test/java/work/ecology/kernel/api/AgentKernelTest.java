package work.ecology.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.ecology.kernel.artifact.Artifact;
import work.ecology.kernel.artifact.ResourcePolicy;
import work.ecology.kernel.intent.InvokeArtifactIntent;
import work.ecology.kernel.oracle.ScoreResult;
import work.ecology.kernel.sandbox.FailureKind;

class AgentKernelTest {
    private AgentKernel kernel;

    @BeforeEach
    void setUp() {
        kernel = new AgentKernel(KernelConfiguration.defaults(), (id, type, content) -> ScoreResult.scored(60, "fine"));
        kernel.ledger().createPrincipal("alice", 100, 10);
        kernel.ledger().createPrincipal("bob", 20, 10);
    }

    @AfterEach
    void tearDown() {
        kernel.close();
    }

    @Test
    void callerPaysComputeAndPriceGoesToOwner() {
        var tool = Artifact.executable("adder", "alice", "function run(a, b) { return a + b; }", 5, ResourcePolicy.CALLER_PAYS);

        var result = kernel.invokeArtifact("bob", tool, List.of(2, 3));

        assertTrue(result.success(), result.error());
        assertEquals(5, result.execution().result());
        assertEquals("bob", result.chargedTo());
        assertEquals(2, result.computeCharged());
        assertEquals(5, result.pricePaid());
        assertEquals(8, kernel.ledger().getCompute("bob"));
        assertEquals(15, kernel.ledger().getScrip("bob"));
        assertEquals(105, kernel.ledger().getScrip("alice"));
    }

    @Test
    void ownerPaysComputeAndFailedRunKeepsPrice() {
        var broken = Artifact.executable("broken", "alice", "function run() { throw new Error('bad'); }", 5, ResourcePolicy.OWNER_PAYS);

        var result = kernel.invokeArtifact("bob", broken, List.of());

        assertFalse(result.success());
        assertEquals(FailureKind.RUNTIME, result.execution().failure());
        assertEquals("alice", result.chargedTo());
        assertEquals(8, kernel.ledger().getCompute("alice"));
        assertEquals(10, kernel.ledger().getCompute("bob"));
        assertEquals(0, result.pricePaid());
        assertEquals(20, kernel.ledger().getScrip("bob"));
    }

    @Test
    void refusesBeforeRunningWhenUnaffordable() {
        var pricey = Artifact.executable("pricey", "alice", "function run() { return 1; }", 50, ResourcePolicy.CALLER_PAYS);
        var tooExpensive = kernel.invokeArtifact("bob", pricey, List.of());
        assertFalse(tooExpensive.success());
        assertNull(tooExpensive.execution());
        assertTrue(tooExpensive.error().startsWith("Insufficient scrip"));
        assertEquals(10, kernel.ledger().getCompute("bob"));

        kernel.ledger().resetCompute("bob", 1);
        var free = Artifact.executable("free", "alice", "function run() { return 1; }", 0, ResourcePolicy.CALLER_PAYS);
        var noCompute = kernel.invokeArtifact("bob", free, List.of());
        assertTrue(noCompute.error().startsWith("Insufficient compute"));

        var doc = kernel.invokeArtifact("bob", Artifact.document("notes", "alice", "text"), List.of());
        assertEquals("Artifact notes is not executable", doc.error());
    }

    @Test
    void ownerInvokingOwnArtifactPaysNoPrice() {
        var tool = Artifact.executable("mine", "alice", "function run() { return 'ok'; }", 7, ResourcePolicy.CALLER_PAYS);
        var result = kernel.invokeArtifact("alice", tool, List.of());
        assertTrue(result.success(), result.error());
        assertEquals(0, result.pricePaid());
        assertEquals(100, kernel.ledger().getScrip("alice"));
    }

    @Test
    void artifactWalletIsItsOwnPrincipal() {
        kernel.ledger().creditScrip("vault", 100);
        var vault = Artifact.executable("vault", "alice", "function run(to) { return pay(to, 50); }", 0, ResourcePolicy.CALLER_PAYS);

        var result = kernel.invokeArtifact("bob", vault, List.of("carol"));

        assertTrue(result.success(), result.error());
        assertEquals(50, kernel.ledger().getScrip("vault"));
        assertEquals(50, kernel.ledger().getScrip("carol"));
        assertEquals(100, kernel.ledger().getScrip("alice"));
    }

    @Test
    void agentTransferGoesThroughLedgerContract() {
        var parse = kernel.parseIntent("bob",
            "{\"action_type\": \"invoke_artifact\", \"artifact_id\": \"genesis_ledger\", \"method\": \"transfer\", "
                + "\"args\": [\"bob\", \"alice\", 5]}");
        var intent = (InvokeArtifactIntent) parse.intent();

        var result = kernel.invoke(intent.principalId(), intent.artifactId(), intent.method(), intent.args());

        assertEquals(true, result.get("success"));
        assertEquals(15, kernel.ledger().getScrip("bob"));
        assertEquals(105, kernel.ledger().getScrip("alice"));
        assertFalse(kernel.validateAction("{\"action_type\": \"transfer\"}").isValid());
    }

    @Test
    void thinkingChargesAndTickRefill() {
        var charge = kernel.chargeThinking("alice", 1000, 1000);
        assertTrue(charge.success());
        assertEquals(4, charge.cost());
        assertEquals(6, kernel.ledger().getCompute("alice"));

        assertFalse(kernel.chargeThinking("alice", 10_000, 0).success());
        assertEquals(6, kernel.ledger().getCompute("alice"));

        kernel.startTick("alice");
        assertEquals(1000, kernel.ledger().getCompute("alice"));
    }

    @Test
    void legacyTransferRequiresKnownRecipient() {
        assertTrue(kernel.transfer("alice", "bob", 10));
        assertFalse(kernel.transfer("alice", "nobody", 10));
        assertEquals(90, kernel.ledger().getScrip("alice"));
    }

    @Test
    void kernelWithoutScorerReportsIt() {
        try (var bare = AgentKernel.withoutScorer(KernelConfiguration.defaults())) {
            var result = bare.oracle().scoreArtifact("a", "tool", "code");
            assertFalse(result.success());
            assertEquals("No scoring backend configured", result.error());
            assertTrue(bare.validateCode("function run() { return 1; }").valid());
        }
    }
}
