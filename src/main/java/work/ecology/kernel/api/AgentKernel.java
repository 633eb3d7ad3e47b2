package work.ecology.kernel.api;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.ecology.kernel.artifact.Artifact;
import work.ecology.kernel.artifact.ResourcePolicy;
import work.ecology.kernel.contract.ContractRegistry;
import work.ecology.kernel.contract.LedgerContract;
import work.ecology.kernel.intent.ActionSchema;
import work.ecology.kernel.intent.ActionValidation;
import work.ecology.kernel.intent.IntentParse;
import work.ecology.kernel.intent.IntentParser;
import work.ecology.kernel.ledger.Ledger;
import work.ecology.kernel.ledger.ThinkingCharge;
import work.ecology.kernel.oracle.InferenceClient;
import work.ecology.kernel.oracle.OriginalityOracle;
import work.ecology.kernel.oracle.PromptScoringBackend;
import work.ecology.kernel.oracle.ScoreResult;
import work.ecology.kernel.oracle.ScoringBackend;
import work.ecology.kernel.sandbox.CodeCheck;
import work.ecology.kernel.sandbox.ExecutionResult;
import work.ecology.kernel.sandbox.SandboxPolicy;
import work.ecology.kernel.sandbox.SandboxedExecutor;

/**
 * Public entry point for embedding the kernel.
 *
 * <p>Each instance owns its ledger, fingerprint set, sandbox worker pool and contract table, so
 * several kernels can run side by side in one process.
 */
public final class AgentKernel implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AgentKernel.class);

    private final KernelConfiguration configuration;
    private final Ledger ledger = new Ledger();
    private final OriginalityOracle oracle;
    private final SandboxedExecutor executor;
    private final ContractRegistry contracts = new ContractRegistry();

    public AgentKernel(KernelConfiguration configuration, ScoringBackend scoring) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.oracle = new OriginalityOracle(scoring);
        this.executor = new SandboxedExecutor(
            configuration.executorTimeout(),
            SandboxPolicy.withModules(configuration.preloadedModules())
        );
        new LedgerContract(ledger).registerInto(contracts);
    }

    public AgentKernel(KernelConfiguration configuration, InferenceClient inference) {
        this(configuration, new PromptScoringBackend(inference, configuration.maxContentLength()));
    }

    /**
     * Kernel with default settings and no scorer; scoring requests fail with a descriptive error.
     */
    public static AgentKernel withoutScorer(KernelConfiguration configuration) {
        return new AgentKernel(configuration, (ScoringBackend) (id, type, content) ->
            ScoreResult.failed("No scoring backend configured"));
    }

    public KernelConfiguration configuration() {
        return configuration;
    }

    public Ledger ledger() {
        return ledger;
    }

    public OriginalityOracle oracle() {
        return oracle;
    }

    public SandboxedExecutor executor() {
        return executor;
    }

    public ContractRegistry contracts() {
        return contracts;
    }

    /**
     * Direct scrip transfer used by the orchestration layer. Agents cannot reach this path: the
     * action vocabulary rejects {@code transfer} and points at {@code genesis_ledger} instead.
     */
    public boolean transfer(String fromId, String toId, long amount) {
        return ledger.transferScrip(fromId, toId, amount);
    }

    public Map<String, Object> invoke(String invokerId, String artifactId, String method, List<Object> args) {
        return contracts.invoke(invokerId, artifactId, method, args);
    }

    /**
     * Runs an executable artifact on behalf of {@code invokerId}.
     *
     * <p>The execution charge comes out of the invoker's compute under {@code caller_pays} and the
     * owner's under {@code owner_pays}, and is kept even when the code fails. The price moves from
     * invoker to owner only when the run succeeds.
     */
    public InvocationResult invokeArtifact(String invokerId, Artifact artifact, List<?> args) {
        Objects.requireNonNull(invokerId, "invokerId");
        Objects.requireNonNull(artifact, "artifact");
        String payer = artifact.resourcePolicy() == ResourcePolicy.OWNER_PAYS ? artifact.ownerId() : invokerId;
        if (!artifact.executable()) {
            return InvocationResult.refused("Artifact " + artifact.id() + " is not executable", payer);
        }
        boolean paysPrice = artifact.price() > 0 && !invokerId.equals(artifact.ownerId());
        if (paysPrice && !ledger.canAffordScrip(invokerId, artifact.price())) {
            return InvocationResult.refused("Insufficient scrip: " + artifact.id() + " costs " + artifact.price()
                + ", " + invokerId + " has " + ledger.getScrip(invokerId), payer);
        }
        long cost = configuration.invokeComputeCost();
        if (!ledger.spendCompute(payer, cost)) {
            return InvocationResult.refused("Insufficient compute: invocation costs " + cost
                + ", " + payer + " has " + ledger.getCompute(payer), payer);
        }

        ExecutionResult execution = executor.executeWithWallet(artifact.code(), args, artifact.id(), ledger);
        long pricePaid = 0;
        if (execution.success() && paysPrice) {
            if (ledger.transferScripCreatingRecipient(invokerId, artifact.ownerId(), artifact.price())) {
                pricePaid = artifact.price();
            } else {
                LOG.warn("Price {} for {} could not be collected from {}", artifact.price(), artifact.id(), invokerId);
            }
        }
        LOG.debug("{} invoked {} (success={}, compute charged to {})", invokerId, artifact.id(), execution.success(), payer);
        return InvocationResult.ran(execution, payer, cost, pricePaid);
    }

    public ThinkingCharge chargeThinking(String principalId, long inputTokens, long outputTokens) {
        return ledger.deductThinkingCost(
            principalId, inputTokens, outputTokens, configuration.rateInput(), configuration.rateOutput());
    }

    /** Refills the principal's compute to the configured per-tick quota. */
    public void startTick(String principalId) {
        ledger.resetCompute(principalId, configuration.computeQuota());
    }

    public CodeCheck validateCode(String code) {
        return executor.validateCode(code);
    }

    public ActionValidation validateAction(String text) {
        return ActionSchema.validateActionJson(text);
    }

    public IntentParse parseIntent(String callerId, String text) {
        return IntentParser.parseIntentFromJson(callerId, text);
    }

    @Override
    public void close() {
        executor.close();
    }
}
