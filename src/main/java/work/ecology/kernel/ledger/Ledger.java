package work.ecology.kernel.ledger;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-principal balance store.
 *
 * <p>Two independent resources are tracked for every principal:
 * <ul>
 *   <li><b>scrip</b> - transferable currency, persistent, moved only by transfer/debit/credit;</li>
 *   <li><b>compute</b> - non-transferable budget consumed by inference charges and refilled
 *   each tick by {@link #resetCompute(String, long)}.</li>
 * </ul>
 *
 * <p>Every mutation is a check-then-act sequence, so the whole ledger is guarded by a single
 * monitor. Failed operations leave every balance untouched.
 */
public final class Ledger {
    private static final Logger LOG = LoggerFactory.getLogger(Ledger.class);

    private final Map<String, Long> scrip = new LinkedHashMap<>();
    private final Map<String, Long> compute = new LinkedHashMap<>();

    public synchronized void createPrincipal(String principalId, long startingScrip) {
        createPrincipal(principalId, startingScrip, 0);
    }

    public synchronized void createPrincipal(String principalId, long startingScrip, long startingCompute) {
        Objects.requireNonNull(principalId, "principalId");
        if (startingScrip < 0 || startingCompute < 0) {
            throw new IllegalArgumentException("Starting balances must be non-negative for " + principalId);
        }
        scrip.put(principalId, startingScrip);
        compute.put(principalId, startingCompute);
        LOG.debug("Created principal {} (scrip={}, compute={})", principalId, startingScrip, startingCompute);
    }

    /**
     * Creates a zero-balance principal unless one already exists.
     */
    public synchronized void ensurePrincipal(String principalId) {
        Objects.requireNonNull(principalId, "principalId");
        scrip.putIfAbsent(principalId, 0L);
        compute.putIfAbsent(principalId, 0L);
    }

    public synchronized boolean hasPrincipal(String principalId) {
        return principalId != null && (scrip.containsKey(principalId) || compute.containsKey(principalId));
    }

    // compute

    public synchronized long getCompute(String principalId) {
        return compute.getOrDefault(principalId, 0L);
    }

    public synchronized boolean canSpendCompute(String principalId, long amount) {
        return getCompute(principalId) >= amount;
    }

    public synchronized boolean spendCompute(String principalId, long amount) {
        if (amount < 0 || !canSpendCompute(principalId, amount)) {
            return false;
        }
        if (amount > 0) {
            compute.merge(principalId, -amount, Long::sum);
        }
        return true;
    }

    /**
     * Sets compute to exactly {@code quota}; this is a refill, not a delta.
     */
    public synchronized void resetCompute(String principalId, long quota) {
        Objects.requireNonNull(principalId, "principalId");
        if (quota < 0) {
            throw new IllegalArgumentException("Compute quota must be non-negative, got " + quota);
        }
        compute.put(principalId, quota);
    }

    public static long calculateThinkingCost(long inputTokens, long outputTokens, double rateInput, double rateOutput) {
        double inputCost = (inputTokens / 1000.0) * rateInput;
        double outputCost = (outputTokens / 1000.0) * rateOutput;
        return (long) Math.ceil(inputCost + outputCost);
    }

    public synchronized ThinkingCharge deductThinkingCost(
        String principalId,
        long inputTokens,
        long outputTokens,
        double rateInput,
        double rateOutput
    ) {
        long cost = calculateThinkingCost(inputTokens, outputTokens, rateInput, rateOutput);
        boolean success = spendCompute(principalId, cost);
        if (!success) {
            LOG.debug("Thinking charge of {} refused for {} (compute={})", cost, principalId, getCompute(principalId));
        }
        return new ThinkingCharge(success, cost);
    }

    // scrip

    public synchronized long getScrip(String principalId) {
        return scrip.getOrDefault(principalId, 0L);
    }

    public synchronized boolean canAffordScrip(String principalId, long amount) {
        return getScrip(principalId) >= amount;
    }

    public synchronized boolean deductScrip(String principalId, long amount) {
        if (amount < 0 || !canAffordScrip(principalId, amount)) {
            return false;
        }
        if (amount > 0) {
            scrip.merge(principalId, -amount, Long::sum);
        }
        return true;
    }

    /**
     * Mints scrip. The only operation that creates currency; creates the principal when absent.
     */
    public synchronized void creditScrip(String principalId, long amount) {
        Objects.requireNonNull(principalId, "principalId");
        if (amount < 0) {
            throw new IllegalArgumentException("Credit amount must be non-negative, got " + amount);
        }
        long updated;
        try {
            updated = Math.addExact(scrip.getOrDefault(principalId, 0L), amount);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Crediting " + amount + " scrip to " + principalId + " overflows its balance", ex);
        }
        compute.putIfAbsent(principalId, 0L);
        scrip.put(principalId, updated);
        LOG.info("Minted {} scrip to {}", amount, principalId);
    }

    /**
     * Moves scrip between two existing principals. Fails without side effects when the amount is
     * not positive, the sender cannot cover it, the recipient is unknown, or the recipient's
     * balance would overflow.
     */
    public synchronized boolean transferScrip(String fromId, String toId, long amount) {
        if (amount <= 0 || !canAffordScrip(fromId, amount) || !scrip.containsKey(toId) || overflows(fromId, toId, amount)) {
            return false;
        }
        move(fromId, toId, amount);
        return true;
    }

    /**
     * Same contract as {@link #transferScrip(String, String, long)} except that an unknown
     * recipient is created. The recipient only comes into existence when the transfer succeeds.
     */
    public synchronized boolean transferScripCreatingRecipient(String fromId, String toId, long amount) {
        if (toId == null || amount <= 0 || !canAffordScrip(fromId, amount) || overflows(fromId, toId, amount)) {
            return false;
        }
        ensurePrincipal(toId);
        move(fromId, toId, amount);
        return true;
    }

    private boolean overflows(String fromId, String toId, long amount) {
        if (toId.equals(fromId)) {
            return false;
        }
        try {
            Math.addExact(getScrip(toId), amount);
            return false;
        } catch (ArithmeticException ex) {
            LOG.debug("Refused transfer of {} scrip to {}: balance would overflow", amount, toId);
            return true;
        }
    }

    private void move(String fromId, String toId, long amount) {
        scrip.merge(fromId, -amount, Long::sum);
        scrip.merge(toId, amount, Long::sum);
        LOG.debug("Transferred {} scrip {} -> {}", amount, fromId, toId);
    }

    // reporting

    public synchronized Map<String, BalanceInfo> getAllBalances() {
        Set<String> principals = new LinkedHashSet<>(compute.keySet());
        principals.addAll(scrip.keySet());
        Map<String, BalanceInfo> snapshot = new LinkedHashMap<>();
        for (String id : principals) {
            snapshot.put(id, new BalanceInfo(compute.getOrDefault(id, 0L), scrip.getOrDefault(id, 0L)));
        }
        return snapshot;
    }

    public synchronized Map<String, Long> getAllScrip() {
        return new LinkedHashMap<>(scrip);
    }

    public synchronized Map<String, Long> getAllCompute() {
        return new LinkedHashMap<>(compute);
    }

    public synchronized long totalScrip() {
        return scrip.values().stream().mapToLong(Long::longValue).sum();
    }
}
