package work.ecology.kernel.ledger;

/**
 * Snapshot of one principal's balances.
 */
public record BalanceInfo(long compute, long scrip) {}
