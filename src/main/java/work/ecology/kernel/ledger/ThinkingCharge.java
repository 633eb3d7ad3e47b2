package work.ecology.kernel.ledger;

/**
 * Outcome of charging inference tokens against compute. {@code cost} is always the computed
 * charge, also when the principal could not cover it.
 */
public record ThinkingCharge(boolean success, long cost) {}
