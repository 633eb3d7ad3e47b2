package work.ecology.kernel.contract;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.ecology.kernel.ledger.BalanceInfo;
import work.ecology.kernel.ledger.Ledger;
import work.ecology.kernel.shared.Integrals;

/**
 * The {@code genesis_ledger} contract: scrip balances and invoker-authorized transfers.
 */
public final class LedgerContract {
    public static final String ID = "genesis_ledger";

    private final Ledger ledger;

    public LedgerContract(Ledger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    public void registerInto(ContractRegistry registry) {
        registry.register(ID, "balance", this::balance);
        registry.register(ID, "all_balances", this::allBalances);
        registry.register(ID, "transfer", this::transfer);
    }

    Map<String, Object> balance(String invokerId, List<Object> args) {
        if (args.isEmpty() || !(args.get(0) instanceof String principalId)) {
            return ContractResults.validation(
                "balance requires [agent_id]. Example: genesis_ledger.balance(['" + invokerId + "'])",
                ErrorCode.MISSING_ARGUMENT
            );
        }
        Map<String, Object> result = ContractResults.ok();
        result.put("agent_id", principalId);
        result.put("scrip", ledger.getScrip(principalId));
        result.put("compute", ledger.getCompute(principalId));
        return result;
    }

    Map<String, Object> allBalances(String invokerId, List<Object> args) {
        Map<String, Object> balances = new LinkedHashMap<>();
        for (Map.Entry<String, BalanceInfo> entry : ledger.getAllBalances().entrySet()) {
            Map<String, Object> balance = new LinkedHashMap<>();
            balance.put("compute", entry.getValue().compute());
            balance.put("scrip", entry.getValue().scrip());
            balances.put(entry.getKey(), balance);
        }
        Map<String, Object> result = ContractResults.ok();
        result.put("balances", balances);
        return result;
    }

    Map<String, Object> transfer(String invokerId, List<Object> args) {
        if (args.size() < 3) {
            return ContractResults.validation(
                "transfer requires [from_id, to_id, amount] (3 args, got " + args.size() + ")",
                ErrorCode.MISSING_ARGUMENT
            );
        }
        String fromId = String.valueOf(args.get(0));
        String toId = String.valueOf(args.get(1));
        Object rawAmount = args.get(2);

        if (!fromId.equals(invokerId)) {
            return ContractResults.permission(
                "Cannot transfer from " + fromId + " - you are " + invokerId + ". You can only transfer your own scrip. "
                    + "To send your scrip: genesis_ledger.transfer(['" + invokerId + "', '" + toId + "', " + rawAmount + "])",
                ErrorCode.NOT_AUTHORIZED,
                Map.of("invoker", String.valueOf(invokerId), "target", fromId)
            );
        }
        Long amount = Integrals.exact(rawAmount).orElse(null);
        if (amount == null) {
            String hint = rawAmount instanceof String s && s.chars().allMatch(Character::isDigit) && !s.isEmpty()
                ? " Pass the number without quotes: [\"" + fromId + "\", \"" + toId + "\", " + s + "]"
                : "";
            return ContractResults.validation(
                "Amount must be an integer, got " + typeName(rawAmount) + ": " + rawAmount + "." + hint,
                ErrorCode.INVALID_ARGUMENT
            );
        }
        if (amount <= 0) {
            return ContractResults.validation("Amount must be positive, got " + amount, ErrorCode.INVALID_ARGUMENT);
        }
        if (!ledger.transferScrip(fromId, toId, amount)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from_id", fromId);
            details.put("to_id", toId);
            details.put("amount", amount);
            return ContractResults.permission(
                "Transfer failed (insufficient scrip or invalid recipient)",
                ErrorCode.INSUFFICIENT_FUNDS,
                details
            );
        }
        Map<String, Object> result = ContractResults.ok();
        result.put("transferred", amount);
        result.put("currency", "scrip");
        result.put("from", fromId);
        result.put("to", toId);
        result.put("from_scrip_after", ledger.getScrip(fromId));
        result.put("to_scrip_after", ledger.getScrip(toId));
        return result;
    }

    private static String typeName(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String) {
            return "string";
        }
        if (value instanceof Number) {
            return "number";
        }
        return value.getClass().getSimpleName();
    }
}
