package work.ecology.kernel.sandbox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.ecology.kernel.ledger.Ledger;

/**
 * Capability table installed into every sandbox.
 *
 * <p>A bound table exposes {@code pay(recipient, amount)} and {@code get_balance()} for exactly one
 * artifact's wallet. The artifact id is captured here on the host side; nothing the guest passes
 * can change whose balance is debited. An unbound table installs no names, so referencing
 * {@code pay} fails as an ordinary undefined name on every call path.
 */
public final class WalletCapabilities {
    private static final Logger LOG = LoggerFactory.getLogger(WalletCapabilities.class);

    public static final String PAY = "pay";
    public static final String GET_BALANCE = "get_balance";

    private final String artifactId;
    private final Ledger ledger;
    private final List<Map<String, Object>> payments = Collections.synchronizedList(new ArrayList<>());

    private WalletCapabilities(String artifactId, Ledger ledger) {
        this.artifactId = artifactId;
        this.ledger = ledger;
    }

    public static WalletCapabilities unbound() {
        return new WalletCapabilities(null, null);
    }

    public static WalletCapabilities bind(String artifactId, Ledger ledger) {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(ledger, "ledger");
        return new WalletCapabilities(artifactId, ledger);
    }

    public boolean isBound() {
        return artifactId != null;
    }

    public String artifactId() {
        return artifactId;
    }

    /**
     * Payments attempted so far, successful or not, in call order.
     */
    public List<Map<String, Object>> payments() {
        synchronized (payments) {
            return List.copyOf(payments);
        }
    }

    /**
     * Host-side implementation of {@code pay}.
     */
    public Map<String, Object> pay(String recipientId, long amount) {
        if (!isBound()) {
            throw new IllegalStateException("Wallet is not bound to an artifact");
        }
        Map<String, Object> result;
        if (recipientId == null || recipientId.isBlank()) {
            result = payment(false, amount, recipientId, "Recipient must be a non-empty principal id");
        } else if (amount <= 0) {
            result = payment(false, amount, recipientId, "Amount must be positive, got " + amount);
        } else if (ledger.transferScripCreatingRecipient(artifactId, recipientId, amount)) {
            result = payment(true, amount, recipientId, "");
        } else {
            result = payment(false, amount, recipientId,
                "Insufficient funds in artifact wallet (balance " + ledger.getScrip(artifactId) + ", requested " + amount + ")");
        }
        payments.add(result);
        LOG.debug("Wallet {} pay {} -> {}: {}", artifactId, amount, recipientId, result.get("success"));
        return result;
    }

    public long balance() {
        if (!isBound()) {
            throw new IllegalStateException("Wallet is not bound to an artifact");
        }
        return ledger.getScrip(artifactId);
    }

    void install(Context context, JsValues values) {
        if (!isBound()) {
            return;
        }
        Value bindings = context.getBindings("js");
        ProxyExecutable payFn = args -> values.toJs(payFromGuest(args));
        ProxyExecutable balanceFn = args -> balance();
        bindings.putMember(PAY, payFn);
        bindings.putMember(GET_BALANCE, balanceFn);
    }

    private Map<String, Object> payFromGuest(Value[] args) {
        if (args.length < 2) {
            Map<String, Object> result = payment(false, 0, null, "pay requires (recipient, amount)");
            payments.add(result);
            return result;
        }
        String recipient = args[0].isString() ? args[0].asString() : null;
        if (!args[1].isNumber() || !args[1].fitsInLong()) {
            Map<String, Object> result = payment(false, 0, recipient, "Amount must be an integer, got " + args[1]);
            payments.add(result);
            return result;
        }
        return pay(recipient, args[1].asLong());
    }

    private static Map<String, Object> payment(boolean success, long amount, String target, String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", success);
        result.put("amount", amount);
        result.put("target", target);
        result.put("error", error);
        return result;
    }
}
