package work.ecology.kernel.sandbox;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import work.ecology.kernel.ledger.Ledger;

class WalletCapabilitiesTest {
    private static SandboxedExecutor executor;

    @BeforeAll
    static void startExecutor() {
        executor = new SandboxedExecutor();
    }

    @AfterAll
    static void stopExecutor() {
        executor.close();
    }

    @Test
    void artifactPaysFromItsOwnBalance() {
        var ledger = new Ledger();
        ledger.createPrincipal("c", 100);

        var result = executor.executeWithWallet("function run(target) { return pay(target, 50); }", List.of("alice"), "c", ledger);

        assertTrue(result.success(), result::error);
        assertEquals(50, ledger.getScrip("c"));
        assertEquals(50, ledger.getScrip("alice"));
        Map<?, ?> payment = (Map<?, ?>) result.result();
        assertEquals(true, payment.get("success"));
        assertEquals(1, result.payments().size());
    }

    @Test
    void overdraftFailsInsideSuccessfulRun() {
        var ledger = new Ledger();
        ledger.createPrincipal("c", 10);

        var result = executor.executeWithWallet("function run() { return pay('alice', 50); }", List.of(), "c", ledger);

        assertTrue(result.success(), result::error);
        Map<?, ?> payment = (Map<?, ?>) result.result();
        assertEquals(false, payment.get("success"));
        assertTrue(String.valueOf(payment.get("error")).contains("Insufficient funds"));
        assertEquals(10, ledger.getScrip("c"));
        assertFalse(ledger.hasPrincipal("alice"));
    }

    @Test
    void walletCannotTouchOtherBalances() {
        var ledger = new Ledger();
        ledger.createPrincipal("whale", 10_000);
        ledger.createPrincipal("c", 0);

        var result = executor.executeWithWallet(
            "function run() { return [pay('whale', -5).success, pay('attacker', 500).success, get_balance()]; }",
            List.of(), "c", ledger);

        assertTrue(result.success(), result::error);
        assertEquals(List.of(false, false, 0), result.result());
        assertEquals(10_000, ledger.getScrip("whale"));
        assertEquals(0, ledger.getScrip("c"));
        assertEquals(0, ledger.getScrip("attacker"));
    }

    @Test
    void sequentialPaymentsSeeEarlierDebits() {
        var ledger = new Ledger();
        ledger.createPrincipal("c", 100);

        var result = executor.executeWithWallet(
            "function run() { const a = pay('x', 60); const b = pay('y', 60); return [a.success, b.success, get_balance()]; }",
            List.of(), "c", ledger);

        assertTrue(result.success(), result::error);
        assertEquals(List.of(true, false, 40), result.result());
        assertEquals(2, result.payments().size());
        assertEquals(100, ledger.totalScrip());
    }

    @Test
    void fractionalAmountIsRefused() {
        var ledger = new Ledger();
        ledger.createPrincipal("c", 100);

        var result = executor.executeWithWallet("function run() { return pay('x', 1.5); }", List.of(), "c", ledger);

        assertTrue(result.success(), result::error);
        Map<?, ?> payment = (Map<?, ?>) result.result();
        assertEquals(false, payment.get("success"));
        assertTrue(String.valueOf(payment.get("error")).startsWith("Amount must be an integer"));
        assertEquals(100, ledger.getScrip("c"));
    }

    @Test
    void hostSideWalletGuardsUnboundUse() {
        var unbound = WalletCapabilities.unbound();
        assertFalse(unbound.isBound());
        assertThrows(IllegalStateException.class, () -> unbound.pay("x", 1));

        var ledger = new Ledger();
        ledger.createPrincipal("c", 5);
        var wallet = WalletCapabilities.bind("c", ledger);
        assertTrue(wallet.isBound());
        assertEquals(true, wallet.pay("d", 5).get("success"));
        assertEquals(false, wallet.pay("d", 1).get("success"));
        assertEquals(0, wallet.balance());
        assertEquals(2, wallet.payments().size());
    }
}
