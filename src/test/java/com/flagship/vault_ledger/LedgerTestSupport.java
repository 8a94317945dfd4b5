package com.flagship.vault_ledger;

import com.flagship.vault_ledger.exception.ErrorKind;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.flow.CashFlowService;
import com.flagship.vault_ledger.ledger.EntryCommand;
import com.flagship.vault_ledger.ledger.LedgerService;
import com.flagship.vault_ledger.ledger.TransferCommand;
import com.flagship.vault_ledger.membership.MembershipService;
import com.flagship.vault_ledger.query.TransactionQueryService;
import com.flagship.vault_ledger.user.UserService;
import com.flagship.vault_ledger.vault.VaultService;
import com.flagship.vault_ledger.vault.VaultSnapshot;
import com.flagship.vault_ledger.wallet.Wallet;
import com.flagship.vault_ledger.wallet.WalletService;
import org.junit.jupiter.api.function.Executable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Shared services, fixtures and console output for the database-backed tests.
 *
 * Each test works on fresh users and vaults, so tests of one class share the
 * database without seeing each other's rows. Subclasses declare their own
 * PostgreSQL container.
 */
public abstract class LedgerTestSupport {

    @Autowired
    protected UserService userService;

    @Autowired
    protected VaultService vaultService;

    @Autowired
    protected WalletService walletService;

    @Autowired
    protected CashFlowService cashFlowService;

    @Autowired
    protected LedgerService ledgerService;

    @Autowired
    protected MembershipService membershipService;

    @Autowired
    protected TransactionQueryService queryService;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected PlatformTransactionManager transactionManager;

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    protected LedgerException assertLedgerError(ErrorKind kind, Executable executable) {
        LedgerException e = assertThrows(LedgerException.class, executable);
        printExpectedException(e.getKind().name(), e.getDetail());
        assertEquals(kind, e.getKind(), "Unexpected error: " + e.getMessage());
        return e;
    }

    /**
     * Runs {@code first} in a transaction that stays open until {@code second}
     * has been blocked on it for a while, then commits and returns the error
     * {@code second} ended with.
     */
    protected LedgerException assertLosesRace(Runnable first, Runnable second) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch written = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);
        try {
            Future<?> holder = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                first.run();
                written.countDown();
                try {
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(written.await(10, TimeUnit.SECONDS));

            Future<?> loser = executor.submit(second);
            Thread.sleep(500);
            assertFalse(loser.isDone(), "Second writer should wait on the first one's row");

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
            ExecutionException failure = assertThrows(ExecutionException.class, () -> loser.get(10, TimeUnit.SECONDS));
            LedgerException e = assertInstanceOf(LedgerException.class, failure.getCause(),
                "Unexpected failure: " + failure.getCause());
            printExpectedException(e.getKind().name(), e.getDetail());
            return e;
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    protected String newUser(String prefix) {
        return userService.createUser(prefix + "-" + UUID.randomUUID().toString().substring(0, 8));
    }

    protected UUID newVault(String owner) {
        return vaultService.newVault("Home", owner, null);
    }

    protected VaultSnapshot snapshot(UUID vaultId, String userId) {
        return vaultService.vaultSnapshot(vaultId, userId);
    }

    protected Wallet cash(UUID vaultId, String userId) {
        return snapshot(vaultId, userId).getWallets().stream()
            .filter(w -> w.getName().equals(Wallet.DEFAULT_NAME))
            .findFirst()
            .orElseThrow();
    }

    protected CashFlow unallocated(UUID vaultId, String userId) {
        return snapshot(vaultId, userId).getFlows().stream()
            .filter(CashFlow::isUnallocated)
            .findFirst()
            .orElseThrow();
    }

    protected long walletBalance(UUID vaultId, String userId, UUID walletId) {
        return walletService.wallet(vaultId, userId, walletId).getBalance();
    }

    protected long flowBalance(UUID vaultId, String userId, UUID flowId) {
        return cashFlowService.cashFlow(vaultId, userId, flowId).getBalance();
    }

    protected EntryCommand.EntryCommandBuilder entry(UUID vaultId, String userId, long amountMinor) {
        return EntryCommand.builder().vaultId(vaultId).userId(userId).amountMinor(amountMinor);
    }

    protected TransferCommand.TransferCommandBuilder transfer(UUID vaultId, String userId, long amountMinor,
                                                              UUID fromId, UUID toId) {
        return TransferCommand.builder()
            .vaultId(vaultId)
            .userId(userId)
            .amountMinor(amountMinor)
            .fromId(fromId)
            .toId(toId);
    }
}
