package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.LedgerTestSupport;
import com.flagship.vault_ledger.exception.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rebuilding cached balances from legs.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class BalanceRecomputeServiceTest extends LedgerTestSupport {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private BalanceRecomputeService recomputeService;

    @Test
    @DisplayName("Drifted wallet, flow and income totals are rebuilt from non-voided legs")
    void testRecomputeRepairsDrift() {
        printTestHeader("Recompute Repairs Drift");

        // Given: a consistent vault
        String owner = newUser("owner");
        UUID vaultId = newVault(owner);
        UUID cashId = cash(vaultId, owner).getId();
        UUID unallocatedId = unallocated(vaultId, owner).getId();
        UUID savings = cashFlowService.newCashFlow(vaultId, owner, "Savings", 0, 10000L, true);
        ledgerService.income(entry(vaultId, owner, 5000).build());
        ledgerService.transferFlow(transfer(vaultId, owner, 2000, unallocatedId, savings).build());
        UUID voided = ledgerService.income(entry(vaultId, owner, 700).flowId(savings).build());
        ledgerService.voidTransaction(vaultId, voided, owner);
        ledgerService.expense(entry(vaultId, owner, 500).flowId(savings).build());

        assertEquals(0, recomputeService.recomputeBalances(vaultId, owner), "Nothing to repair yet");

        // When: the cached columns are corrupted behind the engine's back
        jdbcTemplate.update("UPDATE wallets SET balance = 1 WHERE id = ?", cashId);
        jdbcTemplate.update("UPDATE cash_flows SET balance = 2, income_balance = 9999 WHERE id = ?", savings);
        printInput("Corrupted wallet balance", walletBalance(vaultId, owner, cashId));

        int corrected = recomputeService.recomputeBalances(vaultId, owner);
        printOutput("Corrected rows", corrected);

        // Then: both rows are repaired from the legs
        assertEquals(2, corrected);
        assertEquals(4500, walletBalance(vaultId, owner, cashId));
        assertEquals(1500, flowBalance(vaultId, owner, savings));
        assertEquals(2000L, cashFlowService.cashFlow(vaultId, owner, savings).getCapMode().incomeBalance());
        assertEquals(3000, flowBalance(vaultId, owner, unallocatedId));

        // And: only writers may trigger it
        String viewer = newUser("viewer");
        membershipService.upsertVaultMember(vaultId, owner, viewer, "viewer");
        assertLedgerError(ErrorKind.KEY_NOT_FOUND, () -> recomputeService.recomputeBalances(vaultId, viewer));
    }

    @Test
    @DisplayName("Recompute waits for an in-flight posting and keeps its amount")
    void testRecomputeWaitsForConcurrentPosting() throws Exception {
        printTestHeader("Recompute During Posting");

        // Given: a wallet whose cached balance has drifted by one cent
        String owner = newUser("owner");
        UUID vaultId = newVault(owner);
        UUID cashId = cash(vaultId, owner).getId();
        ledgerService.income(entry(vaultId, owner, 1000).build());
        jdbcTemplate.update("UPDATE wallets SET balance = 999 WHERE id = ?", cashId);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch posted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        TransactionTemplate transactionTemplate = new TransactionTemplate(transactionManager);

        try {
            // When: a posting has written its leg but not committed yet
            Future<?> posting = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                ledgerService.income(entry(vaultId, owner, 200).build());
                posted.countDown();
                try {
                    assertTrue(release.await(10, TimeUnit.SECONDS));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(posted.await(10, TimeUnit.SECONDS));

            Future<Integer> recompute = executor.submit(() -> recomputeService.recomputeBalances(vaultId, owner));
            Thread.sleep(500);
            assertFalse(recompute.isDone(), "Recompute must wait for the locked wallet row");

            release.countDown();
            posting.get(10, TimeUnit.SECONDS);
            int corrected = recompute.get(10, TimeUnit.SECONDS);
            printOutput("Corrected rows", corrected);

            // Then: the repair sees the committed leg instead of overwriting it
            assertEquals(1, corrected);
            assertEquals(1200, walletBalance(vaultId, owner, cashId));
            assertEquals(1200L, jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(l.amount_minor), 0) FROM legs l JOIN transactions t ON t.id = l.transaction_id "
                    + "WHERE l.target_kind = 'wallet' AND l.target_id = ? AND t.voided_at IS NULL",
                Long.class, cashId));
            printSuccess("Balance matches legs after concurrent repair");
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
