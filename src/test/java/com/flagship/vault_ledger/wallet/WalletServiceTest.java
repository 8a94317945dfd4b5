package com.flagship.vault_ledger.wallet;

import com.flagship.vault_ledger.LedgerTestSupport;
import com.flagship.vault_ledger.exception.ErrorKind;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.query.TransactionListItem;
import com.flagship.vault_ledger.query.TransactionFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for wallet lifecycle and opening balances.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class WalletServiceTest extends LedgerTestSupport {

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

    private String owner;
    private UUID vaultId;
    private UUID unallocatedId;

    @BeforeEach
    void setUp() {
        owner = newUser("owner");
        vaultId = newVault(owner);
        unallocatedId = unallocated(vaultId, owner).getId();
    }

    @Test
    @DisplayName("Positive opening balance is booked as income, negative as expense")
    void testOpeningBalances() {
        printTestHeader("Opening Balances");

        // When: opening a bank account with 120.00 and a credit card at -45.50
        UUID bank = walletService.newWallet(vaultId, owner, "Bank", 12000);
        UUID card = walletService.newWallet(vaultId, owner, "Card", -4550);

        // Then: balances and Unallocated follow
        assertEquals(12000, walletBalance(vaultId, owner, bank));
        assertEquals(-4550, walletBalance(vaultId, owner, card));
        assertEquals(7450, flowBalance(vaultId, owner, unallocatedId));

        List<TransactionListItem> bankHistory =
            queryService.listTransactionsForWallet(vaultId, bank, owner, null, TransactionFilter.NONE);
        assertEquals(1, bankHistory.size());
        printOutput("Opening transaction", bankHistory.get(0).getTransaction());
        assertEquals("opening", bankHistory.get(0).getTransaction().getCategory());
        assertEquals("opening balance for wallet 'Bank'", bankHistory.get(0).getTransaction().getNote());

        List<TransactionListItem> cardHistory =
            queryService.listTransactionsForWallet(vaultId, card, owner, null, TransactionFilter.NONE);
        assertEquals(-4550, cardHistory.get(0).getSignedAmountMinor());

        // And: a zero opening books nothing
        UUID jar = walletService.newWallet(vaultId, owner, "Jar", 0);
        assertTrue(queryService.listTransactionsForWallet(vaultId, jar, owner, null, null).isEmpty());
    }

    @Test
    @DisplayName("Wallet names are trimmed and unique per vault ignoring case")
    void testWalletNames() {
        printTestHeader("Wallet Names");

        UUID bank = walletService.newWallet(vaultId, owner, "  Bank ", 0);
        assertEquals("Bank", walletService.wallet(vaultId, owner, bank).getName());

        assertEquals("cash", assertLedgerError(ErrorKind.EXISTING_KEY,
            () -> walletService.newWallet(vaultId, owner, "cash", 0)).getDetail());
        assertLedgerError(ErrorKind.EXISTING_KEY, () -> walletService.renameWallet(vaultId, owner, bank, "CASH"));
        assertLedgerError(ErrorKind.INVALID_AMOUNT, () -> walletService.newWallet(vaultId, owner, " ", 0));

        walletService.renameWallet(vaultId, owner, bank, "Checking");
        assertEquals("Checking", walletService.wallet(vaultId, owner, bank).getName());
    }

    @Test
    @DisplayName("Wallets of other vaults and users are not reachable")
    void testWalletAccess() {
        printTestHeader("Wallet Access");

        String stranger = newUser("stranger");
        UUID otherVault = newVault(stranger);
        UUID foreignCash = cash(otherVault, stranger).getId();

        assertLedgerError(ErrorKind.KEY_NOT_FOUND, () -> walletService.wallet(vaultId, owner, foreignCash));
        assertLedgerError(ErrorKind.KEY_NOT_FOUND, () -> walletService.newWallet(vaultId, stranger, "Mine", 0));
        assertLedgerError(ErrorKind.KEY_NOT_FOUND,
            () -> walletService.setWalletArchived(vaultId, owner, foreignCash, true));
    }

    @Test
    @DisplayName("Concurrent creates of the same wallet name end in EXISTING_KEY for the loser")
    void testConcurrentDuplicateName() throws Exception {
        printTestHeader("Concurrent Duplicate Wallet");

        // Given/When: one create holds an uncommitted "Card" row while a second create of "card" runs
        LedgerException error = assertLosesRace(
            () -> walletService.newWallet(vaultId, owner, "Card", 0),
            () -> walletService.newWallet(vaultId, owner, "card", 0));

        // Then: the unique index violation is reported as a duplicate name, and one wallet exists
        assertEquals(ErrorKind.EXISTING_KEY, error.getKind());
        assertEquals(1, jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM wallets WHERE vault_id = ? AND LOWER(name) = 'card'", Integer.class, vaultId));
    }
}
