package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.exception.ErrorKind;
import com.flagship.vault_ledger.exception.LedgerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that retargeting fields on an update must fit the transaction kind.
 */
class UpdateFieldRulesTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private static UpdateTransactionCommand.UpdateTransactionCommandBuilder command() {
        return UpdateTransactionCommand.builder()
            .vaultId(UUID.randomUUID())
            .transactionId(UUID.randomUUID())
            .userId("alice");
    }

    @Test
    @DisplayName("Entry kinds accept wallet and flow retargeting only")
    void testEntryKinds() {
        printTestHeader("Entry Kinds");

        for (TransactionKind kind : new TransactionKind[] {TransactionKind.INCOME, TransactionKind.EXPENSE, TransactionKind.REFUND}) {
            assertDoesNotThrow(() -> LedgerService.validateUpdateFields(kind,
                command().walletId(UUID.randomUUID()).flowId(UUID.randomUUID()).build()));

            LedgerException e = assertThrows(LedgerException.class, () -> LedgerService.validateUpdateFields(kind,
                command().fromWalletId(UUID.randomUUID()).build()));
            printExpectedException(e.getKind().name(), e.getDetail());
            assertEquals(ErrorKind.INVALID_AMOUNT, e.getKind());
            assertEquals("invalid update: unexpected transfer fields", e.getDetail());

            assertThrows(LedgerException.class, () -> LedgerService.validateUpdateFields(kind,
                command().toFlowId(UUID.randomUUID()).build()));
        }
    }

    @Test
    @DisplayName("Wallet transfers reject entry and flow-transfer fields")
    void testWalletTransfer() {
        printTestHeader("Wallet Transfer");

        assertDoesNotThrow(() -> LedgerService.validateUpdateFields(TransactionKind.TRANSFER_WALLET,
            command().fromWalletId(UUID.randomUUID()).toWalletId(UUID.randomUUID()).amountMinor(10L).build()));

        LedgerException e = assertThrows(LedgerException.class, () -> LedgerService.validateUpdateFields(
            TransactionKind.TRANSFER_WALLET, command().flowId(UUID.randomUUID()).build()));
        assertEquals("invalid update: unexpected wallet/flow fields", e.getDetail());

        assertThrows(LedgerException.class, () -> LedgerService.validateUpdateFields(
            TransactionKind.TRANSFER_WALLET, command().fromFlowId(UUID.randomUUID()).build()));
    }

    @Test
    @DisplayName("Flow transfers reject entry and wallet-transfer fields")
    void testFlowTransfer() {
        printTestHeader("Flow Transfer");

        assertDoesNotThrow(() -> LedgerService.validateUpdateFields(TransactionKind.TRANSFER_FLOW,
            command().toFlowId(UUID.randomUUID()).note("moved").build()));

        LedgerException e = assertThrows(LedgerException.class, () -> LedgerService.validateUpdateFields(
            TransactionKind.TRANSFER_FLOW, command().toWalletId(UUID.randomUUID()).build()));
        assertEquals("invalid update: unexpected wallet fields", e.getDetail());

        assertThrows(LedgerException.class, () -> LedgerService.validateUpdateFields(
            TransactionKind.TRANSFER_FLOW, command().walletId(UUID.randomUUID()).build()));
    }
}
