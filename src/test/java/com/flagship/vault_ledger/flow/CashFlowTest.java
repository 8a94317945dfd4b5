package com.flagship.vault_ledger.flow;

import com.flagship.vault_ledger.exception.ErrorKind;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.money.Currency;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the cap preview of cash flows.
 *
 * These tests verify that:
 * - Unlimited flows accept every change, including going negative
 * - Net caps bound the balance but never block a decrease
 * - Income caps bound cumulative income, and expenses do not free room
 */
class CashFlowTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    private static CashFlow flow(long balance, CapMode mode) {
        return CashFlow.builder()
            .id(UUID.randomUUID())
            .vaultId(UUID.randomUUID())
            .name("Vacation")
            .balance(balance)
            .capMode(mode)
            .currency(Currency.EUR)
            .build();
    }

    @Test
    @DisplayName("Unlimited flow applies any delta, including below zero")
    void testUnlimitedFlow() {
        printTestHeader("Unlimited Flow");

        // Given: an unlimited flow holding 10.00
        CashFlow flow = flow(1000, CapMode.unlimited());

        // When: an expense of 25.00 is booked
        CashFlow after = flow.applyLegChange(0, -2500);
        printOutput("Balance", after.getBalance());

        // Then: the balance goes negative
        assertEquals(-1500, after.getBalance());
        assertEquals(1000, flow.getBalance(), "Preview must not mutate the original");
    }

    @Test
    @DisplayName("Net cap rejects a change that takes the balance above the cap")
    void testNetCapRejectsOverflow() {
        printTestHeader("Net Cap Rejects Overflow");

        CashFlow flow = flow(900, CapMode.netCapped(1000));

        assertEquals(1000, flow.applyLegChange(0, 100).getBalance(), "Reaching the cap exactly is allowed");

        LedgerException e = assertThrows(LedgerException.class, () -> flow.applyLegChange(0, 101));
        printExpectedException(e.getKind().name(), e.getDetail());
        assertEquals(ErrorKind.MAX_BALANCE_REACHED, e.getKind());
        assertEquals("Vacation", e.getDetail());
    }

    @Test
    @DisplayName("Net cap never blocks a decrease, even when already above the cap")
    void testNetCapAllowsDecreaseAboveCap() {
        printTestHeader("Net Cap Allows Decrease Above Cap");

        // Given: a flow that sits above its cap (cap lowered after the fact)
        CashFlow flow = flow(1500, CapMode.netCapped(1000));

        // When/Then: spending from it is fine, adding to it is not
        assertEquals(1400, flow.applyLegChange(0, -100).getBalance());
        assertThrows(LedgerException.class, () -> flow.applyLegChange(0, 1));
    }

    @Test
    @DisplayName("Income cap counts only positive legs and ignores spending")
    void testIncomeCapIgnoresExpenses() {
        printTestHeader("Income Cap Ignores Expenses");

        // Given: income-capped at 100.00 with 80.00 already received and 50.00 spent
        CashFlow flow = flow(3000, CapMode.incomeCapped(10000, 8000));

        // When: spending another 20.00
        CashFlow spent = flow.applyLegChange(0, -2000);

        // Then: income total is unchanged
        assertEquals(1000, spent.getBalance());
        assertEquals(8000, spent.getCapMode().getIncomeTotal());

        // And: further income is bounded by what is left of the cap, not by the balance
        CashFlow topped = spent.applyLegChange(0, 2000);
        assertEquals(10000, topped.getCapMode().getIncomeTotal());
        LedgerException e = assertThrows(LedgerException.class, () -> spent.applyLegChange(0, 2001));
        printExpectedException(e.getKind().name(), "income total would be 100.01");
        assertEquals(ErrorKind.MAX_BALANCE_REACHED, e.getKind());
    }

    @Test
    @DisplayName("Voiding an income leg lowers the income total")
    void testIncomeCapVoidReleasesIncome() {
        printTestHeader("Income Cap Void Releases Income");

        CashFlow flow = flow(5000, CapMode.incomeCapped(10000, 5000));

        CashFlow after = flow.applyLegChange(5000, 0);

        assertEquals(0, after.getBalance());
        assertEquals(0, after.getCapMode().getIncomeTotal());
        assertTrue(after.getCapMode().isIncomeCapped());
    }

    @Test
    @DisplayName("Amending an income leg counts only the difference against the cap")
    void testIncomeCapAmendUsesDelta() {
        printTestHeader("Income Cap Amend Uses Delta");

        CashFlow flow = flow(9000, CapMode.incomeCapped(10000, 9000));

        CashFlow after = flow.applyLegChange(4000, 5000);
        assertEquals(10000, after.getBalance());
        assertEquals(10000, after.getCapMode().getIncomeTotal());

        assertThrows(LedgerException.class, () -> flow.applyLegChange(4000, 5001));
    }

    @Test
    @DisplayName("Cap mode construction rejects impossible combinations")
    void testCapModePreconditions() {
        printTestHeader("Cap Mode Preconditions");

        assertEquals(ErrorKind.INVALID_FLOW,
            assertThrows(LedgerException.class, () -> CapMode.netCapped(0)).getKind());
        assertEquals(ErrorKind.INVALID_FLOW,
            assertThrows(LedgerException.class, () -> CapMode.of(null, true, 0)).getKind());
        assertEquals(ErrorKind.INVALID_FLOW,
            assertThrows(LedgerException.class, () -> CapMode.fromColumns(null, 10L)).getKind());

        CapMode mode = CapMode.fromColumns(1000L, 250L);
        assertEquals(CapMode.Kind.INCOME_CAPPED, mode.getKind());
        assertEquals(1000L, mode.maxBalance());
        assertEquals(250L, mode.incomeBalance());
        assertNull(CapMode.netCapped(1000).incomeBalance());
        assertNull(CapMode.unlimited().maxBalance());
    }
}
