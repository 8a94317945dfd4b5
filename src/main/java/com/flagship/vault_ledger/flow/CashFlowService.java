package com.flagship.vault_ledger.flow;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.ledger.LedgerService;
import com.flagship.vault_ledger.ledger.TargetResolver;
import com.flagship.vault_ledger.ledger.TransferCommand;
import com.flagship.vault_ledger.support.Texts;
import com.flagship.vault_ledger.vault.Vault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Service for managing cash flows and their cap modes.
 *
 * The system flow "Unallocated" cannot be renamed, archived, deleted or
 * capped; every such request fails with INVALID_FLOW.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashFlowService {

    private final CashFlowStore cashFlowStore;
    private final AccessControlService access;
    private final TargetResolver targets;
    private final LedgerService ledgerService;

    /**
     * Creates a cash flow.
     *
     * A positive opening balance is allocated from Unallocated with a flow
     * transfer, so it is subject to the new flow's cap.
     *
     * @param openingBalanceMinor initial allocation, must be >= 0
     * @param maxBalance cap, or null for an unlimited flow
     * @param incomeCapped whether the cap bounds cumulative income instead of the balance
     * @return id of the new flow
     * @throws LedgerException INVALID_FLOW for the reserved name or an invalid mode,
     *         EXISTING_KEY for a duplicate name, MAX_BALANCE_REACHED if the opening
     *         allocation exceeds the cap
     */
    @Transactional
    public UUID newCashFlow(UUID vaultId, String userId, String name, long openingBalanceMinor,
                            Long maxBalance, boolean incomeCapped) {
        Vault vault = access.requireVaultWrite(vaultId, userId);
        String normalized = requireUsableName(name);
        if (openingBalanceMinor < 0) {
            throw LedgerException.invalidFlow("flow balance must be >= 0");
        }
        CapMode mode = CapMode.of(maxBalance, incomeCapped, 0L);
        if (cashFlowStore.existsByName(vaultId, normalized, null)) {
            throw LedgerException.existingKey(normalized);
        }

        CashFlow flow = CashFlow.builder()
            .id(UUID.randomUUID())
            .vaultId(vaultId)
            .name(normalized)
            .balance(0L)
            .capMode(mode)
            .currency(vault.getCurrency())
            .archived(false)
            .build();
        try {
            cashFlowStore.insert(flow);
        } catch (DuplicateKeyException e) {
            throw LedgerException.existingKey(normalized);
        }

        if (openingBalanceMinor > 0) {
            ledgerService.transferFlow(TransferCommand.builder()
                .vaultId(vaultId)
                .userId(userId)
                .amountMinor(openingBalanceMinor)
                .fromId(targets.unallocated(vault).getId())
                .toId(flow.getId())
                .note("opening allocation for flow '" + normalized + "'")
                .build());
        }

        log.info("Cash flow created: vault={}, name={}, mode={}", vaultId, normalized, mode);
        return flow.getId();
    }

    @Transactional
    public void renameCashFlow(UUID vaultId, String userId, UUID flowId, String newName) {
        CashFlow flow = access.requireFlowWrite(vaultId, flowId, userId);
        requireNotSystem(flow, "rename");
        String normalized = requireUsableName(newName);
        if (cashFlowStore.existsByName(vaultId, normalized, flowId)) {
            throw LedgerException.existingKey(normalized);
        }
        try {
            cashFlowStore.rename(flowId, normalized);
        } catch (DuplicateKeyException e) {
            throw LedgerException.existingKey(normalized);
        }
    }

    @Transactional
    public void setCashFlowArchived(UUID vaultId, String userId, UUID flowId, boolean archived) {
        CashFlow flow = access.requireFlowWrite(vaultId, flowId, userId);
        requireNotSystem(flow, "archive");
        cashFlowStore.setArchived(flowId, archived);
    }

    /**
     * Changes the cap mode of a flow.
     *
     * Switching to a net cap requires the current balance to fit. Switching
     * to an income cap recomputes the income total from the flow's positive,
     * non-voided legs and requires that total to fit.
     *
     * @throws LedgerException INVALID_FLOW for an income cap without cap, a
     *         non-positive cap or the system flow; MAX_BALANCE_REACHED if the
     *         flow already exceeds the new cap
     */
    @Transactional
    public void setCashFlowMode(UUID vaultId, String userId, UUID flowId, Long maxBalance, boolean incomeCapped) {
        access.requireFlowWrite(vaultId, flowId, userId);
        CashFlow flow = cashFlowStore.findInVaultForUpdate(vaultId, flowId)
            .orElseThrow(() -> LedgerException.keyNotFound("cash_flow not exists"));
        requireNotSystem(flow, "cap");

        CapMode mode;
        if (maxBalance != null && incomeCapped) {
            long incomeTotal = cashFlowStore.sumActivePositiveLegs(flowId);
            mode = CapMode.incomeCapped(maxBalance, incomeTotal);
            if (incomeTotal > maxBalance) {
                throw LedgerException.maxBalanceReached(flow.getName());
            }
        } else {
            mode = CapMode.of(maxBalance, incomeCapped, 0L);
            if (maxBalance != null && flow.getBalance() > maxBalance) {
                throw LedgerException.maxBalanceReached(flow.getName());
            }
        }

        cashFlowStore.updateBalances(flow.toBuilder().capMode(mode).build());
        log.info("Cash flow mode changed: flow={}, mode={}", flow.getName(), mode);
    }

    /**
     * Removes a flow.
     *
     * @param archive true to archive it instead; a hard delete requires the
     *        flow to have no legs
     */
    @Transactional
    public void deleteCashFlow(UUID vaultId, String userId, UUID flowId, boolean archive) {
        CashFlow flow = access.requireFlowWrite(vaultId, flowId, userId);
        requireNotSystem(flow, "delete");
        if (archive) {
            cashFlowStore.setArchived(flowId, true);
            return;
        }
        if (cashFlowStore.countLegs(flowId) > 0) {
            throw LedgerException.invalidFlow("cash_flow has transactions");
        }
        cashFlowStore.delete(flowId);
        log.info("Cash flow deleted: vault={}, name={}", vaultId, flow.getName());
    }

    @Transactional(readOnly = true)
    public CashFlow cashFlow(UUID vaultId, String userId, UUID flowId) {
        return access.requireFlowRead(vaultId, flowId, userId);
    }

    @Transactional(readOnly = true)
    public CashFlow cashFlowByName(UUID vaultId, String userId, String name) {
        String normalized = Texts.requireName(name, "cash_flow");
        CashFlow flow = cashFlowStore.findByName(vaultId, normalized)
            .orElseThrow(() -> LedgerException.keyNotFound("cash_flow not exists"));
        return access.requireFlowRead(vaultId, flow.getId(), userId);
    }

    private static String requireUsableName(String name) {
        String normalized = Texts.requireName(name, "cash_flow");
        if (normalized.equalsIgnoreCase(CashFlow.UNALLOCATED_NAME)) {
            throw LedgerException.invalidFlow("flow name is reserved");
        }
        return normalized;
    }

    private static void requireNotSystem(CashFlow flow, String action) {
        if (flow.isSystem()) {
            throw LedgerException.invalidFlow("cannot " + action + " Unallocated");
        }
    }
}
