package com.flagship.vault_ledger.query;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.config.LedgerProperties;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.ledger.LedgerTransaction;
import com.flagship.vault_ledger.ledger.LegTarget;
import com.flagship.vault_ledger.ledger.TargetResolver;
import com.flagship.vault_ledger.vault.Vault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Read side of the ledger: transaction history of a vault, a cash flow or
 * a wallet, newest first, with opaque cursors.
 *
 * A page is complete and stable: following cursors from the first page
 * visits every matching row exactly once. Rows posted after the first page
 * sort before the cursor and are not reached by continuing forward.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionQueryService {

    private final AccessControlService access;
    private final TargetResolver targets;
    private final TransactionQueryStore queryStore;
    private final CursorCodec cursorCodec;
    private final LedgerProperties properties;

    @Transactional(readOnly = true)
    public List<TransactionListItem> listTransactionsForVault(UUID vaultId, String userId, Integer limit,
                                                              TransactionFilter filter) {
        return listTransactionsForVaultPage(vaultId, userId, limit, null, filter).getItems();
    }

    /**
     * @param limit page size, or null for the configured default
     * @param cursor token from a previous page, or null for the first page
     * @throws LedgerException KEY_NOT_FOUND without read access,
     *         INVALID_AMOUNT for a bad filter, limit or cursor
     */
    @Transactional(readOnly = true)
    public TransactionPage listTransactionsForVaultPage(UUID vaultId, String userId, Integer limit,
                                                        String cursor, TransactionFilter filter) {
        Vault vault = access.requireVaultRead(vaultId, userId);
        PageRequest request = pageRequest(limit, cursor, filter);
        List<TransactionListItem> rows =
            queryStore.findForVault(vault.getId(), request.filter, request.after, request.limit + 1);
        return toPage(rows, request.limit);
    }

    @Transactional(readOnly = true)
    public List<TransactionListItem> listTransactionsForFlow(UUID vaultId, UUID flowId, String userId,
                                                             Integer limit, TransactionFilter filter) {
        return listTransactionsForFlowPage(vaultId, flowId, userId, limit, null, filter).getItems();
    }

    /**
     * Items carry the signed amount of the leg on this flow. Flow members
     * without vault access may list their flow.
     */
    @Transactional(readOnly = true)
    public TransactionPage listTransactionsForFlowPage(UUID vaultId, UUID flowId, String userId, Integer limit,
                                                       String cursor, TransactionFilter filter) {
        access.requireFlowRead(vaultId, flowId, userId);
        PageRequest request = pageRequest(limit, cursor, filter);
        List<TransactionListItem> rows = queryStore.findForTarget(
            vaultId, LegTarget.flow(flowId), request.filter, request.after, request.limit + 1);
        return toPage(rows, request.limit);
    }

    @Transactional(readOnly = true)
    public List<TransactionListItem> listTransactionsForWallet(UUID vaultId, UUID walletId, String userId,
                                                               Integer limit, TransactionFilter filter) {
        return listTransactionsForWalletPage(vaultId, walletId, userId, limit, null, filter).getItems();
    }

    /**
     * Items carry the signed amount of the leg on this wallet.
     */
    @Transactional(readOnly = true)
    public TransactionPage listTransactionsForWalletPage(UUID vaultId, UUID walletId, String userId, Integer limit,
                                                         String cursor, TransactionFilter filter) {
        Vault vault = access.requireVaultRead(vaultId, userId);
        targets.requireWallet(vault, walletId);
        PageRequest request = pageRequest(limit, cursor, filter);
        List<TransactionListItem> rows = queryStore.findForTarget(
            vault.getId(), LegTarget.wallet(walletId), request.filter, request.after, request.limit + 1);
        return toPage(rows, request.limit);
    }

    private PageRequest pageRequest(Integer limit, String cursor, TransactionFilter filter) {
        TransactionFilter effective = filter != null ? filter : TransactionFilter.NONE;
        effective.validate();
        Cursor after = cursor != null ? cursorCodec.decode(cursor) : null;
        return new PageRequest(effectiveLimit(limit), after, effective);
    }

    int effectiveLimit(Integer requested) {
        LedgerProperties.Pagination pagination = properties.getPagination();
        if (requested == null) {
            return pagination.getDefaultLimit();
        }
        if (requested <= 0) {
            throw LedgerException.invalidAmount("limit must be > 0");
        }
        return Math.min(requested, pagination.getMaxLimit());
    }

    private TransactionPage toPage(List<TransactionListItem> rows, int limit) {
        if (rows.size() <= limit) {
            return new TransactionPage(rows, null);
        }
        List<TransactionListItem> items = rows.subList(0, limit);
        LedgerTransaction last = items.get(items.size() - 1).getTransaction();
        String next = cursorCodec.encode(new Cursor(last.getOccurredAt(), last.getId()));
        log.debug("Page of {} rows, more available after {}", limit, last.getId());
        return new TransactionPage(List.copyOf(items), next);
    }

    private static final class PageRequest {
        final int limit;
        final Cursor after;
        final TransactionFilter filter;

        PageRequest(int limit, Cursor after, TransactionFilter filter) {
            this.limit = limit;
            this.after = after;
            this.filter = filter;
        }
    }
}
