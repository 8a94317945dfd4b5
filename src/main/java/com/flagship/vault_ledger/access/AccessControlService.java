package com.flagship.vault_ledger.access;

import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.flow.CashFlowStore;
import com.flagship.vault_ledger.membership.FlowMembershipEntity;
import com.flagship.vault_ledger.membership.FlowMembershipRepository;
import com.flagship.vault_ledger.membership.Role;
import com.flagship.vault_ledger.membership.VaultMembershipEntity;
import com.flagship.vault_ledger.membership.VaultMembershipRepository;
import com.flagship.vault_ledger.vault.Vault;
import com.flagship.vault_ledger.vault.VaultStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Access gate consulted by every engine operation.
 *
 * Rules:
 * 1. The vault owner ({@code vaults.user_id}) can read and write everything.
 * 2. A vault membership grants read; owner/editor roles also grant write.
 * 3. For a single non-system flow, a flow membership grants the same rights
 *    to users without vault-level access.
 *
 * A denial is reported exactly like a missing row (KEY_NOT_FOUND), so callers
 * cannot probe for vaults or flows they cannot see.
 *
 * Must run inside the caller's transaction: it only reads.
 */
@Service
@RequiredArgsConstructor
public class AccessControlService {

    static final String VAULT_NOT_EXISTS = "vault not exists";
    static final String FLOW_NOT_EXISTS = "cash_flow not exists";

    private final VaultStore vaultStore;
    private final CashFlowStore cashFlowStore;
    private final VaultMembershipRepository vaultMembershipRepository;
    private final FlowMembershipRepository flowMembershipRepository;

    /**
     * @return the vault if the user owns it or is a member of it
     * @throws LedgerException KEY_NOT_FOUND otherwise
     */
    public Vault requireVaultRead(UUID vaultId, String userId) {
        Vault vault = findVault(vaultId);
        if (!canRead(vault, userId)) {
            throw LedgerException.keyNotFound(VAULT_NOT_EXISTS);
        }
        return vault;
    }

    /**
     * @return the vault if the user owns it or has an owner/editor membership
     * @throws LedgerException KEY_NOT_FOUND otherwise
     */
    public Vault requireVaultWrite(UUID vaultId, String userId) {
        Vault vault = findVault(vaultId);
        if (!canWrite(vault, userId)) {
            throw LedgerException.keyNotFound(VAULT_NOT_EXISTS);
        }
        return vault;
    }

    /**
     * Only the user recorded as the vault owner passes; an "owner" membership
     * row does not.
     */
    public Vault requireVaultOwner(UUID vaultId, String userId) {
        Vault vault = findVault(vaultId);
        if (!vault.isOwnedBy(userId)) {
            throw LedgerException.keyNotFound(VAULT_NOT_EXISTS);
        }
        return vault;
    }

    /**
     * Resolves a vault by name among the vaults the user can read.
     *
     * @throws LedgerException INVALID_AMOUNT if several visible vaults share the name
     */
    public Vault requireVaultReadByName(String name, String userId) {
        String normalized = name == null ? "" : name.trim();
        if (normalized.isEmpty()) {
            throw LedgerException.invalidAmount("vault name must not be empty");
        }
        List<Vault> candidates = vaultStore.findVisibleByName(normalized, userId);
        if (candidates.isEmpty()) {
            throw LedgerException.keyNotFound(VAULT_NOT_EXISTS);
        }
        if (candidates.size() > 1) {
            throw LedgerException.invalidAmount("ambiguous vault name");
        }
        return candidates.get(0);
    }

    /**
     * Read gate of the transaction detail view: a caller who is neither owner
     * nor member is told FORBIDDEN instead of KEY_NOT_FOUND.
     */
    public Vault requireVaultReadOrForbidden(UUID vaultId, String userId) {
        Vault vault = findVault(vaultId);
        if (!canRead(vault, userId)) {
            throw LedgerException.forbidden("forbidden");
        }
        return vault;
    }

    /**
     * Write gate for moving money between flows: vault write access, or
     * flow write access on every listed flow.
     */
    public Vault requireFlowsWrite(UUID vaultId, List<UUID> flowIds, String userId) {
        Vault vault = findVault(vaultId);
        if (canWrite(vault, userId)) {
            for (UUID flowId : flowIds) {
                cashFlowStore.findInVault(vaultId, flowId)
                    .orElseThrow(() -> LedgerException.keyNotFound(FLOW_NOT_EXISTS));
            }
            return vault;
        }
        for (UUID flowId : flowIds) {
            requireFlowWrite(vaultId, flowId, userId);
        }
        return vault;
    }

    /**
     * The flow must belong to the vault. Vault read access suffices;
     * otherwise any flow membership does.
     */
    public CashFlow requireFlowRead(UUID vaultId, UUID flowId, String userId) {
        CashFlow flow = cashFlowStore.findInVault(vaultId, flowId)
            .orElseThrow(() -> LedgerException.keyNotFound(FLOW_NOT_EXISTS));
        if (hasVaultRead(vaultId, userId)) {
            return flow;
        }
        flowRole(flow, userId).orElseThrow(() -> LedgerException.keyNotFound(FLOW_NOT_EXISTS));
        return flow;
    }

    /**
     * Vault write access, or a flow membership with a writing role.
     */
    public CashFlow requireFlowWrite(UUID vaultId, UUID flowId, String userId) {
        CashFlow flow = requireFlowRead(vaultId, flowId, userId);
        if (hasVaultWrite(vaultId, userId)) {
            return flow;
        }
        Role role = flowRole(flow, userId)
            .orElseThrow(() -> LedgerException.keyNotFound(FLOW_NOT_EXISTS));
        if (!role.canWrite()) {
            throw LedgerException.keyNotFound(FLOW_NOT_EXISTS);
        }
        return flow;
    }

    public boolean hasVaultRead(UUID vaultId, String userId) {
        return vaultStore.findById(vaultId).map(vault -> canRead(vault, userId)).orElse(false);
    }

    public boolean hasVaultWrite(UUID vaultId, String userId) {
        return vaultStore.findById(vaultId).map(vault -> canWrite(vault, userId)).orElse(false);
    }

    private Vault findVault(UUID vaultId) {
        return vaultStore.findById(vaultId)
            .orElseThrow(() -> LedgerException.keyNotFound(VAULT_NOT_EXISTS));
    }

    private boolean canRead(Vault vault, String userId) {
        return vault.isOwnedBy(userId) || vaultRole(vault.getId(), userId).isPresent();
    }

    private boolean canWrite(Vault vault, String userId) {
        return vault.isOwnedBy(userId) || vaultRole(vault.getId(), userId).map(Role::canWrite).orElse(false);
    }

    private Optional<Role> vaultRole(UUID vaultId, String userId) {
        return vaultMembershipRepository.findByVaultIdAndUserId(vaultId, userId)
            .map(VaultMembershipEntity::getRole);
    }

    private Optional<Role> flowRole(CashFlow flow, String userId) {
        // The system flow is only reachable through vault-level access
        if (flow.isSystem()) {
            return Optional.empty();
        }
        return flowMembershipRepository.findByFlowIdAndUserId(flow.getId(), userId)
            .map(FlowMembershipEntity::getRole);
    }
}
