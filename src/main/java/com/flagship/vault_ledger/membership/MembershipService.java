package com.flagship.vault_ledger.membership;

import com.flagship.vault_ledger.access.AccessControlService;
import com.flagship.vault_ledger.exception.LedgerException;
import com.flagship.vault_ledger.flow.CashFlow;
import com.flagship.vault_ledger.ledger.TargetResolver;
import com.flagship.vault_ledger.user.UserService;
import com.flagship.vault_ledger.vault.Vault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Service for sharing vaults and single cash flows with other users.
 *
 * Only the vault owner manages memberships. The Unallocated flow is never
 * shared on its own: it is reachable through vault-level access only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MembershipService {

    private final VaultMembershipRepository vaultMembershipRepository;
    private final FlowMembershipRepository flowMembershipRepository;
    private final AccessControlService access;
    private final TargetResolver targets;
    private final UserService userService;

    /**
     * Grants or changes a user's role on the vault.
     *
     * @param role one of owner, editor, viewer
     * @throws LedgerException INVALID_AMOUNT for an unknown role,
     *         KEY_NOT_FOUND for an unknown user
     */
    @Transactional
    public void upsertVaultMember(UUID vaultId, String ownerUserId, String memberUserId, String role) {
        access.requireVaultOwner(vaultId, ownerUserId);
        Role parsed = Role.parse(role);
        userService.requireUser(memberUserId);

        VaultMembershipEntity membership = vaultMembershipRepository.findByVaultIdAndUserId(vaultId, memberUserId)
            .orElse(null);
        if (membership == null) {
            membership = new VaultMembershipEntity(vaultId, memberUserId, parsed);
        } else {
            membership.changeRole(parsed);
        }
        vaultMembershipRepository.saveAndFlush(membership);
        log.info("Vault member set: vault={}, user={}, role={}", vaultId, memberUserId, parsed.dbValue());
    }

    /**
     * @throws LedgerException INVALID_AMOUNT when trying to remove the vault owner
     */
    @Transactional
    public void removeVaultMember(UUID vaultId, String ownerUserId, String memberUserId) {
        Vault vault = access.requireVaultOwner(vaultId, ownerUserId);
        if (vault.isOwnedBy(memberUserId)) {
            throw LedgerException.invalidAmount("cannot remove vault owner");
        }
        vaultMembershipRepository.findByVaultIdAndUserId(vaultId, memberUserId)
            .ifPresent(vaultMembershipRepository::delete);
        vaultMembershipRepository.flush();
        log.info("Vault member removed: vault={}, user={}", vaultId, memberUserId);
    }

    @Transactional(readOnly = true)
    public List<Member> listVaultMembers(UUID vaultId, String ownerUserId) {
        access.requireVaultOwner(vaultId, ownerUserId);
        return vaultMembershipRepository.findByVaultIdOrderByUserIdAsc(vaultId).stream()
            .map(m -> new Member(m.getUserId(), m.getRole()))
            .toList();
    }

    /**
     * Grants or changes a user's role on one cash flow.
     *
     * @throws LedgerException INVALID_FLOW for the Unallocated flow
     */
    @Transactional
    public void upsertFlowMember(UUID vaultId, String ownerUserId, UUID flowId, String memberUserId, String role) {
        Vault vault = access.requireVaultOwner(vaultId, ownerUserId);
        CashFlow flow = targets.requireFlow(vault, flowId);
        if (flow.isSystem()) {
            throw LedgerException.invalidFlow("cannot share Unallocated");
        }
        Role parsed = Role.parse(role);
        userService.requireUser(memberUserId);

        FlowMembershipEntity membership = flowMembershipRepository.findByFlowIdAndUserId(flowId, memberUserId)
            .orElse(null);
        if (membership == null) {
            membership = new FlowMembershipEntity(flowId, memberUserId, parsed);
        } else {
            membership.changeRole(parsed);
        }
        flowMembershipRepository.saveAndFlush(membership);
        log.info("Flow member set: flow={}, user={}, role={}", flow.getName(), memberUserId, parsed.dbValue());
    }

    @Transactional
    public void removeFlowMember(UUID vaultId, String ownerUserId, UUID flowId, String memberUserId) {
        Vault vault = access.requireVaultOwner(vaultId, ownerUserId);
        targets.requireFlow(vault, flowId);
        flowMembershipRepository.findByFlowIdAndUserId(flowId, memberUserId)
            .ifPresent(flowMembershipRepository::delete);
        flowMembershipRepository.flush();
    }

    @Transactional(readOnly = true)
    public List<Member> listFlowMembers(UUID vaultId, String ownerUserId, UUID flowId) {
        Vault vault = access.requireVaultOwner(vaultId, ownerUserId);
        targets.requireFlow(vault, flowId);
        return flowMembershipRepository.findByFlowIdOrderByUserIdAsc(flowId).stream()
            .map(m -> new Member(m.getUserId(), m.getRole()))
            .toList();
    }
}
