package com.flagship.vault_ledger.membership;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for vault memberships.
 */
@Repository
public interface VaultMembershipRepository
        extends JpaRepository<VaultMembershipEntity, VaultMembershipEntity.Key> {

    /**
     * Primary lookup of the access gate.
     */
    Optional<VaultMembershipEntity> findByVaultIdAndUserId(UUID vaultId, String userId);

    List<VaultMembershipEntity> findByVaultIdOrderByUserIdAsc(UUID vaultId);
}
