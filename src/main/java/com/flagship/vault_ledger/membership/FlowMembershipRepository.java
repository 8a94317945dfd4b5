package com.flagship.vault_ledger.membership;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for flow memberships.
 */
@Repository
public interface FlowMembershipRepository
        extends JpaRepository<FlowMembershipEntity, FlowMembershipEntity.Key> {

    Optional<FlowMembershipEntity> findByFlowIdAndUserId(UUID flowId, String userId);

    List<FlowMembershipEntity> findByFlowIdOrderByUserIdAsc(UUID flowId);
}
