package com.flagship.vault_ledger.membership;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.UUID;

/**
 * JPA entity granting a user a role on one (non-system) cash flow.
 * Used for users that have no vault-level access.
 */
@Entity
@Table(name = "flow_memberships")
@IdClass(FlowMembershipEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FlowMembershipEntity {

    @Id
    @Column(name = "flow_id", nullable = false, updatable = false)
    private UUID flowId;

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Convert(converter = RoleConverter.class)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    public FlowMembershipEntity(UUID flowId, String userId, Role role) {
        this.flowId = flowId;
        this.userId = userId;
        this.role = role;
    }

    public void changeRole(Role newRole) {
        this.role = newRole;
    }

    @Getter
    @EqualsAndHashCode
    @NoArgsConstructor
    public static class Key implements Serializable {
        private UUID flowId;
        private String userId;

        public Key(UUID flowId, String userId) {
            this.flowId = flowId;
            this.userId = userId;
        }
    }
}
