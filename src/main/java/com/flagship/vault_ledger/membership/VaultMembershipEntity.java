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
 * JPA entity granting a user a role on a whole vault.
 */
@Entity
@Table(name = "vault_memberships")
@IdClass(VaultMembershipEntity.Key.class)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class VaultMembershipEntity {

    @Id
    @Column(name = "vault_id", nullable = false, updatable = false)
    private UUID vaultId;

    @Id
    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Convert(converter = RoleConverter.class)
    @Column(name = "role", nullable = false, length = 16)
    private Role role;

    public VaultMembershipEntity(UUID vaultId, String userId, Role role) {
        this.vaultId = vaultId;
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
        private UUID vaultId;
        private String userId;

        public Key(UUID vaultId, String userId) {
            this.vaultId = vaultId;
            this.userId = userId;
        }
    }
}
