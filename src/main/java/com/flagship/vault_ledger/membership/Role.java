package com.flagship.vault_ledger.membership;

import com.flagship.vault_ledger.exception.LedgerException;

/**
 * Membership role on a vault or a single cash flow.
 */
public enum Role {
    OWNER("owner"),
    EDITOR("editor"),
    VIEWER("viewer");

    private final String dbValue;

    Role(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean canWrite() {
        return this == OWNER || this == EDITOR;
    }

    /**
     * @throws LedgerException INVALID_AMOUNT for anything but owner, editor or viewer
     */
    public static Role parse(String value) {
        for (Role role : values()) {
            if (role.dbValue.equals(value)) {
                return role;
            }
        }
        throw LedgerException.invalidAmount("invalid role: " + value);
    }
}
