package com.flagship.vault_ledger.flow;

import java.util.Optional;

/**
 * Marks system-managed flows. Stored in {@code cash_flows.system_kind}.
 */
public enum SystemFlowKind {
    UNALLOCATED("unallocated");

    private final String dbValue;

    SystemFlowKind(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static Optional<SystemFlowKind> fromDbValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SystemFlowKind kind : values()) {
            if (kind.dbValue.equals(value)) {
                return Optional.of(kind);
            }
        }
        throw new IllegalStateException("Unknown system flow kind: " + value);
    }
}
