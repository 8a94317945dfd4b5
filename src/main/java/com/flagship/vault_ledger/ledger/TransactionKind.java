package com.flagship.vault_ledger.ledger;

import com.flagship.vault_ledger.exception.LedgerException;

/**
 * Kinds of ledger transactions. Stored lowercase in {@code transactions.kind}.
 */
public enum TransactionKind {
    INCOME("income"),
    EXPENSE("expense"),
    REFUND("refund"),
    TRANSFER_WALLET("transfer_wallet"),
    TRANSFER_FLOW("transfer_flow");

    private final String dbValue;

    TransactionKind(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isTransfer() {
        return this == TRANSFER_WALLET || this == TRANSFER_FLOW;
    }

    /**
     * Sign of the wallet and flow legs of a non-transfer transaction.
     */
    public long signedAmount(long amountMinor) {
        switch (this) {
            case INCOME:
            case REFUND:
                return amountMinor;
            case EXPENSE:
                return -amountMinor;
            default:
                throw LedgerException.invalidAmount("transfers have no single signed amount");
        }
    }

    public static TransactionKind fromDbValue(String value) {
        for (TransactionKind kind : values()) {
            if (kind.dbValue.equals(value)) {
                return kind;
            }
        }
        throw new IllegalStateException("Unknown transaction kind: " + value);
    }
}
