package com.flagship.vault_ledger.exception;

import lombok.Getter;

/**
 * Failure raised by every engine operation.
 *
 * Unchecked so that it rolls back the surrounding {@code @Transactional}
 * unit of work: nothing validated before the failure is ever persisted.
 */
@Getter
public class LedgerException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;

    public LedgerException(ErrorKind kind, String detail) {
        super(kind + ": " + detail);
        this.kind = kind;
        this.detail = detail;
    }

    public static LedgerException keyNotFound(String detail) {
        return new LedgerException(ErrorKind.KEY_NOT_FOUND, detail);
    }

    public static LedgerException existingKey(String name) {
        return new LedgerException(ErrorKind.EXISTING_KEY, name);
    }

    public static LedgerException invalidAmount(String detail) {
        return new LedgerException(ErrorKind.INVALID_AMOUNT, detail);
    }

    public static LedgerException invalidFlow(String detail) {
        return new LedgerException(ErrorKind.INVALID_FLOW, detail);
    }

    /**
     * @param flowName display name of the flow whose cap would be exceeded
     */
    public static LedgerException maxBalanceReached(String flowName) {
        return new LedgerException(ErrorKind.MAX_BALANCE_REACHED, flowName);
    }

    public static LedgerException currencyMismatch(String detail) {
        return new LedgerException(ErrorKind.CURRENCY_MISMATCH, detail);
    }

    public static LedgerException forbidden(String detail) {
        return new LedgerException(ErrorKind.FORBIDDEN, detail);
    }
}
