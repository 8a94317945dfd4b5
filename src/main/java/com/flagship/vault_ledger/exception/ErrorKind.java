package com.flagship.vault_ledger.exception;

/**
 * Classification of engine failures.
 *
 * Front ends switch on the kind to render a specific message; the detail
 * string of the exception carries the name or reason.
 */
public enum ErrorKind {
    /** Vault, wallet, flow or transaction absent, or not visible to the caller. */
    KEY_NOT_FOUND,
    /** Duplicate name where uniqueness is required. */
    EXISTING_KEY,
    INVALID_AMOUNT,
    /** Forbidden on the system flow, or cap-mode preconditions violated. */
    INVALID_FLOW,
    MAX_BALANCE_REACHED,
    CURRENCY_MISMATCH,
    FORBIDDEN
}
