package com.flagship.vault_ledger.support;

import com.flagship.vault_ledger.exception.LedgerException;

/**
 * Normalization of names and free text coming from callers.
 */
public final class Texts {

    private Texts() {
        // Utility class
    }

    /**
     * Trims a required display name.
     *
     * @param what the kind of object, used in the error message ("vault", "wallet", ...)
     * @throws LedgerException INVALID_AMOUNT if the name is null or blank
     */
    public static String requireName(String name, String what) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw LedgerException.invalidAmount(what + " name must not be empty");
        }
        return trimmed;
    }

    /**
     * Trims optional text; blank becomes null.
     */
    public static String normalizeOptional(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Applies a metadata patch: null keeps {@code current}, blank clears it,
     * anything else replaces it (trimmed).
     */
    public static String patch(String current, String patch) {
        if (patch == null) {
            return current;
        }
        return normalizeOptional(patch);
    }
}
