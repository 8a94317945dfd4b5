package com.flagship.vault_ledger.money;

import com.flagship.vault_ledger.exception.LedgerException;

import java.util.Locale;

/**
 * Supported currencies.
 *
 * Every vault, wallet, flow, transaction and leg carries one. It is used for
 * consistency checks only: amounts are never converted.
 */
public enum Currency {
    EUR(2);

    private final int minorUnits;

    Currency(int minorUnits) {
        this.minorUnits = minorUnits;
    }

    /**
     * Number of fractional digits of the currency (2 for EUR).
     */
    public int minorUnits() {
        return minorUnits;
    }

    public String code() {
        return name();
    }

    /**
     * Parses an ISO code, ignoring case and surrounding whitespace.
     *
     * @throws LedgerException CURRENCY_MISMATCH for unsupported codes
     */
    public static Currency parse(String code) {
        if (code == null) {
            throw LedgerException.currencyMismatch("missing currency");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (Currency currency : values()) {
            if (currency.name().equals(normalized)) {
                return currency;
            }
        }
        throw LedgerException.currencyMismatch("unsupported currency: " + code);
    }
}
