package com.flagship.vault_ledger.money;

import com.flagship.vault_ledger.exception.LedgerException;
import lombok.Value;

/**
 * Signed amount in minor units (cents for EUR).
 *
 * All arithmetic is checked: an overflow raises INVALID_AMOUNT instead of
 * wrapping. Parsing and formatting never depend on the JVM locale.
 */
@Value
public class Money {

    long minor;

    /**
     * Formats an amount as {@code -12.34 EUR}.
     */
    public static String formatMinor(long minor, Currency currency) {
        int digits = currency.minorUnits();
        long scale = pow10(digits);
        long units = minor / scale;
        long fraction = Math.abs(minor % scale);

        StringBuilder out = new StringBuilder();
        if (minor < 0) {
            out.append('-');
            units = -units;
        }
        out.append(units);
        if (digits > 0) {
            String fractionText = Long.toString(fraction);
            out.append('.');
            for (int i = fractionText.length(); i < digits; i++) {
                out.append('0');
            }
            out.append(fractionText);
        }
        return out.append(' ').append(currency.code()).toString();
    }

    /**
     * Parses a decimal amount such as {@code 12}, {@code -3,5} or {@code +0.99}.
     *
     * Accepts {@code .} or {@code ,} as the single decimal separator and at
     * most {@link Currency#minorUnits()} fractional digits.
     *
     * @param text the user input
     * @param currency currency that defines the fractional digits
     * @return the parsed amount
     * @throws LedgerException INVALID_AMOUNT for empty, malformed, too precise
     *         or out-of-range input
     */
    public static Money parse(String text, Currency currency) {
        if (text == null || text.trim().isEmpty()) {
            throw LedgerException.invalidAmount("empty amount");
        }
        String value = text.trim();

        boolean negative = false;
        char first = value.charAt(0);
        if (first == '+' || first == '-') {
            negative = first == '-';
            value = value.substring(1);
        }
        value = value.replace(',', '.');

        int separator = value.indexOf('.');
        if (separator != value.lastIndexOf('.')) {
            throw LedgerException.invalidAmount("invalid amount: " + text);
        }
        String whole = separator < 0 ? value : value.substring(0, separator);
        String fraction = separator < 0 ? "" : value.substring(separator + 1);

        if (whole.isEmpty() && fraction.isEmpty()) {
            throw LedgerException.invalidAmount("invalid amount: " + text);
        }
        if (!isDigits(whole) || !isDigits(fraction)) {
            throw LedgerException.invalidAmount("invalid amount: " + text);
        }
        int digits = currency.minorUnits();
        if (fraction.length() > digits) {
            throw LedgerException.invalidAmount("too many decimals");
        }

        long scale = pow10(digits);
        long minor = 0;
        for (int i = 0; i < whole.length(); i++) {
            minor = addExact(multiplyExact(minor, 10), whole.charAt(i) - '0');
        }
        minor = multiplyExact(minor, scale);

        long fractionMinor = 0;
        for (int i = 0; i < digits; i++) {
            int digit = i < fraction.length() ? fraction.charAt(i) - '0' : 0;
            fractionMinor = fractionMinor * 10 + digit;
        }
        minor = addExact(minor, fractionMinor);

        return new Money(negative ? -minor : minor);
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static long pow10(int exponent) {
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= 10;
        }
        return result;
    }

    public static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw LedgerException.invalidAmount("amount too large");
        }
    }

    public static long subtractExact(long a, long b) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw LedgerException.invalidAmount("amount too large");
        }
    }

    public static long negateExact(long a) {
        try {
            return Math.negateExact(a);
        } catch (ArithmeticException e) {
            throw LedgerException.invalidAmount("amount too large");
        }
    }

    private static long multiplyExact(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw LedgerException.invalidAmount("amount too large");
        }
    }
}
