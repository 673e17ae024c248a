package com.fxledger.ingest;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Converts broker and central-bank number text into exact decimals.
 *
 * <p>Exports mix "1 234,56", "1234.56" and non-breaking-space grouping. All whitespace is removed
 * and a comma is read as the decimal separator. Values are never routed through double.
 */
public final class DecimalCoercion {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");

    private DecimalCoercion() {}

    /**
     * Parses decimal text. Returns {@code null} for null/blank input. Throws
     * {@link NumberFormatException} for anything that is not a plain decimal literal after
     * normalization (including "1,234.56", which would carry two separators).
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String normalized = WHITESPACE.matcher(text).replaceAll("").replace(',', '.');
        if (normalized.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
    }
}
