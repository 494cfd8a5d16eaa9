/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.text;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Text helpers for mined policies: the description sentence, decimal
 * rounding of stored scores, and quoting of antecedent values.
 *
 * <p>All rounding is done on the exact binary value of the double with
 * half-even ties, so {@code 0.125} formats as {@code 0.12} and
 * {@code 2.675} (stored as 2.67499999...) formats as {@code 2.67}.
 */
public final class PolicyDescriptions {

    private PolicyDescriptions() {
    }

    /**
     * Builds the human-readable sentence for a rule, e.g.
     * {@code When role='admin', agents perform 'read_file' with 100.0% confidence (support=70.0%, lift=1.43)}.
     *
     * <p>Renderers consume this text verbatim; the shape must not change.
     */
    public static String describe(String key, String value, String action,
                                  double support, double confidence, double lift) {
        return "When " + key + "=" + quote(value)
                + ", agents perform '" + action + "'"
                + " with " + fixed(confidence * 100, 1) + "% confidence"
                + " (support=" + fixed(support * 100, 1) + "%"
                + ", lift=" + fixed(lift, 2) + ")";
    }

    /**
     * Rounds to {@code scale} decimal places (half-even on the exact value).
     */
    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Formats with exactly {@code scale} fraction digits (half-even on the exact value).
     */
    public static String fixed(double value, int scale) {
        if (Double.isNaN(value)) {
            return "nan";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).toPlainString();
    }

    /**
     * Renders text as a quoted literal.
     *
     * <p>Single quotes are used unless the text contains a single quote and no
     * double quote. Backslashes, the chosen quote character and control
     * characters are escaped.
     */
    public static String quote(String text) {
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(text.length() + 2).append(quote);
        text.codePoints().forEach(cp -> {
            if (cp == quote || cp == '\\') {
                sb.append('\\').append((char) cp);
            } else if (cp == '\t') {
                sb.append("\\t");
            } else if (cp == '\n') {
                sb.append("\\n");
            } else if (cp == '\r') {
                sb.append("\\r");
            } else if (Character.isISOControl(cp)) {
                sb.append(String.format("\\x%02x", cp));
            } else {
                sb.appendCodePoint(cp);
            }
        });
        return sb.append(quote).toString();
    }
}
