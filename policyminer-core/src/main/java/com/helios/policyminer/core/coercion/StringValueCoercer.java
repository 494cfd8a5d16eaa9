/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.coercion;

/**
 * Default coercer: {@link String#valueOf(Object)}.
 *
 * <p>Values are read exactly as stored. No case folding or whitespace
 * trimming happens, so {@code "Admin"} and {@code "admin "} stay distinct
 * while the number {@code 1} and the text {@code "1"} collapse.
 */
public final class StringValueCoercer implements AntecedentValueCoercer {

    public static final StringValueCoercer INSTANCE = new StringValueCoercer();

    private StringValueCoercer() {
    }

    @Override
    public String coerce(Object value) {
        return String.valueOf(value);
    }
}
