/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.coercion;

/**
 * Converts a raw context attribute value into the text form used as an
 * antecedent value.
 *
 * <p>Every value read by the counting pass goes through exactly one coercer,
 * so two values that coerce to the same text form are treated as the same
 * antecedent.
 */
@FunctionalInterface
public interface AntecedentValueCoercer {

    /**
     * @param value raw context value as stored in the log, may be null
     * @return non-null text form
     */
    String coerce(Object value);
}
