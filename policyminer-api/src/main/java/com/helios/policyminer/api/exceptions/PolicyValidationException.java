/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api.exceptions;

/**
 * Thrown when a behavior log, a mined policy or a policy set document
 * violates one of its invariants.
 *
 * <p>The offending field is reported using its document name (for example
 * {@code log_id} or {@code support}) so that ingestion layers can surface it
 * next to the rejected record.
 */
public class PolicyValidationException extends IllegalArgumentException {

    private final String field;

    public PolicyValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public PolicyValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * Returns the document name of the field that failed validation.
     */
    public String field() {
        return field;
    }
}
