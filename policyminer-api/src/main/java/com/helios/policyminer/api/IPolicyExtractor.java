/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.api;

import com.helios.policyminer.api.model.BehaviorLog;
import com.helios.policyminer.api.model.PolicySet;

import java.util.List;

/**
 * Contract for mining governance policies from validated behavior logs.
 *
 * <p>Implementations are pure functions of their input and configuration:
 * extraction never fails for well-formed input, including an empty list.
 */
public interface IPolicyExtractor {

    /**
     * Mines policies from the given logs.
     *
     * @param logs validated behavior logs, in the order they should be scanned
     * @param name label for the resulting policy set
     * @return ranked policy set
     */
    PolicySet extract(List<BehaviorLog> logs, String name);

    /**
     * Mines policies using the default set name.
     */
    default PolicySet extract(List<BehaviorLog> logs) {
        return extract(logs, PolicySet.DEFAULT_NAME);
    }

    /**
     * Sets a listener for tracking extraction stages.
     *
     * @param listener the extraction listener (null to disable)
     */
    default void setExtractionListener(ExtractionListener listener) {
    }
}
