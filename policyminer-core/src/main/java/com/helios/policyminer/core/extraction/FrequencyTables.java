/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.extraction;

import com.helios.policyminer.api.model.BehaviorLog;
import com.helios.policyminer.core.coercion.AntecedentValueCoercer;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;

import java.util.List;
import java.util.Map;

/**
 * The three frequency tables of one extraction run.
 *
 * <ul>
 *   <li>action counts: records per action</li>
 *   <li>antecedent counts: records per (context key, coerced value)</li>
 *   <li>co-occurrence counts: records per (context key, coerced value, action)</li>
 * </ul>
 *
 * <p>Tables are linked hash maps, so iteration follows first-seen order of a
 * scan over the input. Instances are confined to a single extraction call
 * and are not thread-safe; parallel counting builds one table set per chunk
 * and merges them in chunk order with {@link #mergeFrom(FrequencyTables)}.
 */
final class FrequencyTables {

    /**
     * A (context key, coerced value) pair.
     */
    record Antecedent(String key, String value) {
    }

    /**
     * An antecedent paired with the action that followed it.
     */
    record RuleKey(Antecedent antecedent, String action) {
    }

    private final Object2IntLinkedOpenHashMap<String> actionCounts = new Object2IntLinkedOpenHashMap<>();
    private final Object2IntLinkedOpenHashMap<Antecedent> antecedentCounts = new Object2IntLinkedOpenHashMap<>();
    private final Object2IntLinkedOpenHashMap<RuleKey> coOccurrenceCounts = new Object2IntLinkedOpenHashMap<>();
    private int totalRecords;

    /**
     * Counts the given logs in list order.
     */
    static FrequencyTables count(List<BehaviorLog> logs, AntecedentValueCoercer coercer) {
        FrequencyTables tables = new FrequencyTables();
        for (BehaviorLog log : logs) {
            tables.add(log, coercer);
        }
        return tables;
    }

    void add(BehaviorLog log, AntecedentValueCoercer coercer) {
        totalRecords++;
        String action = log.action();
        actionCounts.addTo(action, 1);
        for (Map.Entry<String, Object> attribute : log.context().entrySet()) {
            Antecedent antecedent = new Antecedent(attribute.getKey(), coercer.coerce(attribute.getValue()));
            antecedentCounts.addTo(antecedent, 1);
            coOccurrenceCounts.addTo(new RuleKey(antecedent, action), 1);
        }
    }

    /**
     * Adds another table set into this one. Keys first seen in {@code other}
     * are appended after the keys already present, in {@code other}'s order.
     */
    void mergeFrom(FrequencyTables other) {
        totalRecords += other.totalRecords;
        mergeInto(actionCounts, other.actionCounts);
        mergeInto(antecedentCounts, other.antecedentCounts);
        mergeInto(coOccurrenceCounts, other.coOccurrenceCounts);
    }

    private static <K> void mergeInto(Object2IntLinkedOpenHashMap<K> target, Object2IntLinkedOpenHashMap<K> source) {
        for (Object2IntMap.Entry<K> entry : Object2IntMaps.fastIterable(source)) {
            target.addTo(entry.getKey(), entry.getIntValue());
        }
    }

    int totalRecords() {
        return totalRecords;
    }

    int actionCount(String action) {
        return actionCounts.getInt(action);
    }

    int antecedentCount(Antecedent antecedent) {
        return antecedentCounts.getInt(antecedent);
    }

    int distinctActions() {
        return actionCounts.size();
    }

    int distinctAntecedents() {
        return antecedentCounts.size();
    }

    /**
     * Co-occurrence counts in first-seen order (read-only view).
     */
    Object2IntMap<RuleKey> coOccurrences() {
        return Object2IntMaps.unmodifiable(coOccurrenceCounts);
    }
}
