/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.io;

import com.helios.policyminer.api.model.BehaviorLog;
import com.helios.policyminer.api.model.PolicySet;
import com.helios.policyminer.core.extraction.ExtractionConfig;
import com.helios.policyminer.core.extraction.PolicyExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Parses a JSONL file, mines it, persists the result and renders it back.
 */
class PolicyMiningPipelineTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should mine, persist and render policies from a log file")
    void shouldRunEndToEnd() throws IOException {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            lines.add("{\"log_id\": \"a" + i + "\", \"agent_id\": \"bot\", \"action\": \"read\", \"context\": {\"role\": \"admin\"}}");
        }
        for (int i = 0; i < 3; i++) {
            lines.add("{\"log_id\": \"e" + i + "\", \"agent_id\": \"bot\", \"action\": \"write\", \"context\": {\"role\": \"editor\"}}");
        }
        lines.add("garbage");
        Path logsFile = tempDir.resolve("behavior.jsonl");
        Files.write(logsFile, lines);

        List<BehaviorLog> logs = new BehaviorLogParser().parseFileLogs(logsFile);
        PolicySet mined = new PolicyExtractor(ExtractionConfig.of(0.4, 0.6, 1.0)).extract(logs, "Pipeline");

        PolicySetCodec codec = new PolicySetCodec();
        Path output = tempDir.resolve("policies.json");
        codec.write(mined, output);
        PolicySet reloaded = codec.read(output);

        assertThat(reloaded).isEqualTo(mined);
        assertThat(reloaded.sourceLogs()).isEqualTo(10);
        assertThat(new PolicyFormatter().toMarkdown(reloaded))
                .contains("| policy_0001 | role=admin | read | 0.7000 | 1.0000 | 1.4286 |");
    }
}
