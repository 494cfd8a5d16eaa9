/*
 * Copyright (c) 2025 Helios Policy Miner
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.policyminer.core.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyDescriptionsTest {

    @Test
    @DisplayName("Should render the description sentence")
    void shouldDescribe() {
        String description = PolicyDescriptions.describe("department", "finance", "approve_invoice",
                0.25, 0.8333333333333334, 2.5);

        assertThat(description).isEqualTo(
                "When department='finance', agents perform 'approve_invoice' with 83.3% confidence (support=25.0%, lift=2.50)");
    }

    @ParameterizedTest
    @CsvSource({
            "0.125, 2, 0.12",
            "0.375, 2, 0.38",
            "2.675, 2, 2.67",
            "1.0, 2, 1.00",
            "30.000000000000004, 1, 30.0",
            "0.05, 1, 0.1",
            "66.66666666666667, 1, 66.7"
    })
    @DisplayName("Should format with half-even rounding of the exact value")
    void shouldFormatFixed(double value, int scale, String expected) {
        assertThat(PolicyDescriptions.fixed(value, scale)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should format non-finite values")
    void shouldFormatNonFinite() {
        assertThat(PolicyDescriptions.fixed(Double.NaN, 2)).isEqualTo("nan");
        assertThat(PolicyDescriptions.fixed(Double.POSITIVE_INFINITY, 2)).isEqualTo("inf");
        assertThat(PolicyDescriptions.fixed(Double.NEGATIVE_INFINITY, 2)).isEqualTo("-inf");
    }

    @Test
    @DisplayName("Should round stored scores to the requested scale")
    void shouldRound() {
        assertThat(PolicyDescriptions.round(1.4285714285714286, 6)).isEqualTo(1.428571);
        assertThat(PolicyDescriptions.round(2.0 / 3.0, 6)).isEqualTo(0.666667);
        assertThat(PolicyDescriptions.round(0.7, 6)).isEqualTo(0.7);
        assertThat(PolicyDescriptions.round(1.0, 6)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should quote values as literals")
    void shouldQuote() {
        assertThat(PolicyDescriptions.quote("admin")).isEqualTo("'admin'");
        assertThat(PolicyDescriptions.quote("O'Brien")).isEqualTo("\"O'Brien\"");
        assertThat(PolicyDescriptions.quote("say \"hi\"")).isEqualTo("'say \"hi\"'");
        assertThat(PolicyDescriptions.quote("it's \"x\"")).isEqualTo("'it\\'s \"x\"'");
        assertThat(PolicyDescriptions.quote("C:\\temp")).isEqualTo("'C:\\\\temp'");
    }

    @Test
    @DisplayName("Should escape control characters")
    void shouldEscapeControlCharacters() {
        assertThat(PolicyDescriptions.quote("a\tb\nc\rd\u0001")).isEqualTo("'a\\tb\\nc\\rd\\x01'");
        assertThat(PolicyDescriptions.quote("")).isEqualTo("''");
    }
}
