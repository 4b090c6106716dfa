package com.anthem.acctctl.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a mutex test run: one entry per test plus a summary of the
 * false-claim rate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MutexTestReport {

    private Summary summary;
    private List<TestResult> results;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int workers;
        private Duration delay;
        private int tests;
        private int failures;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TestResult {
        private int num;
        private Duration verifyDelay;
        /** Workers that believed they won. */
        private int owners;
        private int misses;
        private int errors;
        /** Workers that attempted a write. */
        private int setters;
        private String assumedOwner;
        private String finalOwner;
        private boolean pass;
    }
}
