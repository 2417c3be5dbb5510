package com.example.intent.model;

import java.util.List;

/**
 * A critique of a reasoning draft. {@code confidenceScore} and {@code improvedConclusion} are
 * null when the critique did not supply them.
 */
public record ReasoningVerification(
    boolean valid,
    Double confidenceScore,
    List<Issue> issues,
    String improvedConclusion
) {

    public ReasoningVerification {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    /**
     * A problem found at one step. {@code step} is 1-based.
     */
    public record Issue(int step, String issue, String correction) {}
}
