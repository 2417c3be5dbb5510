package com.example.intent.model;

import java.util.List;

/**
 * Outcome of classifying one query. Built once by
 * {@link com.example.intent.classification.ClassificationResultBuilder} and never changed after.
 *
 * @param matches candidates at or above the similarity threshold, confidence descending
 * @param topMatch first element of {@code matches}, or {@code null} when there are none
 * @param confidenceDifferential gap between the two best confidences, 1.0 with fewer than two
 * @param clarificationQuestion set only when {@code recommendedAction} is CLARIFY
 * @param contextRelevance conversation relevance factor shared by every candidate
 * @param historicalAccuracy historical accuracy factor of the top match
 */
public record ClassificationResult(
    String query,
    List<IntentMatch> matches,
    IntentMatch topMatch,
    boolean ambiguous,
    double confidenceDifferential,
    RecommendedAction recommendedAction,
    String clarificationQuestion,
    String explanation,
    double contextRelevance,
    double historicalAccuracy
) {

    public ClassificationResult {
        matches = List.copyOf(matches);
    }

    public boolean hasMatches() {
        return !matches.isEmpty();
    }

    public double topConfidence() {
        return topMatch != null ? topMatch.confidence() : 0.0;
    }
}
