package com.example.intent.classification;

import java.util.List;

import com.example.intent.model.DetectedIntent;

/**
 * Conversation signals shared by every candidate of one classification.
 *
 * @param contextRelevance how strongly the query leans on earlier turns, in [0, 1]
 * @param recentIntents previously detected intents, most recent first
 */
public record ScoringContext(double contextRelevance, List<DetectedIntent> recentIntents) {

    public static final ScoringContext NONE = new ScoringContext(0.0, List.of());

    public ScoringContext {
        recentIntents = recentIntents != null ? List.copyOf(recentIntents) : List.of();
    }
}
