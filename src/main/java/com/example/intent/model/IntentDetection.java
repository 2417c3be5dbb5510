package com.example.intent.model;

import java.util.List;

/**
 * A single resolved intent: what the fallback ladder starts from, considers as alternatives
 * and returns as its final answer.
 */
public record IntentDetection(
    String intent,
    String query,
    double confidence,
    List<Entity> entities,
    String explanation
) {

    public static final String UNKNOWN = "unknown";

    public IntentDetection {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public static IntentDetection unknown(String query, String explanation) {
        return new IntentDetection(UNKNOWN, query, 0.0, List.of(), explanation);
    }

    public static IntentDetection from(ClassificationResult result) {
        IntentMatch top = result.topMatch();
        if (top == null) {
            return unknown(result.query(), result.explanation());
        }
        return new IntentDetection(top.intentName(), result.query(), top.confidence(), List.of(),
            result.explanation());
    }
}
