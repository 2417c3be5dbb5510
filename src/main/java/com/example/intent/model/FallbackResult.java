package com.example.intent.model;

import java.util.List;

public record FallbackResult(
    FallbackLevel fallbackLevel,
    IntentDetection originalResult,
    IntentDetection finalResult,
    List<IntentDetection> alternatives,
    List<String> clarificationQuestions,
    boolean successful,
    String fallbackReason,
    boolean requiresUserInteraction,
    MisclassificationData misclassificationData
) {

    public FallbackResult {
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        clarificationQuestions = clarificationQuestions != null ? List.copyOf(clarificationQuestions) : List.of();
    }

    public static FallbackResult notNeeded(IntentDetection result) {
        return new FallbackResult(FallbackLevel.NONE, result, result, List.of(), List.of(),
            true, "No fallback needed", false, null);
    }
}
