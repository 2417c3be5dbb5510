package com.example.intent.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit record of one escalation attempt.
 */
public record MisclassificationData(
    String id,
    Instant timestamp,
    String originalQuery,
    String actualIntent,
    String expectedIntent,
    double confidence,
    FallbackLevel fallbackApplied,
    boolean fallbackSuccessful,
    Map<String, String> additionalDetails
) {

    public MisclassificationData {
        additionalDetails = additionalDetails != null ? Map.copyOf(additionalDetails) : Map.of();
    }

    public static MisclassificationData of(IntentDetection original, String expectedIntent,
                                           FallbackLevel level, boolean successful,
                                           Map<String, String> details) {
        return new MisclassificationData(UUID.randomUUID().toString(), Instant.now(),
            original.query(), original.intent(), expectedIntent, original.confidence(),
            level, successful, details);
    }
}
