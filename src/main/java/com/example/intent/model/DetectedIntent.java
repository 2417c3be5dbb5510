package com.example.intent.model;

import java.time.Instant;
import java.util.List;

/**
 * An intent recorded against a conversation, with the entities found alongside it.
 */
public record DetectedIntent(String intent, double confidence, String query, Instant detectedAt,
                             List<Entity> entities) {

    public DetectedIntent {
        if (detectedAt == null) {
            detectedAt = Instant.now();
        }
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    public DetectedIntent(String intent, double confidence, String query, Instant detectedAt) {
        this(intent, confidence, query, detectedAt, List.of());
    }

    public static DetectedIntent of(IntentDetection detection) {
        return new DetectedIntent(detection.intent(), detection.confidence(), detection.query(), Instant.now(),
            detection.entities());
    }
}
