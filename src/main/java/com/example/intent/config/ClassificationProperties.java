package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Thresholds and weights for embedding classification.
 *
 * <p>The three weights are applied as given and need not sum to one; the weighted score is
 * clamped to [0, 1] before the contextual boost and again after it.
 *
 * @param embeddingModel model passed to the provider for every embedding call
 * @param similarityThreshold minimum cosine similarity for an intent to become a candidate
 * @param highConfidenceThreshold confidence at or above which the top match is acted on directly
 * @param mismatchThreshold confidence below which the top match is treated as a mismatch
 * @param ambiguityThreshold gap between the top two confidences under which a result is ambiguous
 * @param semanticWeight weight of the cosine similarity term
 * @param contextWeight weight of the conversation relevance term
 * @param historicalWeight weight of the historical accuracy term
 * @param contextualBoostFactor boost for an intent seen among the most recent detections
 * @param maxConfidence ceiling applied after the boost
 * @param historicalInteractionsCount number of past detections considered for historical accuracy
 * @param contextualBoostEnabled whether the contextual boost is applied at all
 */
@ConfigurationProperties(prefix = "app.intent.classification")
public record ClassificationProperties(
    @DefaultValue("nomic-embed-text") String embeddingModel,
    @DefaultValue("0.7") double similarityThreshold,
    @DefaultValue("0.85") double highConfidenceThreshold,
    @DefaultValue("0.5") double mismatchThreshold,
    @DefaultValue("0.1") double ambiguityThreshold,
    @DefaultValue("0.7") double semanticWeight,
    @DefaultValue("0.15") double contextWeight,
    @DefaultValue("0.15") double historicalWeight,
    @DefaultValue("0.1") double contextualBoostFactor,
    @DefaultValue("1.0") double maxConfidence,
    @DefaultValue("10") int historicalInteractionsCount,
    @DefaultValue("true") boolean contextualBoostEnabled
) {

    public static ClassificationProperties defaults() {
        return new ClassificationProperties("nomic-embed-text", 0.7, 0.85, 0.5, 0.1,
            0.7, 0.15, 0.15, 0.1, 1.0, 10, true);
    }

    public ClassificationProperties withSimilarityThreshold(double threshold) {
        return new ClassificationProperties(embeddingModel, threshold, highConfidenceThreshold,
            mismatchThreshold, ambiguityThreshold, semanticWeight, contextWeight, historicalWeight,
            contextualBoostFactor, maxConfidence, historicalInteractionsCount, contextualBoostEnabled);
    }

    public ClassificationProperties withWeights(double semantic, double context, double historical) {
        return new ClassificationProperties(embeddingModel, similarityThreshold, highConfidenceThreshold,
            mismatchThreshold, ambiguityThreshold, semantic, context, historical,
            contextualBoostFactor, maxConfidence, historicalInteractionsCount, contextualBoostEnabled);
    }

    public ClassificationProperties withBoost(double boostFactor, double ceiling) {
        return new ClassificationProperties(embeddingModel, similarityThreshold, highConfidenceThreshold,
            mismatchThreshold, ambiguityThreshold, semanticWeight, contextWeight, historicalWeight,
            boostFactor, ceiling, historicalInteractionsCount, contextualBoostEnabled);
    }
}
