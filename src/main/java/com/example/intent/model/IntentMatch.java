package com.example.intent.model;

/**
 * One candidate intent for a query.
 *
 * @param intentName canonical intent name
 * @param matchedExample the example phrase closest to the query
 * @param semanticSimilarity cosine similarity between the query and {@code matchedExample}
 * @param contextRelevance conversation relevance factor used in the weighted score
 * @param historicalAccuracy historical accuracy factor used in the weighted score
 * @param contextualBoost boost added after weighting, in [0, 0.5]
 * @param rawScore weighted score before the boost, in [0, 1]
 * @param confidence final confidence, in [0, 1]
 */
public record IntentMatch(
    String intentName,
    String matchedExample,
    double semanticSimilarity,
    double contextRelevance,
    double historicalAccuracy,
    double contextualBoost,
    double rawScore,
    double confidence
) {

    public static final double MAX_BOOST = 0.5;

    public IntentMatch withBoost(double boost, double maxConfidence) {
        double applied = Math.max(0.0, Math.min(MAX_BOOST, boost));
        double ceiling = Math.max(0.0, Math.min(1.0, maxConfidence));
        double boosted = Math.min(ceiling, Math.max(0.0, Math.min(1.0, rawScore + applied)));
        return new IntentMatch(intentName, matchedExample, semanticSimilarity, contextRelevance,
            historicalAccuracy, applied, rawScore, boosted);
    }
}
