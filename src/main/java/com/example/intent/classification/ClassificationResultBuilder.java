package com.example.intent.classification;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.example.intent.config.ClassificationProperties;
import com.example.intent.model.ClassificationResult;
import com.example.intent.model.IntentMatch;
import com.example.intent.model.RecommendedAction;

/**
 * Assembles a {@link ClassificationResult} in fixed stages. Each stage reads what the previous
 * one set, so calling them out of order fails with {@link IllegalStateException}:
 *
 * <pre>
 * new ClassificationResultBuilder(query, matches, properties)
 *     .calculateAmbiguity()
 *     .determineRecommendedAction()
 *     .buildExplanation()
 *     .build();
 * </pre>
 */
public class ClassificationResultBuilder {

    private enum Stage { RANKED, AMBIGUITY, ACTION, EXPLANATION }

    private final String query;
    private final List<IntentMatch> matches;
    private final ClassificationProperties properties;
    private double contextRelevance;

    private Stage stage = Stage.RANKED;
    private boolean ambiguous;
    private double confidenceDifferential = 1.0;
    private RecommendedAction action;
    private String clarificationQuestion;
    private String explanation;

    /**
     * Ranks {@code candidates} by confidence, highest first. The sort is stable, so candidates
     * with equal confidence keep the order in which they were found.
     */
    public ClassificationResultBuilder(String query, List<IntentMatch> candidates,
                                       ClassificationProperties properties) {
        this.query = query;
        this.properties = properties;
        List<IntentMatch> ranked = new ArrayList<>(candidates);
        ranked.sort(Comparator.comparingDouble(IntentMatch::confidence).reversed());
        this.matches = List.copyOf(ranked);
    }

    public ClassificationResultBuilder withContextRelevance(double contextRelevance) {
        expect(Stage.RANKED);
        this.contextRelevance = contextRelevance;
        return this;
    }

    public ClassificationResultBuilder calculateAmbiguity() {
        expect(Stage.RANKED);
        if (matches.size() < 2) {
            confidenceDifferential = 1.0;
            ambiguous = false;
        } else {
            confidenceDifferential = matches.get(0).confidence() - matches.get(1).confidence();
            ambiguous = confidenceDifferential < properties.ambiguityThreshold();
        }
        stage = Stage.AMBIGUITY;
        return this;
    }

    public ClassificationResultBuilder determineRecommendedAction() {
        expect(Stage.AMBIGUITY);
        action = recommend(matches.isEmpty(), matches.isEmpty() ? 0.0 : matches.get(0).confidence(),
            ambiguous, properties);
        if (action == RecommendedAction.CLARIFY) {
            clarificationQuestion = clarificationQuestion(matches);
        }
        stage = Stage.ACTION;
        return this;
    }

    public ClassificationResultBuilder buildExplanation() {
        expect(Stage.ACTION);
        StringBuilder text = new StringBuilder();
        if (matches.isEmpty()) {
            text.append(String.format(Locale.ROOT,
                "No intent reached the similarity threshold of %.2f. ", properties.similarityThreshold()));
        } else {
            IntentMatch top = matches.get(0);
            text.append(String.format(Locale.ROOT, "Top intent '%s' matched example \"%s\". ",
                top.intentName(), top.matchedExample()));
            text.append(String.format(Locale.ROOT, "Semantic similarity: %.3f. ", top.semanticSimilarity()));
            text.append(String.format(Locale.ROOT, "Context relevance: %.3f. ", top.contextRelevance()));
            text.append(String.format(Locale.ROOT, "Historical accuracy: %.3f. ", top.historicalAccuracy()));
            if (top.contextualBoost() > 0.0) {
                text.append(String.format(Locale.ROOT, "Contextual boost: +%.3f. ", top.contextualBoost()));
            }
            if (ambiguous) {
                text.append(String.format(Locale.ROOT, "Ambiguous with '%s' (differential %.3f). ",
                    matches.get(1).intentName(), confidenceDifferential));
            }
        }
        text.append(String.format(Locale.ROOT, "Final confidence: %.3f. Recommended action: %s.",
            matches.isEmpty() ? 0.0 : matches.get(0).confidence(), action));
        explanation = text.toString();
        stage = Stage.EXPLANATION;
        return this;
    }

    public ClassificationResult build() {
        expect(Stage.EXPLANATION);
        IntentMatch top = matches.isEmpty() ? null : matches.get(0);
        return new ClassificationResult(query, matches, top, ambiguous, confidenceDifferential, action,
            clarificationQuestion, explanation, contextRelevance, top != null ? top.historicalAccuracy() : 0.0);
    }

    static RecommendedAction recommend(boolean noMatches, double topConfidence, boolean ambiguous,
                                       ClassificationProperties properties) {
        if (noMatches) {
            return RecommendedAction.NO_MATCH;
        }
        if (topConfidence < properties.mismatchThreshold()) {
            return RecommendedAction.FALLBACK;
        }
        if (ambiguous && topConfidence < properties.highConfidenceThreshold()) {
            return RecommendedAction.CLARIFY;
        }
        if (topConfidence >= properties.highConfidenceThreshold()) {
            return RecommendedAction.PROCEED;
        }
        return RecommendedAction.PROCEED_WITH_CAUTION;
    }

    static String clarificationQuestion(List<IntentMatch> matches) {
        if (matches.size() == 2) {
            return String.format("Did you mean %s or %s?",
                displayName(matches.get(0).intentName()), displayName(matches.get(1).intentName()));
        }
        List<String> names = matches.stream().limit(3)
            .map(m -> displayName(m.intentName()))
            .collect(Collectors.toList());
        return String.format("I'm not sure what you mean. Are you asking about %s, %s, or %s?",
            names.get(0), names.get(1), names.get(2));
    }

    static String displayName(String intentName) {
        return intentName.replace('_', ' ').replace('-', ' ');
    }

    private void expect(Stage required) {
        if (stage != required) {
            throw new IllegalStateException("Builder is at stage " + stage + ", expected " + required);
        }
    }
}
