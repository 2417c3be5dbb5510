package com.example.intent.classification;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.example.intent.config.ClassificationProperties;
import com.example.intent.model.ConversationContext;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.DetectedIntent;
import com.example.intent.model.IntentDefinition;
import com.example.intent.model.IntentMatch;

/**
 * Turns a raw cosine similarity into a confidence, optionally weighted by conversation
 * relevance and historical accuracy and raised by a contextual boost.
 */
public class ConfidenceScorer {

    static final int RECENT_INTENT_WINDOW = 3;
    static final int FULL_SAMPLE_SIZE = 5;
    static final int FOLLOW_UP_MAX_TOKENS = 3;

    static final double FOLLOW_UP_RELEVANCE = 0.8;
    static final double CONTINUATION_RELEVANCE = 0.4;
    static final double MINIMAL_HISTORY_RELEVANCE = 0.2;

    private static final Pattern BACK_REFERENCE = Pattern.compile(
        "\\b(it|its|that|this|those|these|they|them|their|he|she|him|her|same|again|also|too|instead)\\b"
            + "|^(and|but|so|or|what about|how about)\\b");

    private final ClassificationProperties properties;

    public ConfidenceScorer(ClassificationProperties properties) {
        this.properties = properties;
    }

    /**
     * Collects the conversation signals for {@code query}. A null context scores as no history.
     */
    public ScoringContext contextFor(String query, ConversationContext context) {
        if (context == null) {
            return ScoringContext.NONE;
        }
        List<ConversationMessage> history = context.messages();
        List<DetectedIntent> recent = context.recentIntents(Math.max(0, properties.historicalInteractionsCount()));
        return new ScoringContext(contextRelevance(query, history), recent);
    }

    /**
     * 0.8 for a likely follow-up (back-reference or three tokens or fewer), 0.4 with at least
     * two prior turns, 0.2 with a single prior turn, 0 with none.
     */
    static double contextRelevance(String query, List<ConversationMessage> history) {
        if (history == null || history.isEmpty()) {
            return 0.0;
        }
        String normalized = query.strip().toLowerCase(Locale.ROOT);
        int tokens = normalized.isEmpty() ? 0 : normalized.split("\\s+").length;
        if (tokens <= FOLLOW_UP_MAX_TOKENS || BACK_REFERENCE.matcher(normalized).find()) {
            return FOLLOW_UP_RELEVANCE;
        }
        return history.size() >= 2 ? CONTINUATION_RELEVANCE : MINIMAL_HISTORY_RELEVANCE;
    }

    /**
     * Hits among the last N detections divided by N, scaled by {@code min(1, N/5)}, where N is
     * the configured history size. A short history counts its missing turns as misses.
     */
    double historicalAccuracy(String intentName, List<DetectedIntent> recentIntents) {
        int n = properties.historicalInteractionsCount();
        if (n <= 0 || recentIntents.isEmpty()) {
            return 0.0;
        }
        long hits = recentIntents.subList(0, Math.min(n, recentIntents.size())).stream()
            .filter(d -> intentName.equalsIgnoreCase(d.intent()))
            .count();
        double sampleDiscount = Math.min(1.0, (double) n / FULL_SAMPLE_SIZE);
        return clamp01((double) hits / n * sampleDiscount);
    }

    /**
     * The full factor when the intent was among the three latest detections, half of it when
     * only a parent or child was, otherwise 0.
     */
    double contextualBoost(IntentDefinition intent, List<DetectedIntent> recentIntents) {
        if (!properties.contextualBoostEnabled() || recentIntents.isEmpty()) {
            return 0.0;
        }
        List<DetectedIntent> latest = recentIntents.subList(0, Math.min(RECENT_INTENT_WINDOW, recentIntents.size()));
        double factor = Math.max(0.0, properties.contextualBoostFactor());
        if (latest.stream().anyMatch(d -> intent.getName().equalsIgnoreCase(d.intent()))) {
            return factor;
        }
        if (latest.stream().anyMatch(d -> intent.isRelatedTo(d.intent()))) {
            return factor / 2;
        }
        return 0.0;
    }

    /**
     * Scores a candidate without conversation context: the confidence is the clamped similarity.
     */
    public IntentMatch score(IntentDefinition intent, String matchedExample, double similarity) {
        double confidence = Math.min(clamp01(properties.maxConfidence()), clamp01(similarity));
        return new IntentMatch(intent.getName(), matchedExample, similarity, 0.0, 0.0, 0.0,
            clamp01(similarity), confidence);
    }

    public IntentMatch score(IntentDefinition intent, String matchedExample, double similarity,
                             ScoringContext context) {
        double historical = historicalAccuracy(intent.getName(), context.recentIntents());
        double raw = clamp01(similarity * properties.semanticWeight()
            + context.contextRelevance() * properties.contextWeight()
            + historical * properties.historicalWeight());
        double boost = contextualBoost(intent, context.recentIntents());

        IntentMatch weighted = new IntentMatch(intent.getName(), matchedExample, similarity,
            context.contextRelevance(), historical, 0.0, raw, raw);
        return weighted.withBoost(boost, properties.maxConfidence());
    }

    static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
