package com.example.intent.classification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import com.example.intent.config.ClassificationProperties;
import com.example.intent.model.ConversationContext;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.DetectedIntent;
import com.example.intent.model.IntentClassificationModel;
import com.example.intent.model.IntentDefinition;
import com.example.intent.model.IntentMatch;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer(ClassificationProperties.defaults());

    static DetectedIntent detected(String intent, int secondsAgo) {
        return new DetectedIntent(intent, 0.9, "q", Instant.now().minusSeconds(secondsAgo));
    }

    static List<ConversationMessage> history(int turns) {
        List<ConversationMessage> messages = new ArrayList<>();
        for (int i = 0; i < turns; i++) {
            messages.add(new ConversationMessage("user", "message " + i, Instant.now().minusSeconds(100 - i)));
        }
        return messages;
    }

    static Stream<Arguments> relevanceCases() {
        return Stream.of(
            Arguments.of("I want to see my invoice from last month please", 0, 0.0),
            Arguments.of("what about it", 1, 0.8),
            Arguments.of("yes please", 3, 0.8),
            Arguments.of("can you also send that invoice to my accountant", 2, 0.8),
            Arguments.of("I want to see my invoice from last month please", 2, 0.4),
            Arguments.of("I want to see my invoice from last month please", 1, 0.2)
        );
    }

    @ParameterizedTest
    @MethodSource("relevanceCases")
    void contextRelevanceHeuristic(String query, int turns, double expected) {
        assertEquals(expected, ConfidenceScorer.contextRelevance(query, history(turns)), 1e-9);
    }

    @Test
    void historicalAccuracyDividesByConfiguredHistorySize() {
        // 2 hits over N = 10
        List<DetectedIntent> recent = List.of(detected("billing", 1), detected("billing", 2));
        assertEquals(0.2, scorer.historicalAccuracy("billing", recent), 1e-9);

        // 3 hits over N = 10
        List<DetectedIntent> five = List.of(detected("billing", 1), detected("other", 2),
            detected("billing", 3), detected("other", 4), detected("BILLING", 5));
        assertEquals(0.3, scorer.historicalAccuracy("billing", five), 1e-9);

        assertEquals(0.0, scorer.historicalAccuracy("billing", List.of()), 1e-9);
    }

    @Test
    void historicalAccuracyLooksAtConfiguredWindowOnly() {
        ConfidenceScorer narrow = new ConfidenceScorer(new ClassificationProperties("m", 0.7, 0.85, 0.5, 0.1,
            0.7, 0.15, 0.15, 0.1, 1.0, 2, true));
        List<DetectedIntent> recent = List.of(detected("other", 1), detected("other", 2),
            detected("billing", 3), detected("billing", 4), detected("billing", 5));

        assertEquals(0.0, narrow.historicalAccuracy("billing", recent), 1e-9);
        // 2 of 2, discounted by 2/5
        assertEquals(0.4, narrow.historicalAccuracy("other", recent), 1e-9);
    }

    @Test
    void historyDisabledScoresZero() {
        ConfidenceScorer none = new ConfidenceScorer(new ClassificationProperties("m", 0.7, 0.85, 0.5, 0.1,
            0.7, 0.15, 0.15, 0.1, 1.0, 0, true));

        assertEquals(0.0, none.historicalAccuracy("billing", List.of(detected("billing", 1))), 1e-9);
    }

    @Test
    void boostForRecentAndRelatedIntents() {
        IntentClassificationModel model = new IntentClassificationModel("m", 0.7);
        IntentDefinition account = new IntentDefinition("account", "", List.of());
        IntentDefinition billing = new IntentDefinition("billing", "", List.of());
        IntentDefinition weather = new IntentDefinition("weather", "", List.of());
        model.addIntent(account);
        model.addIntent(billing);
        model.addIntent(weather);
        model.linkIntents("account", "billing");

        List<DetectedIntent> recent = List.of(detected("billing", 1), detected("other", 2));

        assertEquals(0.1, scorer.contextualBoost(billing, recent), 1e-9);
        assertEquals(0.05, scorer.contextualBoost(account, recent), 1e-9);
        assertEquals(0.0, scorer.contextualBoost(weather, recent), 1e-9);
    }

    @Test
    void boostIgnoresOlderDetections() {
        IntentDefinition billing = new IntentDefinition("billing", "", List.of());
        List<DetectedIntent> recent = List.of(detected("a", 1), detected("b", 2), detected("c", 3),
            detected("billing", 4));

        assertEquals(0.0, scorer.contextualBoost(billing, recent), 1e-9);
    }

    @Test
    void boostCanBeDisabled() {
        ConfidenceScorer disabled = new ConfidenceScorer(new ClassificationProperties("m", 0.7, 0.85, 0.5, 0.1,
            0.7, 0.15, 0.15, 0.1, 1.0, 10, false));
        IntentDefinition billing = new IntentDefinition("billing", "", List.of());

        assertEquals(0.0, disabled.contextualBoost(billing, List.of(detected("billing", 1))), 1e-9);
    }

    @Test
    void weightedScoreWithBoost() {
        IntentDefinition billing = new IntentDefinition("billing", "", List.of());
        ScoringContext context = new ScoringContext(0.4, List.of(detected("billing", 1)));

        IntentMatch match = scorer.score(billing, "my bill", 0.8, context);

        // 0.8*0.7 + 0.4*0.15 + (1/10)*0.15 = 0.56 + 0.06 + 0.015
        assertEquals(0.635, match.rawScore(), 1e-9);
        assertEquals(0.1, match.contextualBoost(), 1e-9);
        assertEquals(0.735, match.confidence(), 1e-9);
        assertEquals(0.1, match.historicalAccuracy(), 1e-9);
        assertEquals(0.8, match.semanticSimilarity(), 1e-9);
    }

    @Test
    void contextFreeScoreIsClampedSimilarity() {
        IntentDefinition billing = new IntentDefinition("billing", "", List.of());

        IntentMatch match = scorer.score(billing, "my bill", 0.93);
        assertEquals(0.93, match.confidence(), 1e-9);
        assertEquals(0.0, match.contextualBoost(), 1e-9);
    }

    static Stream<Arguments> extremeSettings() {
        return Stream.of(
            Arguments.of(5.0, 5.0, 5.0, 2.0, 1.0),
            Arguments.of(-3.0, 0.0, 0.0, 0.5, 1.0),
            Arguments.of(0.0, 0.0, 0.0, 10.0, 0.6),
            Arguments.of(1.0, 1.0, 1.0, 0.5, 1.0)
        );
    }

    @ParameterizedTest
    @MethodSource("extremeSettings")
    void confidenceStaysWithinBounds(double semantic, double context, double historical, double boost, double ceiling) {
        ConfidenceScorer extreme = new ConfidenceScorer(ClassificationProperties.defaults()
            .withWeights(semantic, context, historical)
            .withBoost(boost, ceiling));
        IntentDefinition billing = new IntentDefinition("billing", "", List.of());
        ScoringContext scoring = new ScoringContext(0.8, List.of(detected("billing", 1)));

        for (double similarity : new double[] {-1.0, 0.0, 0.5, 1.0}) {
            IntentMatch match = extreme.score(billing, "x", similarity, scoring);
            assertTrue(match.confidence() >= 0.0 && match.confidence() <= ceiling,
                "confidence " + match.confidence() + " out of bounds");
            assertTrue(match.contextualBoost() <= IntentMatch.MAX_BOOST);
        }
    }

    @Test
    void contextForUsesRecentIntentsMostRecentFirst() {
        ConversationContext context = ConversationContext.empty("c1")
            .withMessage(ConversationMessage.user("hello"), 20)
            .withDetectedIntent(detected("greeting", 10), 10)
            .withDetectedIntent(detected("billing", 1), 10);

        ScoringContext scoring = scorer.contextFor("and the other one?", context);

        assertEquals(0.8, scoring.contextRelevance(), 1e-9);
        assertEquals("billing", scoring.recentIntents().get(0).intent());
        assertEquals(ScoringContext.NONE, scorer.contextFor("anything", null));
    }
}
