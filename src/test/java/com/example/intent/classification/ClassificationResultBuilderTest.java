package com.example.intent.classification;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.intent.config.ClassificationProperties;
import com.example.intent.model.ClassificationResult;
import com.example.intent.model.IntentMatch;
import com.example.intent.model.RecommendedAction;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationResultBuilderTest {

    private final ClassificationProperties properties = ClassificationProperties.defaults();

    private static IntentMatch match(String intent, double confidence) {
        return new IntentMatch(intent, intent + " example", confidence, 0.0, 0.0, 0.0, confidence, confidence);
    }

    private ClassificationResult build(List<IntentMatch> matches) {
        return new ClassificationResultBuilder("query", matches, properties)
            .calculateAmbiguity()
            .determineRecommendedAction()
            .buildExplanation()
            .build();
    }

    @ParameterizedTest(name = "noMatches={0}, top={1}, ambiguous={2} -> {3}")
    @CsvSource({
        "true,  0.0,  false, NO_MATCH",
        "true,  0.0,  true,  NO_MATCH",
        "false, 0.49, false, FALLBACK",
        "false, 0.49, true,  FALLBACK",
        "false, 0.5,  true,  CLARIFY",
        "false, 0.84, true,  CLARIFY",
        "false, 0.85, true,  PROCEED",
        "false, 0.95, false, PROCEED",
        "false, 0.5,  false, PROCEED_WITH_CAUTION",
        "false, 0.84, false, PROCEED_WITH_CAUTION",
    })
    void actionPrecedence(boolean noMatches, double top, boolean ambiguous, RecommendedAction expected) {
        assertEquals(expected, ClassificationResultBuilder.recommend(noMatches, top, ambiguous, properties));
    }

    @Test
    void ranksByConfidenceKeepingTiesInOrder() {
        ClassificationResult result = build(List.of(
            match("first", 0.8), match("best", 0.95), match("second", 0.8)));

        assertEquals(List.of("best", "first", "second"),
            result.matches().stream().map(IntentMatch::intentName).toList());
        assertEquals("best", result.topMatch().intentName());
        assertEquals(0.15, result.confidenceDifferential(), 1e-9);
        assertFalse(result.ambiguous());
        assertEquals(RecommendedAction.PROCEED, result.recommendedAction());
    }

    @Test
    void singleMatchIsNeverAmbiguous() {
        ClassificationResult result = build(List.of(match("greeting", 0.72)));

        assertEquals(1.0, result.confidenceDifferential(), 1e-9);
        assertFalse(result.ambiguous());
        assertEquals(RecommendedAction.PROCEED_WITH_CAUTION, result.recommendedAction());
        assertNull(result.clarificationQuestion());
    }

    @Test
    void noMatchesGivesNoMatchResult() {
        ClassificationResult result = build(List.of());

        assertNull(result.topMatch());
        assertEquals(RecommendedAction.NO_MATCH, result.recommendedAction());
        assertEquals(0.0, result.topConfidence());
        assertTrue(result.explanation().startsWith("No intent reached the similarity threshold of 0.70."));
        assertTrue(result.explanation().endsWith("Recommended action: NO_MATCH."));
    }

    @Test
    void twoCloseMatchesAskToChoose() {
        ClassificationResult result = build(List.of(match("billing_inquiry", 0.75), match("cancel-subscription", 0.7)));

        assertTrue(result.ambiguous());
        assertEquals(RecommendedAction.CLARIFY, result.recommendedAction());
        assertEquals("Did you mean billing inquiry or cancel subscription?", result.clarificationQuestion());
        assertTrue(result.explanation().contains("Ambiguous with 'cancel-subscription'"));
    }

    @Test
    void threeCloseMatchesListTheTopThree() {
        ClassificationResult result = build(List.of(
            match("a_one", 0.76), match("b_two", 0.74), match("c_three", 0.72), match("d_four", 0.71)));

        assertEquals(RecommendedAction.CLARIFY, result.recommendedAction());
        assertEquals("I'm not sure what you mean. Are you asking about a one, b two, or c three?",
            result.clarificationQuestion());
    }

    @Test
    void explanationDescribesTopMatch() {
        IntentMatch boosted = new IntentMatch("billing", "my bill", 0.8, 0.4, 0.2, 0.1, 0.65, 0.75);
        ClassificationResult result = new ClassificationResultBuilder("query", List.of(boosted), properties)
            .withContextRelevance(0.4)
            .calculateAmbiguity()
            .determineRecommendedAction()
            .buildExplanation()
            .build();

        String explanation = result.explanation();
        assertTrue(explanation.contains("Top intent 'billing' matched example \"my bill\"."));
        assertTrue(explanation.contains("Semantic similarity: 0.800."));
        assertTrue(explanation.contains("Contextual boost: +0.100."));
        assertTrue(explanation.contains("Final confidence: 0.750."));
        assertEquals(0.4, result.contextRelevance(), 1e-9);
        assertEquals(0.2, result.historicalAccuracy(), 1e-9);
    }

    @Test
    void stagesMustRunInOrder() {
        ClassificationResultBuilder builder = new ClassificationResultBuilder("query", List.of(match("x", 0.9)), properties);

        assertThrows(IllegalStateException.class, builder::determineRecommendedAction);
        assertThrows(IllegalStateException.class, builder::buildExplanation);
        assertThrows(IllegalStateException.class, builder::build);

        builder.calculateAmbiguity();
        assertThrows(IllegalStateException.class, builder::calculateAmbiguity);
        assertThrows(IllegalStateException.class, () -> builder.withContextRelevance(0.5));
        assertThrows(IllegalStateException.class, builder::build);
    }
}
