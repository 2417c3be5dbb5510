package com.example.intent.reasoning;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.intent.model.ChainOfThoughtResult;
import com.example.intent.model.ChainOfThoughtStep;
import com.example.intent.model.Entity;
import com.example.intent.model.ReasoningVerification;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningReconcilerTest {

    private final ChainOfThoughtResult draft = new ChainOfThoughtResult(
        List.of(
            new ChainOfThoughtStep(1, "Read the request", "User wants last month's revenue", false),
            new ChainOfThoughtStep(2, "Find the data", "Revenue lives in the orders table", false),
            new ChainOfThoughtStep(3, "Plan", "Sum order totals for March", false)),
        "Sum order totals for March",
        0.6,
        List.of(new Entity("metric", "revenue", 0.9)),
        List.of("run_query"),
        false, false, null);

    @Test
    void validVerificationRaisesConfidence() {
        ChainOfThoughtResult result = ReasoningReconciler.reconcile(draft,
            new ReasoningVerification(true, 0.85, List.of(), null));

        assertTrue(result.verified());
        assertEquals(0.85, result.confidenceScore(), 1e-9);
        assertEquals(draft.reasoningSteps(), result.reasoningSteps());
        assertEquals(draft.finalConclusion(), result.finalConclusion());
    }

    @Test
    void validVerificationNeverLowersConfidence() {
        ChainOfThoughtResult result = ReasoningReconciler.reconcile(draft,
            new ReasoningVerification(true, 0.3, List.of(), null));

        assertEquals(0.6, result.confidenceScore(), 1e-9);
        assertTrue(result.verified());
    }

    @Test
    void validVerificationWithoutScoreKeepsDraftScore() {
        ChainOfThoughtResult result = ReasoningReconciler.reconcile(draft,
            new ReasoningVerification(true, null, List.of(), null));

        assertEquals(0.6, result.confidenceScore(), 1e-9);
    }

    @Test
    void invalidVerificationRevisesFlaggedSteps() {
        ChainOfThoughtResult result = ReasoningReconciler.reconcile(draft, new ReasoningVerification(false, 0.7,
            List.of(
                new ReasoningVerification.Issue(3, "Wrong month", "Sum order totals for April"),
                new ReasoningVerification.Issue(7, "No such step", "ignored"),
                new ReasoningVerification.Issue(0, "No such step", "ignored"),
                new ReasoningVerification.Issue(2, "Vague", " ")),
            "Sum order totals for April"));

        assertTrue(result.verified());
        assertEquals(0.7, result.confidenceScore(), 1e-9);
        assertEquals("Sum order totals for April", result.finalConclusion());
        assertEquals(3, result.reasoningSteps().size());

        ChainOfThoughtStep revised = result.reasoningSteps().get(2);
        assertTrue(revised.revised());
        assertEquals("Sum order totals for April", revised.conclusion());
        assertEquals("Plan", revised.thought());
        assertFalse(result.reasoningSteps().get(1).revised());
        assertFalse(result.reasoningSteps().get(0).revised());

        assertEquals(draft.extractedEntities(), result.extractedEntities());
        assertFalse(draft.reasoningSteps().get(2).revised());
    }

    @Test
    void invalidVerificationWithoutImprovementsKeepsDraftConclusion() {
        ChainOfThoughtResult result = ReasoningReconciler.reconcile(draft,
            new ReasoningVerification(false, null, List.of(), null));

        assertTrue(result.verified());
        assertEquals(draft.finalConclusion(), result.finalConclusion());
        assertEquals(0.6, result.confidenceScore(), 1e-9);
    }
}
