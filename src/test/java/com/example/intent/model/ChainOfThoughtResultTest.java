package com.example.intent.model;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChainOfThoughtResultTest {

    private static ChainOfThoughtResult withSteps(int count, int... revised) {
        List<ChainOfThoughtStep> steps = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            boolean isRevised = false;
            for (int r : revised) {
                isRevised |= r == i;
            }
            steps.add(new ChainOfThoughtStep(i, "thought " + i, "conclusion " + i, isRevised));
        }
        return new ChainOfThoughtResult(steps, "done", 0.8, List.of(), List.of(), false, false, null);
    }

    private static List<Integer> numbers(List<ChainOfThoughtStep> steps) {
        return steps.stream().map(ChainOfThoughtStep::stepNumber).toList();
    }

    @Test
    void shortReasoningIsReturnedWhole() {
        assertEquals(List.of(1, 2, 3), numbers(withSteps(3).keyReasoningSteps(3)));
    }

    @Test
    void keepsFirstLastAndEvenlySpacedSteps() {
        assertEquals(List.of(1, 6, 10), numbers(withSteps(10).keyReasoningSteps(3)));
    }

    @Test
    void revisedStepsArePreferred() {
        assertEquals(List.of(1, 7, 10), numbers(withSteps(10, 7).keyReasoningSteps(3)));
    }

    @Test
    void zeroBudgetSelectsNothing() {
        assertTrue(withSteps(5).keyReasoningSteps(0).isEmpty());
    }

    @Test
    void summaryKeepsEverythingButTheDroppedSteps() {
        ChainOfThoughtResult summary = withSteps(10, 7).summarized(3);

        assertEquals(List.of(1, 7, 10), numbers(summary.reasoningSteps()));
        assertEquals("done", summary.finalConclusion());
        assertEquals(0.8, summary.confidenceScore());
        assertFalse(summary.hasError());
    }

    @Test
    void errorResultCarriesTheMessage() {
        ChainOfThoughtResult error = ChainOfThoughtResult.error("boom");

        assertTrue(error.hasError());
        assertFalse(error.verified());
        assertEquals(0.0, error.confidenceScore());
        assertEquals("boom", error.reasoningSteps().get(0).conclusion());
    }
}
