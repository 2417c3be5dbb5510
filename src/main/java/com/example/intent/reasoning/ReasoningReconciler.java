package com.example.intent.reasoning;

import java.util.ArrayList;
import java.util.List;

import com.example.intent.model.ChainOfThoughtResult;
import com.example.intent.model.ChainOfThoughtStep;
import com.example.intent.model.ReasoningVerification;

/**
 * Folds a verification pass into a reasoning draft. Neither input is modified.
 */
public final class ReasoningReconciler {

    private ReasoningReconciler() {
    }

    /**
     * A valid verification keeps the draft and raises its confidence to the verified score when
     * that is higher. An invalid one rewrites the conclusion of every step it has a correction
     * for and takes its improved conclusion and confidence, falling back to the draft's own.
     * Issues pointing outside the draft's steps are ignored.
     */
    public static ChainOfThoughtResult reconcile(ChainOfThoughtResult draft, ReasoningVerification verification) {
        if (verification.valid()) {
            double verified = verification.confidenceScore() != null
                ? verification.confidenceScore() : draft.confidenceScore();
            return draft.markVerified(Math.max(draft.confidenceScore(), verified));
        }

        List<ChainOfThoughtStep> steps = new ArrayList<>(draft.reasoningSteps());
        for (ReasoningVerification.Issue issue : verification.issues()) {
            int index = issue.step() - 1;
            if (index < 0 || index >= steps.size()) {
                continue;
            }
            if (issue.correction() != null && !issue.correction().isBlank()) {
                steps.set(index, steps.get(index).revise(issue.correction()));
            }
        }

        String conclusion = verification.improvedConclusion() != null
            ? verification.improvedConclusion() : draft.finalConclusion();
        double confidence = verification.confidenceScore() != null
            ? verification.confidenceScore() : draft.confidenceScore();

        return new ChainOfThoughtResult(steps, conclusion, confidence, draft.extractedEntities(),
            draft.suggestedActions(), true, draft.hasError(), draft.errorMessage());
    }
}
