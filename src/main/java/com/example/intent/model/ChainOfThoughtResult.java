package com.example.intent.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public record ChainOfThoughtResult(
    List<ChainOfThoughtStep> reasoningSteps,
    String finalConclusion,
    double confidenceScore,
    List<Entity> extractedEntities,
    List<String> suggestedActions,
    boolean verified,
    boolean hasError,
    String errorMessage
) {

    public ChainOfThoughtResult {
        reasoningSteps = reasoningSteps != null ? List.copyOf(reasoningSteps) : List.of();
        extractedEntities = extractedEntities != null ? List.copyOf(extractedEntities) : List.of();
        suggestedActions = suggestedActions != null ? List.copyOf(suggestedActions) : List.of();
    }

    public static ChainOfThoughtResult error(String message) {
        return new ChainOfThoughtResult(
            List.of(new ChainOfThoughtStep(1, "Error occurred during reasoning", message, false)),
            "Unable to provide reasoning due to an error", 0.0, List.of(), List.of(),
            false, true, message);
    }

    public ChainOfThoughtResult markVerified(double confidence) {
        return new ChainOfThoughtResult(reasoningSteps, finalConclusion, confidence, extractedEntities,
            suggestedActions, true, hasError, errorMessage);
    }

    /**
     * This result with its steps cut down to {@link #keyReasoningSteps(int)}.
     */
    public ChainOfThoughtResult summarized(int maxSteps) {
        return new ChainOfThoughtResult(keyReasoningSteps(maxSteps), finalConclusion, confidenceScore,
            extractedEntities, suggestedActions, verified, hasError, errorMessage);
    }

    /**
     * Picks at most {@code maxSteps} steps for a summary: the first step, revised steps, the
     * last step, then evenly spaced steps to fill the remaining slots. Returned in step order.
     */
    public List<ChainOfThoughtStep> keyReasoningSteps(int maxSteps) {
        if (reasoningSteps.size() <= maxSteps) {
            return reasoningSteps;
        }
        if (maxSteps <= 0) {
            return List.of();
        }

        List<ChainOfThoughtStep> selected = new ArrayList<>();
        selected.add(reasoningSteps.get(0));

        reasoningSteps.stream()
            .filter(ChainOfThoughtStep::revised)
            .filter(step -> !selected.contains(step))
            .limit(Math.max(0, maxSteps - 2))
            .forEach(selected::add);

        ChainOfThoughtStep last = reasoningSteps.get(reasoningSteps.size() - 1);
        if (selected.size() < maxSteps && !selected.contains(last)) {
            selected.add(last);
        }

        if (selected.size() < maxSteps && reasoningSteps.size() > 2) {
            int remaining = maxSteps - selected.size();
            int interval = reasoningSteps.size() / (remaining + 1);
            for (int i = 1; i <= remaining && interval > 0; i++) {
                int index = i * interval;
                if (index > 0 && index < reasoningSteps.size() - 1) {
                    ChainOfThoughtStep step = reasoningSteps.get(index);
                    if (!selected.contains(step) && selected.size() < maxSteps) {
                        selected.add(step);
                    }
                }
            }
        }

        selected.sort(Comparator.comparingInt(ChainOfThoughtStep::stepNumber));
        return List.copyOf(selected);
    }
}
