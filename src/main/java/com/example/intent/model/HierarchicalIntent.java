package com.example.intent.model;

import java.util.List;

/**
 * A top-level intent with the narrower intents found inside the same query.
 */
public record HierarchicalIntent(IntentDetection topLevelIntent, List<IntentDetection> subIntents) {

    public HierarchicalIntent {
        subIntents = subIntents != null ? List.copyOf(subIntents) : List.of();
    }

    public boolean hasMultipleIntents() {
        return !subIntents.isEmpty();
    }
}
