package com.example.intent.model;

public enum RecommendedAction {
    PROCEED,
    PROCEED_WITH_CAUTION,
    CLARIFY,
    FALLBACK,
    NO_MATCH;

    public boolean requiresEscalation() {
        return this == FALLBACK || this == NO_MATCH;
    }
}
