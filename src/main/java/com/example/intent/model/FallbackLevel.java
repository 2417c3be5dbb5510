package com.example.intent.model;

/**
 * Escalation tiers, in the order they are attempted. NONE means no escalation was needed.
 */
public enum FallbackLevel {
    NONE,
    REQUEST_CLARIFICATION,
    GENERALIZED_INTENT,
    PARTIAL_INTENT_EXTRACTION,
    EXPLICIT_HANDOFF
}
