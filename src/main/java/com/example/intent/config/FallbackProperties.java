package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.intent.fallback")
public record FallbackProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("0.5") double fallbackThreshold,
    @DefaultValue("0.4") double generalizedIntentThreshold,
    @DefaultValue("0.3") double partialIntentThreshold,
    @DefaultValue("3") int maxClarificationQuestions,
    @DefaultValue("5") int maxAlternatives,
    @DefaultValue("5") int contextWindowMessages,
    @DefaultValue("true") boolean learnFromMisclassifications,
    @DefaultValue("I'm not completely sure I understand. Are you asking about: %s? Or did you mean something else?")
    String clarificationPromptTemplate,
    @DefaultValue("llama3") String modelName
) {

    public static final String DEFAULT_CLARIFICATION_TEMPLATE =
        "I'm not completely sure I understand. Are you asking about: %s? Or did you mean something else?";

    public static FallbackProperties defaults() {
        return new FallbackProperties(true, 0.5, 0.4, 0.3, 3, 5, 5, true,
            DEFAULT_CLARIFICATION_TEMPLATE, "llama3");
    }
}
