package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings for model-based intent detection. A context-free detection below
 * {@code confidenceThreshold} is sent back to the model for review when self-verification is on.
 */
@ConfigurationProperties(prefix = "app.intent.detection")
public record DetectionProperties(
    @DefaultValue("llama3") String modelName,
    @DefaultValue("0.7") double confidenceThreshold,
    @DefaultValue("true") boolean selfVerificationEnabled,
    @DefaultValue("10") int maxContextWindowMessages
) {

    public static DetectionProperties defaults() {
        return new DetectionProperties("llama3", 0.7, true, 10);
    }
}
