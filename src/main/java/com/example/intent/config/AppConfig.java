package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Chat provider selection. The primary provider serves every completion; the fallback
 * provider is tried only after the primary has exhausted its retries.
 */
@ConfigurationProperties(prefix = "app.llm")
public record AppConfig(
    @DefaultValue("ollama") String provider,
    @DefaultValue("llama3") String modelCapable,
    @DefaultValue("llama3") String modelFast,
    @DefaultValue("") String fallbackProvider,
    @DefaultValue("") String fallbackModel,
    @DefaultValue("1024") int maxTokens,
    @DefaultValue("0.2") double temperature
) {

    public boolean hasFallbackProvider() {
        return fallbackProvider != null && !fallbackProvider.isBlank()
            && !fallbackProvider.equalsIgnoreCase(provider);
    }
}
