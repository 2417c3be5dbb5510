package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.intent.context")
public record ContextProperties(
    @DefaultValue("20") int maxMessageHistory,
    @DefaultValue("10") int maxStoredIntents
) {

    public static ContextProperties defaults() {
        return new ContextProperties(20, 10);
    }
}
