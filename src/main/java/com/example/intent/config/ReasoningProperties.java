package com.example.intent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.intent.reasoning")
public record ReasoningProperties(
    @DefaultValue("llama3") String modelName,
    @DefaultValue("true") boolean selfVerificationEnabled,
    @DefaultValue("10") int maxContextMessages
) {

    public static ReasoningProperties defaults() {
        return new ReasoningProperties("llama3", true, 10);
    }
}
