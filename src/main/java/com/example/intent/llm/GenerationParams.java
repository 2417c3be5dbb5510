package com.example.intent.llm;

/**
 * Sampling parameters for a single completion. {@code maxTokens} of zero leaves the
 * provider default in place; {@code jsonOutput} asks for a bare JSON document.
 */
public record GenerationParams(
    double temperature,
    double topP,
    int maxTokens,
    boolean jsonOutput
) {

    public static GenerationParams json(double temperature) {
        return new GenerationParams(temperature, 0.95, 0, true);
    }

    public static GenerationParams json(double temperature, int maxTokens) {
        return new GenerationParams(temperature, 0.95, maxTokens, true);
    }

    public static GenerationParams text(double temperature) {
        return new GenerationParams(temperature, 0.95, 0, false);
    }
}
