package com.example.intent.llm;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Embedding and completion access used by classification, fallback and reasoning.
 *
 * <p>Every call is lazy and cancellable: nothing is sent until the returned {@link Mono} is
 * subscribed, and disposing the subscription abandons the in-flight request. Timeouts are
 * the implementation's concern.
 */
public interface LlmProvider {

    Mono<float[]> generateEmbedding(String model, String text);

    /**
     * Embeds {@code texts} in one request. The result has one vector per input, in input order.
     */
    Mono<List<float[]>> generateBatchEmbeddings(String model, List<String> texts);

    Mono<String> generateCompletion(String model, String prompt, GenerationParams params);

    Mono<String> generateChatCompletion(String model, List<ChatTurn> messages, GenerationParams params);
}
