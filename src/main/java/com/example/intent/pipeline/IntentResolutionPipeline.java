package com.example.intent.pipeline;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.intent.classification.IntentClassifier;
import com.example.intent.context.ConversationContextStore;
import com.example.intent.fallback.FallbackEscalator;
import com.example.intent.model.ClassificationResult;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.DetectedIntent;
import com.example.intent.model.FallbackLevel;
import com.example.intent.model.FallbackResult;
import com.example.intent.model.IntentDetection;
import com.example.intent.telemetry.IntentMetrics;

import reactor.core.publisher.Mono;

/**
 * Resolves one inbound query: classify against the conversation so far, escalate when the
 * result is too weak, then record the turn and the resolved intent in the conversation.
 */
@Component
public class IntentResolutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IntentResolutionPipeline.class);

    private final IntentClassifier classifier;
    private final FallbackEscalator escalator;
    private final ConversationContextStore contextStore;
    private final IntentMetrics metrics;

    @Autowired
    public IntentResolutionPipeline(IntentClassifier classifier, FallbackEscalator escalator,
                                    ObjectProvider<ConversationContextStore> contextStore, IntentMetrics metrics) {
        this(classifier, escalator, contextStore.getIfAvailable(), metrics);
    }

    public IntentResolutionPipeline(IntentClassifier classifier, FallbackEscalator escalator,
                                    ConversationContextStore contextStore, IntentMetrics metrics) {
        this.classifier = classifier;
        this.escalator = escalator;
        this.contextStore = contextStore;
        this.metrics = metrics;
    }

    public record Resolution(
        String conversationId,
        ClassificationResult classification,
        FallbackResult fallback,
        IntentDetection resolved
    ) {

        public boolean escalated() {
            return fallback.fallbackLevel() != FallbackLevel.NONE;
        }
    }

    /**
     * @param conversationId existing conversation, or null to start a new one
     * @throws IllegalArgumentException if the query is empty
     */
    public Mono<Resolution> resolve(String query, String conversationId) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        String convId = conversationId != null && !conversationId.isBlank()
            ? conversationId : UUID.randomUUID().toString();
        long startNanos = System.nanoTime();

        return classifier.classifyWithContext(query, convId)
            .flatMap(classification -> {
                IntentDetection detection = IntentDetection.from(classification);
                Mono<FallbackResult> fallback = escalator.needsFallback(detection)
                    ? escalator.applyFallback(query, detection, convId)
                    : Mono.just(FallbackResult.notNeeded(detection));
                return fallback.map(result -> new Resolution(convId, classification, result, result.finalResult()));
            })
            .flatMap(resolution -> record(query, resolution).thenReturn(resolution))
            .doOnNext(resolution -> {
                double durationSec = (System.nanoTime() - startNanos) / 1_000_000_000.0;
                metrics.recordResolutionDuration(durationSec, resolution.resolved().intent(), resolution.escalated());
                log.info("Resolution complete: conv={} intent={} confidence={} fallback={}",
                    convId, resolution.resolved().intent(), resolution.resolved().confidence(),
                    resolution.fallback().fallbackLevel());
            });
    }

    private Mono<Void> record(String query, Resolution resolution) {
        if (contextStore == null) {
            return Mono.empty();
        }
        String convId = resolution.conversationId();
        Mono<?> appendMessage = contextStore.appendMessage(convId, ConversationMessage.user(query));
        IntentDetection resolved = resolution.resolved();
        Mono<?> appendIntent = IntentDetection.UNKNOWN.equals(resolved.intent())
            ? Mono.empty()
            : contextStore.appendDetectedIntent(convId, DetectedIntent.of(resolved));

        return appendMessage.then(appendIntent)
            .then()
            .onErrorResume(e -> {
                log.warn("Failed to update conversation {}: {}", convId, e.getMessage());
                return Mono.empty();
            });
    }
}
