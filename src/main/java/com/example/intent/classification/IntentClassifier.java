package com.example.intent.classification;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.intent.config.ClassificationProperties;
import com.example.intent.context.ConversationContextStore;
import com.example.intent.llm.LlmProvider;
import com.example.intent.model.ClassificationResult;
import com.example.intent.model.ConversationContext;
import com.example.intent.model.EntitySlot;
import com.example.intent.model.IntentClassificationModel;
import com.example.intent.model.IntentDefinition;
import com.example.intent.model.IntentMatch;
import com.example.intent.telemetry.IntentMetrics;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import reactor.core.publisher.Mono;

/**
 * Embedding-based intent classification over an {@link IntentClassificationModel}.
 *
 * <p>Writes to the model through this class are serialized. Classification works on a
 * snapshot of the intents and of each intent's examples, so it never sees an example set
 * that is half replaced.
 */
@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    private final LlmProvider llmProvider;
    private final ConversationContextStore contextStore;
    private final ClassificationProperties properties;
    private final ConfidenceScorer scorer;
    private final IntentMetrics metrics;
    private final Tracer tracer;
    private volatile IntentClassificationModel model;

    @Autowired
    public IntentClassifier(LlmProvider llmProvider, ObjectProvider<ConversationContextStore> contextStore,
                            ClassificationProperties properties, IntentMetrics metrics) {
        this(llmProvider, contextStore.getIfAvailable(), properties, metrics);
    }

    public IntentClassifier(LlmProvider llmProvider, ConversationContextStore contextStore,
                            ClassificationProperties properties, IntentMetrics metrics) {
        this.llmProvider = llmProvider;
        this.contextStore = contextStore;
        this.properties = properties;
        this.scorer = new ConfidenceScorer(properties);
        this.metrics = metrics;
        this.tracer = GlobalOpenTelemetry.getTracer("intent-resolution");
        this.model = new IntentClassificationModel(properties.embeddingModel(), properties.similarityThreshold());
    }

    public Mono<ClassificationResult> classify(String query) {
        return classify(query, null);
    }

    /**
     * Classifies {@code query} without conversation context. Each candidate's confidence is its
     * clamped similarity.
     *
     * @param similarityThreshold overrides the model threshold when not null
     * @throws IllegalArgumentException if the query is empty
     */
    public Mono<ClassificationResult> classify(String query, Double similarityThreshold) {
        requireQuery(query);
        double threshold = threshold(similarityThreshold);
        return embed(query)
            .map(embedding -> embedding.isPresent()
                ? rank(query, embedding.get(), threshold, null)
                : unavailable(query));
    }

    public Mono<ClassificationResult> classifyWithContext(String query, String conversationId) {
        return classifyWithContext(query, conversationId, null);
    }

    /**
     * Classifies {@code query} against the conversation's history. Falls back to
     * {@link #classify(String, Double)} when no store is configured, the conversation is
     * unknown, or the store fails.
     *
     * @throws IllegalArgumentException if the query or conversation id is empty
     */
    public Mono<ClassificationResult> classifyWithContext(String query, String conversationId,
                                                          Double similarityThreshold) {
        requireQuery(query);
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation id cannot be empty");
        }
        if (contextStore == null) {
            log.debug("No conversation store configured, classifying without context");
            return classify(query, similarityThreshold);
        }
        double threshold = threshold(similarityThreshold);

        return contextStore.getContext(conversationId)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .onErrorResume(e -> {
                log.warn("Conversation context unavailable for {}: {}", conversationId, e.getMessage());
                return Mono.just(Optional.empty());
            })
            .flatMap(context -> {
                if (context.isEmpty()) {
                    return classify(query, similarityThreshold);
                }
                return embed(query)
                    .map(embedding -> embedding.isPresent()
                        ? rank(query, embedding.get(), threshold, context.get())
                        : unavailable(query));
            });
    }

    /**
     * Registers an intent, embedding every example. Replaces an intent of the same name.
     */
    public Mono<IntentDefinition> addIntent(String name, String description, List<String> examples,
                                            List<EntitySlot> entitySlots) {
        IntentDefinition intent = new IntentDefinition(name, description, entitySlots);
        List<String> phrases = requireExamples(examples);
        return llmProvider.generateBatchEmbeddings(model.getEmbeddingModel(), phrases)
            .map(embeddings -> {
                intent.replaceExamples(phrases, embeddings);
                synchronized (this) {
                    model.addIntent(intent);
                }
                log.info("Added intent '{}' with {} examples", intent.getName(), phrases.size());
                return intent;
            });
    }

    /**
     * Replaces the examples of an existing intent and regenerates their embeddings.
     *
     * @throws IllegalArgumentException if no intent or alias matches {@code nameOrAlias}
     */
    public Mono<IntentDefinition> updateIntentExamples(String nameOrAlias, List<String> examples) {
        IntentDefinition intent = model.findIntent(nameOrAlias)
            .orElseThrow(() -> new IllegalArgumentException("Intent '" + nameOrAlias + "' does not exist"));
        List<String> phrases = requireExamples(examples);
        return llmProvider.generateBatchEmbeddings(model.getEmbeddingModel(), phrases)
            .map(embeddings -> {
                synchronized (this) {
                    intent.replaceExamples(phrases, embeddings);
                }
                log.info("Updated intent '{}' with {} examples", intent.getName(), phrases.size());
                return intent;
            });
    }

    /**
     * Removes an intent by name or alias, together with every alias pointing to it.
     *
     * @return false if nothing matched
     */
    public synchronized boolean removeIntent(String nameOrAlias) {
        Optional<IntentDefinition> intent = model.findIntent(nameOrAlias);
        if (intent.isEmpty()) {
            log.warn("Cannot remove intent '{}': not found", nameOrAlias);
            return false;
        }
        int aliases = model.removeIntent(intent.get().getName());
        log.info("Removed intent '{}' and {} aliases", intent.get().getName(), aliases);
        return aliases >= 0;
    }

    public synchronized void addAlias(String alias, String intentName) {
        model.addAlias(alias, intentName);
        log.info("Added alias '{}' for intent '{}'", alias, intentName);
    }

    public synchronized void linkIntents(String parentName, String childName) {
        model.linkIntents(parentName, childName);
        log.info("Linked intent '{}' under '{}'", childName, parentName);
    }

    public String resolveIntentName(String nameOrAlias) {
        return model.resolveIntentName(nameOrAlias);
    }

    public IntentClassificationModel getModel() {
        return model;
    }

    public synchronized void setModel(IntentClassificationModel model) {
        if (model == null) {
            throw new IllegalArgumentException("Model cannot be null");
        }
        this.model = model;
        log.info("Replaced classification model: {} intents, {} aliases", model.size(), model.aliases().size());
    }

    /**
     * The query embedding, or empty when the provider fails. Only provider errors are absorbed.
     */
    private Mono<Optional<float[]>> embed(String query) {
        return llmProvider.generateEmbedding(model.getEmbeddingModel(), query)
            .map(Optional::of)
            .onErrorResume(e -> {
                log.error("Query embedding failed for '{}': {}", truncate(query), e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    private ClassificationResult rank(String query, float[] embedding, double threshold,
                                      ConversationContext context) {
        Span span = tracer.spanBuilder("classify_intent")
            .setAttribute("intent.stage", "classify")
            .setAttribute("intent.with_context", context != null)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            ScoringContext scoring = context != null ? scorer.contextFor(query, context) : ScoringContext.NONE;

            List<IntentMatch> candidates = new ArrayList<>();
            for (IntentDefinition intent : model.intents()) {
                if (!intent.hasExamples()) {
                    continue;
                }
                Optional<EmbeddingSimilarity.ExampleMatch> best = EmbeddingSimilarity.bestMatch(embedding, intent);
                if (best.isEmpty() || best.get().similarity() < threshold) {
                    continue;
                }
                candidates.add(context != null
                    ? scorer.score(intent, best.get().example(), best.get().similarity(), scoring)
                    : scorer.score(intent, best.get().example(), best.get().similarity()));
            }

            ClassificationResultBuilder builder = new ClassificationResultBuilder(query, candidates,
                properties.withSimilarityThreshold(threshold));
            ClassificationResult result = builder
                .withContextRelevance(scoring.contextRelevance())
                .calculateAmbiguity()
                .determineRecommendedAction()
                .buildExplanation()
                .build();

            String topIntent = result.topMatch() != null ? result.topMatch().intentName() : "none";
            span.setAttribute("intent.name", topIntent);
            span.setAttribute("intent.confidence", result.topConfidence());
            span.setAttribute("intent.candidates", (long) result.matches().size());
            span.setAttribute("intent.recommended_action", result.recommendedAction().name());
            metrics.recordClassification(result.recommendedAction().name(), topIntent,
                result.topConfidence(), context != null);

            log.debug("Classified '{}': top={} confidence={} action={} candidates={}",
                truncate(query), topIntent, result.topConfidence(), result.recommendedAction(),
                result.matches().size());
            return result;

        } finally {
            span.end();
        }
    }

    private ClassificationResult unavailable(String query) {
        return new ClassificationResultBuilder(query, List.of(), properties)
            .calculateAmbiguity()
            .determineRecommendedAction()
            .buildExplanation()
            .build();
    }

    private double threshold(Double override) {
        if (override == null) {
            return model.getSimilarityThreshold();
        }
        if (override.isNaN() || override < 0.0 || override > 1.0) {
            throw new IllegalArgumentException("Similarity threshold must be between 0 and 1: " + override);
        }
        return override;
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
    }

    private static List<String> requireExamples(List<String> examples) {
        if (examples == null) {
            throw new IllegalArgumentException("Examples cannot be null");
        }
        for (String example : examples) {
            if (example == null || example.isBlank()) {
                throw new IllegalArgumentException("Example cannot be empty");
            }
        }
        return List.copyOf(examples);
    }

    static String truncate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
