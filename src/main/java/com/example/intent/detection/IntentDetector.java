package com.example.intent.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.intent.classification.IntentClassifier;
import com.example.intent.config.DetectionProperties;
import com.example.intent.context.ConversationContextStore;
import com.example.intent.fallback.FallbackEscalator;
import com.example.intent.llm.GenerationParams;
import com.example.intent.llm.LlmProvider;
import com.example.intent.llm.ModelOutputDecoder;
import com.example.intent.llm.ParseResult;
import com.example.intent.model.ConversationContext;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.DetectedIntent;
import com.example.intent.model.Entity;
import com.example.intent.model.FallbackResult;
import com.example.intent.model.HierarchicalIntent;
import com.example.intent.model.IntentDetection;
import com.example.intent.telemetry.IntentMetrics;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;

/**
 * Asks the chat model for the intent of a query directly, as opposed to matching it against
 * registered examples. Low-confidence answers go through the {@link FallbackEscalator}, and the
 * outcome of the ladder is attached to the detection as entities.
 *
 * <p>Intent names the model returns are mapped onto registered intents where a name or alias
 * matches; other names are kept as given. Provider failures propagate, except on the
 * conversation-aware path, which retries without the conversation.
 */
@Component
public class IntentDetector {

    private static final Logger log = LoggerFactory.getLogger(IntentDetector.class);

    public static final String PARSE_ERROR = "parse_error";
    public static final String FALLBACK_LEVEL = "fallback_level";
    public static final String REQUIRES_CLARIFICATION = "requires_clarification";
    public static final String CLARIFICATION_QUESTION = "clarification_question_";
    public static final String FALLBACK_REASON = "fallback_reason";

    private static final String DETECTION_PROMPT = """
        Classify the intent of this user query and pull out any entities it mentions.

        User query: "%s"

        Respond with a JSON object:
        {
          "intent": "<intent_name>",
          "confidence": <0.0 to 1.0>,
          "explanation": "<short reason for the classification>",
          "entities": [
            {"type": "<entity type>", "value": "<entity value>", "confidence": <0.0 to 1.0>}
          ]
        }
        """;

    private static final String CONTEXTUAL_PROMPT = """
        Classify the intent of the latest user query in light of the conversation so far.

        %s

        Latest user query: "%s"

        Respond with a JSON object:
        {
          "intent": "<intent_name>",
          "confidence": <0.0 to 1.0>,
          "explanation": "<short reason, including how the conversation affected it>",
          "entities": [
            {"type": "<entity type>", "value": "<entity value>", "confidence": <0.0 to 1.0>}
          ]
        }
        """;

    private static final String VERIFICATION_PROMPT = """
        Check whether this intent classification is right.

        User query: "%s"
        Classified intent: "%s"
        Confidence: %.2f

        If it is wrong, give the intent that fits better.

        Respond with a JSON object:
        {
          "isCorrect": <true or false>,
          "correctedIntent": "<intent_name if corrected>",
          "confidence": <0.0 to 1.0>,
          "explanation": "<why>"
        }
        """;

    private static final String HIERARCHICAL_PROMPT = """
        Find the top-level intent of this user query and any sub-intents it also contains.

        User query: "%s"

        Respond with a JSON object:
        {
          "topLevelIntent": {"intent": "<intent_name>", "confidence": <0.0 to 1.0>, "explanation": "<why>"},
          "subIntents": [
            {"intent": "<intent_name>", "confidence": <0.0 to 1.0>, "explanation": "<why>"}
          ]
        }
        """;

    private final LlmProvider llmProvider;
    private final ConversationContextStore contextStore;
    private final FallbackEscalator escalator;
    private final IntentClassifier classifier;
    private final DetectionProperties properties;
    private final IntentMetrics metrics;

    @Autowired
    public IntentDetector(LlmProvider llmProvider, ObjectProvider<ConversationContextStore> contextStore,
                          FallbackEscalator escalator, IntentClassifier classifier,
                          DetectionProperties properties, IntentMetrics metrics) {
        this(llmProvider, contextStore.getIfAvailable(), escalator, classifier, properties, metrics);
    }

    public IntentDetector(LlmProvider llmProvider, ConversationContextStore contextStore,
                          FallbackEscalator escalator, IntentClassifier classifier,
                          DetectionProperties properties, IntentMetrics metrics) {
        this.llmProvider = llmProvider;
        this.contextStore = contextStore;
        this.escalator = escalator;
        this.classifier = classifier;
        this.properties = properties;
        this.metrics = metrics;
    }

    public Mono<IntentDetection> detectIntent(String query) {
        return detectIntent(query, null);
    }

    /**
     * Detects the intent of {@code query}. With a conversation id the latest turns of the
     * conversation go into the prompt, and the query and its intent are recorded afterwards.
     * A conversation that cannot be used is logged and the query is detected without it.
     *
     * @throws IllegalArgumentException if the query is empty
     */
    public Mono<IntentDetection> detectIntent(String query, String conversationId) {
        requireQuery(query);
        boolean withConversation = conversationId != null && !conversationId.isBlank() && contextStore != null;

        Mono<IntentDetection> detection = withConversation
            ? detectInConversation(query, conversationId)
                .onErrorResume(e -> {
                    log.warn("Conversation {} unusable for detection, detecting without it: {}",
                        conversationId, e.getMessage());
                    return detectWithoutContext(query);
                })
            : detectWithoutContext(query);

        return detection.flatMap(result -> withConversation ? record(conversationId, query, result) : Mono.just(result));
    }

    /**
     * Detects the intent of {@code query} against an explicit list of earlier messages. Nothing
     * is recorded.
     *
     * @throws IllegalArgumentException if the query is empty
     */
    public Mono<IntentDetection> detectIntentWithContext(String query, List<ConversationMessage> messages) {
        requireQuery(query);
        List<ConversationMessage> history = messages != null ? messages : List.of();
        String prompt = String.format(Locale.ROOT, CONTEXTUAL_PROMPT, formatConversation(history), query);

        return complete(prompt, query)
            .flatMap(result -> escalateIfNeeded(result, "contextual",
                () -> escalator.applyFallbackWithContext(query, result, history)))
            .doOnNext(result -> log.info("Detected '{}' with explicit context: {} ({})",
                truncate(query), result.intent(), result.confidence()));
    }

    public Mono<HierarchicalIntent> classifyHierarchicalIntent(String query) {
        return classifyHierarchicalIntent(query, null);
    }

    /**
     * Splits {@code query} into a top-level intent and sub-intents. With a conversation id the
     * query and the top-level intent are recorded; recording failures are only logged.
     *
     * @throws IllegalArgumentException if the query is empty
     */
    public Mono<HierarchicalIntent> classifyHierarchicalIntent(String query, String conversationId) {
        requireQuery(query);
        String prompt = String.format(Locale.ROOT, HIERARCHICAL_PROMPT, query);

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.1))
            .map(raw -> parseHierarchy(raw, query))
            .map(hierarchy -> new HierarchicalIntent(canonical(hierarchy.topLevelIntent()),
                hierarchy.subIntents().stream().map(this::canonical).toList()))
            .flatMap(hierarchy -> {
                log.info("Hierarchical intent for '{}': {} with {} sub-intents", truncate(query),
                    hierarchy.topLevelIntent().intent(), hierarchy.subIntents().size());
                metrics.recordDetection("hierarchical", hierarchy.topLevelIntent().intent(), false);
                if (conversationId == null || conversationId.isBlank() || contextStore == null) {
                    return Mono.just(hierarchy);
                }
                return record(conversationId, query, hierarchy.topLevelIntent()).thenReturn(hierarchy);
            });
    }

    /**
     * Entities recorded with the conversation's intents, newest first.
     */
    public Mono<List<Entity>> getRecentEntities(String conversationId, String entityType, int maxCount) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation id cannot be empty");
        }
        if (contextStore == null) {
            return Mono.just(List.of());
        }
        return contextStore.getRecentEntities(conversationId, entityType, maxCount);
    }

    public boolean isConfidentClassification(double confidence) {
        return confidence >= properties.confidenceThreshold();
    }

    private Mono<IntentDetection> detectInConversation(String query, String conversationId) {
        int window = Math.max(0, properties.maxContextWindowMessages());
        return contextStore.getContext(conversationId)
            .map(context -> context.recentMessages(window))
            .defaultIfEmpty(List.of())
            .flatMap(history -> complete(String.format(Locale.ROOT, CONTEXTUAL_PROMPT,
                formatConversation(history), query), query))
            .flatMap(result -> escalateIfNeeded(result, "contextual",
                () -> escalator.applyFallback(query, result, conversationId)));
    }

    private Mono<IntentDetection> detectWithoutContext(String query) {
        return complete(String.format(Locale.ROOT, DETECTION_PROMPT, query), query)
            .flatMap(result -> properties.selfVerificationEnabled() && !isConfidentClassification(result.confidence())
                ? verifyIntent(query, result)
                : Mono.just(result))
            .flatMap(result -> escalateIfNeeded(result, "flat", () -> escalator.applyFallback(query, result)));
    }

    private Mono<IntentDetection> complete(String prompt, String query) {
        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.1))
            .map(raw -> canonical(parseDetection(raw, query)));
    }

    /**
     * Asks the model to review a weak detection. A correction replaces intent, confidence and
     * explanation but keeps the entities; unusable output keeps the detection as it was.
     */
    Mono<IntentDetection> verifyIntent(String query, IntentDetection detection) {
        String prompt = String.format(Locale.ROOT, VERIFICATION_PROMPT, query, detection.intent(),
            detection.confidence());

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.1))
            .map(raw -> {
                ParseResult<JsonNode> parsed = ModelOutputDecoder.readObject(raw);
                if (!parsed.isOk()) {
                    log.warn("Unparseable intent verification, keeping '{}': {}",
                        detection.intent(), parsed.error().reason());
                    return detection;
                }
                JsonNode root = parsed.value();
                if (ModelOutputDecoder.bool(root, "isCorrect", true)) {
                    return detection;
                }
                IntentDetection corrected = canonical(new IntentDetection(
                    ModelOutputDecoder.text(root, "correctedIntent", detection.intent()),
                    query,
                    ModelOutputDecoder.confidence(root, "confidence", detection.confidence()),
                    detection.entities(),
                    ModelOutputDecoder.text(root, "explanation", detection.explanation())));
                log.info("Intent corrected from '{}' to '{}'", detection.intent(), corrected.intent());
                return corrected;
            })
            .onErrorResume(e -> {
                log.error("Intent verification failed, keeping '{}': {}", detection.intent(), e.getMessage());
                return Mono.just(detection);
            });
    }

    private Mono<IntentDetection> escalateIfNeeded(IntentDetection result, String mode,
                                                   Supplier<Mono<FallbackResult>> fallback) {
        if (!escalator.needsFallback(result)) {
            metrics.recordDetection(mode, result.intent(), false);
            return Mono.just(result);
        }
        log.info("Detection '{}' has low confidence ({}), applying fallback", result.intent(), result.confidence());
        return fallback.get()
            .map(IntentDetector::withFallbackOutcome)
            .doOnNext(annotated -> metrics.recordDetection(mode, annotated.intent(), true));
    }

    /**
     * The ladder's final detection with its level, reason and any clarification questions
     * attached as entities.
     */
    static IntentDetection withFallbackOutcome(FallbackResult fallback) {
        IntentDetection chosen = fallback.finalResult() != null ? fallback.finalResult() : fallback.originalResult();
        List<Entity> entities = new ArrayList<>(chosen.entities());
        if (entities.stream().noneMatch(e -> FALLBACK_LEVEL.equals(e.type()))) {
            entities.add(new Entity(FALLBACK_LEVEL, fallback.fallbackLevel().name(), 1.0));
        }
        if (fallback.requiresUserInteraction()) {
            entities.add(new Entity(REQUIRES_CLARIFICATION, "true", 1.0));
            List<String> questions = fallback.clarificationQuestions();
            for (int i = 0; i < questions.size(); i++) {
                entities.add(new Entity(CLARIFICATION_QUESTION + (i + 1), questions.get(i), 1.0));
            }
        }
        if (fallback.fallbackReason() != null && !fallback.fallbackReason().isBlank()) {
            entities.add(new Entity(FALLBACK_REASON, fallback.fallbackReason(), 1.0));
        }
        return new IntentDetection(chosen.intent(), chosen.query(), chosen.confidence(), entities,
            chosen.explanation());
    }

    private Mono<IntentDetection> record(String conversationId, String query, IntentDetection result) {
        Mono<ConversationContext> intent = recordable(result)
            ? Mono.defer(() -> contextStore.appendDetectedIntent(conversationId, DetectedIntent.of(result)))
            : Mono.empty();
        return Mono.defer(() -> contextStore.appendMessage(conversationId, ConversationMessage.user(query)))
            .then(intent)
            .thenReturn(result)
            .onErrorResume(e -> {
                log.warn("Failed to record detection for conversation {}: {}", conversationId, e.getMessage());
                return Mono.just(result);
            });
    }

    private static boolean recordable(IntentDetection result) {
        return !IntentDetection.UNKNOWN.equalsIgnoreCase(result.intent())
            && !PARSE_ERROR.equalsIgnoreCase(result.intent());
    }

    private IntentDetection canonical(IntentDetection detection) {
        return classifier.getModel().findIntent(detection.intent())
            .filter(intent -> !intent.getName().equals(detection.intent()))
            .map(intent -> new IntentDetection(intent.getName(), detection.query(), detection.confidence(),
                detection.entities(), detection.explanation()))
            .orElse(detection);
    }

    static IntentDetection parseDetection(String raw, String query) {
        ParseResult<JsonNode> parsed = ModelOutputDecoder.readObject(raw);
        if (!parsed.isOk()) {
            log.error("Unparseable intent detection: {}", parsed.error().reason());
            return new IntentDetection(PARSE_ERROR, query, 0.0, List.of(), "Failed to parse model response");
        }
        JsonNode root = parsed.value();
        List<Entity> entities = new ArrayList<>();
        JsonNode extracted = root.get("entities");
        if (extracted != null && extracted.isArray()) {
            for (JsonNode node : extracted) {
                if (node.isObject()) {
                    entities.add(new Entity(
                        ModelOutputDecoder.text(node, "type", IntentDetection.UNKNOWN),
                        ModelOutputDecoder.text(node, "value", ""),
                        ModelOutputDecoder.confidence(node, "confidence", 0.0)));
                }
            }
        }
        return new IntentDetection(
            ModelOutputDecoder.text(root, "intent", IntentDetection.UNKNOWN),
            query,
            ModelOutputDecoder.confidence(root, "confidence", 0.0),
            entities,
            ModelOutputDecoder.text(root, "explanation", null));
    }

    static HierarchicalIntent parseHierarchy(String raw, String query) {
        ParseResult<JsonNode> parsed = ModelOutputDecoder.readObject(raw);
        if (!parsed.isOk()) {
            log.error("Unparseable hierarchical intent: {}", parsed.error().reason());
            return new HierarchicalIntent(
                new IntentDetection(PARSE_ERROR, query, 0.0, List.of(), "Failed to parse model response"), List.of());
        }
        JsonNode root = parsed.value();
        JsonNode top = root.get("topLevelIntent");
        IntentDetection topLevel = top != null && top.isObject()
            ? readIntent(top, query)
            : IntentDetection.unknown(query, "No top-level intent found in response");

        List<IntentDetection> subIntents = new ArrayList<>();
        JsonNode subs = root.get("subIntents");
        if (subs != null && subs.isArray()) {
            for (JsonNode node : subs) {
                if (node.isObject()) {
                    subIntents.add(readIntent(node, query));
                }
            }
        }
        return new HierarchicalIntent(topLevel, subIntents);
    }

    private static IntentDetection readIntent(JsonNode node, String query) {
        return new IntentDetection(
            ModelOutputDecoder.text(node, "intent", IntentDetection.UNKNOWN),
            query,
            ModelOutputDecoder.confidence(node, "confidence", 0.0),
            List.of(),
            ModelOutputDecoder.text(node, "explanation", null));
    }

    /**
     * The newest {@code maxContextWindowMessages} turns, oldest first.
     */
    String formatConversation(List<ConversationMessage> messages) {
        if (messages.isEmpty()) {
            return "No conversation context available.";
        }
        List<ConversationMessage> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparing(ConversationMessage::timestamp,
            Comparator.nullsFirst(Comparator.naturalOrder())));
        int window = properties.maxContextWindowMessages();
        if (window > 0 && ordered.size() > window) {
            ordered = ordered.subList(ordered.size() - window, ordered.size());
        }
        StringBuilder history = new StringBuilder("Conversation history:\n");
        for (ConversationMessage message : ordered) {
            String role = "user".equalsIgnoreCase(message.role()) ? "User" : "Assistant";
            history.append(role).append(": ").append(message.content()).append('\n');
        }
        return history.toString().strip();
    }

    private static void requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
    }

    private static String truncate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
