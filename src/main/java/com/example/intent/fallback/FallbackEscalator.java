package com.example.intent.fallback;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.intent.config.FallbackProperties;
import com.example.intent.context.ConversationContextStore;
import com.example.intent.llm.GenerationParams;
import com.example.intent.llm.LlmProvider;
import com.example.intent.llm.ModelOutputDecoder;
import com.example.intent.llm.ParseResult;
import com.example.intent.model.ClassificationResult;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.Entity;
import com.example.intent.model.FallbackLevel;
import com.example.intent.model.FallbackResult;
import com.example.intent.model.IntentDetection;
import com.example.intent.model.MisclassificationData;
import com.example.intent.telemetry.IntentMetrics;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;

/**
 * Escalates a low-confidence detection through four tiers, stopping at the first that works:
 * clarification against better alternatives, a generalized intent, partial extraction, and
 * finally an explicit handoff.
 *
 * <p>Each tier turns provider and parse failures into an empty outcome and moves on. Any other
 * failure ends the ladder in a handoff, so {@code applyFallback} always emits a result.
 */
@Component
public class FallbackEscalator {

    private static final Logger log = LoggerFactory.getLogger(FallbackEscalator.class);

    static final double MIN_ALTERNATIVE_CONFIDENCE = 0.2;
    static final double NEXT_STEP_CONFIDENCE = 0.9;
    static final double MISSING_INFORMATION_CONFIDENCE = 0.9;
    static final String NEXT_STEP = "next_step";
    static final String MISSING_INFORMATION = "missing_information";

    private static final String ALTERNATIVES_PROMPT = """
        You are an intent classification assistant. A user's query was classified with low confidence.
        Suggest other intents the user may have meant.

        User query: "%s"

        Initial classification:
        - Intent: %s
        - Confidence: %.2f
        - Explanation: %s

        Respond with a JSON array, one object per alternative:
        [
          {"intent": "<alternative intent name>", "confidence": <0.0 to 1.0>, "explanation": "<why it may fit>"}
        ]
        """;

    private static final String QUESTIONS_PROMPT = """
        You are helping to work out what a user wants. Their intent is uncertain.

        User query: "%s"

        Possible intents:
        %s

        Write %d short, friendly questions that would tell these intents apart.
        Respond with a JSON array of strings: ["<question 1>", "<question 2>"]
        """;

    private static final String GENERALIZED_PROMPT = """
        You are an intent classification assistant. Classify the query below into a broad category
        of request rather than a specific intent.

        User query: "%s"
        %s
        Respond with a JSON object:
        {
          "intent": "<broad intent category>",
          "confidence": <0.0 to 1.0>,
          "explanation": "<short explanation>",
          "suggestedNextStep": "<what the system should do next>"
        }
        """;

    private static final String PARTIAL_PROMPT = """
        You are an intent analysis assistant. The query below is ambiguous. Extract whatever can be
        determined about the intent and any entities, even if incomplete.

        User query: "%s"
        %s
        Respond with a JSON object:
        {
          "partialIntent": "<what can be determined about the intent>",
          "confidence": <0.0 to 1.0>,
          "extractedEntities": [
            {"type": "<entity type>", "value": "<entity value>", "confidence": <0.0 to 1.0>}
          ],
          "missingInformation": "<what else is needed to understand the query>"
        }
        """;

    private final LlmProvider llmProvider;
    private final ConversationContextStore contextStore;
    private final MisclassificationRecorder recorder;
    private final FallbackProperties properties;
    private final IntentMetrics metrics;

    @Autowired
    public FallbackEscalator(LlmProvider llmProvider, ObjectProvider<ConversationContextStore> contextStore,
                             MisclassificationRecorder recorder, FallbackProperties properties,
                             IntentMetrics metrics) {
        this(llmProvider, contextStore.getIfAvailable(), recorder, properties, metrics);
    }

    public FallbackEscalator(LlmProvider llmProvider, ConversationContextStore contextStore,
                             MisclassificationRecorder recorder, FallbackProperties properties,
                             IntentMetrics metrics) {
        this.llmProvider = llmProvider;
        this.contextStore = contextStore;
        this.recorder = recorder;
        this.properties = properties;
        this.metrics = metrics;
    }

    public boolean needsFallback(IntentDetection detection) {
        return detection == null || detection.confidence() < properties.fallbackThreshold();
    }

    public boolean needsFallback(ClassificationResult result) {
        return result == null || result.topMatch() == null
            || result.topMatch().confidence() < properties.fallbackThreshold();
    }

    public Mono<FallbackResult> applyFallback(String query, IntentDetection detection) {
        return applyFallback(query, detection, null);
    }

    /**
     * Runs the ladder for {@code detection}, folding the latest turns of the conversation into
     * every prompt when {@code conversationId} is given. A conversation that cannot be read is
     * logged and the ladder runs without it.
     *
     * @throws IllegalArgumentException if the query is empty or the detection is null
     */
    public Mono<FallbackResult> applyFallback(String query, IntentDetection detection, String conversationId) {
        requireArguments(query, detection);
        if (!needsFallback(detection)) {
            return Mono.just(FallbackResult.notNeeded(detection));
        }
        return conversationWindow(conversationId)
            .flatMap(messages -> escalate(query, detection, messages));
    }

    /**
     * Runs the ladder with an explicit message window instead of a store lookup.
     *
     * @throws IllegalArgumentException if the query is empty or the detection is null
     */
    public Mono<FallbackResult> applyFallbackWithContext(String query, IntentDetection detection,
                                                         List<ConversationMessage> messages) {
        requireArguments(query, detection);
        if (!needsFallback(detection)) {
            return Mono.just(FallbackResult.notNeeded(detection));
        }
        return escalate(query, detection, latest(messages));
    }

    /**
     * Asks the provider for up to {@code maxQuestions} questions that tell the alternatives apart.
     * Never fails: unusable output yields one templated question about the first alternative.
     *
     * @throws IllegalArgumentException if the query or the alternatives are empty
     */
    public Mono<List<String>> generateClarificationQuestions(String query, List<IntentDetection> alternatives,
                                                             int maxQuestions) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("Alternatives cannot be empty");
        }
        int limit = Math.max(1, Math.min(maxQuestions, properties.maxClarificationQuestions()));
        List<String> templated = List.of(String.format(properties.clarificationPromptTemplate(),
            alternatives.get(0).intent()));

        StringBuilder listing = new StringBuilder();
        for (int i = 0; i < alternatives.size(); i++) {
            IntentDetection alt = alternatives.get(i);
            listing.append(String.format(Locale.ROOT, "%d. Intent: %s, Confidence: %.2f, Explanation: %s%n",
                i + 1, alt.intent(), alt.confidence(), alt.explanation() != null ? alt.explanation() : "none"));
        }
        String prompt = String.format(Locale.ROOT, QUESTIONS_PROMPT, query, listing.toString().strip(), limit);

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.7))
            .map(raw -> {
                List<String> questions = parseQuestions(raw, limit);
                return questions.isEmpty() ? templated : questions;
            })
            .onErrorResume(e -> {
                log.error("Clarification question generation failed: {}", e.getMessage());
                return Mono.just(templated);
            });
    }

    /**
     * @throws IllegalArgumentException if {@code data} is null
     */
    public Mono<Boolean> recordMisclassification(MisclassificationData data) {
        if (data == null) {
            throw new IllegalArgumentException("Misclassification data cannot be null");
        }
        return recorder.record(data)
            .onErrorResume(e -> {
                log.error("Failed to record misclassification {}: {}", data.id(), e.getMessage());
                return Mono.just(false);
            });
    }

    private Mono<FallbackResult> escalate(String query, IntentDetection original, List<ConversationMessage> messages) {
        log.info("Applying fallback for '{}': intent={} confidence={}",
            truncate(query), original.intent(), original.confidence());

        Mono<FallbackResult> ladder = properties.enabled()
            ? runLadder(query, original, formatContext(messages))
            : Mono.just(handoff(original, List.of(), "Fallback strategies are disabled", Map.of()));

        return ladder
            .onErrorResume(e -> {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.error("Fallback failed for '{}', handing off: {}", truncate(query), message, e);
                return Mono.just(handoff(original, List.of(), "Error in fallback processing: " + message,
                    Map.of("error", message)));
            })
            .flatMap(result -> {
                metrics.recordFallback(result.fallbackLevel().name(), result.successful());
                log.info("Fallback for '{}' ended at {} (successful={})",
                    truncate(query), result.fallbackLevel(), result.successful());
                if (!properties.learnFromMisclassifications() || result.misclassificationData() == null) {
                    return Mono.just(result);
                }
                return recordMisclassification(result.misclassificationData()).thenReturn(result);
            });
    }

    private Mono<FallbackResult> runLadder(String query, IntentDetection original, String context) {
        return findAlternatives(query, original, context).flatMap(alternatives -> {
            if (alternatives.stream().anyMatch(a -> a.confidence() > original.confidence())) {
                log.debug("Found {} better alternatives, requesting clarification", alternatives.size());
                return generateClarificationQuestions(query, alternatives, properties.maxClarificationQuestions())
                    .map(questions -> clarification(original, alternatives, questions));
            }
            return generalize(query, context).flatMap(generalized -> {
                if (generalized.isPresent()
                        && generalized.get().confidence() >= properties.generalizedIntentThreshold()) {
                    log.debug("Using generalized intent {}", generalized.get().intent());
                    return Mono.just(tierResult(FallbackLevel.GENERALIZED_INTENT, original, generalized.get(),
                        alternatives, "Using generalized intent approach"));
                }
                return extractPartial(query, context).map(partial -> {
                    if (partial.isPresent() && hasConfidentEntity(partial.get())) {
                        log.debug("Using partial intent {}", partial.get().intent());
                        return tierResult(FallbackLevel.PARTIAL_INTENT_EXTRACTION, original, partial.get(),
                            alternatives, "Extracted partial intent information");
                    }
                    return handoff(original, alternatives, "All fallback strategies failed", Map.of());
                });
            });
        });
    }

    Mono<List<IntentDetection>> findAlternatives(String query, IntentDetection original, String context) {
        String prompt = withContext(context) + String.format(Locale.ROOT, ALTERNATIVES_PROMPT, query,
            original.intent(), original.confidence(),
            original.explanation() != null ? original.explanation() : "No explanation provided");

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.7))
            .map(raw -> {
                ParseResult<JsonNode> parsed = ModelOutputDecoder.readArray(raw);
                if (!parsed.isOk()) {
                    log.warn("Unparseable alternative intents: {}", parsed.error().reason());
                    return List.<IntentDetection>of();
                }
                List<IntentDetection> alternatives = new ArrayList<>();
                for (JsonNode node : parsed.value()) {
                    if (!node.isObject()) {
                        continue;
                    }
                    alternatives.add(new IntentDetection(
                        ModelOutputDecoder.text(node, "intent", IntentDetection.UNKNOWN),
                        query,
                        ModelOutputDecoder.confidence(node, "confidence", 0.0),
                        List.of(),
                        ModelOutputDecoder.text(node, "explanation", null)));
                }
                return alternatives.stream()
                    .filter(a -> !a.intent().equalsIgnoreCase(original.intent()))
                    .filter(a -> a.confidence() > MIN_ALTERNATIVE_CONFIDENCE)
                    .sorted(Comparator.comparingDouble(IntentDetection::confidence).reversed())
                    .limit(properties.maxAlternatives())
                    .collect(Collectors.toList());
            })
            .onErrorResume(e -> {
                log.error("Finding alternative intents failed: {}", e.getMessage());
                return Mono.just(List.of());
            });
    }

    Mono<Optional<IntentDetection>> generalize(String query, String context) {
        String prompt = String.format(Locale.ROOT, GENERALIZED_PROMPT, query, withContext(context));

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.4))
            .map(raw -> {
                ParseResult<JsonNode> parsed = ModelOutputDecoder.readObject(raw);
                if (!parsed.isOk()) {
                    log.warn("Unparseable generalized intent: {}", parsed.error().reason());
                    return Optional.of(IntentDetection.unknown(query, "Generalized intent could not be parsed"));
                }
                JsonNode root = parsed.value();
                List<Entity> entities = new ArrayList<>();
                String nextStep = ModelOutputDecoder.text(root, "suggestedNextStep", null);
                if (nextStep != null && !nextStep.isBlank()) {
                    entities.add(new Entity(NEXT_STEP, nextStep, NEXT_STEP_CONFIDENCE));
                }
                return Optional.of(new IntentDetection(
                    ModelOutputDecoder.text(root, "intent", "general_query"),
                    query,
                    ModelOutputDecoder.confidence(root, "confidence", 0.5),
                    entities,
                    ModelOutputDecoder.text(root, "explanation", "Generalized intent")));
            })
            .onErrorResume(e -> {
                log.error("Generalizing intent failed: {}", e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    Mono<Optional<IntentDetection>> extractPartial(String query, String context) {
        String prompt = String.format(Locale.ROOT, PARTIAL_PROMPT, query, withContext(context));

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.3))
            .map(raw -> {
                ParseResult<JsonNode> parsed = ModelOutputDecoder.readObject(raw);
                if (!parsed.isOk()) {
                    log.warn("Unparseable partial intent: {}", parsed.error().reason());
                    return Optional.<IntentDetection>empty();
                }
                JsonNode root = parsed.value();
                String missing = ModelOutputDecoder.text(root, "missingInformation", "Additional context needed");

                List<Entity> entities = new ArrayList<>();
                JsonNode extracted = root.get("extractedEntities");
                if (extracted != null && extracted.isArray()) {
                    for (JsonNode node : extracted) {
                        if (node.isObject()) {
                            entities.add(new Entity(
                                ModelOutputDecoder.text(node, "type", IntentDetection.UNKNOWN),
                                ModelOutputDecoder.text(node, "value", ""),
                                ModelOutputDecoder.confidence(node, "confidence", 0.5)));
                        }
                    }
                }
                entities.add(new Entity(MISSING_INFORMATION, missing, MISSING_INFORMATION_CONFIDENCE));

                return Optional.of(new IntentDetection(
                    ModelOutputDecoder.text(root, "partialIntent", "unclear_intent"),
                    query,
                    ModelOutputDecoder.confidence(root, "confidence", 0.3),
                    entities,
                    "Partial intent extraction. Missing: " + missing));
            })
            .onErrorResume(e -> {
                log.error("Partial intent extraction failed: {}", e.getMessage());
                return Mono.just(Optional.empty());
            });
    }

    static List<String> parseQuestions(String raw, int limit) {
        ParseResult<JsonNode> parsed = ModelOutputDecoder.readArray(raw);
        List<String> questions = new ArrayList<>();
        if (parsed.isOk()) {
            for (JsonNode node : parsed.value()) {
                if (node.isTextual() && !node.asText().isBlank()) {
                    questions.add(node.asText().strip());
                }
            }
        } else if (raw != null) {
            log.warn("Unparseable clarification questions, salvaging lines: {}", parsed.error().reason());
            for (String part : raw.replace("[", "").replace("]", "").split("\",|\\R")) {
                String candidate = part.replace("\"", "").strip();
                if (candidate.endsWith(",")) {
                    candidate = candidate.substring(0, candidate.length() - 1).strip();
                }
                if (!candidate.isEmpty() && candidate.endsWith("?")) {
                    questions.add(candidate);
                }
            }
        }
        return questions.stream().limit(limit).collect(Collectors.toList());
    }

    private boolean hasConfidentEntity(IntentDetection partial) {
        return partial.entities().stream()
            .filter(e -> !MISSING_INFORMATION.equals(e.type()))
            .anyMatch(e -> e.confidence() >= properties.partialIntentThreshold());
    }

    private FallbackResult clarification(IntentDetection original, List<IntentDetection> alternatives,
                                         List<String> questions) {
        IntentDetection best = alternatives.get(0);
        boolean successful = !questions.isEmpty();
        Map<String, String> details = new LinkedHashMap<>();
        details.put("alternatives", String.valueOf(alternatives.size()));
        details.put("questions", String.valueOf(questions.size()));
        return new FallbackResult(FallbackLevel.REQUEST_CLARIFICATION, original, best, alternatives, questions,
            successful, "Low confidence classification, requesting clarification", true,
            MisclassificationData.of(original, best.intent(), FallbackLevel.REQUEST_CLARIFICATION,
                successful, details));
    }

    private FallbackResult tierResult(FallbackLevel level, IntentDetection original, IntentDetection chosen,
                                      List<IntentDetection> alternatives, String reason) {
        Map<String, String> details = new LinkedHashMap<>();
        details.put("finalConfidence", String.format(Locale.ROOT, "%.3f", chosen.confidence()));
        return new FallbackResult(level, original, chosen, alternatives, List.of(), true, reason, false,
            MisclassificationData.of(original, chosen.intent(), level, true, details));
    }

    private FallbackResult handoff(IntentDetection original, List<IntentDetection> alternatives, String reason,
                                   Map<String, String> details) {
        Map<String, String> recorded = new LinkedHashMap<>(details);
        recorded.put("reason", reason);
        return new FallbackResult(FallbackLevel.EXPLICIT_HANDOFF, original, original, alternatives, List.of(),
            false, reason, true,
            MisclassificationData.of(original, null, FallbackLevel.EXPLICIT_HANDOFF, false, recorded));
    }

    private Mono<List<ConversationMessage>> conversationWindow(String conversationId) {
        if (conversationId == null || conversationId.isBlank() || contextStore == null) {
            return Mono.just(List.of());
        }
        return contextStore.getContext(conversationId)
            .map(context -> context.recentMessages(properties.contextWindowMessages()))
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                log.warn("Conversation context unavailable for {}, continuing without it: {}",
                    conversationId, e.getMessage());
                return Mono.just(List.of());
            });
    }

    private List<ConversationMessage> latest(List<ConversationMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<ConversationMessage> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparing(ConversationMessage::timestamp));
        int window = Math.max(0, properties.contextWindowMessages());
        return ordered.subList(Math.max(0, ordered.size() - window), ordered.size());
    }

    static String formatContext(List<ConversationMessage> messages) {
        return messages.stream()
            .map(m -> roleLabel(m.role()) + ": " + m.content())
            .collect(Collectors.joining("\n"));
    }

    private static String roleLabel(String role) {
        if (role == null) {
            return "User";
        }
        return switch (role.toLowerCase(Locale.ROOT)) {
            case "user" -> "User";
            case "assistant" -> "Assistant";
            case "system" -> "System";
            default -> role;
        };
    }

    private static String withContext(String context) {
        return context.isEmpty() ? "" : "Context information:\n" + context + "\n\n";
    }

    private static void requireArguments(String query, IntentDetection detection) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        if (detection == null) {
            throw new IllegalArgumentException("Detection result cannot be null");
        }
    }

    private static String truncate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
