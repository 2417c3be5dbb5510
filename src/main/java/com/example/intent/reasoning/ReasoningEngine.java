package com.example.intent.reasoning;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.intent.config.ReasoningProperties;
import com.example.intent.llm.GenerationParams;
import com.example.intent.llm.LlmProvider;
import com.example.intent.llm.ModelOutputDecoder;
import com.example.intent.llm.ParseResult;
import com.example.intent.model.ChainOfThoughtResult;
import com.example.intent.model.ChainOfThoughtStep;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.Entity;
import com.example.intent.model.ReasoningVerification;
import com.example.intent.telemetry.IntentMetrics;
import com.fasterxml.jackson.databind.JsonNode;

import reactor.core.publisher.Mono;

/**
 * Step-by-step reasoning over a query in three phases: draft, verify, reconcile. Verification
 * runs only when enabled and can only revise the draft, never discard it.
 */
@Component
public class ReasoningEngine {

    private static final Logger log = LoggerFactory.getLogger(ReasoningEngine.class);

    private static final String CHAIN_OF_THOUGHT_PROMPT = """
        You reason step by step. Work through the following request:

        %s

        Previous context:
        %s

        Follow this process:
        1. Parse and clarify the request
        2. Identify key entities and how they relate
        3. Consider possible approaches
        4. Analyze constraints and limitations
        5. Plan a multi-step solution
        6. Refine and validate the solution

        Respond with a JSON object:
        {
          "reasoning": [
            {"step": 1, "thought": "<your thinking at this step>", "conclusion": "<what this step concludes>"}
          ],
          "finalConclusion": "<conclusion after all steps>",
          "confidenceScore": <0.0 to 1.0>,
          "entities": [
            {"type": "<entity type>", "value": "<entity value>", "importance": <0 to 10>}
          ],
          "suggestedActions": ["<action>"]
        }
        """;

    private static final String VERIFICATION_PROMPT = """
        Review this step-by-step reasoning for logical consistency, factual accuracy and whether
        the conclusion follows from the steps:

        %s

        Check that the steps connect, that no step contains a factual error or a wrong
        assumption, and whether the conclusion could be improved.

        Respond with a JSON object:
        {
          "isValid": <true or false>,
          "confidenceScore": <0.0 to 1.0>,
          "issues": [
            {"step": <step number>, "issue": "<what is wrong>", "correction": "<corrected conclusion>"}
          ],
          "improvedConclusion": "<better conclusion, if any>"
        }
        """;

    private final LlmProvider llmProvider;
    private final ReasoningProperties properties;
    private final IntentMetrics metrics;

    public ReasoningEngine(LlmProvider llmProvider, ReasoningProperties properties, IntentMetrics metrics) {
        this.llmProvider = llmProvider;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Never fails: a provider error or an unreadable draft yields a result with
     * {@code hasError} set and zero confidence.
     *
     * @throws IllegalArgumentException if the query is empty
     */
    public Mono<ChainOfThoughtResult> performChainOfThoughtReasoning(String query, List<ConversationMessage> messages) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        String prompt = String.format(CHAIN_OF_THOUGHT_PROMPT, query, formatContext(messages));

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.2, 2048))
            .flatMap(raw -> {
                ParseResult<ChainOfThoughtResult> draft = parseDraft(raw);
                if (!draft.isOk()) {
                    log.error("Unparseable reasoning draft: {}", draft.error().reason());
                    return Mono.just(ChainOfThoughtResult.error("Failed to parse reasoning response"));
                }
                return properties.selfVerificationEnabled() ? verify(draft.value()) : Mono.just(draft.value());
            })
            .onErrorResume(e -> {
                log.error("Reasoning failed for '{}': {}", query, e.getMessage());
                return Mono.just(ChainOfThoughtResult.error("Error during reasoning: " + e.getMessage()));
            })
            .doOnNext(result -> {
                metrics.recordReasoning(result.verified(), result.hasError());
                log.info("Reasoning completed with {} steps, confidence {} (verified={})",
                    result.reasoningSteps().size(), result.confidenceScore(), result.verified());
            });
    }

    Mono<ChainOfThoughtResult> verify(ChainOfThoughtResult draft) {
        String prompt = String.format(VERIFICATION_PROMPT, ModelOutputDecoder.toJson(draft));

        return llmProvider.generateCompletion(properties.modelName(), prompt, GenerationParams.json(0.1, 1024))
            .map(raw -> {
                ParseResult<ReasoningVerification> verification = parseVerification(raw);
                if (!verification.isOk()) {
                    log.warn("Unparseable verification, keeping draft: {}", verification.error().reason());
                    return draft;
                }
                return ReasoningReconciler.reconcile(draft, verification.value());
            })
            .onErrorResume(e -> {
                log.error("Reasoning verification failed, keeping draft: {}", e.getMessage());
                return Mono.just(draft);
            });
    }

    static ParseResult<ChainOfThoughtResult> parseDraft(String raw) {
        return ModelOutputDecoder.readObject(raw).map(root -> {
            List<ChainOfThoughtStep> steps = new ArrayList<>();
            JsonNode reasoning = root.get("reasoning");
            if (reasoning != null && reasoning.isArray()) {
                for (JsonNode node : reasoning) {
                    if (node.isObject()) {
                        steps.add(new ChainOfThoughtStep(
                            ModelOutputDecoder.integer(node, "step", steps.size() + 1),
                            ModelOutputDecoder.text(node, "thought", ""),
                            ModelOutputDecoder.text(node, "conclusion", ""),
                            false));
                    }
                }
            }

            List<Entity> entities = new ArrayList<>();
            JsonNode extracted = root.get("entities");
            if (extracted != null && extracted.isArray()) {
                for (JsonNode node : extracted) {
                    if (!node.isObject()) {
                        continue;
                    }
                    double confidence = ModelOutputDecoder.number(node, "confidence", 0.5);
                    if (node.has("importance")) {
                        // importance is on a 0-10 scale
                        confidence = Math.min(1.0, ModelOutputDecoder.number(node, "importance", confidence * 10) / 10.0);
                    }
                    entities.add(new Entity(
                        ModelOutputDecoder.text(node, "type", "unknown"),
                        ModelOutputDecoder.text(node, "value", ""),
                        ModelOutputDecoder.clamp01(confidence)));
                }
            }

            List<String> actions = new ArrayList<>();
            JsonNode suggested = root.get("suggestedActions");
            if (suggested != null && suggested.isArray()) {
                for (JsonNode node : suggested) {
                    if (node.isTextual()) {
                        actions.add(node.asText());
                    }
                }
            }

            return new ChainOfThoughtResult(steps,
                ModelOutputDecoder.text(root, "finalConclusion", "No conclusion provided"),
                ModelOutputDecoder.confidence(root, "confidenceScore", 0.5),
                entities, actions, false, false, null);
        });
    }

    static ParseResult<ReasoningVerification> parseVerification(String raw) {
        return ModelOutputDecoder.readObject(raw).map(root -> {
            List<ReasoningVerification.Issue> issues = new ArrayList<>();
            JsonNode array = root.get("issues");
            if (array != null && array.isArray()) {
                for (JsonNode node : array) {
                    if (node.isObject()) {
                        issues.add(new ReasoningVerification.Issue(
                            ModelOutputDecoder.integer(node, "step", 0),
                            ModelOutputDecoder.text(node, "issue", ""),
                            ModelOutputDecoder.text(node, "correction", null)));
                    }
                }
            }
            double score = ModelOutputDecoder.number(root, "confidenceScore", Double.NaN);
            Double confidence = Double.isNaN(score) ? null : ModelOutputDecoder.clamp01(score);
            return new ReasoningVerification(
                ModelOutputDecoder.bool(root, "isValid", true),
                confidence,
                issues,
                ModelOutputDecoder.text(root, "improvedConclusion", null));
        });
    }

    private String formatContext(List<ConversationMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return "No previous context available.";
        }
        List<ConversationMessage> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparing(ConversationMessage::timestamp));
        int window = Math.max(0, properties.maxContextMessages());
        StringBuilder context = new StringBuilder();
        for (ConversationMessage message : ordered.subList(Math.max(0, ordered.size() - window), ordered.size())) {
            context.append(message.role()).append(": ").append(message.content()).append('\n');
        }
        return context.toString().strip();
    }
}
