package com.example.intent.controller;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.intent.classification.IntentClassifier;
import com.example.intent.detection.IntentDetector;
import com.example.intent.fallback.FallbackEscalator;
import com.example.intent.model.ChainOfThoughtResult;
import com.example.intent.model.ClassificationResult;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.Entity;
import com.example.intent.model.EntitySlot;
import com.example.intent.model.FallbackResult;
import com.example.intent.model.HierarchicalIntent;
import com.example.intent.model.IntentDefinition;
import com.example.intent.model.IntentDetection;
import com.example.intent.pipeline.IntentResolutionPipeline;
import com.example.intent.reasoning.ReasoningEngine;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/intents")
public class IntentController {

    private static final Logger log = LoggerFactory.getLogger(IntentController.class);

    private final IntentClassifier classifier;
    private final IntentResolutionPipeline pipeline;
    private final FallbackEscalator escalator;
    private final ReasoningEngine reasoningEngine;
    private final IntentDetector detector;

    public IntentController(IntentClassifier classifier, IntentResolutionPipeline pipeline,
                            FallbackEscalator escalator, ReasoningEngine reasoningEngine,
                            IntentDetector detector) {
        this.classifier = classifier;
        this.pipeline = pipeline;
        this.escalator = escalator;
        this.reasoningEngine = reasoningEngine;
        this.detector = detector;
    }

    public record ClassifyRequest(String query, String conversationId, Double similarityThreshold) {}

    public record ResolveRequest(String query, String conversationId) {}

    public record ResolveResponse(
        String conversationId,
        String intent,
        double confidence,
        String recommendedAction,
        String fallbackLevel,
        boolean requiresUserInteraction,
        List<String> clarificationQuestions,
        String explanation
    ) {}

    public record FallbackRequest(String query, IntentDetection detection, String conversationId) {}

    public record DetectRequest(String query, String conversationId, List<ConversationMessage> messages) {}

    public record ReasoningRequest(String query, List<ConversationMessage> messages, Integer maxSteps) {}

    public record IntentRequest(String name, String description, List<String> examples, List<EntitySlot> entitySlots) {}

    public record ExamplesRequest(List<String> examples) {}

    public record AliasRequest(String alias) {}

    public record IntentSummary(String name, String description, List<String> examples,
                                String parentIntent, List<String> childIntents) {

        static IntentSummary of(IntentDefinition intent) {
            return new IntentSummary(intent.getName(), intent.getDescription(), intent.getExamples(),
                intent.getParentIntent(), intent.getChildIntents());
        }
    }

    @PostMapping("/classify")
    public Mono<ClassificationResult> classify(@RequestBody ClassifyRequest request) {
        if (request.conversationId() != null && !request.conversationId().isBlank()) {
            return classifier.classifyWithContext(request.query(), request.conversationId(),
                request.similarityThreshold());
        }
        return classifier.classify(request.query(), request.similarityThreshold());
    }

    @PostMapping("/resolve")
    public Mono<ResolveResponse> resolve(@RequestBody ResolveRequest request) {
        return pipeline.resolve(request.query(), request.conversationId())
            .map(resolution -> new ResolveResponse(
                resolution.conversationId(),
                resolution.resolved().intent(),
                resolution.resolved().confidence(),
                resolution.classification().recommendedAction().name(),
                resolution.fallback().fallbackLevel().name(),
                resolution.fallback().requiresUserInteraction(),
                resolution.fallback().clarificationQuestions(),
                resolution.classification().explanation()
            ));
    }

    @PostMapping("/fallback")
    public Mono<FallbackResult> fallback(@RequestBody FallbackRequest request) {
        return escalator.applyFallback(request.query(), request.detection(), request.conversationId());
    }

    @PostMapping("/detect")
    public Mono<IntentDetection> detect(@RequestBody DetectRequest request) {
        if (request.messages() != null) {
            return detector.detectIntentWithContext(request.query(), request.messages());
        }
        return detector.detectIntent(request.query(), request.conversationId());
    }

    @PostMapping("/detect/hierarchical")
    public Mono<HierarchicalIntent> detectHierarchical(@RequestBody DetectRequest request) {
        return detector.classifyHierarchicalIntent(request.query(), request.conversationId());
    }

    @GetMapping("/conversations/{conversationId}/entities")
    public Mono<List<Entity>> recentEntities(@PathVariable String conversationId,
                                             @RequestParam(required = false) String type,
                                             @RequestParam(defaultValue = "5") int max) {
        return detector.getRecentEntities(conversationId, type, max);
    }

    /**
     * Runs chain-of-thought reasoning. With {@code maxSteps} set, only the key steps are returned.
     */
    @PostMapping("/reasoning")
    public Mono<ChainOfThoughtResult> reason(@RequestBody ReasoningRequest request) {
        Mono<ChainOfThoughtResult> result = reasoningEngine.performChainOfThoughtReasoning(request.query(),
            request.messages() != null ? request.messages() : List.of());
        if (request.maxSteps() == null) {
            return result;
        }
        if (request.maxSteps() < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1");
        }
        return result.map(reasoning -> reasoning.summarized(request.maxSteps()));
    }

    @GetMapping
    public List<IntentSummary> list() {
        return classifier.getModel().intents().stream()
            .map(IntentSummary::of)
            .toList();
    }

    @PostMapping
    public Mono<IntentSummary> add(@RequestBody IntentRequest request) {
        return classifier.addIntent(request.name(), request.description(), request.examples(), request.entitySlots())
            .map(IntentSummary::of);
    }

    @PutMapping("/{name}/examples")
    public Mono<IntentSummary> updateExamples(@PathVariable String name, @RequestBody ExamplesRequest request) {
        return classifier.updateIntentExamples(name, request.examples())
            .map(IntentSummary::of);
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> remove(@PathVariable String name) {
        return classifier.removeIntent(name)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @PostMapping("/{name}/aliases")
    public ResponseEntity<Void> addAlias(@PathVariable String name, @RequestBody AliasRequest request) {
        classifier.addAlias(request.alias(), name);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{parent}/children/{child}")
    public ResponseEntity<Void> link(@PathVariable String parent, @PathVariable String child) {
        classifier.linkIntents(parent, child);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.debug("Rejected request: {}", e.getMessage());
        String message = e.getMessage() != null ? e.getMessage() : "Invalid request";
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", message));
    }
}
