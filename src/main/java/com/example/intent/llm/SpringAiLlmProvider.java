package com.example.intent.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingOptionsBuilder;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

import com.example.intent.config.AppConfig;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * {@link LlmProvider} over Spring AI models. Chat calls retry with jittered exponential backoff
 * and then move to the fallback provider, if one is configured. Every call is recorded as a
 * GenAI client span with token, duration and error metrics.
 */
public class SpringAiLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiLlmProvider.class);
    private static final int MAX_RETRIES = 3;
    private static final long MIN_BACKOFF_MS = 1000;
    private static final long MAX_BACKOFF_MS = 10000;
    private static final String JSON_INSTRUCTION =
        "Respond only with valid JSON. Do not wrap the JSON in Markdown and do not add commentary.";

    private final ChatModel primaryModel;
    private final ChatModel fallbackModel;
    private final EmbeddingModel embeddingModel;
    private final AppConfig config;
    private final Tracer tracer;
    private final DoubleHistogram tokenUsage;
    private final DoubleHistogram operationDuration;
    private final LongCounter retryCounter;
    private final LongCounter fallbackCounter;
    private final LongCounter errorCounter;

    public SpringAiLlmProvider(ChatModel primaryModel, ChatModel fallbackModel,
                               EmbeddingModel embeddingModel, AppConfig config) {
        this.primaryModel = primaryModel;
        this.fallbackModel = fallbackModel;
        this.embeddingModel = embeddingModel;
        this.config = config;

        this.tracer = GlobalOpenTelemetry.getTracer("intent-resolution");
        Meter meter = GlobalOpenTelemetry.getMeter("intent-resolution");

        this.tokenUsage = meter.histogramBuilder("gen_ai.client.token.usage")
            .setUnit("{token}").build();
        this.operationDuration = meter.histogramBuilder("gen_ai.client.operation.duration")
            .setUnit("s").build();
        this.retryCounter = meter.counterBuilder("gen_ai.client.retry.count")
            .build();
        this.fallbackCounter = meter.counterBuilder("gen_ai.client.fallback.count")
            .build();
        this.errorCounter = meter.counterBuilder("gen_ai.client.error.count")
            .build();
    }

    @Override
    public Mono<float[]> generateEmbedding(String model, String text) {
        return generateBatchEmbeddings(model, List.of(text))
            .map(vectors -> vectors.get(0));
    }

    @Override
    public Mono<List<float[]>> generateBatchEmbeddings(String model, List<String> texts) {
        if (texts.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.fromCallable(() -> embedOnce(model, texts))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<String> generateCompletion(String model, String prompt, GenerationParams params) {
        return generateChatCompletion(model, List.of(ChatTurn.user(prompt)), params);
    }

    @Override
    public Mono<String> generateChatCompletion(String model, List<ChatTurn> messages, GenerationParams params) {
        Mono<String> primary = withRetry(
            Mono.fromCallable(() -> chatOnce(primaryModel, config.provider(), model, messages, params)),
            config.provider(), model);

        if (fallbackModel == null) {
            return primary.subscribeOn(Schedulers.boundedElastic());
        }

        String fallbackModelName = config.fallbackModel() != null && !config.fallbackModel().isBlank()
            ? config.fallbackModel() : model;
        return primary
            .onErrorResume(e -> {
                log.warn("Primary provider {} failed, falling back to {}", config.provider(), config.fallbackProvider());
                fallbackCounter.add(1);
                return withRetry(
                    Mono.fromCallable(() -> chatOnce(fallbackModel, config.fallbackProvider(),
                        fallbackModelName, messages, params)),
                    config.fallbackProvider(), fallbackModelName);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<String> withRetry(Mono<String> call, String providerName, String model) {
        return call.retryWhen(Retry.backoff(MAX_RETRIES - 1, Duration.ofMillis(MIN_BACKOFF_MS))
                .maxBackoff(Duration.ofMillis(MAX_BACKOFF_MS))
                .jitter(0.25)
                .doBeforeRetry(signal -> {
                    log.warn("LLM call failed (attempt {}/{}): provider={} model={} error={}",
                        signal.totalRetries() + 1, MAX_RETRIES, providerName, model,
                        signal.failure().getMessage());
                    retryCounter.add(1, providerModelAttrs(providerName, model));
                })
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .doOnError(e -> log.error("All {} attempts exhausted for provider={}", MAX_RETRIES, providerName, e));
    }

    private String chatOnce(ChatModel chatModel, String providerName, String model,
                            List<ChatTurn> messages, GenerationParams params) {
        long start = System.nanoTime();
        int maxTokens = params.maxTokens() > 0 ? params.maxTokens() : config.maxTokens();

        Span span = tracer.spanBuilder("gen_ai.chat " + model)
            .setAttribute("gen_ai.operation.name", "chat")
            .setAttribute("gen_ai.provider.name", providerName)
            .setAttribute("gen_ai.request.model", model)
            .setAttribute("server.address", LlmConfig.PROVIDER_SERVERS.getOrDefault(providerName, "unknown"))
            .setAttribute("server.port", (long) LlmConfig.PROVIDER_PORTS.getOrDefault(providerName, 443))
            .setAttribute("gen_ai.request.temperature", params.temperature())
            .setAttribute("gen_ai.request.top_p", params.topP())
            .setAttribute("gen_ai.request.max_tokens", (long) maxTokens)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            ChatResponse response = chatModel.call(buildPrompt(messages, model, params, maxTokens));

            var generation = response.getResult();
            var usage = response.getMetadata().getUsage();

            String content = generation.getOutput().getText();
            int inputTokens = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            int outputTokens = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            String responseModel = response.getMetadata().getModel() != null
                ? response.getMetadata().getModel() : model;
            double duration = (System.nanoTime() - start) / 1_000_000_000.0;

            span.setAttribute("gen_ai.response.model", responseModel);
            span.setAttribute("gen_ai.usage.input_tokens", (long) inputTokens);
            span.setAttribute("gen_ai.usage.output_tokens", (long) outputTokens);
            String finishReason = generation.getMetadata().getFinishReason();
            if (finishReason != null && !finishReason.isEmpty()) {
                span.setAttribute("gen_ai.response.finish_reasons", finishReason);
            }

            var attrs = providerModelAttrs(providerName, responseModel);
            tokenUsage.record(inputTokens, withTokenType(attrs, "input"));
            tokenUsage.record(outputTokens, withTokenType(attrs, "output"));
            operationDuration.record(duration, attrs);

            return content != null ? content : "";

        } catch (RuntimeException e) {
            recordError(span, e, providerName, model);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<float[]> embedOnce(String model, List<String> texts) {
        long start = System.nanoTime();
        Span span = tracer.spanBuilder("gen_ai.embeddings " + model)
            .setAttribute("gen_ai.operation.name", "embeddings")
            .setAttribute("gen_ai.provider.name", config.provider())
            .setAttribute("gen_ai.request.model", model)
            .setAttribute("intent.embedding.batch_size", (long) texts.size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            var options = EmbeddingOptionsBuilder.builder().withModel(model).build();
            EmbeddingResponse response = embeddingModel.call(new EmbeddingRequest(texts, options));

            List<float[]> vectors = new ArrayList<>(texts.size());
            for (Embedding embedding : response.getResults()) {
                vectors.add(embedding.getOutput());
            }
            if (vectors.size() != texts.size()) {
                throw new IllegalStateException("Embedding provider returned " + vectors.size()
                    + " vectors for " + texts.size() + " inputs");
            }

            operationDuration.record((System.nanoTime() - start) / 1_000_000_000.0,
                Attributes.of(
                    AttributeKey.stringKey("gen_ai.operation.name"), "embeddings",
                    AttributeKey.stringKey("gen_ai.provider.name"), config.provider(),
                    AttributeKey.stringKey("gen_ai.request.model"), model));
            return vectors;

        } catch (RuntimeException e) {
            recordError(span, e, config.provider(), model);
            throw e;
        } finally {
            span.end();
        }
    }

    private Prompt buildPrompt(List<ChatTurn> turns, String model, GenerationParams params, int maxTokens) {
        var messages = new ArrayList<Message>();
        if (params.jsonOutput()) {
            messages.add(new SystemMessage(JSON_INSTRUCTION));
        }
        for (ChatTurn turn : turns) {
            messages.add(toMessage(turn));
        }

        var options = ChatOptions.builder()
            .model(model)
            .temperature(params.temperature())
            .topP(params.topP())
            .maxTokens(maxTokens)
            .build();
        return new Prompt(messages, options);
    }

    private static Message toMessage(ChatTurn turn) {
        String role = turn.role() != null ? turn.role().toLowerCase(Locale.ROOT) : "user";
        return switch (role) {
            case "system" -> new SystemMessage(turn.content());
            case "assistant" -> new AssistantMessage(turn.content());
            default -> new UserMessage(turn.content());
        };
    }

    private void recordError(Span span, Exception e, String providerName, String model) {
        span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        span.setAttribute("error.type", classifyError(e));
        errorCounter.add(1, Attributes.of(
            AttributeKey.stringKey("gen_ai.provider.name"), providerName,
            AttributeKey.stringKey("gen_ai.request.model"), model,
            AttributeKey.stringKey("error.type"), classifyError(e)
        ));
    }

    static String classifyError(Exception e) {
        if (e == null) return "unknown_error";
        String msg = e.getMessage() != null ? e.getMessage().toLowerCase(Locale.ROOT) : "";
        if (msg.contains("rate limit") || msg.contains("429")) return "rate_limit";
        if (msg.contains("timeout") || msg.contains("timed out") || msg.contains("deadline")) return "timeout";
        if (msg.contains("401") || msg.contains("403") || msg.contains("auth") || msg.contains("api key")) return "auth_error";
        if (msg.contains("model") && msg.contains("not found")) return "model_not_found";
        if (msg.contains("400") || msg.contains("422") || msg.contains("invalid")) return "invalid_request";
        if (msg.contains("500") || msg.contains("502") || msg.contains("503") || msg.contains("server")) return "server_error";
        if (msg.contains("connect") || msg.contains("dns") || msg.contains("network") || msg.contains("reset")) return "network_error";
        return "unknown_error";
    }

    private static Attributes providerModelAttrs(String provider, String model) {
        return Attributes.of(
            AttributeKey.stringKey("gen_ai.operation.name"), "chat",
            AttributeKey.stringKey("gen_ai.provider.name"), provider,
            AttributeKey.stringKey("gen_ai.request.model"), model
        );
    }

    private static Attributes withTokenType(Attributes base, String tokenType) {
        return base.toBuilder()
            .put(AttributeKey.stringKey("gen_ai.token.type"), tokenType)
            .build();
    }
}
