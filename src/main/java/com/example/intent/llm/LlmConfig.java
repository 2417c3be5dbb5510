package com.example.intent.llm;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.intent.config.AppConfig;

@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    public static final Map<String, String> PROVIDER_SERVERS = Map.of(
        "openai", "api.openai.com",
        "anthropic", "api.anthropic.com",
        "ollama", "localhost"
    );

    public static final Map<String, Integer> PROVIDER_PORTS = Map.of(
        "openai", 443,
        "anthropic", 443,
        "ollama", 11434
    );

    @Bean
    LlmProvider llmProvider(
        AppConfig config,
        Map<String, ChatModel> chatModels,
        Map<String, EmbeddingModel> embeddingModels
    ) {
        ChatModel primary = resolveChatModel(config.provider(), chatModels);
        ChatModel fallback = null;
        if (config.hasFallbackProvider()) {
            fallback = chatModels.get(chatBeanName(config.fallbackProvider()));
            if (fallback == null) {
                log.warn("Fallback provider {} configured but no ChatModel bean is present; continuing without it",
                    config.fallbackProvider());
            }
        }
        EmbeddingModel embeddingModel = resolveEmbeddingModel(config.provider(), embeddingModels);

        log.info("LLM provider: {} (capable={}, fast={}), fallback: {}",
            config.provider(), config.modelCapable(), config.modelFast(),
            fallback != null ? config.fallbackProvider() : "none");
        return new SpringAiLlmProvider(primary, fallback, embeddingModel, config);
    }

    static ChatModel resolveChatModel(String provider, Map<String, ChatModel> chatModels) {
        // Spring AI registers beans as "openAiChatModel", "anthropicChatModel", "ollamaChatModel"
        return findBean(chatModels, chatBeanName(provider));
    }

    static EmbeddingModel resolveEmbeddingModel(String provider, Map<String, EmbeddingModel> embeddingModels) {
        String name = switch (provider) {
            case "openai" -> "openAiEmbeddingModel";
            case "ollama" -> "ollamaEmbeddingModel";
            default -> null;
        };
        EmbeddingModel model = name != null ? embeddingModels.get(name) : null;
        if (model == null && embeddingModels.size() == 1) {
            model = embeddingModels.values().iterator().next();
        }
        if (model == null) {
            throw new IllegalStateException(
                "No EmbeddingModel bean for provider '" + provider + "'. Available: " + embeddingModels.keySet());
        }
        return model;
    }

    static String chatBeanName(String provider) {
        return switch (provider) {
            case "openai" -> "openAiChatModel";
            case "anthropic" -> "anthropicChatModel";
            case "ollama" -> "ollamaChatModel";
            default -> throw new IllegalArgumentException("Unknown LLM provider: " + provider);
        };
    }

    private static <T> T findBean(Map<String, T> beans, String name) {
        var bean = beans.get(name);
        if (bean == null) {
            throw new IllegalStateException(
                "Bean '" + name + "' not found. Available: " + beans.keySet());
        }
        return bean;
    }
}
