package com.example.intent.context;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.intent.config.ContextProperties;
import com.example.intent.model.ConversationContext;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.DetectedIntent;

import reactor.core.publisher.Mono;

/**
 * Process-local store. Each append replaces the conversation atomically and trims it to the
 * configured message and intent caps, dropping the oldest entries first.
 */
@Component
public class InMemoryConversationContextStore implements ConversationContextStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConversationContextStore.class);

    private final Map<String, ConversationContext> conversations = new ConcurrentHashMap<>();
    private final ContextProperties properties;

    public InMemoryConversationContextStore(ContextProperties properties) {
        this.properties = properties;
    }

    @Override
    public Mono<ConversationContext> getContext(String conversationId) {
        requireId(conversationId);
        return Mono.fromCallable(() -> conversations.get(conversationId));
    }

    @Override
    public Mono<ConversationContext> appendMessage(String conversationId, ConversationMessage message) {
        requireId(conversationId);
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        return Mono.fromCallable(() -> conversations.compute(conversationId, (id, existing) ->
            (existing != null ? existing : ConversationContext.empty(id))
                .withMessage(message, properties.maxMessageHistory())));
    }

    @Override
    public Mono<ConversationContext> appendDetectedIntent(String conversationId, DetectedIntent intent) {
        requireId(conversationId);
        if (intent == null) {
            throw new IllegalArgumentException("Detected intent cannot be null");
        }
        return Mono.fromCallable(() -> {
            ConversationContext updated = conversations.compute(conversationId, (id, existing) ->
                (existing != null ? existing : ConversationContext.empty(id))
                    .withDetectedIntent(intent, properties.maxStoredIntents()));
            log.debug("Recorded intent {} ({}) for conversation {}",
                intent.intent(), intent.confidence(), conversationId);
            return updated;
        });
    }

    @Override
    public Mono<Boolean> delete(String conversationId) {
        requireId(conversationId);
        return Mono.fromCallable(() -> conversations.remove(conversationId) != null);
    }

    private static void requireId(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("Conversation id cannot be empty");
        }
    }
}
