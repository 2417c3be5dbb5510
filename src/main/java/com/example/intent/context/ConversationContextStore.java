package com.example.intent.context;

import java.util.List;

import com.example.intent.model.ConversationContext;
import com.example.intent.model.ConversationMessage;
import com.example.intent.model.DetectedIntent;
import com.example.intent.model.Entity;

import reactor.core.publisher.Mono;

/**
 * Conversation history keyed by conversation id. Appends create the conversation on first
 * use; implementations decide how much history they retain.
 */
public interface ConversationContextStore {

    /**
     * Emits the conversation, or completes empty when the id is unknown.
     */
    Mono<ConversationContext> getContext(String conversationId);

    Mono<ConversationContext> appendMessage(String conversationId, ConversationMessage message);

    Mono<ConversationContext> appendDetectedIntent(String conversationId, DetectedIntent intent);

    /**
     * Emits {@code true} if a conversation was removed.
     */
    Mono<Boolean> delete(String conversationId);

    /**
     * Up to {@code maxCount} entities recorded with the conversation's intents, newest first,
     * optionally restricted to one type. An unknown conversation yields an empty list.
     */
    default Mono<List<Entity>> getRecentEntities(String conversationId, String entityType, int maxCount) {
        if (maxCount <= 0) {
            return Mono.just(List.of());
        }
        return getContext(conversationId)
            .map(context -> context.recentEntities(entityType, maxCount))
            .defaultIfEmpty(List.of());
    }
}
