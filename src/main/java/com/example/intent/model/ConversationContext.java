package com.example.intent.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Snapshot of a conversation: its turns and the intents detected so far, each oldest first.
 */
public record ConversationContext(
    String id,
    List<ConversationMessage> messages,
    List<DetectedIntent> detectedIntents,
    Instant lastUpdatedAt
) {

    public ConversationContext {
        messages = messages != null ? List.copyOf(messages) : List.of();
        detectedIntents = detectedIntents != null ? List.copyOf(detectedIntents) : List.of();
    }

    public static ConversationContext empty(String id) {
        return new ConversationContext(id, List.of(), List.of(), Instant.now());
    }

    public ConversationContext withMessage(ConversationMessage message, int maxMessages) {
        List<ConversationMessage> updated = new ArrayList<>(messages);
        updated.add(message);
        return new ConversationContext(id, tail(updated, maxMessages), detectedIntents, Instant.now());
    }

    public ConversationContext withDetectedIntent(DetectedIntent intent, int maxIntents) {
        List<DetectedIntent> updated = new ArrayList<>(detectedIntents);
        updated.add(intent);
        updated.sort(Comparator.comparing(DetectedIntent::detectedAt));
        return new ConversationContext(id, messages, tail(updated, maxIntents), Instant.now());
    }

    /**
     * The last {@code count} messages ordered by timestamp, oldest first.
     */
    public List<ConversationMessage> recentMessages(int count) {
        List<ConversationMessage> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparing(ConversationMessage::timestamp));
        return tail(ordered, count);
    }

    /**
     * The last {@code count} detected intents, most recent first.
     */
    public List<DetectedIntent> recentIntents(int count) {
        List<DetectedIntent> recent = new ArrayList<>(tail(detectedIntents, count));
        Collections.reverse(recent);
        return recent;
    }

    /**
     * Entities of the detected intents, most recent detection first, keeping each detection's
     * entity order. A null {@code entityType} matches every type.
     */
    public List<Entity> recentEntities(String entityType, int maxCount) {
        List<Entity> found = new ArrayList<>();
        for (DetectedIntent intent : recentIntents(detectedIntents.size())) {
            for (Entity entity : intent.entities()) {
                if (found.size() >= maxCount) {
                    return found;
                }
                if (entityType == null || entityType.equalsIgnoreCase(entity.type())) {
                    found.add(entity);
                }
            }
        }
        return found;
    }

    private static <T> List<T> tail(List<T> items, int count) {
        if (count <= 0) {
            return List.of();
        }
        return items.size() <= count ? items : items.subList(items.size() - count, items.size());
    }
}
