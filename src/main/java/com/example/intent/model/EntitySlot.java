package com.example.intent.model;

import java.util.List;

public record EntitySlot(
    String name,
    String entityType,
    boolean required,
    String defaultValue,
    List<String> extractionPrompts
) {

    public EntitySlot {
        extractionPrompts = extractionPrompts != null ? List.copyOf(extractionPrompts) : List.of();
    }

    public static EntitySlot required(String name, String entityType) {
        return new EntitySlot(name, entityType, true, null, List.of());
    }

    public static EntitySlot optional(String name, String entityType, String defaultValue) {
        return new EntitySlot(name, entityType, false, defaultValue, List.of());
    }
}
