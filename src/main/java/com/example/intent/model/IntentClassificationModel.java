package com.example.intent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The intents known to one tenant, keyed case-insensitively, plus aliases that map alternate
 * names onto canonical intent names.
 *
 * <p>Each operation is atomic and {@link #intents()} returns a snapshot, so classification can
 * iterate while intents are added or removed. Callers that need several writes to appear
 * together must serialize them. Iteration follows registration order, which is also the
 * tie-break order for equal scores.
 */
public class IntentClassificationModel {

    private final Map<String, IntentDefinition> intents = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private final String embeddingModel;
    private final double similarityThreshold;

    public IntentClassificationModel(String embeddingModel, double similarityThreshold) {
        this.embeddingModel = embeddingModel;
        this.similarityThreshold = similarityThreshold;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public synchronized List<IntentDefinition> intents() {
        return List.copyOf(intents.values());
    }

    public synchronized int size() {
        return intents.size();
    }

    /**
     * Registers {@code intent}, replacing any intent with the same name.
     */
    public synchronized void addIntent(IntentDefinition intent) {
        if (intent == null) {
            throw new IllegalArgumentException("Intent cannot be null");
        }
        String key = key(intent.getName());
        IntentDefinition previous = intents.get(key);
        if (previous != null) {
            if (previous.getParentIntent() != null) {
                intent.setParentIntent(previous.getParentIntent());
            }
            previous.getChildIntents().forEach(intent::addChildIntent);
        }
        intents.put(key, intent);
    }

    public synchronized Optional<IntentDefinition> findIntent(String nameOrAlias) {
        if (nameOrAlias == null) {
            return Optional.empty();
        }
        IntentDefinition direct = intents.get(key(nameOrAlias));
        if (direct != null) {
            return Optional.of(direct);
        }
        String canonical = aliases.get(key(nameOrAlias));
        return canonical != null ? Optional.ofNullable(intents.get(key(canonical))) : Optional.empty();
    }

    public synchronized void addAlias(String alias, String intentName) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be empty");
        }
        if (intentName == null || intentName.isBlank()) {
            throw new IllegalArgumentException("Intent name cannot be empty");
        }
        IntentDefinition target = intents.get(key(intentName));
        if (target == null) {
            throw new IllegalArgumentException("Intent '" + intentName + "' does not exist");
        }
        aliases.put(key(alias), target.getName());
    }

    public synchronized Map<String, String> aliases() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    /**
     * Returns the canonical name for an intent name or alias.
     *
     * @throws IllegalArgumentException if neither an intent nor an alias matches
     */
    public String resolveIntentName(String nameOrAlias) {
        return findIntent(nameOrAlias)
            .map(IntentDefinition::getName)
            .orElseThrow(() -> new IllegalArgumentException("Intent or alias '" + nameOrAlias + "' not found"));
    }

    /**
     * Removes the intent and every alias that points to it, and unlinks it from related intents.
     *
     * @return the number of aliases removed, or -1 if nothing was removed
     */
    public synchronized int removeIntent(String canonicalName) {
        IntentDefinition removed = intents.remove(key(canonicalName));
        if (removed == null) {
            return -1;
        }
        List<String> dangling = new ArrayList<>();
        aliases.forEach((alias, target) -> {
            if (target.equalsIgnoreCase(removed.getName())) {
                dangling.add(alias);
            }
        });
        dangling.forEach(aliases::remove);
        intents.values().forEach(other -> other.removeRelation(removed.getName()));
        return dangling.size();
    }

    public synchronized void linkIntents(String parentName, String childName) {
        IntentDefinition parent = findIntent(parentName)
            .orElseThrow(() -> new IllegalArgumentException("Intent '" + parentName + "' does not exist"));
        IntentDefinition child = findIntent(childName)
            .orElseThrow(() -> new IllegalArgumentException("Intent '" + childName + "' does not exist"));
        if (parent == child) {
            throw new IllegalArgumentException("Intent '" + parentName + "' cannot be its own parent");
        }
        if (child.getParentIntent() != null) {
            findIntent(child.getParentIntent()).ifPresent(old -> old.removeRelation(child.getName()));
        }
        child.setParentIntent(parent.getName());
        parent.addChildIntent(child.getName());
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
