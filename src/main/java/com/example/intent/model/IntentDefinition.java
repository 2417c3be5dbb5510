package com.example.intent.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A registered intent with its example phrases and one embedding per example.
 *
 * <p>Examples and their embeddings are parallel lists held in one {@link ExampleSet} that is
 * swapped as a whole, so a reader that takes {@link #exampleSet()} once always sees the i-th
 * embedding next to the i-th example.
 */
public class IntentDefinition {

    private final String name;
    private String description;
    private volatile ExampleSet exampleSet = ExampleSet.EMPTY;
    private List<EntitySlot> entitySlots;
    private volatile String parentIntent;
    private final List<String> childIntents = new CopyOnWriteArrayList<>();

    public IntentDefinition(String name, String description, List<EntitySlot> entitySlots) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Intent name cannot be empty");
        }
        this.name = name;
        this.description = description;
        this.entitySlots = entitySlots != null ? List.copyOf(entitySlots) : List.of();
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /**
     * Example phrases and their embeddings, index-aligned.
     */
    public record ExampleSet(List<String> examples, List<float[]> embeddings) {

        static final ExampleSet EMPTY = new ExampleSet(List.of(), List.of());

        public ExampleSet {
            if (examples.size() != embeddings.size()) {
                throw new IllegalArgumentException(examples.size() + " examples but "
                    + embeddings.size() + " embeddings");
            }
            examples = List.copyOf(examples);
            embeddings = Collections.unmodifiableList(new ArrayList<>(embeddings));
        }

        public int size() {
            return examples.size();
        }
    }

    public ExampleSet exampleSet() {
        return exampleSet;
    }

    public List<String> getExamples() {
        return exampleSet.examples();
    }

    public List<float[]> getExampleEmbeddings() {
        return exampleSet.embeddings();
    }

    public boolean hasExamples() {
        return exampleSet.size() > 0;
    }

    public void replaceExamples(List<String> newExamples, List<float[]> newEmbeddings) {
        if (newExamples.size() != newEmbeddings.size()) {
            throw new IllegalArgumentException("Intent '" + name + "' has " + newExamples.size()
                + " examples but " + newEmbeddings.size() + " embeddings");
        }
        for (String example : newExamples) {
            if (example == null || example.isBlank()) {
                throw new IllegalArgumentException("Example cannot be empty");
            }
        }
        this.exampleSet = new ExampleSet(newExamples, newEmbeddings);
    }

    public List<EntitySlot> getEntitySlots() {
        return entitySlots;
    }

    public void setEntitySlots(List<EntitySlot> entitySlots) {
        this.entitySlots = entitySlots != null ? List.copyOf(entitySlots) : List.of();
    }

    public String getParentIntent() {
        return parentIntent;
    }

    void setParentIntent(String parentIntent) {
        this.parentIntent = parentIntent;
    }

    public List<String> getChildIntents() {
        return Collections.unmodifiableList(childIntents);
    }

    void addChildIntent(String child) {
        if (childIntents.stream().noneMatch(c -> c.equalsIgnoreCase(child))) {
            childIntents.add(child);
        }
    }

    void removeRelation(String other) {
        childIntents.removeIf(c -> c.equalsIgnoreCase(other));
        if (parentIntent != null && parentIntent.equalsIgnoreCase(other)) {
            parentIntent = null;
        }
    }

    /**
     * Whether {@code other} is this intent's parent or one of its children.
     */
    public boolean isRelatedTo(String other) {
        if (other == null) {
            return false;
        }
        if (parentIntent != null && parentIntent.equalsIgnoreCase(other)) {
            return true;
        }
        return childIntents.stream().anyMatch(c -> c.equalsIgnoreCase(other));
    }
}
