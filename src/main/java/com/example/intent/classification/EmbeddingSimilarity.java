package com.example.intent.classification;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.intent.model.IntentDefinition;

/**
 * Cosine similarity between embeddings and best-example selection per intent.
 */
public final class EmbeddingSimilarity {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSimilarity.class);

    private EmbeddingSimilarity() {
    }

    /**
     * The example of one intent that lies closest to the query.
     */
    public record ExampleMatch(String example, double similarity) {}

    /**
     * Cosine similarity of two vectors of equal length, clamped to [-1, 1].
     * A zero-length or zero-norm vector has similarity 0 with anything.
     *
     * @throws IllegalArgumentException if the vectors differ in length
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embedding dimensions differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return clamp(dot / (Math.sqrt(normA) * Math.sqrt(normB)));
    }

    /**
     * Finds the example with the highest similarity to {@code query}. Equal similarities keep
     * the earlier example. Returns empty for an intent without examples.
     */
    public static Optional<ExampleMatch> bestMatch(float[] query, IntentDefinition intent) {
        IntentDefinition.ExampleSet snapshot = intent.exampleSet();
        List<String> examples = snapshot.examples();
        List<float[]> embeddings = snapshot.embeddings();

        ExampleMatch best = null;
        for (int i = 0; i < embeddings.size(); i++) {
            float[] embedding = embeddings.get(i);
            if (embedding == null || embedding.length != query.length) {
                log.warn("Skipping example {} of intent '{}': embedding has {} dimensions, query has {}",
                    i, intent.getName(), embedding == null ? 0 : embedding.length, query.length);
                continue;
            }
            double similarity = cosine(query, embedding);
            if (best == null || similarity > best.similarity()) {
                best = new ExampleMatch(examples.get(i), similarity);
            }
        }
        return Optional.ofNullable(best);
    }

    static double clamp(double similarity) {
        if (Double.isNaN(similarity)) {
            log.warn("Cosine similarity is NaN, treating as 0");
            return 0.0;
        }
        if (similarity > 1.0 || similarity < -1.0) {
            // floating point drift lands just past the bound; anything further is a bad vector
            if (Math.abs(similarity) > 1.0 + 1e-6) {
                log.warn("Cosine similarity {} out of range, clamping", similarity);
            }
            return Math.max(-1.0, Math.min(1.0, similarity));
        }
        return similarity;
    }
}
