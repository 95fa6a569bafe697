package fr.lapetina.aigateway.infrastructure.cache;

/**
 * Maps request text to a fixed-size vector for the similarity tier.
 */
@FunctionalInterface
public interface EmbeddingFunction {

    float[] embed(String text);

    /**
     * Cosine similarity of two vectors of the same dimension; 0 when either is all zeros.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
