package fr.lapetina.aigateway.infrastructure.cache;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic hashed bag-of-words embedding, L2-normalized.
 */
public final class TermFrequencyEmbedder implements EmbeddingFunction {

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimensions;

    public TermFrequencyEmbedder(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("Dimensions must be positive: " + dimensions);
        }
        this.dimensions = dimensions;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimensions];
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), dimensions)] += 1.0f;
            }
        }

        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0.0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    public int getDimensions() {
        return dimensions;
    }
}
