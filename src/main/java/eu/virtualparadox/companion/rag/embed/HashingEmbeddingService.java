package eu.virtualparadox.companion.rag.embed;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic bag-of-words embedding using signed feature hashing.
 * <p>Each lower-cased word token is hashed into one of {@code dimensions} buckets with a
 * hash-derived sign; the result is L2-normalized. Texts sharing words get positive cosine
 * similarity, which is enough for local development and tests without a model download.</p>
 */
public final class HashingEmbeddingService implements EmbeddingService {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int dimensions;

    public HashingEmbeddingService(final int dimensions) {
        if (dimensions <= 1) {
            throw new IllegalArgumentException("dimensions must be > 1");
        }
        this.dimensions = dimensions;
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> out = new ArrayList<>(texts.size());
        for (final String text : texts) {
            out.add(embedOne(text));
        }
        return out;
    }

    @Override
    public String modelName() {
        return "hashing-" + dimensions;
    }

    private float[] embedOne(final String text) {
        final float[] vec = new float[dimensions];
        for (final String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            final int hash = fnv1a(token);
            final int bucket = Math.floorMod(hash, dimensions);
            vec[bucket] += (hash & 0x4000_0000) == 0 ? 1f : -1f;
        }

        if (!normalize(vec)) {
            // cosine similarity is undefined for the zero vector
            vec[0] = 1f;
        }
        return vec;
    }

    private static int fnv1a(final String token) {
        int hash = 0x811c9dc5;
        for (final byte b : token.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= 0x01000193;
        }
        return hash;
    }

    private static boolean normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0) {
            return false;
        }
        for (int i = 0; i < vec.length; i++) {
            vec[i] /= (float) norm;
        }
        return true;
    }
}
