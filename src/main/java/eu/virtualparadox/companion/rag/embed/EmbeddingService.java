package eu.virtualparadox.companion.rag.embed;

import java.util.List;

/**
 * Maps text to fixed-dimension vectors. One implementation per backend, chosen by
 * {@code companion.embedding.backend} at startup.
 * <p>Implementations throw {@link eu.virtualparadox.companion.error.EmbeddingUnavailableException}
 * when the backend cannot be reached.</p>
 */
public interface EmbeddingService {

    /**
     * @return one vector per input text, in input order
     */
    List<float[]> embed(List<String> texts);

    default float[] embedQuery(final String text) {
        return embed(List.of(text)).get(0);
    }

    /** Identifier recorded on every document embedded by this backend. */
    String modelName();
}
