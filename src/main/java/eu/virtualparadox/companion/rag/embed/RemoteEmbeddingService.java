package eu.virtualparadox.companion.rag.embed;

import eu.virtualparadox.companion.error.EmbeddingUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeddings served by a remote API (Ollama or OpenAI) through a Spring AI {@link EmbeddingModel}.
 */
@Slf4j
public final class RemoteEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final int batchSize;

    public RemoteEmbeddingService(final EmbeddingModel embeddingModel, final String modelName, final int batchSize) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public List<float[]> embed(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += batchSize) {
            final List<String> batch = texts.subList(from, Math.min(from + batchSize, texts.size()));
            try {
                result.addAll(embeddingModel.embed(batch));
            } catch (RuntimeException e) {
                log.warn("Embedding backend {} failed: {}", modelName, e.getMessage());
                throw new EmbeddingUnavailableException("Embedding backend " + modelName + " unavailable", e);
            }
        }
        return result;
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
