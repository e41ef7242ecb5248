package eu.virtualparadox.companion.application.config;

import eu.virtualparadox.companion.rag.embed.EmbeddingService;
import eu.virtualparadox.companion.rag.embed.HashingEmbeddingService;
import eu.virtualparadox.companion.rag.embed.OnnxEmbeddingService;
import eu.virtualparadox.companion.rag.embed.RemoteEmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers exactly one {@link EmbeddingService}, selected by {@code companion.embedding.backend}.
 */
@Configuration
@Slf4j
public class EmbeddingConfig {

    private static final String BACKEND = "companion.embedding.backend";

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "hashing", matchIfMissing = true)
    public EmbeddingService hashingEmbeddingService(final ApplicationConfig config) {
        log.info("Using hashing embeddings with {} dimensions", config.getEmbedding().getDimensions());
        return new HashingEmbeddingService(config.getEmbedding().getDimensions());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = BACKEND, havingValue = "onnx")
    public EmbeddingService onnxEmbeddingService(final ApplicationConfig config) throws Exception {
        final OnnxEmbeddingService service = new OnnxEmbeddingService(
                config.getModels().resolve("embedding"), config.getEmbedding().getBatchSize());
        service.init();
        return service;
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "ollama")
    public EmbeddingService ollamaEmbeddingService(final ApplicationConfig config) {
        final ApplicationConfig.Ollama ollama = config.getOllama();
        final OllamaEmbeddingModel model = OllamaEmbeddingModel.builder()
                .ollamaApi(OllamaApi.builder().baseUrl(ollama.getBaseUrl()).build())
                .defaultOptions(OllamaOptions.builder().model(ollama.getEmbeddingModel()).build())
                .build();
        log.info("Using Ollama embeddings: {} at {}", ollama.getEmbeddingModel(), ollama.getBaseUrl());
        return new RemoteEmbeddingService(model, "ollama:" + ollama.getEmbeddingModel(),
                config.getEmbedding().getBatchSize());
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "openai")
    public EmbeddingService openAiEmbeddingService(final ApplicationConfig config) {
        final ApplicationConfig.OpenAi openai = config.getOpenai();
        if (openai.getApiKey() == null || openai.getApiKey().isBlank()) {
            throw new IllegalStateException("companion.openai.api-key is required for OpenAI embeddings");
        }
        final OpenAiApi api = OpenAiApi.builder()
                .baseUrl(openai.getBaseUrl())
                .apiKey(openai.getApiKey())
                .build();
        final OpenAiEmbeddingModel model = new OpenAiEmbeddingModel(api, MetadataMode.EMBED,
                OpenAiEmbeddingOptions.builder().model(openai.getEmbeddingModel()).build());
        log.info("Using OpenAI embeddings: {}", openai.getEmbeddingModel());
        return new RemoteEmbeddingService(model, "openai:" + openai.getEmbeddingModel(),
                config.getEmbedding().getBatchSize());
    }
}
