package eu.virtualparadox.companion.application.config;

import eu.virtualparadox.companion.llm.health.ProviderHealthRegistry;
import eu.virtualparadox.companion.llm.provider.ChatModelGenerationProvider;
import eu.virtualparadox.companion.llm.provider.GenerationProvider;
import eu.virtualparadox.companion.llm.provider.MockGenerationProvider;
import eu.virtualparadox.companion.llm.router.ModelRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Generation providers and the router in front of them.
 * <ul>
 *   <li>{@code ollama} – local model, on unless {@code companion.ollama.enabled=false}</li>
 *   <li>{@code openai} – cloud fallback, only when {@code companion.openai.api-key} is set</li>
 *   <li>{@code mock} – canned answers, only when {@code companion.generation.mock.enabled=true}</li>
 * </ul>
 */
@Configuration
@Slf4j
public class GenerationConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "companion.ollama.enabled", havingValue = "true", matchIfMissing = true)
    public GenerationProvider ollamaGenerationProvider(final ApplicationConfig config) {
        final ApplicationConfig.Ollama ollama = config.getOllama();
        final OllamaChatModel chatModel = OllamaChatModel.builder()
                .ollamaApi(OllamaApi.builder().baseUrl(ollama.getBaseUrl()).build())
                .defaultOptions(OllamaOptions.builder()
                        .model(ollama.getModel())
                        .temperature(config.getGeneration().getTemperature())
                        .build())
                .build();
        log.info("Ollama provider: {} at {}", ollama.getModel(), ollama.getBaseUrl());
        return new ChatModelGenerationProvider("ollama", ollama.getModel(), chatModel);
    }

    @Bean
    @ConditionalOnExpression("!'${companion.openai.api-key:}'.isBlank()")
    public GenerationProvider openAiGenerationProvider(final ApplicationConfig config) {
        final ApplicationConfig.OpenAi openai = config.getOpenai();
        final OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(OpenAiApi.builder()
                        .baseUrl(openai.getBaseUrl())
                        .apiKey(openai.getApiKey())
                        .build())
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(openai.getModel())
                        .temperature(config.getGeneration().getTemperature())
                        .build())
                .build();
        log.info("OpenAI provider: {}", openai.getModel());
        return new ChatModelGenerationProvider("openai", openai.getModel(), chatModel);
    }

    @Bean
    @ConditionalOnProperty(name = "companion.generation.mock.enabled", havingValue = "true")
    public GenerationProvider mockGenerationProvider(final ApplicationConfig config) {
        log.warn("Mock generation provider enabled; answers are canned");
        return new MockGenerationProvider(config.getGeneration().getMock().getDelay());
    }

    @Bean
    public ProviderHealthRegistry providerHealthRegistry(final Clock clock, final ApplicationConfig config) {
        return new ProviderHealthRegistry(clock, config.getGeneration().getCooldown());
    }

    @Bean
    public ModelRouter modelRouter(final ObjectProvider<GenerationProvider> providers,
                                   final ProviderHealthRegistry healthRegistry,
                                   final ApplicationConfig config) {
        final ApplicationConfig.Generation generation = config.getGeneration();
        final List<GenerationProvider> ordered = ModelRouter.prioritize(
                providers.orderedStream().toList(), generation.getPriority());
        log.info("Provider priority: {}", ordered.stream().map(GenerationProvider::name).toList());
        return new ModelRouter(ordered, healthRegistry, generation.getFirstFragmentTimeout());
    }
}
