package eu.virtualparadox.companion.llm.provider;

import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * Adapts a Spring AI {@link ChatModel} (Ollama, OpenAI) to {@link GenerationProvider}.
 */
public final class ChatModelGenerationProvider implements GenerationProvider {

    private final String name;
    private final String model;
    private final ChatModel chatModel;

    public ChatModelGenerationProvider(final String name, final String model, final ChatModel chatModel) {
        this.name = name;
        this.model = model;
        this.chatModel = chatModel;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public Flux<String> generate(final Prompt prompt) {
        return Flux.defer(() -> chatModel.stream(prompt))
                .map(ChatModelGenerationProvider::textOf)
                .filter(text -> !text.isEmpty());
    }

    private static String textOf(final ChatResponse response) {
        if (response == null) {
            return "";
        }
        final Generation generation = response.getResult();
        if (generation == null || generation.getOutput() == null || generation.getOutput().getText() == null) {
            return "";
        }
        return generation.getOutput().getText();
    }
}
