package eu.virtualparadox.companion.llm.provider;

import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline provider that streams a canned answer word by word. Enabled with
 * {@code companion.generation.mock.enabled=true}; useful for front-end work without a model.
 */
public final class MockGenerationProvider implements GenerationProvider {

    public static final String NAME = "mock";

    private static final String ANSWER = "This is a mock response from the companion backend. "
            + "No language model was contacted. You asked: ";

    private final Duration delay;

    public MockGenerationProvider(final Duration delay) {
        this.delay = delay;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return NAME;
    }

    @Override
    public Flux<String> generate(final Prompt prompt) {
        final String question = prompt.getUserMessage() != null ? prompt.getUserMessage().getText() : "";
        final List<String> words = words(ANSWER + "\"" + question + "\"");
        final Flux<String> fragments = Flux.fromIterable(words);
        return delay.isZero() ? fragments : fragments.delayElements(delay);
    }

    private static List<String> words(final String text) {
        final List<String> out = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == ' ') {
                out.add(text.substring(start, i));
                start = i;
            }
        }
        return out;
    }
}
