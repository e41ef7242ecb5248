package eu.virtualparadox.companion.llm.provider;

import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

/**
 * A backend able to turn a prompt into a stream of text fragments.
 */
public interface GenerationProvider {

    /** Name used in {@code companion.generation.priority} and health reports. */
    String name();

    String model();

    /**
     * @return a cold, finite stream of non-empty fragments; nothing is sent before subscription
     */
    Flux<String> generate(Prompt prompt);
}
