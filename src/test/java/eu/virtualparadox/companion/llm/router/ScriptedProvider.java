package eu.virtualparadox.companion.llm.router;

import eu.virtualparadox.companion.llm.provider.GenerationProvider;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Provider whose output is supplied by the test; counts how often it was subscribed.
 */
public final class ScriptedProvider implements GenerationProvider {

    private final String name;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile Supplier<Flux<String>> script;
    private volatile Prompt lastPrompt;

    public ScriptedProvider(String name, Supplier<Flux<String>> script) {
        this.name = name;
        this.script = script;
    }

    public static ScriptedProvider answering(String name, String... fragments) {
        return new ScriptedProvider(name, () -> Flux.just(fragments));
    }

    public static ScriptedProvider failing(String name, String error) {
        return new ScriptedProvider(name, () -> Flux.error(new IllegalStateException(error)));
    }

    public void script(Supplier<Flux<String>> script) {
        this.script = script;
    }

    public int calls() {
        return calls.get();
    }

    public Prompt lastPrompt() {
        return lastPrompt;
    }

    public void reset() {
        calls.set(0);
        lastPrompt = null;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return name + "-model";
    }

    @Override
    public Flux<String> generate(Prompt prompt) {
        return Flux.defer(() -> {
            calls.incrementAndGet();
            lastPrompt = prompt;
            return script.get();
        });
    }
}
