package eu.virtualparadox.companion.llm.router;

import eu.virtualparadox.companion.error.NoProviderAvailableException;
import eu.virtualparadox.companion.error.StreamInterruptedException;
import eu.virtualparadox.companion.llm.health.ProviderHealth;
import eu.virtualparadox.companion.llm.health.ProviderHealthRegistry;
import eu.virtualparadox.companion.llm.provider.GenerationProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes a prompt to the first healthy provider, local first.
 * <p>
 * Fallback is decided per request: a provider that fails before its first fragment (connection error,
 * error response, empty answer or first-fragment timeout) is marked unavailable and the next one is
 * tried, each at most once. Once a fragment has been emitted the request is bound to that provider and
 * a later failure surfaces as {@link StreamInterruptedException}.
 * </p>
 */
@Slf4j
public class ModelRouter {

    private final List<GenerationProvider> providers;
    private final ProviderHealthRegistry healthRegistry;
    private final Duration firstFragmentTimeout;

    /**
     * @param providers providers in priority order
     */
    public ModelRouter(final List<GenerationProvider> providers,
                       final ProviderHealthRegistry healthRegistry,
                       final Duration firstFragmentTimeout) {
        this.providers = List.copyOf(providers);
        this.healthRegistry = healthRegistry;
        this.firstFragmentTimeout = firstFragmentTimeout;
        for (final GenerationProvider provider : this.providers) {
            healthRegistry.register(provider.name(), provider.model());
        }
    }

    /**
     * Orders {@code available} by the names in {@code priority}; providers not listed keep
     * their relative order after the listed ones.
     */
    public static List<GenerationProvider> prioritize(final Collection<GenerationProvider> available,
                                                      final List<String> priority) {
        final List<GenerationProvider> ordered = new ArrayList<>(available.size());
        for (final String name : priority) {
            for (final GenerationProvider provider : available) {
                if (provider.name().equalsIgnoreCase(name.trim()) && !ordered.contains(provider)) {
                    ordered.add(provider);
                }
            }
        }
        for (final GenerationProvider provider : available) {
            if (!ordered.contains(provider)) {
                ordered.add(provider);
            }
        }
        return ordered;
    }

    /**
     * @return a lazy fragment stream; providers are only contacted on subscription
     * @throws NoProviderAvailableException (as an error signal) when every attempted provider failed
     */
    public Flux<String> generate(final Prompt prompt) {
        return Flux.defer(() -> attempt(candidates(), 0, prompt, new ArrayList<>()));
    }

    public List<ProviderHealth> health() {
        return healthRegistry.snapshot();
    }

    public List<GenerationProvider> providers() {
        return providers;
    }

    /**
     * Eligible providers in priority order, or all of them when every provider is cooling down.
     */
    private List<GenerationProvider> candidates() {
        final List<GenerationProvider> eligible = new ArrayList<>();
        for (final GenerationProvider provider : providers) {
            if (healthRegistry.isEligible(provider.name())) {
                eligible.add(provider);
            }
        }
        if (eligible.isEmpty()) {
            log.info("All providers are cooling down, probing them again");
            return providers;
        }
        return eligible;
    }

    private Flux<String> attempt(final List<GenerationProvider> candidates,
                                 final int index,
                                 final Prompt prompt,
                                 final List<String> failures) {
        if (index >= candidates.size()) {
            final String detail = failures.isEmpty() ? "no provider configured" : String.join("; ", failures);
            return Flux.error(new NoProviderAvailableException("No generation provider available (" + detail + ")"));
        }

        final GenerationProvider provider = candidates.get(index);
        final AtomicBoolean emitted = new AtomicBoolean();
        log.debug("Generating with provider {} ({})", provider.name(), provider.model());

        return provider.generate(prompt)
                .timeout(Mono.delay(firstFragmentTimeout), fragment -> Mono.never())
                .switchIfEmpty(Flux.error(new IllegalStateException("empty response")))
                .doOnNext(fragment -> emitted.set(true))
                .doOnComplete(() -> healthRegistry.markAvailable(provider.name()))
                .onErrorResume(error -> {
                    final String reason = describe(error);
                    healthRegistry.markUnavailable(provider.name(), reason);
                    if (emitted.get()) {
                        return Flux.error(new StreamInterruptedException(
                                "Provider " + provider.name() + " failed mid-stream: " + reason, error));
                    }
                    log.warn("Provider {} failed before producing output, falling back: {}", provider.name(), reason);
                    failures.add(provider.name() + ": " + reason);
                    return attempt(candidates, index + 1, prompt, failures);
                });
    }

    private String describe(final Throwable error) {
        if (error instanceof TimeoutException) {
            return "no output within " + firstFragmentTimeout.toSeconds() + "s";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
