package eu.virtualparadox.companion.llm.health;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory availability of generation providers, rebuilt on every start.
 * <p>
 * A provider marked unavailable stays ineligible for {@code cooldown}; after that the next request
 * probes it again. Providers never called are optimistically available.
 * </p>
 */
@Slf4j
public class ProviderHealthRegistry {

    private final Clock clock;
    private final Duration cooldown;
    private final Map<String, ProviderHealth> states = new LinkedHashMap<>();

    public ProviderHealthRegistry(final Clock clock, final Duration cooldown) {
        this.clock = clock;
        this.cooldown = cooldown;
    }

    public synchronized void register(final String name, final String model) {
        states.putIfAbsent(name, new ProviderHealth(name, model, true, null, null));
    }

    /**
     * @return {@code true} if the provider is available or its cooldown has elapsed
     */
    public synchronized boolean isEligible(final String name) {
        final ProviderHealth health = states.get(name);
        if (health == null || health.available()) {
            return true;
        }
        return !clock.instant().isBefore(health.lastChecked().plus(cooldown));
    }

    public synchronized void markAvailable(final String name) {
        final ProviderHealth previous = states.get(name);
        if (previous != null && !previous.available()) {
            log.info("Provider {} is available again", name);
        }
        states.put(name, new ProviderHealth(name, modelOf(previous), true, clock.instant(), null));
    }

    public synchronized void markUnavailable(final String name, final String error) {
        final ProviderHealth previous = states.get(name);
        final Instant now = clock.instant();
        states.put(name, new ProviderHealth(name, modelOf(previous), false, now, error));
        log.warn("Provider {} marked unavailable until {}: {}", name, now.plus(cooldown), error);
    }

    /**
     * @return a copy of the current state, in registration order
     */
    public synchronized List<ProviderHealth> snapshot() {
        return new ArrayList<>(states.values());
    }

    private static String modelOf(final ProviderHealth health) {
        return health == null ? null : health.model();
    }
}
