package eu.virtualparadox.companion.llm.health;

import java.time.Instant;

/**
 * Last known state of one provider. {@code lastChecked} is {@code null} until the first call.
 */
public record ProviderHealth(String name,
                             String model,
                             boolean available,
                             Instant lastChecked,
                             String lastError) {
}
