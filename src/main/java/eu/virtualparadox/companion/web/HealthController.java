package eu.virtualparadox.companion.web;

import eu.virtualparadox.companion.llm.health.ProviderHealth;
import eu.virtualparadox.companion.llm.router.ModelRouter;
import eu.virtualparadox.companion.web.dto.HealthResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liveness plus the last known state of every generation provider. Providers are not probed here;
 * their state comes from real traffic. The overall status is {@code degraded} when none is usable.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ModelRouter modelRouter;

    @GetMapping("/health")
    public HealthResponse health() {
        final List<ProviderHealth> providers = modelRouter.health();

        final Map<String, String> services = new LinkedHashMap<>();
        services.put("api", "running");
        for (final ProviderHealth provider : providers) {
            services.put(provider.name(), provider.available() ? "available" : "unavailable");
        }

        final boolean usable = providers.stream().anyMatch(ProviderHealth::available);
        return new HealthResponse(
                usable ? "healthy" : "degraded",
                services,
                providers.stream()
                        .map(p -> new HealthResponse.Provider(p.name(), p.model(), p.available(), p.lastChecked(), p.lastError()))
                        .toList());
    }
}
