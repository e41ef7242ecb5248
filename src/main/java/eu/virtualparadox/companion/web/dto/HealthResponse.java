package eu.virtualparadox.companion.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HealthResponse(@JsonProperty("status") String status,
                             @JsonProperty("services") Map<String, String> services,
                             @JsonProperty("providers") List<Provider> providers) {

    public record Provider(@JsonProperty("name") String name,
                           @JsonProperty("model") String model,
                           @JsonProperty("available") boolean available,
                           @JsonProperty("last_checked") Instant lastChecked,
                           @JsonProperty("last_error") String lastError) {
    }
}
