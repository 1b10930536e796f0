package io.keepsake.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResticConfig(
    String binary,
    @JsonAlias({"timeout_minutes"}) Integer timeoutMinutes
) {
    public static final String DEFAULT_BINARY = "restic";
    public static final int DEFAULT_TIMEOUT_MINUTES = 720;

    public ResticConfig {
        binary = binary == null || binary.isBlank() ? DEFAULT_BINARY : binary;
        timeoutMinutes = timeoutMinutes == null ? DEFAULT_TIMEOUT_MINUTES : timeoutMinutes;
    }

    public static ResticConfig defaults() {
        return new ResticConfig(DEFAULT_BINARY, DEFAULT_TIMEOUT_MINUTES);
    }

    public Duration timeout() {
        return Duration.ofMinutes(timeoutMinutes);
    }
}
