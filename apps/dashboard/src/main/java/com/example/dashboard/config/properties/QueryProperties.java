package com.example.dashboard.config.properties;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "dashboard.query")
public record QueryProperties(
        Duration cacheTtl,
        @Min(0) Integer retryCount,
        Duration retryDelay
) {
    public QueryProperties {
        if (cacheTtl == null) {
            cacheTtl = Duration.ofMinutes(5);
        }
        if (retryCount == null) {
            retryCount = 0;
        }
        if (retryDelay == null) {
            retryDelay = Duration.ofSeconds(1);
        }
    }

    public static QueryProperties defaults() {
        return new QueryProperties(null, null, null);
    }
}
