package com.tsforecast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Process-wide settings, bound once at startup and handed to the dispatcher, the pipeline
 * factory and the request filter. Every value can be overridden through the environment
 * variables mapped in {@code application.yml}.
 *
 * @param minDataPoints          minimum number of points the series must have after aggregation
 * @param nonNegativePredictions floor predicted values and bounds at zero
 * @param returnConfidenceDefault confidence bounds when the request does not say
 */
@Validated
@ConfigurationProperties(prefix = "forecast")
public record ForecastProperties(
        @Min(1) @DefaultValue("30") int minDataPoints,
        @DefaultValue("true") boolean nonNegativePredictions,
        @DefaultValue("false") boolean returnConfidenceDefault,
        @Valid @NotNull @DefaultValue Callback callback,
        @Valid @NotNull @DefaultValue Auth auth) {

    public record Callback(
            @NotNull @DefaultValue("30s") Duration timeout,
            @DefaultValue("") String apiKey,
            @Min(1) @DefaultValue("4") int poolSize,
            @Min(1) @DefaultValue("100") int queueCapacity) {
    }

    public record Auth(
            @DefaultValue("false") boolean enabled,
            @DefaultValue List<String> secretTokens,
            @DefaultValue List<String> apiKeys) {

        public Auth {
            secretTokens = secretTokens == null ? List.of() : List.copyOf(secretTokens);
            apiKeys = apiKeys == null ? List.of() : List.copyOf(apiKeys);
        }
    }

    public static ForecastProperties defaults() {
        return new ForecastProperties(30, true, false,
            new Callback(Duration.ofSeconds(30), "", 4, 100),
            new Auth(false, List.of(), List.of()));
    }
}
