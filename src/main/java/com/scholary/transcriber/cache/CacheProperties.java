package com.scholary.transcriber.cache;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the content-addressed cache.
 *
 * <p>Entries older than {@code maxAge} are removed on cleanup. When the cache holds more than
 * {@code maxTotalBytes}, the shorter {@code aggressiveMaxAge} applies instead.
 */
@ConfigurationProperties(prefix = "cache")
@Validated
public record CacheProperties(
    @NotNull Duration maxAge,
    @NotNull Duration aggressiveMaxAge,
    @Positive long maxTotalBytes,
    @Positive long cleanupIntervalMs) {}
