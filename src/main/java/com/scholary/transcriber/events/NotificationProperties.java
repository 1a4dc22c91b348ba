package com.scholary.transcriber.events;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for event delivery.
 *
 * <p>{@code webhookUrls} receive a JSON POST per event; an empty list disables webhooks.
 */
@ConfigurationProperties(prefix = "notifications")
@Validated
public record NotificationProperties(
    @NotNull List<String> webhookUrls,
    @Positive int timeoutSeconds,
    @Positive int threads,
    @Positive int queueCapacity) {}
