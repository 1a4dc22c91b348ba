package com.scholary.transcriber.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech-to-text client.
 *
 * <p>The provider speaks the OpenAI-compatible {@code /audio/transcriptions} API. Timeouts are in
 * seconds. Retries are owned by the worker pool, not the client.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
