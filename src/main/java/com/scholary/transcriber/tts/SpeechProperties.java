package com.scholary.transcriber.tts;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration for the text-to-speech provider. Timeouts are in seconds. */
@ConfigurationProperties(prefix = "tts")
@Validated
public record SpeechProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @NotBlank String defaultVoice,
    @NotBlank String defaultFormat,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxTextLength) {}
