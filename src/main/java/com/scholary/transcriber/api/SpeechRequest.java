package com.scholary.transcriber.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request to synthesize speech.
 *
 * <p>{@code voice} and {@code format} fall back to the configured defaults when omitted.
 */
public record SpeechRequest(@NotBlank String text, String voice, String format) {}
