package com.scholary.transcriber.tts;

import com.scholary.transcriber.cache.CacheEntry;
import com.scholary.transcriber.cache.CacheResult;
import com.scholary.transcriber.cache.ComputedArtifact;
import com.scholary.transcriber.cache.ContentAddressedCache;
import com.scholary.transcriber.cache.FingerprintInputs;
import com.scholary.transcriber.exception.ValidationException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Text-to-speech served through the content-addressed cache.
 *
 * <p>The fingerprint covers text, voice, format and model, so repeating a question with the same
 * voice never calls the provider twice.
 */
@Service
public class SpeechService {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechService.class);

  static final String NAMESPACE = "tts";
  private static final double WORDS_PER_MINUTE = 150.0;
  private static final Map<String, String> CONTENT_TYPES =
      Map.of(
          "wav", "audio/wav",
          "mp3", "audio/mpeg",
          "ogg", "audio/ogg",
          "flac", "audio/flac");

  private final SpeechSynthesizer synthesizer;
  private final ContentAddressedCache cache;
  private final SpeechProperties properties;

  public SpeechService(
      SpeechSynthesizer synthesizer, ContentAddressedCache cache, SpeechProperties properties) {
    this.synthesizer = synthesizer;
    this.cache = cache;
    this.properties = properties;
  }

  /**
   * Synthesize {@code text}, or return the cached audio for identical inputs.
   *
   * @param voice voice name, or null for the configured default
   * @param format audio format, or null for the configured default
   * @throws ValidationException if the text is blank or too long, or the format is unsupported
   */
  public SpeechResult synthesize(String text, String voice, String format) {
    if (text == null || text.isBlank()) {
      throw new ValidationException("text", "Text must not be blank");
    }
    if (text.length() > properties.maxTextLength()) {
      throw new ValidationException(
          "text", "Text exceeds " + properties.maxTextLength() + " characters");
    }
    String resolvedVoice = voice == null || voice.isBlank() ? properties.defaultVoice() : voice;
    String resolvedFormat =
        (format == null || format.isBlank() ? properties.defaultFormat() : format)
            .toLowerCase(Locale.ROOT);
    String contentType = CONTENT_TYPES.get(resolvedFormat);
    if (contentType == null) {
      throw new ValidationException("format", "Unsupported audio format: " + resolvedFormat);
    }

    FingerprintInputs inputs =
        FingerprintInputs.of(
            NAMESPACE,
            Map.of(
                "text", text,
                "voice", resolvedVoice,
                "format", resolvedFormat,
                "model", properties.model()));

    CacheResult result =
        cache.getOrCompute(
            inputs,
            () ->
                new ComputedArtifact(
                    synthesizer.synthesize(text, resolvedVoice, resolvedFormat),
                    contentType,
                    estimateDurationSeconds(text)));

    CacheEntry entry = result.entry();
    LOGGER.info(
        "Speech ready: key={}, voice={}, cached={}",
        entry.key(),
        resolvedVoice,
        result.wasCached());
    return new SpeechResult(
        entry.key(),
        "/api/v1/cache/" + entry.key(),
        entry.contentType(),
        entry.sizeBytes(),
        entry.durationSeconds(),
        resolvedVoice,
        resolvedFormat,
        result.wasCached());
  }

  /** Rough playback length at 150 words per minute, never below one second. */
  static double estimateDurationSeconds(String text) {
    String stripped = text.strip();
    int words = stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    return Math.max(1.0, words / WORDS_PER_MINUTE * 60.0);
  }
}
