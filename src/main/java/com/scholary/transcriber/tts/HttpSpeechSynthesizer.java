package com.scholary.transcriber.tts;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Client for an OpenAI-compatible {@code POST /audio/speech} endpoint.
 *
 * <p>Sends a JSON body with model, input, voice and response format and returns the raw audio.
 */
@Component
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechSynthesizer.class);

  private final HttpClient httpClient;
  private final SpeechProperties properties;
  private final ObjectMapper objectMapper;

  public HttpSpeechSynthesizer(SpeechProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();
  }

  @Override
  public byte[] synthesize(String text, String voice, String format) {
    Map<String, String> payload = new LinkedHashMap<>();
    payload.put("model", properties.model());
    payload.put("input", text);
    payload.put("voice", voice);
    payload.put("response_format", format);

    try {
      String base = properties.baseUrl();
      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(URI.create((base.endsWith("/") ? base : base + "/") + "audio/speech"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload)));
      if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
        builder.header("Authorization", "Bearer " + properties.apiKey());
      }

      HttpResponse<byte[]> response =
          httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() != 200) {
        throw new SpeechSynthesisException(
            String.format(
                "Speech API returned status %d: %s",
                response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
      }
      if (response.body().length == 0) {
        throw new SpeechSynthesisException("Speech API returned no audio");
      }

      LOGGER.debug(
          "Synthesized {} chars with voice {} into {} bytes", text.length(), voice,
          response.body().length);
      return response.body();

    } catch (IOException e) {
      throw new SpeechSynthesisException("Speech API request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SpeechSynthesisException("Speech synthesis interrupted", e);
    }
  }
}
