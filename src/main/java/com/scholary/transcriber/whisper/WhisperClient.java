package com.scholary.transcriber.whisper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for an OpenAI-compatible Whisper transcription API.
 *
 * <p>Builds the multipart request by hand on top of the JDK HttpClient, asks for {@code
 * verbose_json} so segments carry timing and {@code avg_logprob}, and classifies every failure into
 * a {@link WhisperErrorKind}. One call is one attempt; the worker pool decides whether to retry.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public WhisperOutcome transcribe(AudioClip clip) {
    LOGGER.debug("Transcribing clip: file={}, size={} bytes", clip.fileName(), clip.data().length);

    String boundary = UUID.randomUUID().toString();
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(stripTrailingSlash(properties.baseUrl()) + "/audio/transcriptions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(buildMultipartBody(clip, boundary)));
    if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiKey());
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      return WhisperOutcome.failure(WhisperErrorKind.TIMEOUT, "Request timed out");
    } catch (IOException e) {
      return WhisperOutcome.failure(WhisperErrorKind.NETWORK, e.toString());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return WhisperOutcome.failure(WhisperErrorKind.INTERRUPTED, "Transcription interrupted");
    }

    int status = response.statusCode();
    if (status == 429) {
      return WhisperOutcome.failure(WhisperErrorKind.RATE_LIMITED, "Rate limited by provider");
    }
    if (status >= 500) {
      return WhisperOutcome.failure(
          WhisperErrorKind.SERVER_ERROR,
          String.format("Whisper API returned status %d: %s", status, response.body()));
    }
    if (status < 200 || status >= 300) {
      return WhisperOutcome.failure(
          WhisperErrorKind.REJECTED,
          String.format("Whisper API returned status %d: %s", status, response.body()));
    }

    try {
      WhisperResponse whisperResponse =
          objectMapper.readValue(response.body(), WhisperResponse.class);
      LOGGER.debug(
          "Transcription successful: {} segments, language={}",
          whisperResponse.segments().size(),
          whisperResponse.language());
      return WhisperOutcome.success(whisperResponse);
    } catch (JsonProcessingException e) {
      return WhisperOutcome.failure(
          WhisperErrorKind.SERVER_ERROR, "Malformed provider response: " + e.getOriginalMessage());
    }
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are written out by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk_0000.webm"
   * Content-Type: audio/webm
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * whisper-large-v3
   * ...
   * --boundary--
   * </pre>
   */
  private byte[] buildMultipartBody(AudioClip clip, String boundary) {
    ByteArrayOutputStream body = new ByteArrayOutputStream(clip.data().length + 1024);

    String filePart =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + clip.fileName()
            + "\"\r\n"
            + "Content-Type: "
            + clip.contentType()
            + "\r\n\r\n";
    body.writeBytes(filePart.getBytes(StandardCharsets.UTF_8));
    body.writeBytes(clip.data());
    body.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));

    StringBuilder sb = new StringBuilder();
    appendField(sb, boundary, "model", properties.model());
    appendField(sb, boundary, "response_format", "verbose_json");
    appendField(sb, boundary, "timestamp_granularities[]", "segment");
    appendField(sb, boundary, "temperature", "0");
    sb.append("--").append(boundary).append("--\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));

    return body.toByteArray();
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
