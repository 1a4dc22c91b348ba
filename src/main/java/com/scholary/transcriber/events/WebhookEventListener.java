package com.scholary.transcriber.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Posts session events as JSON to the configured webhook URLs.
 *
 * <p>Each URL gets one request. A non-2xx response or a transport error fails the delivery, which
 * the {@link EventNotifier} logs.
 */
@Component
public class WebhookEventListener implements SessionEventListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookEventListener.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final List<String> webhookUrls;
  private final Duration timeout;

  public WebhookEventListener(NotificationProperties properties, ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
    this.webhookUrls = List.copyOf(properties.webhookUrls());
    this.timeout = Duration.ofSeconds(properties.timeoutSeconds());
    this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  @Override
  public void onEvent(SessionEvent event) throws IOException, InterruptedException {
    if (webhookUrls.isEmpty()) {
      return;
    }
    byte[] body = objectMapper.writeValueAsBytes(WebhookPayload.of(event));

    IOException failure = null;
    for (String url : webhookUrls) {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(url))
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofByteArray(body))
              .build();
      try {
        HttpResponse<Void> response =
            httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
          throw new IOException("Webhook " + url + " returned status " + response.statusCode());
        }
        LOGGER.debug("Delivered {} event to {}", event.type(), url);
      } catch (IOException e) {
        // every URL gets its attempt before the first failure is rethrown
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
