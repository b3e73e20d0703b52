package io.intellixity.querygate.server.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.querygate.pipeline.model.ModelClient;
import io.intellixity.querygate.pipeline.model.ModelClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ModelClient} over an OpenAI-compatible {@code /chat/completions} endpoint.
 * <p>
 * Deterministic settings (temperature 0). Transport errors, timeouts and HTTP errors surface as
 * {@link ModelClientException}; callers decide whether to retry or fail closed.
 */
public final class HttpModelClient implements ModelClient {
  private static final Logger log = LoggerFactory.getLogger(HttpModelClient.class);

  private final RestClient client;
  private final String modelName;

  public HttpModelClient(RestClient client, String modelName) {
    this.client = Objects.requireNonNull(client, "client");
    this.modelName = Objects.requireNonNull(modelName, "modelName");
  }

  public static HttpModelClient create(RestClient.Builder builder, String baseUrl, String apiKey, String modelName) {
    RestClient.Builder b = builder.baseUrl(baseUrl)
        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    if (apiKey != null && !apiKey.isBlank()) b = b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
    return new HttpModelClient(b.build(), modelName);
  }

  /** Request factory bounding both connect and read by {@code timeout}; a stalled endpoint then fails the call. */
  public static ClientHttpRequestFactory requestFactory(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return ClientHttpRequestFactories.get(ClientHttpRequestFactorySettings.DEFAULTS
        .withConnectTimeout(timeout)
        .withReadTimeout(timeout));
  }

  @Override
  public String complete(String instructions, String input) {
    Map<String, Object> req = new LinkedHashMap<>();
    req.put("model", modelName);
    req.put("temperature", 0);
    req.put("messages", List.of(
        Map.of("role", "system", "content", instructions),
        Map.of("role", "user", "content", input == null ? "" : input)));

    JsonNode body;
    try {
      body = client.post()
          .uri("/chat/completions")
          .accept(MediaType.APPLICATION_JSON)
          .body(req)
          .retrieve()
          .body(JsonNode.class);
    } catch (RestClientResponseException e) {
      log.warn("querygate.model http_error status={} model={}", e.getStatusCode().value(), modelName);
      throw new ModelClientException("model endpoint returned " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      log.warn("querygate.model transport_error model={} cause={}", modelName, e.toString());
      throw new ModelClientException("model endpoint unreachable: " + e.getMessage(), e);
    }
    return extractText(body);
  }

  static String extractText(JsonNode body) {
    if (body == null) throw new ModelClientException("empty model response");
    JsonNode content = body.path("choices").path(0).path("message").path("content");
    if (!content.isTextual() || content.asText().isBlank()) {
      throw new ModelClientException("model response has no message content");
    }
    return content.asText();
  }
}
