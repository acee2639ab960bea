package com.scholary.survey.translator.translation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the DeepSeek chat-completions API.
 *
 * <p>Each operation is one chat-completion request: detection asks for a small JSON object
 * ({@code language}, {@code confidence}, {@code reason}), translation asks for the bare English
 * text. The upstream model is not strict about either format, so detection parsing is lenient and
 * falls back to {@link LanguageDetection#FALLBACK} instead of failing the item.
 *
 * <p>There is no retry here. A failed call becomes an errored item and is retried by submitting
 * the unfinished items as a new batch.
 */
public class DeepSeekTranslationClient implements TranslationClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeepSeekTranslationClient.class);

  private static final double TEMPERATURE = 0.1;

  private static final Pattern CODE_FENCE =
      Pattern.compile("^```[a-zA-Z]*\\s*(.*?)\\s*```$", Pattern.DOTALL);

  private static final Pattern LEADING_NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?");

  private final HttpClient httpClient;
  private final TranslationProperties properties;
  private final ObjectMapper objectMapper;

  public DeepSeekTranslationClient(TranslationProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build(),
        properties,
        objectMapper);
  }

  DeepSeekTranslationClient(
      HttpClient httpClient, TranslationProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;

    LOGGER.info(
        "Initialized DeepSeek client: apiUrl={}, model={}",
        properties.apiUrl(),
        properties.model());
  }

  @Override
  public LanguageDetection detectLanguage(String text) {
    String body = send(detectionPrompt(text), "Language detection");

    Optional<LanguageDetection> detection = messageContent(body).flatMap(this::parseDetection);
    if (detection.isEmpty()) {
      LOGGER.warn("Unparseable language detection response, using fallback: {}", body);
      return LanguageDetection.FALLBACK;
    }
    return detection.get();
  }

  @Override
  public String translate(String text) {
    String body = send(translationPrompt(text), "Translation");

    return messageContent(body)
        .map(String::trim)
        .orElseThrow(
            () -> new TranslationException("Translation API returned no content: " + body));
  }

  /**
   * Send one chat-completion request and return the raw response body.
   *
   * @throws TranslationException on network failure or a non-success status
   * @throws IllegalStateException if no API key is configured
   */
  private String send(String prompt, String operation) {
    String apiKey = properties.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException("DeepSeek API key not configured");
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.apiUrl()))
            .timeout(properties.readTimeout())
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(requestBody(prompt)))
            .build();

    LOGGER.debug("Sending {} request to {}", operation, request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TranslationException(
          String.format("Network error during %s: %s", operation.toLowerCase(), e.getMessage()),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranslationException(operation + " interrupted", e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new TranslationException(
          String.format("%s API error: %d - %s", operation, status, response.body()));
    }
    return response.body();
  }

  private String requestBody(String prompt) {
    Map<String, Object> payload =
        Map.of(
            "model", properties.model(),
            "messages", List.of(Map.of("role", "user", "content", prompt)),
            "temperature", TEMPERATURE);
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new TranslationException("Failed to encode request body", e);
    }
  }

  /** Extract {@code choices[0].message.content} from a chat-completion response. */
  private Optional<String> messageContent(String body) {
    try {
      JsonNode content =
          objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
      return content.isTextual() ? Optional.of(content.asText()) : Optional.empty();
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }

  /**
   * Parse the detection object returned by the model.
   *
   * <p>Accepts the object on its own or inside a markdown code fence. The confidence may be a
   * number or a numeric string such as {@code "87%"}; a missing confidence counts as 0.
   */
  Optional<LanguageDetection> parseDetection(String content) {
    String json = content.trim();
    Matcher fence = CODE_FENCE.matcher(json);
    if (fence.matches()) {
      json = fence.group(1);
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
    if (node == null || !node.isObject()) {
      return Optional.empty();
    }

    JsonNode language = node.path("language");
    if (!language.isTextual() || language.asText().isBlank()) {
      return Optional.empty();
    }

    Optional<Double> rawConfidence = rawConfidence(node.path("confidence"));
    if (rawConfidence.isEmpty()) {
      return Optional.empty();
    }

    JsonNode reason = node.path("reason");
    return Optional.of(
        new LanguageDetection(
            language.asText().trim(),
            LanguageDetection.normalizeConfidence(rawConfidence.get()),
            reason.isTextual() && !reason.asText().isBlank() ? reason.asText().trim() : null));
  }

  private Optional<Double> rawConfidence(JsonNode confidence) {
    if (confidence.isMissingNode() || confidence.isNull()) {
      return Optional.of(0.0);
    }
    if (confidence.isNumber()) {
      return Optional.of(confidence.asDouble());
    }
    if (confidence.isTextual()) {
      Matcher number = LEADING_NUMBER.matcher(confidence.asText().trim());
      if (number.find()) {
        return Optional.of(Double.parseDouble(number.group()));
      }
    }
    return Optional.empty();
  }

  private static String detectionPrompt(String text) {
    return String.format(
        "Analyze the following text and provide:%n"
            + "1. The detected language (language name in English)%n"
            + "2. A confidence score (0-100)%n"
            + "3. A short reason for the confidence score%n%n"
            + "Text: \"%s\"%n%n"
            + "Respond in JSON format only:%n"
            + "{\"language\": \"detected_language_name\", \"confidence\": confidence_score, "
            + "\"reason\": \"short_reason\"}",
        text);
  }

  private static String translationPrompt(String text) {
    return String.format(
        "Translate the following text to English. Maintain the original meaning and tone.%n"
            + "If the text is already in English, return it unchanged.%n"
            + "Keep any inline markup exactly as it appears.%n%n"
            + "Text: \"%s\"%n%n"
            + "Provide only the English translation, nothing else.",
        text);
  }
}
