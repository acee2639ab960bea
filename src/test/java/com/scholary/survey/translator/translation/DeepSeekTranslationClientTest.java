package com.scholary.survey.translator.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DeepSeekTranslationClientTest {

  private static final String API_URL = "https://api.deepseek.test/v1/chat/completions";

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private DeepSeekTranslationClient client;

  @BeforeEach
  void setUp() {
    client = new DeepSeekTranslationClient(httpClient, properties("secret-key"), objectMapper);
  }

  @Test
  void detectLanguage_shouldParseDetectionObject() throws Exception {
    respondWith(
        200,
        completion("{\"language\": \"Spanish\", \"confidence\": 0.87, \"reason\": \"Accents\"}"));

    LanguageDetection detection = client.detectLanguage("¿Dónde está la biblioteca?");

    assertThat(detection.language()).isEqualTo("Spanish");
    assertThat(detection.confidence()).isEqualTo(87);
    assertThat(detection.reason()).isEqualTo("Accents");
  }

  @Test
  void detectLanguage_shouldSendBearerTokenAndModel() throws Exception {
    respondWith(200, completion("{\"language\": \"French\", \"confidence\": 90}"));

    client.detectLanguage("Bonjour");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    HttpRequest request = captor.getValue();
    assertThat(request.uri().toString()).isEqualTo(API_URL);
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.headers().firstValue("Authorization")).contains("Bearer secret-key");
  }

  @Test
  void detectLanguage_shouldFallBackOnUnparseableContent() throws Exception {
    respondWith(200, completion("I think this is probably Spanish."));

    LanguageDetection detection = client.detectLanguage("Hola");

    assertThat(detection).isEqualTo(LanguageDetection.FALLBACK);
  }

  @Test
  void detectLanguage_shouldRaiseOnErrorStatus() throws Exception {
    respondWith(500, "upstream exploded");

    assertThatThrownBy(() -> client.detectLanguage("Hola"))
        .isInstanceOf(TranslationException.class)
        .hasMessage("Language detection API error: 500 - upstream exploded");
  }

  @Test
  void translate_shouldReturnTrimmedContent() throws Exception {
    respondWith(200, completion("  Where is the <b>library</b>?\n"));

    assertThat(client.translate("¿Dónde está la <b>biblioteca</b>?"))
        .isEqualTo("Where is the <b>library</b>?");
  }

  @Test
  void translate_shouldRaiseOnMissingContent() throws Exception {
    respondWith(200, "{\"choices\": []}");

    assertThatThrownBy(() -> client.translate("Hola"))
        .isInstanceOf(TranslationException.class)
        .hasMessageStartingWith("Translation API returned no content");
  }

  @Test
  void translate_shouldWrapNetworkErrors() throws Exception {
    doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> client.translate("Hola"))
        .isInstanceOf(TranslationException.class)
        .hasMessage("Network error during translation: connection reset")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void translate_shouldFailFastWithoutApiKey() {
    DeepSeekTranslationClient unconfigured =
        new DeepSeekTranslationClient(httpClient, properties(" "), objectMapper);

    assertThatThrownBy(() -> unconfigured.translate("Hola"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("DeepSeek API key not configured");
    verifyNoInteractions(httpClient);
  }

  @Test
  void parseDetection_shouldStripCodeFence() {
    Optional<LanguageDetection> detection =
        client.parseDetection(
            "```json\n"
                + "{\"language\": \"German\", \"confidence\": \"92%\", \"reason\": \"Umlauts\"}\n"
                + "```");

    assertThat(detection).contains(new LanguageDetection("German", 92, "Umlauts"));
  }

  @Test
  void parseDetection_shouldTreatMissingConfidenceAsZero() {
    Optional<LanguageDetection> detection = client.parseDetection("{\"language\": \"Italian\"}");

    assertThat(detection).contains(new LanguageDetection("Italian", 0, null));
  }

  @Test
  void parseDetection_shouldRejectObjectWithoutLanguage() {
    assertThat(client.parseDetection("{\"confidence\": 80}")).isEmpty();
    assertThat(client.parseDetection("[1, 2, 3]")).isEmpty();
  }

  private void respondWith(int status, String body) throws Exception {
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(body);
    doReturn(response).when(httpClient).send(any(), any());
  }

  private String completion(String content) throws Exception {
    JsonNode root =
        objectMapper
            .createObjectNode()
            .set(
                "choices",
                objectMapper
                    .createArrayNode()
                    .add(
                        objectMapper
                            .createObjectNode()
                            .set(
                                "message",
                                objectMapper
                                    .createObjectNode()
                                    .put("role", "assistant")
                                    .put("content", content))));
    return objectMapper.writeValueAsString(root);
  }

  private static TranslationProperties properties(String apiKey) {
    return new TranslationProperties(
        API_URL, apiKey, "deepseek-chat", Duration.ofSeconds(5), Duration.ofSeconds(15), false);
  }
}
