package com.scholary.survey.translator.translation;

/**
 * Interface for the external text-analysis service.
 *
 * <p>This abstraction lets the batch pipeline run against the real DeepSeek API or a
 * deterministic fake without changing any scheduling logic.
 */
public interface TranslationClient {

  /**
   * Detect the language of a text.
   *
   * <p>Implementations fall back to a fixed detection when the upstream answer cannot be parsed;
   * only transport and status failures are raised.
   *
   * @param text the text to analyse
   * @return the detected language with a normalized confidence
   * @throws TranslationException if the upstream call fails
   */
  LanguageDetection detectLanguage(String text);

  /**
   * Translate a text to English.
   *
   * @param text the text to translate, inline markup included
   * @return the English translation, trimmed
   * @throws TranslationException if the upstream call fails or returns no translation
   */
  String translate(String text);
}
