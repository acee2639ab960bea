package com.scholary.survey.translator.translation;

/**
 * Deterministic client used in test mode.
 *
 * <p>Never touches the network. Every text is reported as English and echoed back with a marker.
 */
public class FakeTranslationClient implements TranslationClient {

  static final String TRANSLATION_PREFIX = "[TEST MODE] ";

  private static final LanguageDetection DETECTION =
      new LanguageDetection("English", 95, "Test mode");

  @Override
  public LanguageDetection detectLanguage(String text) {
    return DETECTION;
  }

  @Override
  public String translate(String text) {
    return TRANSLATION_PREFIX + text;
  }
}
