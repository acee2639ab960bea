package com.scholary.survey.translator.translation;

/**
 * Result of a language detection call.
 *
 * @param language the detected language name in English
 * @param confidence confidence in percent, always within [0, 100]
 * @param reason the rationale given by the service, or null when none was given
 */
public record LanguageDetection(String language, int confidence, String reason) {

  /** Used when the detection response cannot be parsed. */
  public static final LanguageDetection FALLBACK = new LanguageDetection("English", 90, null);

  public LanguageDetection {
    confidence = clamp(confidence);
  }

  /**
   * Normalize a raw confidence value to an integer percentage.
   *
   * <p>The upstream service answers either with a fraction or with a percentage. Values up to
   * 1.0 are treated as fractions and scaled by 100; larger values are taken as percentages. The
   * result is truncated toward zero and clamped to [0, 100], so a fraction whose product is not
   * exact in binary, such as 0.29, lands one below.
   */
  public static int normalizeConfidence(double raw) {
    if (Double.isNaN(raw)) {
      return 0;
    }
    double percent = raw <= 1.0 ? raw * 100 : raw;
    return clamp((int) percent);
  }

  private static int clamp(int value) {
    return Math.max(0, Math.min(100, value));
  }
}
