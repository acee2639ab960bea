package com.scholary.survey.translator.translation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LanguageDetectionTest {

  @Test
  void normalizeConfidence_shouldScaleFractions() {
    assertThat(LanguageDetection.normalizeConfidence(0.87)).isEqualTo(87);
    assertThat(LanguageDetection.normalizeConfidence(0.875)).isEqualTo(87);
    assertThat(LanguageDetection.normalizeConfidence(0.29)).isEqualTo(28);
    assertThat(LanguageDetection.normalizeConfidence(1.0)).isEqualTo(100);
  }

  @Test
  void normalizeConfidence_shouldKeepPercentages() {
    assertThat(LanguageDetection.normalizeConfidence(87)).isEqualTo(87);
    assertThat(LanguageDetection.normalizeConfidence(87.9)).isEqualTo(87);
    assertThat(LanguageDetection.normalizeConfidence(87.9999999999)).isEqualTo(87);
  }

  @Test
  void normalizeConfidence_shouldClampOutOfRangeValues() {
    assertThat(LanguageDetection.normalizeConfidence(250)).isEqualTo(100);
    assertThat(LanguageDetection.normalizeConfidence(-0.5)).isEqualTo(0);
    assertThat(LanguageDetection.normalizeConfidence(Double.NaN)).isEqualTo(0);
  }

  @Test
  void constructor_shouldClampConfidence() {
    assertThat(new LanguageDetection("Spanish", 140, null).confidence()).isEqualTo(100);
    assertThat(new LanguageDetection("Spanish", -3, null).confidence()).isEqualTo(0);
  }
}
