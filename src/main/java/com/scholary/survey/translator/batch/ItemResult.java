package com.scholary.survey.translator.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.survey.translator.translation.LanguageDetection;

/**
 * Result for one item of a batch.
 *
 * <p>The {@code status} tags which fields are meaningful: translated items carry the detection
 * and translation, errored items an {@code errorMessage}, pending items a {@code pendingReason}.
 * Errored and pending items still fill the language and translation columns with readable
 * placeholders so that an exported table needs no special casing.
 *
 * @param questionNumber 1-based processing order
 * @param rowNumber 1-based source order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemResult(
    int questionNumber,
    int rowNumber,
    String originalQuestion,
    ItemStatus status,
    String detectedLanguage,
    int confidence,
    String confidenceReason,
    String englishTranslation,
    String errorMessage,
    String pendingReason) {

  public static final String PENDING_TIMEOUT = "timeout";

  public static ItemResult translated(
      int questionNumber, Item item, LanguageDetection detection, String translation) {
    return new ItemResult(
        questionNumber,
        item.rowNumber(),
        item.text(),
        ItemStatus.TRANSLATED,
        detection.language(),
        detection.confidence(),
        detection.reason(),
        translation,
        null,
        null);
  }

  public static ItemResult errored(int questionNumber, Item item, String message) {
    return new ItemResult(
        questionNumber,
        item.rowNumber(),
        item.text(),
        ItemStatus.ERROR,
        "Error",
        0,
        null,
        "Translation error: " + message,
        message,
        null);
  }

  public static ItemResult pending(int questionNumber, Item item) {
    return new ItemResult(
        questionNumber,
        item.rowNumber(),
        item.text(),
        ItemStatus.PENDING,
        "Pending",
        0,
        null,
        "Not processed: time budget exhausted",
        null,
        PENDING_TIMEOUT);
  }

  /** The item this result was produced from. */
  public Item toItem() {
    return new Item(rowNumber, originalQuestion);
  }
}
