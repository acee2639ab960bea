package com.scholary.survey.translator.progress;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Phase reported by a progress snapshot. Serialized in lower case. */
public enum ProgressStatus {
  IDLE,
  READING,
  PROCESSING_BATCH,
  PROCESSING_QUESTION,
  BATCH_COMPLETED,
  COMPLETED,
  ERROR,
  TIMEOUT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Whether a progress stream ends after emitting this status. */
  public boolean endsStream() {
    return this == COMPLETED || this == ERROR;
  }
}
