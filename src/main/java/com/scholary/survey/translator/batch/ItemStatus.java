package com.scholary.survey.translator.batch;

/** Outcome of processing one item. */
public enum ItemStatus {
  TRANSLATED,
  ERROR,
  PENDING
}
