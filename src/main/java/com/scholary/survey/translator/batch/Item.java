package com.scholary.survey.translator.batch;

/**
 * A question to process.
 *
 * @param rowNumber 1-based position in the source, carried from extraction
 * @param text the question text
 */
public record Item(int rowNumber, String text) {}
