package com.scholary.survey.translator.batch;

import java.util.List;

/**
 * Outcome of one chunk step.
 *
 * @param complete whether the batch has no items left
 * @param nextCursor index of the next unprocessed item
 * @param remaining number of items not yet processed
 * @param appended results appended by this step, in order
 * @param allResults every result of the batch when complete, empty otherwise
 */
public record ChunkOutcome(
    boolean complete,
    int nextCursor,
    int remaining,
    List<ItemResult> appended,
    List<ItemResult> allResults) {

  public static ChunkOutcome moreRemaining(
      int nextCursor, int remaining, List<ItemResult> appended) {
    return new ChunkOutcome(false, nextCursor, remaining, List.copyOf(appended), List.of());
  }

  public static ChunkOutcome complete(List<ItemResult> appended, List<ItemResult> allResults) {
    return new ChunkOutcome(
        true, allResults.size(), 0, List.copyOf(appended), List.copyOf(allResults));
  }
}
