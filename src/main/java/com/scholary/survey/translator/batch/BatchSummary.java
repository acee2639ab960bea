package com.scholary.survey.translator.batch;

import java.util.List;

/** Counts of item outcomes in a result set. */
public record BatchSummary(int processed, int errored, int pending) {

  public static BatchSummary of(List<ItemResult> results) {
    int processed = 0;
    int errored = 0;
    int pending = 0;
    for (ItemResult result : results) {
      if (result.status() == ItemStatus.TRANSLATED) {
        processed++;
      } else if (result.status() == ItemStatus.ERROR) {
        errored++;
      } else {
        pending++;
      }
    }
    return new BatchSummary(processed, errored, pending);
  }

  public int unfinished() {
    return errored + pending;
  }
}
