package com.acme.achnotify.domain;

import java.util.List;

/** Output of the grouping stage: closed payment groups plus both buckets. */
public record GroupingResult(
    List<PaymentGroup> groups, List<BucketEntry> skipped, List<BucketEntry> errored) {

  public GroupingResult {
    groups = List.copyOf(groups);
    skipped = List.copyOf(skipped);
    errored = List.copyOf(errored);
  }

  public List<BucketEntry> bucket(Bucket bucket) {
    return bucket == Bucket.SKIPPED_RECORDS ? skipped : errored;
  }

  /** Number of distinct keys produced: one per group plus one per non-empty bucket. */
  public int keyCount() {
    return groups.size() + (skipped.isEmpty() ? 0 : 1) + (errored.isEmpty() ? 0 : 1);
  }
}
