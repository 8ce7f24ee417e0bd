package com.acme.achnotify.domain;

/**
 * Outcome of normalizing one raw record: a payment order, or an entry for one of the buckets.
 */
public record NormalizedResult(Outcome outcome, PaymentOrder order, BucketEntry entry) {

  public enum Outcome {
    VALID,
    SKIPPED,
    ERRORED
  }

  public static NormalizedResult valid(PaymentOrder order) {
    return new NormalizedResult(Outcome.VALID, order, null);
  }

  public static NormalizedResult skipped(BucketEntry entry) {
    return new NormalizedResult(Outcome.SKIPPED, null, entry);
  }

  public static NormalizedResult errored(BucketEntry entry) {
    return new NormalizedResult(Outcome.ERRORED, null, entry);
  }

  public boolean isValid() {
    return outcome == Outcome.VALID;
  }
}
