package com.acme.achnotify.domain;

import java.time.Instant;
import java.util.List;

/** End-of-run report. Immutable once built. */
public record SummaryReport(
    String runId,
    long totalRecords,
    int successfullyProcessed,
    int notifiedGroups,
    List<BucketEntry> skippedRecords,
    List<BucketEntry> errorRecords,
    List<GroupFailure> failedGroups,
    Instant startedAt,
    Instant finishedAt) {

  public SummaryReport {
    skippedRecords = List.copyOf(skippedRecords);
    errorRecords = List.copyOf(errorRecords);
    failedGroups = List.copyOf(failedGroups);
  }

  /** A group that reached the generator but was not notified. */
  public record GroupFailure(
      String groupKey, String accountId, String vendorId, GroupStatus status, String errorNote) {}

  public int skippedCount() {
    return skippedRecords.size();
  }

  public int errorCount() {
    return errorRecords.size();
  }

  public boolean hasProblems() {
    return !skippedRecords.isEmpty() || !errorRecords.isEmpty() || !failedGroups.isEmpty();
  }
}
