package com.acme.achnotify.domain;

import java.util.List;

/** A record diverted to the skipped or error bucket, with the reason. */
public record BucketEntry(
    String recordId,
    String orderNumber,
    String entityName,
    String accountId,
    String vendorId,
    String errorNote,
    List<String> missingFields) {

  public static final String NOT_AVAILABLE = "N/A";

  public BucketEntry {
    orderNumber = orElseNotAvailable(orderNumber);
    entityName = orElseNotAvailable(entityName);
    accountId = orElseNotAvailable(accountId);
    vendorId = orElseNotAvailable(vendorId);
    missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
  }

  private static String orElseNotAvailable(String value) {
    return value == null || value.isBlank() ? NOT_AVAILABLE : value;
  }
}
