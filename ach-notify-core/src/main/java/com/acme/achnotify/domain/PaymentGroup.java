package com.acme.achnotify.domain;

import java.util.List;

/** Payments of one bank account and vendor, notified together in a single email. */
public record PaymentGroup(
    String groupKey,
    String accountId,
    String vendorId,
    String recipientEmail,
    List<String> orderIds) {

  public PaymentGroup {
    if (orderIds == null || orderIds.isEmpty()) {
      throw new IllegalArgumentException("Payment group must contain at least one order");
    }
    orderIds = List.copyOf(orderIds);
  }

  /**
   * Builds a group from its key. The account is everything before the first separator, the
   * vendor everything after it.
   */
  public static PaymentGroup fromKey(String groupKey, String recipientEmail, List<String> orderIds) {
    int separator = groupKey.indexOf(PaymentOrder.KEY_SEPARATOR);
    if (separator <= 0 || separator == groupKey.length() - 1) {
      throw new IllegalArgumentException("Malformed group key: " + groupKey);
    }
    return new PaymentGroup(
        groupKey,
        groupKey.substring(0, separator),
        groupKey.substring(separator + 1),
        recipientEmail,
        orderIds);
  }

  public int size() {
    return orderIds.size();
  }
}
