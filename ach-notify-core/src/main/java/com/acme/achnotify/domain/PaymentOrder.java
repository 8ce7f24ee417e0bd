package com.acme.achnotify.domain;

/** Normalized eligible payment. Everything but the posting period is mandatory. */
public record PaymentOrder(
    String orderId,
    String groupKey,
    String orderDate,
    String postingPeriod,
    String orderNumber,
    String entityName,
    String vendorEmail) {

  public static final String KEY_SEPARATOR = "_";

  public PaymentOrder {
    requireText(orderId, "Order ID");
    requireText(groupKey, "Group key");
    requireText(orderDate, "Order date");
    requireText(orderNumber, "Order number");
    requireText(entityName, "Entity name");
    requireText(vendorEmail, "Vendor email");
    if (postingPeriod == null) {
      postingPeriod = "";
    }
  }

  public static String groupKey(String accountId, String vendorId) {
    return accountId + KEY_SEPARATOR + vendorId;
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " cannot be null or blank");
    }
  }
}
