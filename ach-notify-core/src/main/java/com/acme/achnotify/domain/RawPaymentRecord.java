package com.acme.achnotify.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the eligible-payments search. Field values are either scalars or select pairs of
 * the form {@code {"value": ..., "text": ...}}.
 */
public record RawPaymentRecord(String recordId, Map<String, Object> values) {

  public static final String ACCOUNT = "account";
  public static final String ENTITY = "entity";
  public static final String TRAN_DATE = "trandate";
  public static final String POSTING_PERIOD = "postingperiod";
  public static final String TRAN_ID = "tranid";
  public static final String VENDOR_EMAIL = "email.vendor";

  public RawPaymentRecord {
    values = values == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  /**
   * Scalar value of a field. For select pairs this is the {@code value} member.
   *
   * @return the value as a string, or null when absent or blank
   */
  public String value(String field) {
    Object raw = values.get(field);
    if (raw instanceof Map<?, ?> pair) {
      return asText(pair.get("value"));
    }
    return asText(raw);
  }

  /**
   * Display text of a select field, or null when the field is absent or not a select pair.
   */
  public String text(String field) {
    Object raw = values.get(field);
    if (raw instanceof Map<?, ?> pair) {
      return asText(pair.get("text"));
    }
    return null;
  }

  private static String asText(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Map<?, ?> || raw instanceof Iterable<?>) {
      throw new IllegalArgumentException("Unexpected structured value: " + raw);
    }
    String text = raw.toString();
    return text.isBlank() ? null : text;
  }
}
