package com.acme.achnotify.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable handle on a stored payment record. Tracks which fields were changed so the store
 * only writes those back.
 */
public class PaymentRecord {

  /** Flag set once the voucher email for the payment went out. */
  public static final String FIELD_EMAIL_SENT = "ach_email_sent";

  private final RecordType type;
  private final String id;
  private final Map<String, Object> fields;
  private final Set<String> dirtyFields = new LinkedHashSet<>();

  public PaymentRecord(RecordType type, String id, Map<String, Object> fields) {
    if (type == null) {
      throw new IllegalArgumentException("Record type cannot be null");
    }
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Record ID cannot be null or blank");
    }
    this.type = type;
    this.id = id;
    this.fields = new LinkedHashMap<>(fields);
  }

  public RecordType getType() {
    return type;
  }

  public String getId() {
    return id;
  }

  public Object getValue(String fieldId) {
    return fields.get(fieldId);
  }

  public void setValue(String fieldId, Object value) {
    if (!fields.containsKey(fieldId)) {
      throw new IllegalArgumentException(
          "Unknown field " + fieldId + " on " + type + " " + id);
    }
    fields.put(fieldId, value);
    dirtyFields.add(fieldId);
  }

  public Map<String, Object> getFields() {
    return Collections.unmodifiableMap(fields);
  }

  public Set<String> getDirtyFields() {
    return Collections.unmodifiableSet(dirtyFields);
  }

  public void markClean() {
    dirtyFields.clear();
  }
}
