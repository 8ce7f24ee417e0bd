package com.acme.achnotify.domain;

/** Record types the job loads from the record store. */
public enum RecordType {
  VENDOR_PAYMENT("vendor_payment");

  private final String tableName;

  RecordType(String tableName) {
    this.tableName = tableName;
  }

  public String getTableName() {
    return tableName;
  }
}
