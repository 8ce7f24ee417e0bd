package com.acme.achnotify.domain;

/** Side channels carrying records that never reach voucher generation. */
public enum Bucket {
  SKIPPED_RECORDS,
  ERROR_RECORDS
}
