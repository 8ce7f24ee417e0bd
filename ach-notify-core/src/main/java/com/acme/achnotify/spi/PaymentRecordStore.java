package com.acme.achnotify.spi;

import com.acme.achnotify.domain.PaymentRecord;
import com.acme.achnotify.domain.RecordType;

/** Loads and saves payment records of the system of record. */
public interface PaymentRecordStore {

  /**
   * @throws com.acme.achnotify.core.PermanentException when the record does not exist
   */
  PaymentRecord load(RecordType type, String id);

  /** Writes back the changed fields of the record. */
  void save(PaymentRecord record);
}
