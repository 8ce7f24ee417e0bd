package com.acme.achnotify.pipeline;

import static com.acme.achnotify.domain.RawPaymentRecord.ACCOUNT;
import static com.acme.achnotify.domain.RawPaymentRecord.ENTITY;
import static com.acme.achnotify.domain.RawPaymentRecord.POSTING_PERIOD;
import static com.acme.achnotify.domain.RawPaymentRecord.TRAN_DATE;
import static com.acme.achnotify.domain.RawPaymentRecord.TRAN_ID;
import static com.acme.achnotify.domain.RawPaymentRecord.VENDOR_EMAIL;

import com.acme.achnotify.domain.BucketEntry;
import com.acme.achnotify.domain.NormalizedResult;
import com.acme.achnotify.domain.PaymentOrder;
import com.acme.achnotify.domain.RawPaymentRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map stage. Turns one search row into a {@link PaymentOrder}, or into a bucket entry when the
 * row is incomplete or cannot be read. Stateless and safe to call from many threads.
 */
public class RecordNormalizer {
  private static final Logger LOG = LoggerFactory.getLogger(RecordNormalizer.class);

  public NormalizedResult normalize(RawPaymentRecord raw) {
    try {
      List<String> missingFields = missingFields(raw);
      if (!missingFields.isEmpty()) {
        String note = "Missing required fields: " + String.join(", ", missingFields);
        LOG.error(
            "Skipping record with missing required fields. Record ID: {}, {}",
            raw.recordId(),
            note);
        return NormalizedResult.skipped(
            new BucketEntry(
                raw.recordId(),
                raw.value(TRAN_ID),
                raw.text(ENTITY),
                raw.value(ACCOUNT),
                raw.value(ENTITY),
                note,
                missingFields));
      }

      String accountId = raw.value(ACCOUNT);
      String vendorId = raw.value(ENTITY);
      if (accountId.contains(PaymentOrder.KEY_SEPARATOR)) {
        throw new IllegalArgumentException(
            "Account ID must not contain '" + PaymentOrder.KEY_SEPARATOR + "': " + accountId);
      }
      String entityName = raw.text(ENTITY) != null ? raw.text(ENTITY) : vendorId;

      PaymentOrder order =
          new PaymentOrder(
              raw.recordId(),
              PaymentOrder.groupKey(accountId, vendorId),
              raw.value(TRAN_DATE),
              raw.text(POSTING_PERIOD),
              raw.value(TRAN_ID),
              entityName,
              raw.value(VENDOR_EMAIL));
      return NormalizedResult.valid(order);
    } catch (RuntimeException e) {
      String recordId = raw != null ? raw.recordId() : null;
      LOG.error(
          "Error processing record in map stage. Record ID: {}, Error: {}",
          recordId,
          e.getMessage());
      return NormalizedResult.errored(
          new BucketEntry(
              recordId,
              quietly(() -> raw.value(TRAN_ID)),
              quietly(() -> raw.text(ENTITY)),
              quietly(() -> raw.value(ACCOUNT)),
              quietly(() -> raw.value(ENTITY)),
              "Error processing record: " + e.getMessage(),
              List.of()));
    }
  }

  /** Required fields in check order; every missing one is reported, not just the first. */
  static List<String> missingFields(RawPaymentRecord raw) {
    List<String> missing = new ArrayList<>();
    if (raw.value(ACCOUNT) == null) {
      missing.add("account");
    }
    if (raw.value(ENTITY) == null) {
      missing.add("entity");
    }
    if (raw.value(TRAN_DATE) == null) {
      missing.add("transaction date");
    }
    if (raw.value(TRAN_ID) == null) {
      missing.add("transaction ID");
    }
    if (raw.value(VENDOR_EMAIL) == null) {
      missing.add("vendor email");
    }
    return missing;
  }

  private static String quietly(Supplier<String> read) {
    try {
      return read.get();
    } catch (RuntimeException e) {
      return null;
    }
  }
}
