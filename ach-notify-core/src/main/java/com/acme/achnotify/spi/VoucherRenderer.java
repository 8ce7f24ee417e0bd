package com.acme.achnotify.spi;

import com.acme.achnotify.domain.PaymentRecord;

/** Produces the PDF voucher of a payment from a print template. */
public interface VoucherRenderer {
  byte[] renderVoucher(String printTemplateId, PaymentRecord payment);
}
