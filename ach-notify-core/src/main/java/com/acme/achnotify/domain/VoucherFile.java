package com.acme.achnotify.domain;

/** Rendered voucher PDF as stored in the file cabinet. */
public record VoucherFile(String fileId, String name, String folder, byte[] contents) {

  public static final String CONTENT_TYPE = "application/pdf";

  public static String nameFor(String orderId) {
    return "ACH_Payment_" + orderId + ".pdf";
  }
}
