package com.acme.achnotify.domain;

import java.util.List;

/** Outbound email handed to the transport. */
public record EmailMessage(
    String author,
    List<String> recipients,
    String subject,
    String body,
    List<VoucherFile> attachments,
    boolean html) {

  public EmailMessage {
    if (recipients == null || recipients.isEmpty()) {
      throw new IllegalArgumentException("Email must have at least one recipient");
    }
    recipients = List.copyOf(recipients);
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }
}
