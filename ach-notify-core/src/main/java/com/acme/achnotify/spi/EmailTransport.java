package com.acme.achnotify.spi;

import com.acme.achnotify.domain.EmailMessage;

/** Outbound mail. Implementations throw on any delivery failure. */
public interface EmailTransport {
  void send(EmailMessage message);
}
