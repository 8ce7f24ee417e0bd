package com.acme.achnotify.spi;

/** Maps a bank account to the email template used for its vendor notifications. */
public interface EmailTemplateLookup {

  /**
   * @throws com.acme.achnotify.core.TemplateNotFoundException when no mapping exists
   */
  String findEmailTemplate(String accountId);
}
