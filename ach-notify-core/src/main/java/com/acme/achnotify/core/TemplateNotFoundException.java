package com.acme.achnotify.core;

/** No email template is mapped to the bank account of a payment group. */
public class TemplateNotFoundException extends RuntimeException {
  private final String accountId;

  public TemplateNotFoundException(String accountId) {
    super("No email template found for account ID: " + accountId);
    this.accountId = accountId;
  }

  public String getAccountId() {
    return accountId;
  }
}
