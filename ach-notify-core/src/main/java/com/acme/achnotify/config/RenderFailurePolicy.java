package com.acme.achnotify.config;

/** What the generator does with a group when at least one voucher failed to render. */
public enum RenderFailurePolicy {
  /** Send the email with whatever vouchers rendered. */
  SEND_PARTIAL,

  /** Send nothing for the group; it is reported and picked up by a later run. */
  DEFER_GROUP
}
