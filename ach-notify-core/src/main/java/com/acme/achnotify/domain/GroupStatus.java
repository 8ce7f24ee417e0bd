package com.acme.achnotify.domain;

/** Final state of one payment group after the generator ran. */
public enum GroupStatus {
  /** Email sent; notified flags written (individual saves may still have failed). */
  NOTIFIED,

  /** No email template mapped to the account. */
  TEMPLATE_NOT_FOUND,

  /** A voucher failed to render and the policy defers the whole group. */
  DEFERRED_RENDER_FAILURE,

  /** Transport rejected the email. */
  SEND_FAILED,

  /** A previous attempt of this run already sent the email; nothing left to do. */
  ALREADY_DISPATCHED,

  /** A previous attempt claimed the group but never recorded the send; needs reconciling. */
  DISPATCH_IN_PROGRESS,

  /** Unexpected failure, e.g. while merging the email template. */
  FAILED;

  public boolean isFailure() {
    return this != NOTIFIED && this != ALREADY_DISPATCHED;
  }
}
