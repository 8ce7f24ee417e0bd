package com.acme.achnotify.spi;

/**
 * Records group dispatches by idempotency token so a restarted run does not email a vendor
 * twice.
 */
public interface DispatchLedger {

  /**
   * Claims the token before sending.
   *
   * @return true if the caller may send; false if the token is already sent or in flight
   */
  boolean begin(String token, String groupKey, String runId);

  void markSent(String token);

  /** True once the token has been marked sent; false for pending, failed or unknown tokens. */
  boolean isSent(String token);

  /** Releases the token so a later attempt may send again. */
  void markFailed(String token, String error);
}
