package com.acme.achnotify.core;

/** Failure categories of a notification run and the scope each one is recovered at. */
public enum ErrorKind {
  /** Missing parameter or unreadable search. Aborts the run. */
  CONFIGURATION,

  /** Raw record lacks a required field. Record goes to the skipped bucket. */
  RECORD_VALIDATION,

  /** Unexpected failure while normalizing one record. Record goes to the error bucket. */
  RECORD_PROCESSING,

  /** No email template mapped to the account. Group is not notified. */
  TEMPLATE_RESOLUTION,

  /** Voucher PDF could not be produced for one payment. */
  RENDER,

  /** Email transport rejected the message. Group is not flagged. */
  SEND,

  /** Notified flag could not be saved after a successful send. */
  PERSISTENCE
}
