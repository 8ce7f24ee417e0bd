package com.acme.achnotify.domain;

/** Subject and body produced by merging an email template for one recipient. */
public record MergedEmail(String subject, String body, boolean html) {}
