package com.acme.achnotify.domain;

/** Layout of a voucher: a title line and a body with {@code ${field}} placeholders. */
public record PrintTemplate(String templateId, String title, String body) {}
