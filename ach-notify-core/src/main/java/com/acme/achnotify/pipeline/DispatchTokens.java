package com.acme.achnotify.pipeline;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/** Idempotency tokens for group dispatches: SHA-256 over run id and sorted order ids. */
public final class DispatchTokens {

  private DispatchTokens() {}

  public static String tokenFor(String runId, List<String> orderIds) {
    List<String> sorted = new ArrayList<>(orderIds);
    Collections.sort(sorted);
    String material = runId + "|" + String.join(",", sorted);
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(material.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
