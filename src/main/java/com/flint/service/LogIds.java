package com.flint.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

public final class LogIds {
  private LogIds() {
  }

  public static String hash(UUID userId) {
    if (userId == null) {
      return "anonymous";
    }
    return HexFormat.of().formatHex(sha256(userId.toString())).substring(0, 12);
  }

  static byte[] sha256(String value) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
