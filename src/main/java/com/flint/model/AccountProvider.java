package com.flint.model;

import java.util.Locale;

public enum AccountProvider {
  BANK,
  BROKERAGE,
  CRYPTO;

  public static AccountProvider fromPath(String value) {
    if (value == null) {
      return null;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "bank", "teller" -> BANK;
      case "brokerage", "snaptrade" -> BROKERAGE;
      case "crypto" -> CRYPTO;
      default -> null;
    };
  }
}
