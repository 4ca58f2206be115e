package com.flint.provider.bank;

public record BankAccount(
    String id,
    String name,
    String type,
    String subtype,
    String institutionName,
    String institutionId,
    String lastFour,
    String currency,
    String enrollmentId
) {
  public boolean isCredit() {
    return "credit".equalsIgnoreCase(type);
  }
}
