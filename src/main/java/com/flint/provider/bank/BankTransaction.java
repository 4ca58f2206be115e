package com.flint.provider.bank;

import java.math.BigDecimal;
import java.time.LocalDate;

public record BankTransaction(
    String id,
    String accountId,
    String accountName,
    LocalDate date,
    BigDecimal amount,
    String description,
    String merchantName,
    String category,
    String status
) {
  public BankTransaction withAccountName(String name) {
    return new BankTransaction(id, accountId, name, date, amount, description, merchantName, category, status);
  }
}
